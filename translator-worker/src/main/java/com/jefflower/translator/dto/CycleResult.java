package com.jefflower.translator.dto;

import lombok.Getter;

/**
 * 批次执行结果封装类
 */
@Getter
public class CycleResult {
    private final CycleStats stats;
    private final boolean success;
    private final String message;

    public CycleResult(CycleStats stats, boolean success, String message) {
        this.stats = stats;
        this.success = success;
        this.message = message;
    }
}
