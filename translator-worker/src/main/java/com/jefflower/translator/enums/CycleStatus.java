package com.jefflower.translator.enums;

/**
 * 翻译批次状态枚举
 */
public enum CycleStatus {
    RUNNING, // 正在执行
    SUCCESS, // 执行成功
    FAILED // 执行失败
}
