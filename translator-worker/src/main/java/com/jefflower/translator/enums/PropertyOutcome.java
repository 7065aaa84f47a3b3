package com.jefflower.translator.enums;

/**
 * 单个房源在一个批次内的处理结果
 */
public enum PropertyOutcome {
    SUCCEEDED,
    SUCCEEDED_WITH_FALLBACK,
    FAILED,
    SKIPPED
}
