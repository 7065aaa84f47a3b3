package com.jefflower.translator.enums;

public enum TriggerType {
    SCHEDULED,
    MANUAL
}
