package com.jefflower.translator.exception;

import lombok.Getter;

/**
 * 单个房源写库失败，事务已回滚
 */
@Getter
public class PersistenceFailureException extends RuntimeException {

    private final Long propertyId;

    public PersistenceFailureException(Long propertyId, String message, Throwable cause) {
        super("Failed to persist translations for property " + propertyId + ": " + message, cause);
        this.propertyId = propertyId;
    }
}
