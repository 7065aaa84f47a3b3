package com.jefflower.translator.exception;

public class PropertyNotFoundException extends RuntimeException {

    public PropertyNotFoundException(String externalId) {
        super("房源不存在: " + externalId);
    }
}
