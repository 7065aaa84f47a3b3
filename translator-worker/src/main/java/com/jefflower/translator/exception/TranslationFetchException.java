package com.jefflower.translator.exception;

import com.jefflower.translator.enums.LanguageCode;
import lombok.Getter;

/**
 * 房源接口调用失败
 */
@Getter
public class TranslationFetchException extends RuntimeException {

    public enum FailureType {
        NOT_FOUND(false),
        RATE_LIMITED(true),
        TRANSIENT(true),
        AUTH_ERROR(false),
        MALFORMED(false);

        private final boolean retryable;

        FailureType(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    private final FailureType type;
    private final String externalId;
    private final LanguageCode language;

    public TranslationFetchException(FailureType type, String externalId, LanguageCode language, String message) {
        this(type, externalId, language, message, null);
    }

    public TranslationFetchException(FailureType type, String externalId, LanguageCode language,
                                     String message, Throwable cause) {
        super(String.format("[%s] %s/%s: %s", type, externalId, language.getCode(), message), cause);
        this.type = type;
        this.externalId = externalId;
        this.language = language;
    }

    public boolean isRetryable() {
        return type.isRetryable();
    }
}
