package com.modelguard.modelguard.common;

/**
 * Base type for domain failures that carry a stable machine-readable error code.
 */
public abstract class ModelGuardException extends RuntimeException {

    private final String errorCode;

    protected ModelGuardException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected ModelGuardException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
