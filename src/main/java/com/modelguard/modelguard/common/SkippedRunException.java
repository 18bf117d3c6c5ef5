package com.modelguard.modelguard.common;

/**
 * Data condition that ends a job without producing output. Callers log it as a skip, never alert on it.
 */
public abstract class SkippedRunException extends ModelGuardException {

    protected SkippedRunException(String errorCode, String message) {
        super(errorCode, message);
    }
}
