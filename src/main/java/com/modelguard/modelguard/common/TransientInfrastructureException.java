package com.modelguard.modelguard.common;

/**
 * A collaborator could not be reached within its retry budget. Jobs may be re-run safely.
 */
public abstract class TransientInfrastructureException extends ModelGuardException {

    protected TransientInfrastructureException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
