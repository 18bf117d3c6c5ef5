package com.modelguard.modelguard.registry;

import com.modelguard.modelguard.common.TransientInfrastructureException;

public class ScoringUnavailableException extends TransientInfrastructureException {

    public ScoringUnavailableException(String modelName, String version, Throwable cause) {
        super("SCORING_UNAVAILABLE",
                "Held-out scoring of %s version %s failed: %s".formatted(modelName, version, cause.getMessage()), cause);
    }
}
