package com.modelguard.modelguard.registry;

import com.modelguard.modelguard.common.TransientInfrastructureException;

public class RegistryUnavailableException extends TransientInfrastructureException {

    public RegistryUnavailableException(String operation, Throwable cause) {
        super("REGISTRY_UNAVAILABLE", "Model registry unavailable during " + operation + ": " + cause.getMessage(), cause);
    }
}
