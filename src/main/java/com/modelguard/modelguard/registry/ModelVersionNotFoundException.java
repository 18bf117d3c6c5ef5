package com.modelguard.modelguard.registry;

import com.modelguard.modelguard.common.ModelGuardException;

public class ModelVersionNotFoundException extends ModelGuardException {

    public ModelVersionNotFoundException(String modelName, String version) {
        super("MODEL_VERSION_NOT_FOUND", "Model %s version %s not found in registry".formatted(modelName, version));
    }
}
