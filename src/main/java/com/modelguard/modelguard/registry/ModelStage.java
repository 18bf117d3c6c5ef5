package com.modelguard.modelguard.registry;

import java.util.Arrays;

/**
 * Registry lifecycle stages, with the names the registry uses on the wire.
 */
public enum ModelStage {
    NONE("None"),
    STAGING("Staging"),
    PRODUCTION("Production"),
    ARCHIVED("Archived");

    private final String registryName;

    ModelStage(String registryName) {
        this.registryName = registryName;
    }

    public String registryName() {
        return registryName;
    }

    public static ModelStage fromRegistryName(String value) {
        return Arrays.stream(values())
                .filter(stage -> stage.registryName.equalsIgnoreCase(value == null ? "" : value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown model stage: " + value));
    }
}
