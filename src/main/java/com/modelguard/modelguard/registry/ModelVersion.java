package com.modelguard.modelguard.registry;

public record ModelVersion(String modelName, String version, ModelStage stage, String runId) {
}
