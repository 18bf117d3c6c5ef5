package com.modelguard.modelguard.registry;

import java.util.Optional;

/**
 * Read and transition access to the external model registry. Nothing here deletes a model.
 */
public interface ModelRegistryClient {

    /**
     * Returns the scalar quality metric recorded for a model version.
     *
     * @throws MetricUnavailableException when the version exists but has no such metric
     */
    double getMetric(String modelName, String version);

    ModelStage getStage(String modelName, String version);

    Optional<ModelVersion> findVersionInStage(String modelName, ModelStage stage);

    /**
     * Moves one version to {@code targetStage}. With {@code archiveExistingVersions} the registry archives the
     * versions currently in that stage as part of the same request.
     */
    void requestStageTransition(String modelName, String version, ModelStage targetStage,
                                boolean archiveExistingVersions);
}
