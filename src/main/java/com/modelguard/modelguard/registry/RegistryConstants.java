package com.modelguard.modelguard.registry;

/**
 * Defaults and REST paths for the model registry and held-out scoring collaborators.
 */
public final class RegistryConstants {

    private RegistryConstants() {
    }

    public static final String DEFAULT_REGISTRY_BASE_URL = "http://localhost:5000";
    public static final String DEFAULT_MODEL_NAME = "rakuten_classifier";
    public static final String DEFAULT_METRIC_KEY = "test_f1_weighted";
    public static final long DEFAULT_TIMEOUT_MS = 5_000L;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_BACKOFF_MS = 500L;

    public static final String DEFAULT_SCORING_BASE_URL = "http://localhost:8000";
    public static final String DEFAULT_SCORING_PATH = "/evaluate";
    public static final long DEFAULT_SCORING_TIMEOUT_MS = 60_000L;

    public static final String PATH_LATEST_VERSIONS = "/api/2.0/mlflow/registered-models/get-latest-versions";
    public static final String PATH_GET_VERSION = "/api/2.0/mlflow/model-versions/get";
    public static final String PATH_GET_RUN = "/api/2.0/mlflow/runs/get";
    public static final String PATH_TRANSITION_STAGE = "/api/2.0/mlflow/model-versions/transition-stage";

    public static final String MSG_BAD_RESPONSE = "Unexpected registry response for %s: %s";
}
