package com.modelguard.modelguard.registry;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the model registry, bound from {@code registry.*}.
 */
@ConfigurationProperties(prefix = "registry")
public class RegistryProperties {

    private String baseUrl = RegistryConstants.DEFAULT_REGISTRY_BASE_URL;
    private String modelName = RegistryConstants.DEFAULT_MODEL_NAME;
    private String metricKey = RegistryConstants.DEFAULT_METRIC_KEY;
    private long timeoutMs = RegistryConstants.DEFAULT_TIMEOUT_MS;
    private int maxRetries = RegistryConstants.DEFAULT_MAX_RETRIES;
    private long backoffMs = RegistryConstants.DEFAULT_BACKOFF_MS;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModelName() {
        return modelName;
    }

    public void setModelName(String modelName) {
        this.modelName = modelName;
    }

    public String getMetricKey() {
        return metricKey;
    }

    public void setMetricKey(String metricKey) {
        this.metricKey = metricKey;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getBackoffMs() {
        return backoffMs;
    }

    public void setBackoffMs(long backoffMs) {
        this.backoffMs = backoffMs;
    }
}
