package com.modelguard.modelguard.registry;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Held-out scoring endpoint settings, bound from {@code scoring.*}.
 */
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {

    private String baseUrl = RegistryConstants.DEFAULT_SCORING_BASE_URL;
    private String path = RegistryConstants.DEFAULT_SCORING_PATH;
    private long timeoutMs = RegistryConstants.DEFAULT_SCORING_TIMEOUT_MS;
    private int maxRetries = RegistryConstants.DEFAULT_MAX_RETRIES;
    private long backoffMs = RegistryConstants.DEFAULT_BACKOFF_MS;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
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
