package com.modelguard.modelguard.alerting;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Alert dispatch configuration bound from {@code alerting.*}.
 */
@ConfigurationProperties(prefix = "alerting")
public class AlertingProperties {

    private boolean notifyOnPromotion;
    private String redeliveryCron = AlertingConstants.DEFAULT_REDELIVERY_CRON;
    private int maxDeliveryAttempts = AlertingConstants.DEFAULT_MAX_DELIVERY_ATTEMPTS;
    /** Webhook channel is registered only when this is set. */
    private String webhookUrl;
    private long webhookTimeoutMs = AlertingConstants.DEFAULT_WEBHOOK_TIMEOUT_MS;
    private int webhookMaxRetries = AlertingConstants.DEFAULT_WEBHOOK_MAX_RETRIES;
    private long webhookBackoffMs = AlertingConstants.DEFAULT_WEBHOOK_BACKOFF_MS;

    public boolean isNotifyOnPromotion() {
        return notifyOnPromotion;
    }

    public void setNotifyOnPromotion(boolean notifyOnPromotion) {
        this.notifyOnPromotion = notifyOnPromotion;
    }

    public String getRedeliveryCron() {
        return redeliveryCron;
    }

    public void setRedeliveryCron(String redeliveryCron) {
        this.redeliveryCron = redeliveryCron;
    }

    public int getMaxDeliveryAttempts() {
        return maxDeliveryAttempts;
    }

    public void setMaxDeliveryAttempts(int maxDeliveryAttempts) {
        this.maxDeliveryAttempts = maxDeliveryAttempts;
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public void setWebhookUrl(String webhookUrl) {
        this.webhookUrl = webhookUrl;
    }

    public long getWebhookTimeoutMs() {
        return webhookTimeoutMs;
    }

    public void setWebhookTimeoutMs(long webhookTimeoutMs) {
        this.webhookTimeoutMs = webhookTimeoutMs;
    }

    public int getWebhookMaxRetries() {
        return webhookMaxRetries;
    }

    public void setWebhookMaxRetries(int webhookMaxRetries) {
        this.webhookMaxRetries = webhookMaxRetries;
    }

    public long getWebhookBackoffMs() {
        return webhookBackoffMs;
    }

    public void setWebhookBackoffMs(long webhookBackoffMs) {
        this.webhookBackoffMs = webhookBackoffMs;
    }
}
