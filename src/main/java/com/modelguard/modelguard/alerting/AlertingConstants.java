package com.modelguard.modelguard.alerting;

/**
 * Shared constants for alert dispatch and operator actions.
 */
public final class AlertingConstants {

    private AlertingConstants() {
    }

    public static final String DEFAULT_REDELIVERY_CRON = "0 */15 * * * *";
    public static final int DEFAULT_MAX_DELIVERY_ATTEMPTS = 5;
    public static final long DEFAULT_WEBHOOK_TIMEOUT_MS = 5_000L;
    public static final int DEFAULT_WEBHOOK_MAX_RETRIES = 3;
    public static final long DEFAULT_WEBHOOK_BACKOFF_MS = 500L;

    public static final String WEBHOOK_CHANNEL = "webhook";

    public static final String ACTION_NONE = "No action.";
    public static final String ACTION_MONITOR = "Monitor closely. No immediate action required.";
    public static final String ACTION_INVESTIGATE = "Investigate drift sources. Consider retraining.";
    public static final String ACTION_RETRAIN_OR_ROLLBACK = "Retrain model or roll back to the previous version.";

    public static final String MSG_NO_CHANNELS = "No notification channels configured";
    public static final String MSG_TARGET_NOT_FOUND = "%s %d not found";
    public static final String MSG_FIELD_REQUIRED = "%s is required";
}
