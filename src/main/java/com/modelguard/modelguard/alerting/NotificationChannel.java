package com.modelguard.modelguard.alerting;

/**
 * Outbound notification target. Implementations bound their own retries and report a terminal failure
 * with {@link NotificationDeliveryException}.
 */
public interface NotificationChannel {

    /**
     * Stable name, stored with each dispatch to remember which channels already delivered.
     */
    String name();

    void send(NotificationMessage message);
}
