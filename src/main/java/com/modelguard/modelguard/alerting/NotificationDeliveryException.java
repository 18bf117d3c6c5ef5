package com.modelguard.modelguard.alerting;

import com.modelguard.modelguard.common.ModelGuardException;

public class NotificationDeliveryException extends ModelGuardException {

    public NotificationDeliveryException(String channel, String message, Throwable cause) {
        super("NOTIFICATION_FAILED", "Channel " + channel + " failed: " + message, cause);
    }

    public NotificationDeliveryException(String channel, String message) {
        super("NOTIFICATION_FAILED", "Channel " + channel + " failed: " + message);
    }
}
