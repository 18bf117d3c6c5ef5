package com.modelguard.modelguard.alerting;

public enum NotificationStatus {
    NOT_REQUIRED,
    PENDING,
    DELIVERED,
    FAILED
}
