package com.modelguard.modelguard.alerting;

import java.util.Map;

/**
 * Channel-agnostic payload handed to every {@link NotificationChannel}.
 */
public record NotificationMessage(
        AlertSubjectType subjectType,
        long subjectId,
        String severity,
        String summary,
        Map<String, Object> detailPayload,
        boolean escalate
) {
}
