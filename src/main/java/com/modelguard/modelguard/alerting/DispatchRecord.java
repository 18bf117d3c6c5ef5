package com.modelguard.modelguard.alerting;

import com.modelguard.modelguard.drift.Severity;

import java.util.Map;
import java.util.Set;

/**
 * Stored dispatch of one subject. The action set is evaluated once, when the record is created, and never
 * recomputed; only the delivery fields change afterwards.
 */
public record DispatchRecord(
        Long dispatchId,
        AlertSubjectType subjectType,
        long subjectId,
        Severity severity,
        Set<DispatchAction> actions,
        String summary,
        Map<String, Object> detail,
        boolean escalate,
        NotificationStatus status,
        Set<String> deliveredChannels,
        int attempts,
        String lastError,
        long createdAt,
        long updatedAt
) {

    public DispatchRecord {
        actions = actions == null ? Set.of() : Set.copyOf(actions);
        detail = detail == null ? Map.of() : detail;
        deliveredChannels = deliveredChannels == null ? Set.of() : Set.copyOf(deliveredChannels);
    }

    public boolean requiresNotification() {
        return actions.contains(DispatchAction.NOTIFY);
    }

    public NotificationMessage toMessage() {
        return new NotificationMessage(subjectType, subjectId, severity.name(), summary, detail, escalate);
    }
}
