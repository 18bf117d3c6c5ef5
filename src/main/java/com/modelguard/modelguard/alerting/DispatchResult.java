package com.modelguard.modelguard.alerting;

import com.modelguard.modelguard.drift.Severity;

import java.util.List;
import java.util.Set;

/**
 * What one {@code dispatch} call did. {@code newlyRecorded} is false when the subject had already been
 * dispatched and only outstanding deliveries were retried.
 */
public record DispatchResult(
        long dispatchId,
        AlertSubjectType subjectType,
        long subjectId,
        Severity severity,
        Set<DispatchAction> actions,
        NotificationStatus status,
        boolean escalate,
        boolean newlyRecorded,
        Set<String> deliveredChannels,
        List<String> failedChannels
) {

    static DispatchResult of(DispatchRecord record, boolean newlyRecorded, List<String> failedChannels) {
        return new DispatchResult(
                record.dispatchId(),
                record.subjectType(),
                record.subjectId(),
                record.severity(),
                record.actions(),
                record.status(),
                record.escalate(),
                newlyRecorded,
                record.deliveredChannels(),
                List.copyOf(failedChannels)
        );
    }
}
