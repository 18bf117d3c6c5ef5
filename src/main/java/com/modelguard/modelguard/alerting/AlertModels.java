package com.modelguard.modelguard.alerting;

import java.util.List;
import java.util.Map;

public final class AlertModels {

    private AlertModels() {
    }

    public record AlertActionRequest(
            String targetType,
            Long targetId,
            String actionType,
            String actor,
            Map<String, Object> details
    ) {
    }

    public record BulkAcknowledgeRequest(String targetType, List<Long> targetIds, String actor, Map<String, Object> details) {
    }

    public record AlertAction(
            long actionId,
            AlertSubjectType targetType,
            long targetId,
            AlertActionType actionType,
            String actor,
            Map<String, Object> details,
            long createdAt
    ) {
    }

    public record BulkAcknowledgeResponse(int acknowledgedCount, List<AlertAction> actions) {
    }
}
