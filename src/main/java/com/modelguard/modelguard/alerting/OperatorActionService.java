package com.modelguard.modelguard.alerting;

import com.modelguard.modelguard.drift.DriftReport;
import com.modelguard.modelguard.drift.DriftReportRepository;
import com.modelguard.modelguard.drift.Severity;
import com.modelguard.modelguard.promotion.PromotionDecisionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Records operator responses to drift reports and promotion decisions.
 */
@Service
public class OperatorActionService {

    private static final Logger log = LoggerFactory.getLogger(OperatorActionService.class);
    private static final int MAX_ACTOR_LENGTH = 128;

    private final AlertActionRepository alertActionRepository;
    private final DriftReportRepository driftReportRepository;
    private final PromotionDecisionRepository promotionDecisionRepository;
    private final TransactionTemplate transactionTemplate;

    public OperatorActionService(
            AlertActionRepository alertActionRepository,
            DriftReportRepository driftReportRepository,
            PromotionDecisionRepository promotionDecisionRepository,
            TransactionTemplate transactionTemplate
    ) {
        this.alertActionRepository = alertActionRepository;
        this.driftReportRepository = driftReportRepository;
        this.promotionDecisionRepository = promotionDecisionRepository;
        this.transactionTemplate = transactionTemplate;
    }

    public AlertModels.AlertAction recordAction(AlertModels.AlertActionRequest request) {
        AlertSubjectType targetType = parseTargetType(request.targetType());
        if (request.targetId() == null) {
            throw badRequest(AlertingConstants.MSG_FIELD_REQUIRED.formatted("targetId"));
        }
        AlertActionType actionType = parseActionType(request.actionType());
        String actor = normalizeActor(request.actor());
        requireTarget(targetType, request.targetId());

        AlertModels.AlertAction action = alertActionRepository.append(
                targetType, request.targetId(), actionType, actor, request.details());
        log.info("Operator action recorded. actionId={}, target={}:{}, action={}, actor={}",
                action.actionId(), targetType, action.targetId(), actionType.dbValue(), actor);
        return action;
    }

    /**
     * Acknowledges every listed target in one transaction. If any target is missing nothing is written.
     */
    public AlertModels.BulkAcknowledgeResponse bulkAcknowledge(AlertModels.BulkAcknowledgeRequest request) {
        AlertSubjectType targetType = parseTargetType(request.targetType());
        if (request.targetIds() == null || request.targetIds().isEmpty()) {
            throw badRequest(AlertingConstants.MSG_FIELD_REQUIRED.formatted("targetIds"));
        }
        if (request.targetIds().contains(null)) {
            throw badRequest("targetIds must not contain null");
        }
        String actor = normalizeActor(request.actor());
        Set<Long> targetIds = new LinkedHashSet<>(request.targetIds());

        List<AlertModels.AlertAction> actions = transactionTemplate.execute(status -> {
            targetIds.forEach(targetId -> requireTarget(targetType, targetId));
            List<AlertModels.AlertAction> written = new ArrayList<>();
            for (Long targetId : targetIds) {
                written.add(alertActionRepository.append(
                        targetType, targetId, AlertActionType.BULK_ACKNOWLEDGE, actor, request.details()));
            }
            return written;
        });
        List<AlertModels.AlertAction> result = actions == null ? List.of() : actions;
        log.info("Bulk acknowledge recorded. targetType={}, count={}, actor={}", targetType, result.size(), actor);
        return new AlertModels.BulkAcknowledgeResponse(result.size(), result);
    }

    /**
     * Drift reports at or above {@code minimum} severity without any acknowledgement, newest first.
     */
    public List<DriftReport> listUnacknowledged(Severity minimum) {
        Set<Long> acknowledged = alertActionRepository.findAcknowledgedTargetIds(AlertSubjectType.DRIFT_REPORT);
        return driftReportRepository.findBySeverityAtLeast(minimum).stream()
                .filter(report -> !acknowledged.contains(report.reportId()))
                .toList();
    }

    public List<AlertModels.AlertAction> listActions(String targetType, Long targetId, int limit) {
        AlertSubjectType type = targetType == null || targetType.isBlank() ? null : parseTargetType(targetType);
        if (type == null && targetId != null) {
            throw badRequest("targetType is required when targetId is given");
        }
        return alertActionRepository.findAll(type, targetId, limit);
    }

    private void requireTarget(AlertSubjectType targetType, long targetId) {
        boolean exists = switch (targetType) {
            case DRIFT_REPORT -> driftReportRepository.findById(targetId).isPresent();
            case PROMOTION_DECISION -> promotionDecisionRepository.findById(targetId).isPresent();
        };
        if (!exists) {
            throw new AlertTargetNotFoundException(targetType, targetId);
        }
    }

    private static AlertSubjectType parseTargetType(String value) {
        if (value == null || value.isBlank()) {
            throw badRequest(AlertingConstants.MSG_FIELD_REQUIRED.formatted("targetType"));
        }
        try {
            return AlertSubjectType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            throw badRequest("Unknown targetType: " + value);
        }
    }

    private static AlertActionType parseActionType(String value) {
        if (value == null || value.isBlank()) {
            throw badRequest(AlertingConstants.MSG_FIELD_REQUIRED.formatted("actionType"));
        }
        try {
            return AlertActionType.fromValue(value);
        } catch (IllegalArgumentException ex) {
            throw badRequest(ex.getMessage());
        }
    }

    private static String normalizeActor(String value) {
        String normalized = value == null ? "" : value.trim();
        if (normalized.isBlank()) {
            throw badRequest(AlertingConstants.MSG_FIELD_REQUIRED.formatted("actor"));
        }
        if (normalized.length() > MAX_ACTOR_LENGTH) {
            throw badRequest("actor must be at most " + MAX_ACTOR_LENGTH + " characters");
        }
        return normalized;
    }

    private static ResponseStatusException badRequest(String message) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, message);
    }
}
