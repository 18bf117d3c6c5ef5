package com.modelguard.modelguard.alerting;

import com.modelguard.modelguard.drift.DriftReport;
import com.modelguard.modelguard.drift.Severity;
import com.modelguard.modelguard.promotion.PromotionDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns drift reports and promotion decisions into recorded, logged and delivered notifications.
 * <p>
 * Each subject is recorded once. A repeated dispatch of the same subject neither re-evaluates the policy
 * nor logs again; it only retries delivery to the channels that have not yet accepted the message.
 */
@Service
public class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final DispatchRecordRepository dispatchRecordRepository;
    private final NotificationPolicy notificationPolicy;
    private final ObjectProvider<NotificationChannel> channelProvider;
    private final AlertingProperties alertingProperties;

    public AlertDispatcher(
            DispatchRecordRepository dispatchRecordRepository,
            NotificationPolicy notificationPolicy,
            ObjectProvider<NotificationChannel> channelProvider,
            AlertingProperties alertingProperties
    ) {
        this.dispatchRecordRepository = dispatchRecordRepository;
        this.notificationPolicy = notificationPolicy;
        this.channelProvider = channelProvider;
        this.alertingProperties = alertingProperties;
    }

    public DispatchResult dispatch(DriftReport report) {
        if (report == null || report.reportId() == null) {
            throw new IllegalArgumentException("Only persisted drift reports can be dispatched");
        }
        Set<DispatchAction> actions = notificationPolicy.actionsFor(report.severity());
        String summary = "Drift severity=%s overall=%.4f data=%s prediction=%s performance=%s".formatted(
                report.severity(), report.overallScore(), formatScore(report.dataDriftScore()),
                formatScore(report.predictionDriftScore()), formatScore(report.performanceDriftScore()));

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("reportId", report.reportId());
        detail.put("createdAt", report.createdAt());
        detail.put("overallScore", report.overallScore());
        detail.put("dataDriftScore", report.dataDriftScore());
        detail.put("predictionDriftScore", report.predictionDriftScore());
        detail.put("performanceDriftScore", report.performanceDriftScore());
        detail.put("driftDetected", report.driftDetected());
        detail.put("worstSignals", report.details().worstSignals());
        detail.put("unseenPredictedClasses", report.details().unseenPredictedClasses());
        detail.put("referenceSampleSize", report.referenceSampleSize());
        detail.put("currentSampleSize", report.currentSampleSize());
        detail.put("recommendedAction", notificationPolicy.recommendedAction(report.severity()));

        return dispatch(newRecord(AlertSubjectType.DRIFT_REPORT, report.reportId(), report.severity(), actions,
                summary, detail));
    }

    public DispatchResult dispatch(PromotionDecision decision) {
        requirePersisted(decision);
        Set<DispatchAction> actions = notificationPolicy.actionsFor(decision.outcome());
        String summary = "Promotion %s for %s version %s (%s): %s".formatted(
                decision.outcome(), decision.modelName(), decision.challengerVersion(),
                decision.comparisonMode(), decision.justification());

        return dispatch(newRecord(AlertSubjectType.PROMOTION_DECISION, decision.decisionId(),
                notificationPolicy.severityFor(decision.outcome()), actions, summary, promotionDetail(decision)));
    }

    /**
     * Dispatches a {@code PROMOTE} decision whose registry transition could not be applied. It is recorded
     * and escalated at the failed-transition severity instead of the usual promotion row.
     */
    public DispatchResult dispatchTransitionFailure(PromotionDecision decision, Throwable failure) {
        requirePersisted(decision);
        Severity severity = notificationPolicy.severityForFailedTransition();
        String summary = "Promotion of %s version %s could not be applied: %s".formatted(
                decision.modelName(), decision.challengerVersion(), failure.getMessage());
        Map<String, Object> detail = promotionDetail(decision);
        detail.put("transitionError", failure.getMessage());

        return dispatch(newRecord(AlertSubjectType.PROMOTION_DECISION, decision.decisionId(), severity,
                notificationPolicy.actionsFor(severity), summary, detail));
    }

    private static void requirePersisted(PromotionDecision decision) {
        if (decision == null || decision.decisionId() == null) {
            throw new IllegalArgumentException("Only persisted promotion decisions can be dispatched");
        }
    }

    private static Map<String, Object> promotionDetail(PromotionDecision decision) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("decisionId", decision.decisionId());
        detail.put("modelName", decision.modelName());
        detail.put("challengerVersion", decision.challengerVersion());
        detail.put("challengerMetric", decision.challengerMetric());
        detail.put("incumbentVersion", decision.incumbentVersion());
        detail.put("incumbentMetric", decision.incumbentMetric());
        detail.put("minAcceptableMetric", decision.minAcceptableMetric());
        detail.put("comparisonMode", decision.comparisonMode().name());
        detail.put("outcome", decision.outcome().name());
        detail.put("transitionsApplied", decision.transitionsApplied());
        return detail;
    }

    /**
     * Retries every dispatch still owed a delivery and under the attempt limit.
     *
     * @return number of dispatches that reached {@code DELIVERED} in this pass
     */
    public int redeliverPending() {
        List<DispatchRecord> pending = dispatchRecordRepository.findUndelivered(
                alertingProperties.getMaxDeliveryAttempts());
        int delivered = 0;
        for (DispatchRecord record : pending) {
            DispatchResult result = deliver(record, false);
            if (result.status() == NotificationStatus.DELIVERED) {
                delivered++;
            }
        }
        if (!pending.isEmpty()) {
            log.info("Alert redelivery pass finished. pending={}, delivered={}", pending.size(), delivered);
        }
        return delivered;
    }

    public List<DispatchRecord> getRecentDispatches(int limit) {
        return dispatchRecordRepository.findRecent(limit);
    }

    private DispatchResult dispatch(DispatchRecord candidate) {
        DispatchRecord inserted = dispatchRecordRepository.insertIfAbsent(candidate).orElse(null);
        if (inserted != null) {
            logRecorded(inserted);
            return deliver(inserted, true);
        }
        DispatchRecord existing = dispatchRecordRepository.find(candidate.subjectType(), candidate.subjectId())
                .orElseThrow(() -> new IllegalStateException("Dispatch for %s %d vanished after insert conflict"
                        .formatted(candidate.subjectType(), candidate.subjectId())));
        log.debug("Dispatch for {} {} already recorded; retrying outstanding deliveries only",
                existing.subjectType(), existing.subjectId());
        return deliver(existing, false);
    }

    private DispatchResult deliver(DispatchRecord record, boolean newlyRecorded) {
        if (!record.requiresNotification() || record.status() == NotificationStatus.DELIVERED) {
            return DispatchResult.of(record, newlyRecorded, List.of());
        }

        List<NotificationChannel> channels = channelProvider.orderedStream().toList();
        Set<String> delivered = new LinkedHashSet<>(record.deliveredChannels());
        List<String> failed = new ArrayList<>();
        String lastError = null;

        if (channels.isEmpty()) {
            lastError = AlertingConstants.MSG_NO_CHANNELS;
        }
        NotificationMessage message = record.toMessage();
        for (NotificationChannel channel : channels) {
            if (delivered.contains(channel.name())) {
                continue;
            }
            try {
                channel.send(message);
                delivered.add(channel.name());
            } catch (NotificationDeliveryException ex) {
                failed.add(channel.name());
                lastError = ex.getMessage();
                log.warn("Notification delivery failed. subjectType={}, subjectId={}, channel={}, reason={}",
                        record.subjectType(), record.subjectId(), channel.name(), ex.getMessage());
            } catch (RuntimeException ex) {
                // Deliveries already made in this pass must still be recorded.
                failed.add(channel.name());
                lastError = ex.getClass().getSimpleName() + ": " + ex.getMessage();
                log.error("Notification channel {} failed unexpectedly for {} {}",
                        channel.name(), record.subjectType(), record.subjectId(), ex);
            }
        }

        NotificationStatus status = channels.isEmpty() || !failed.isEmpty()
                ? NotificationStatus.FAILED
                : NotificationStatus.DELIVERED;
        int attempts = record.attempts() + 1;
        long now = System.currentTimeMillis();
        dispatchRecordRepository.updateDelivery(record.dispatchId(), status, delivered, attempts, lastError, now);

        DispatchRecord updated = new DispatchRecord(record.dispatchId(), record.subjectType(), record.subjectId(),
                record.severity(), record.actions(), record.summary(), record.detail(), record.escalate(), status,
                delivered, attempts, lastError, record.createdAt(), now);
        return DispatchResult.of(updated, newlyRecorded, failed);
    }

    private void logRecorded(DispatchRecord record) {
        if (record.actions().contains(DispatchAction.ESCALATE)) {
            log.error("alert_dispatch escalate=true subjectType={} subjectId={} severity={} actions={} summary=\"{}\"",
                    record.subjectType(), record.subjectId(), record.severity(), record.actions(), record.summary());
        } else if (record.actions().contains(DispatchAction.LOG)) {
            log.warn("alert_dispatch subjectType={} subjectId={} severity={} actions={} summary=\"{}\"",
                    record.subjectType(), record.subjectId(), record.severity(), record.actions(), record.summary());
        } else {
            log.info("Dispatch recorded. subjectType={}, subjectId={}, severity={}, actions={}",
                    record.subjectType(), record.subjectId(), record.severity(), record.actions());
        }
    }

    private static DispatchRecord newRecord(
            AlertSubjectType subjectType,
            long subjectId,
            Severity severity,
            Set<DispatchAction> actions,
            String summary,
            Map<String, Object> detail
    ) {
        long now = System.currentTimeMillis();
        NotificationStatus status = actions.contains(DispatchAction.NOTIFY)
                ? NotificationStatus.PENDING
                : NotificationStatus.NOT_REQUIRED;
        String boundedSummary = summary.length() > 1024 ? summary.substring(0, 1021) + "..." : summary;
        return new DispatchRecord(null, subjectType, subjectId, severity, actions, boundedSummary, detail,
                actions.contains(DispatchAction.ESCALATE), status, Set.of(), 0, null, now, now);
    }

    private static String formatScore(Double score) {
        return score == null ? "n/a" : "%.4f".formatted(score);
    }
}
