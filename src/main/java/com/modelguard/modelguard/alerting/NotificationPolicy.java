package com.modelguard.modelguard.alerting;

import com.modelguard.modelguard.drift.Severity;
import com.modelguard.modelguard.promotion.PromotionOutcome;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Severity to action-set table. Promotion decisions map onto the {@code WARNING} row; a {@code PROMOTE}
 * additionally notifies when {@code alerting.notify-on-promotion} is set. A promotion whose registry
 * transition failed maps onto the {@code CRITICAL} row.
 */
public class NotificationPolicy {

    private final Map<Severity, Set<DispatchAction>> table;
    private final Map<Severity, String> recommendedActions;
    private final boolean notifyOnPromotion;

    public NotificationPolicy(boolean notifyOnPromotion) {
        Map<Severity, Set<DispatchAction>> rows = new EnumMap<>(Severity.class);
        rows.put(Severity.OK, Collections.unmodifiableSet(EnumSet.of(DispatchAction.RECORD)));
        rows.put(Severity.WARNING, Collections.unmodifiableSet(EnumSet.of(DispatchAction.RECORD, DispatchAction.LOG)));
        rows.put(Severity.ALERT, Collections.unmodifiableSet(EnumSet.of(DispatchAction.RECORD, DispatchAction.NOTIFY)));
        rows.put(Severity.CRITICAL, Collections.unmodifiableSet(
                EnumSet.of(DispatchAction.RECORD, DispatchAction.NOTIFY, DispatchAction.ESCALATE)));
        this.table = Collections.unmodifiableMap(rows);

        Map<Severity, String> recommendations = new EnumMap<>(Severity.class);
        recommendations.put(Severity.OK, AlertingConstants.ACTION_NONE);
        recommendations.put(Severity.WARNING, AlertingConstants.ACTION_MONITOR);
        recommendations.put(Severity.ALERT, AlertingConstants.ACTION_INVESTIGATE);
        recommendations.put(Severity.CRITICAL, AlertingConstants.ACTION_RETRAIN_OR_ROLLBACK);
        this.recommendedActions = Collections.unmodifiableMap(recommendations);
        this.notifyOnPromotion = notifyOnPromotion;
    }

    public Set<DispatchAction> actionsFor(Severity severity) {
        return table.get(severity);
    }

    /**
     * Operator guidance attached to a drift alert of the given severity.
     */
    public String recommendedAction(Severity severity) {
        return recommendedActions.get(severity);
    }

    public Severity severityFor(PromotionOutcome outcome) {
        return Severity.WARNING;
    }

    public Severity severityForFailedTransition() {
        return Severity.CRITICAL;
    }

    public Set<DispatchAction> actionsFor(PromotionOutcome outcome) {
        Set<DispatchAction> actions = EnumSet.copyOf(actionsFor(severityFor(outcome)));
        if (outcome == PromotionOutcome.PROMOTE && notifyOnPromotion) {
            actions.add(DispatchAction.NOTIFY);
        }
        return Collections.unmodifiableSet(actions);
    }

    public Map<Severity, Set<DispatchAction>> table() {
        return table;
    }
}
