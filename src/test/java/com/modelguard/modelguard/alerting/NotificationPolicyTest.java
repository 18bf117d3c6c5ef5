package com.modelguard.modelguard.alerting;

import com.modelguard.modelguard.drift.Severity;
import com.modelguard.modelguard.promotion.PromotionOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NotificationPolicyTest {

    @Test
    void shouldMapEverySeverityToItsActionSet() {
        NotificationPolicy policy = new NotificationPolicy(false);

        assertEquals(Set.of(DispatchAction.RECORD), policy.actionsFor(Severity.OK));
        assertEquals(Set.of(DispatchAction.RECORD, DispatchAction.LOG), policy.actionsFor(Severity.WARNING));
        assertEquals(Set.of(DispatchAction.RECORD, DispatchAction.NOTIFY), policy.actionsFor(Severity.ALERT));
        assertEquals(Set.of(DispatchAction.RECORD, DispatchAction.NOTIFY, DispatchAction.ESCALATE),
                policy.actionsFor(Severity.CRITICAL));
        assertEquals(List.of(Severity.values()), List.copyOf(policy.table().keySet()));
    }

    @Test
    void shouldTreatPromotionEventsAsWarnings() {
        NotificationPolicy policy = new NotificationPolicy(false);

        assertEquals(Severity.WARNING, policy.severityFor(PromotionOutcome.PROMOTE));
        assertEquals(Severity.WARNING, policy.severityFor(PromotionOutcome.REJECT));
        assertEquals(Set.of(DispatchAction.RECORD, DispatchAction.LOG), policy.actionsFor(PromotionOutcome.PROMOTE));
        assertEquals(Set.of(DispatchAction.RECORD, DispatchAction.LOG), policy.actionsFor(PromotionOutcome.REJECT));
    }

    @Test
    void shouldNotifyOnPromotionWhenConfigured() {
        NotificationPolicy policy = new NotificationPolicy(true);

        assertEquals(Set.of(DispatchAction.RECORD, DispatchAction.LOG, DispatchAction.NOTIFY),
                policy.actionsFor(PromotionOutcome.PROMOTE));
        assertEquals(Set.of(DispatchAction.RECORD, DispatchAction.LOG), policy.actionsFor(PromotionOutcome.REJECT));
    }

    @Test
    void shouldEscalateFailedTransitions() {
        NotificationPolicy policy = new NotificationPolicy(false);

        assertEquals(Severity.CRITICAL, policy.severityForFailedTransition());
    }

    @Test
    void shouldRecommendActionPerSeverity() {
        NotificationPolicy policy = new NotificationPolicy(false);

        assertEquals("No action.", policy.recommendedAction(Severity.OK));
        assertEquals("Monitor closely. No immediate action required.", policy.recommendedAction(Severity.WARNING));
        assertEquals("Investigate drift sources. Consider retraining.", policy.recommendedAction(Severity.ALERT));
        assertEquals("Retrain model or roll back to the previous version.",
                policy.recommendedAction(Severity.CRITICAL));
    }

    @Test
    void shouldExposeImmutableTable() {
        NotificationPolicy policy = new NotificationPolicy(false);

        assertThrows(UnsupportedOperationException.class,
                () -> policy.actionsFor(Severity.OK).add(DispatchAction.NOTIFY));
    }
}
