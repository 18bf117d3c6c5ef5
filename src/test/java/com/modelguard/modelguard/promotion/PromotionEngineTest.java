package com.modelguard.modelguard.promotion;

import com.modelguard.modelguard.registry.ModelStage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromotionEngineTest {

    private static final PromotionThresholds THRESHOLDS = new PromotionThresholds(0.75);

    private final PromotionEngine engine = new PromotionEngine();

    @Test
    void shouldPromoteChallengerBeforeArchivingIncumbent() {
        PromotionDecision decision = engine.evaluatePromotion(
                new ChallengerMetric("rakuten_classifier", "4", 0.80),
                IncumbentMetric.of("3", 0.78),
                THRESHOLDS);

        assertEquals(PromotionOutcome.PROMOTE, decision.outcome());
        assertEquals(ComparisonMode.FULL, decision.comparisonMode());
        assertTrue(decision.passedMinimum());
        assertEquals(Boolean.TRUE, decision.beatIncumbent());
        assertEquals(List.of(
                new StageTransition("4", ModelStage.PRODUCTION),
                new StageTransition("3", ModelStage.ARCHIVED)
        ), decision.requestedTransitions());
        assertTrue(decision.justification().contains("[1]"));
        assertTrue(decision.justification().contains("[2]"));
        assertFalse(decision.transitionsApplied());
    }

    @Test
    void shouldRejectTieWithIncumbent() {
        PromotionDecision decision = engine.evaluatePromotion(
                new ChallengerMetric("rakuten_classifier", "4", 0.78),
                IncumbentMetric.of("3", 0.78),
                THRESHOLDS);

        assertEquals(PromotionOutcome.REJECT, decision.outcome());
        assertEquals(Boolean.FALSE, decision.beatIncumbent());
        assertTrue(decision.requestedTransitions().isEmpty());
    }

    @Test
    void shouldRejectMetricEqualToMinimum() {
        PromotionDecision decision = engine.evaluatePromotion(
                new ChallengerMetric("rakuten_classifier", "1", 0.75),
                IncumbentMetric.none(),
                THRESHOLDS);

        assertEquals(PromotionOutcome.REJECT, decision.outcome());
        assertFalse(decision.passedMinimum());
        assertTrue(decision.justification().contains("(fail)"));
    }

    @Test
    void shouldPromoteFirstModelWithoutIncumbent() {
        PromotionDecision decision = engine.evaluatePromotion(
                new ChallengerMetric("rakuten_classifier", "1", 0.76),
                IncumbentMetric.none(),
                THRESHOLDS);

        assertEquals(PromotionOutcome.PROMOTE, decision.outcome());
        assertEquals(ComparisonMode.NO_INCUMBENT, decision.comparisonMode());
        assertNull(decision.incumbentVersion());
        assertEquals(List.of(new StageTransition("1", ModelStage.PRODUCTION)), decision.requestedTransitions());
    }

    @Test
    void shouldFlagDegradedComparisonWhenIncumbentMetricIsUnavailable() {
        PromotionDecision decision = engine.evaluatePromotion(
                new ChallengerMetric("rakuten_classifier", "4", 0.80),
                IncumbentMetric.unavailable("3", "metric missing"),
                THRESHOLDS);

        assertEquals(ComparisonMode.DEGRADED_COMPARISON, decision.comparisonMode());
        assertNull(decision.beatIncumbent());
        assertEquals(PromotionOutcome.PROMOTE, decision.outcome());
        assertTrue(decision.justification().contains("DEGRADED_COMPARISON"));
        assertEquals(2, decision.requestedTransitions().size());
    }

    @Test
    void shouldRejectBelowMinimumEvenInDegradedMode() {
        PromotionDecision decision = engine.evaluatePromotion(
                new ChallengerMetric("rakuten_classifier", "4", 0.70),
                IncumbentMetric.unavailable("3", null),
                THRESHOLDS);

        assertEquals(PromotionOutcome.REJECT, decision.outcome());
        assertEquals(ComparisonMode.DEGRADED_COMPARISON, decision.comparisonMode());
    }

    @Test
    void shouldRejectDecisionWithoutJustification() {
        assertThrows(IllegalStateException.class, () -> new PromotionDecision(null, 0L, "m", "2", 0.8, null, null,
                0.75, true, Boolean.TRUE, ComparisonMode.NO_INCUMBENT, PromotionOutcome.PROMOTE, "  ",
                List.of(), false));
    }

    @Test
    void shouldRejectOutcomeThatContradictsChecks() {
        assertThrows(IllegalStateException.class, () -> new PromotionDecision(null, 0L, "m", "2", 0.7, null, null,
                0.75, false, Boolean.TRUE, ComparisonMode.NO_INCUMBENT, PromotionOutcome.PROMOTE, "promote anyway",
                List.of(), false));
        assertThrows(IllegalStateException.class, () -> new PromotionDecision(null, 0L, "m", "2", 0.7, null, null,
                0.75, false, Boolean.TRUE, ComparisonMode.NO_INCUMBENT, PromotionOutcome.REJECT, "rejected",
                List.of(new StageTransition("2", ModelStage.PRODUCTION)), false));
    }
}
