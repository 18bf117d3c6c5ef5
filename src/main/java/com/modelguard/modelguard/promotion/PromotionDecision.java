package com.modelguard.modelguard.promotion;

import java.util.List;

/**
 * Auditable outcome of one promotion evaluation.
 * <p>
 * {@code beatIncumbent} is {@code null} when the incumbent check could not be evaluated
 * ({@link ComparisonMode#DEGRADED_COMPARISON}). A decision without a justification, or whose outcome and
 * requested transitions do not follow from its checks, cannot be constructed.
 */
public record PromotionDecision(
        Long decisionId,
        long decidedAt,
        String modelName,
        String challengerVersion,
        double challengerMetric,
        String incumbentVersion,
        Double incumbentMetric,
        double minAcceptableMetric,
        boolean passedMinimum,
        Boolean beatIncumbent,
        ComparisonMode comparisonMode,
        PromotionOutcome outcome,
        String justification,
        List<StageTransition> requestedTransitions,
        boolean transitionsApplied
) {

    public PromotionDecision {
        if (justification == null || justification.isBlank()) {
            throw new IllegalStateException(PromotionConstants.MSG_JUSTIFICATION_REQUIRED);
        }
        if (comparisonMode == null || outcome == null) {
            throw new IllegalStateException("A promotion decision requires a comparison mode and an outcome");
        }
        requestedTransitions = requestedTransitions == null ? List.of() : List.copyOf(requestedTransitions);
        boolean shouldPromote = passedMinimum && !Boolean.FALSE.equals(beatIncumbent);
        if ((outcome == PromotionOutcome.PROMOTE) != shouldPromote) {
            throw new IllegalStateException("Outcome %s contradicts checks (minimum=%s, incumbent=%s)"
                    .formatted(outcome, passedMinimum, beatIncumbent));
        }
        if (outcome == PromotionOutcome.REJECT && (!requestedTransitions.isEmpty() || transitionsApplied)) {
            throw new IllegalStateException("A rejected decision must not request stage transitions");
        }
    }

    public PromotionDecision withDecisionId(long id) {
        return new PromotionDecision(id, decidedAt, modelName, challengerVersion, challengerMetric, incumbentVersion,
                incumbentMetric, minAcceptableMetric, passedMinimum, beatIncumbent, comparisonMode, outcome,
                justification, requestedTransitions, transitionsApplied);
    }

    public PromotionDecision withTransitionsApplied() {
        return new PromotionDecision(decisionId, decidedAt, modelName, challengerVersion, challengerMetric,
                incumbentVersion, incumbentMetric, minAcceptableMetric, passedMinimum, beatIncumbent, comparisonMode,
                outcome, justification, requestedTransitions, true);
    }
}
