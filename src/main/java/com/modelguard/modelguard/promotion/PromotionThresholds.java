package com.modelguard.modelguard.promotion;

/**
 * Immutable promotion gate, passed explicitly into the engine.
 */
public record PromotionThresholds(double minAcceptableMetric) {

    public PromotionThresholds {
        if (!Double.isFinite(minAcceptableMetric)) {
            throw new IllegalArgumentException(PromotionConstants.MSG_MIN_METRIC_INVALID.formatted(minAcceptableMetric));
        }
    }
}
