package com.modelguard.modelguard.promotion;

/**
 * Shared constants for automatic model promotion.
 */
public final class PromotionConstants {

    private PromotionConstants() {
    }

    public static final double DEFAULT_MIN_ACCEPTABLE_METRIC = 0.75;

    public static final String DECISION_TABLE = "promotion_decision";

    public static final String MSG_MIN_METRIC_INVALID = "promotion.min-acceptable-metric must be a finite number, got %s";
    public static final String MSG_JUSTIFICATION_REQUIRED = "A promotion decision requires a non-blank justification";
    public static final String MSG_CHALLENGER_NOT_CANDIDATE =
            "Challenger %s version %s is in stage %s; only None or Staging versions can be promoted";
    public static final String MSG_CHALLENGER_IS_INCUMBENT = "Challenger %s version %s is already the Production version";
    public static final String MSG_DECISION_NOT_FOUND = "Promotion decision %d not found";
}
