package com.modelguard.modelguard.promotion;

public enum ComparisonMode {
    /** Both checks evaluated against a readable incumbent metric. */
    FULL,
    /** Nothing in Production; the incumbent check passes by definition. */
    NO_INCUMBENT,
    /** An incumbent exists but its metric is unreadable; only the minimum decided. */
    DEGRADED_COMPARISON
}
