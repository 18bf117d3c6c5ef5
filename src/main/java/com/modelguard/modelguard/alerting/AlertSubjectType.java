package com.modelguard.modelguard.alerting;

/**
 * Kinds of record that can be dispatched and acted upon by operators.
 */
public enum AlertSubjectType {
    DRIFT_REPORT,
    PROMOTION_DECISION
}
