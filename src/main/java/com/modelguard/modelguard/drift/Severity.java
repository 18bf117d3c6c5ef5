package com.modelguard.modelguard.drift;

/**
 * Drift verdict, ordered from least to most severe.
 */
public enum Severity {
    OK,
    WARNING,
    ALERT,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
