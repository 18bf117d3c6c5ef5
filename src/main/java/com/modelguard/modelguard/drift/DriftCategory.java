package com.modelguard.modelguard.drift;

public enum DriftCategory {
    DATA,
    PREDICTION,
    PERFORMANCE
}
