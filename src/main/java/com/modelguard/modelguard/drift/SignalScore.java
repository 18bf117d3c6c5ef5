package com.modelguard.modelguard.drift;

/**
 * Normalized score of one signal under one test. {@code statistic} is the raw test statistic and
 * {@code pValue} is present only for tests that produce one.
 */
public record SignalScore(
        DriftCategory category,
        String signal,
        String test,
        double score,
        double statistic,
        Double pValue
) {
}
