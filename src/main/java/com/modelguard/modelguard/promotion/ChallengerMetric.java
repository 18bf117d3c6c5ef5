package com.modelguard.modelguard.promotion;

/**
 * The freshly trained candidate and its metric.
 */
public record ChallengerMetric(String modelName, String version, double metric) {

    public ChallengerMetric {
        if (!Double.isFinite(metric)) {
            throw new IllegalArgumentException("Challenger metric must be a finite number, got " + metric);
        }
    }
}
