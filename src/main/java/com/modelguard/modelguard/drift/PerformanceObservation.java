package com.modelguard.modelguard.drift;

/**
 * Held-out re-score of the serving model next to the metric it was registered with.
 */
public record PerformanceObservation(
        String modelName,
        String modelVersion,
        String heldOutSetId,
        double referenceMetric,
        double currentMetric
) {

    public PerformanceObservation {
        if (!(referenceMetric > 0.0) || !Double.isFinite(referenceMetric)) {
            throw new IllegalArgumentException("referenceMetric must be a positive number, got " + referenceMetric);
        }
        if (!Double.isFinite(currentMetric) || currentMetric < 0.0) {
            throw new IllegalArgumentException("currentMetric must be a non-negative number, got " + currentMetric);
        }
    }

    /**
     * Relative degradation {@code max(0, 1 - current/reference)}, capped at 1.
     */
    public double degradation() {
        return Math.min(1.0, Math.max(0.0, 1.0 - currentMetric / referenceMetric));
    }
}
