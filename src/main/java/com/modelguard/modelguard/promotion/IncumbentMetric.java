package com.modelguard.modelguard.promotion;

/**
 * What is known about the model currently in Production: nothing serving, a serving version with its
 * metric, or a serving version whose metric could not be read.
 */
public record IncumbentMetric(String version, Double metric, String unavailableReason) {

    private static final IncumbentMetric NONE = new IncumbentMetric(null, null, null);

    public static IncumbentMetric none() {
        return NONE;
    }

    public static IncumbentMetric of(String version, double metric) {
        if (!Double.isFinite(metric)) {
            throw new IllegalArgumentException("Incumbent metric must be a finite number, got " + metric);
        }
        return new IncumbentMetric(version, metric, null);
    }

    public static IncumbentMetric unavailable(String version, String reason) {
        return new IncumbentMetric(version, null, reason == null ? "metric unavailable" : reason);
    }

    public boolean exists() {
        return version != null;
    }

    public boolean isAvailable() {
        return metric != null;
    }
}
