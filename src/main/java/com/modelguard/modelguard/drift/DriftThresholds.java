package com.modelguard.modelguard.drift;

/**
 * Severity bands and sample-size minimums for one drift evaluation. Each threshold is the inclusive
 * lower bound of its band.
 */
public record DriftThresholds(
        double warning,
        double alert,
        double critical,
        int minCurrentSamples,
        int minReferenceSamples
) {

    public static final DriftThresholds DEFAULT = new DriftThresholds(
            DriftConstants.DEFAULT_WARNING_THRESHOLD,
            DriftConstants.DEFAULT_ALERT_THRESHOLD,
            DriftConstants.DEFAULT_CRITICAL_THRESHOLD,
            DriftConstants.DEFAULT_MIN_CURRENT_SAMPLES,
            DriftConstants.DEFAULT_MIN_REFERENCE_SAMPLES
    );

    public DriftThresholds {
        if (!Double.isFinite(warning) || !Double.isFinite(alert) || !Double.isFinite(critical)) {
            throw new IllegalArgumentException(DriftConstants.MSG_THRESHOLDS_NOT_FINITE);
        }
        if (warning <= 0.0 || warning >= alert || alert >= critical || critical > 1.0) {
            throw new IllegalArgumentException(
                    DriftConstants.MSG_THRESHOLDS_NOT_ORDERED.formatted(warning, alert, critical));
        }
        if (minCurrentSamples < 1 || minReferenceSamples < 1) {
            throw new IllegalArgumentException(DriftConstants.MSG_MIN_SAMPLES_INVALID);
        }
    }

    public Severity classify(double overallScore) {
        if (overallScore >= critical) {
            return Severity.CRITICAL;
        }
        if (overallScore >= alert) {
            return Severity.ALERT;
        }
        if (overallScore >= warning) {
            return Severity.WARNING;
        }
        return Severity.OK;
    }
}
