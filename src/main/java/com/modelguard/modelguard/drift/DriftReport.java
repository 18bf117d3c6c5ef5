package com.modelguard.modelguard.drift;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * Outcome of one drift evaluation.
 * <p>
 * The constructor re-derives the overall score, severity and {@code driftDetected} from the category scores
 * and thresholds and rejects any mismatch, so an inconsistent report cannot exist in memory, whether it was
 * just computed or read back from storage.
 */
public record DriftReport(
        Long reportId,
        long createdAt,
        Double dataDriftScore,
        Double predictionDriftScore,
        Double performanceDriftScore,
        double overallScore,
        Severity severity,
        boolean driftDetected,
        DriftThresholds thresholds,
        int referenceSampleSize,
        int currentSampleSize,
        DriftDetails details
) {

    public DriftReport {
        if (severity == null || thresholds == null) {
            throw new IllegalStateException("Drift report requires a severity and thresholds");
        }
        Stream.of(dataDriftScore, predictionDriftScore, performanceDriftScore).forEach(DriftReport::requireUnitScore);
        requireUnitScore(overallScore);
        double expectedOverall = overallOf(dataDriftScore, predictionDriftScore, performanceDriftScore);
        if (Math.abs(expectedOverall - overallScore) > DriftConstants.SCORE_TOLERANCE) {
            throw new IllegalStateException("Overall score %s does not match category scores (expected %s)"
                    .formatted(overallScore, expectedOverall));
        }
        Severity expectedSeverity = thresholds.classify(overallScore);
        if (severity != expectedSeverity) {
            throw new IllegalStateException("Severity %s is inconsistent with overall score %s (expected %s)"
                    .formatted(severity, overallScore, expectedSeverity));
        }
        if (driftDetected != (severity != Severity.OK)) {
            throw new IllegalStateException("driftDetected=" + driftDetected + " contradicts severity " + severity);
        }
        if (details == null) {
            details = new DriftDetails(null, null, null, null, null);
        }
    }

    /**
     * Worst-case reduction over the available category scores; 0 when none is available.
     */
    public static double overallOf(Double dataDriftScore, Double predictionDriftScore, Double performanceDriftScore) {
        return Stream.of(dataDriftScore, predictionDriftScore, performanceDriftScore)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .max()
                .orElse(0.0);
    }

    public DriftReport withReportId(long id) {
        return new DriftReport(id, createdAt, dataDriftScore, predictionDriftScore, performanceDriftScore,
                overallScore, severity, driftDetected, thresholds, referenceSampleSize, currentSampleSize, details);
    }

    private static void requireUnitScore(Double score) {
        if (score != null && (score.isNaN() || score < 0.0 || score > 1.0)) {
            throw new IllegalStateException("Drift score out of [0, 1]: " + score);
        }
    }
}
