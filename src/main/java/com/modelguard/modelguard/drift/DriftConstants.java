package com.modelguard.modelguard.drift;

/**
 * Shared constants for drift detection.
 */
public final class DriftConstants {

    private DriftConstants() {
    }

    public static final double DEFAULT_WARNING_THRESHOLD = 0.1;
    public static final double DEFAULT_ALERT_THRESHOLD = 0.2;
    public static final double DEFAULT_CRITICAL_THRESHOLD = 0.3;
    public static final int DEFAULT_MIN_CURRENT_SAMPLES = 100;
    public static final int DEFAULT_MIN_REFERENCE_SAMPLES = 100;
    public static final int DEFAULT_CURRENT_DAYS = 1;
    public static final int DEFAULT_REFERENCE_DAYS = 7;
    public static final String DEFAULT_CRON = "0 0 6 * * *";

    public static final String REPORT_TABLE = "drift_report";

    public static final String SIGNAL_TEXT_LENGTH = "text_length";
    public static final String SIGNAL_CONFIDENCE = "confidence";
    public static final String SIGNAL_PREDICTED_CLASS = "predicted_class";
    public static final String SIGNAL_PERFORMANCE = "held_out_metric";

    public static final String TEST_PSI = "PSI";
    public static final String TEST_KS = "KS";
    public static final String TEST_CHI_SQUARE = "CHI_SQUARE";
    public static final String TEST_METRIC_RATIO = "METRIC_RATIO";

    /** Scores are compared with this tolerance when a stored report is re-validated. */
    public static final double SCORE_TOLERANCE = 1e-9;

    public static final String MSG_THRESHOLDS_NOT_FINITE = "Drift thresholds must be finite numbers";
    public static final String MSG_THRESHOLDS_NOT_ORDERED =
            "Drift thresholds must satisfy 0 < warning < alert < critical <= 1, got %s / %s / %s";
    public static final String MSG_MIN_SAMPLES_INVALID = "Drift sample minimums must be at least 1";
    public static final String MSG_INSUFFICIENT_SAMPLES = "%s snapshot has %d samples, at least %d required";
    public static final String MSG_WINDOW_INVALID = "drift.reference-days (%d) must exceed drift.current-days (%d)";
    public static final String MSG_REPORT_NOT_FOUND = "Drift report %d not found";
}
