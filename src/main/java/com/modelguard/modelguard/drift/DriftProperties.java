package com.modelguard.modelguard.drift;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Drift monitoring configuration bound from {@code drift.*}.
 */
@ConfigurationProperties(prefix = "drift")
public class DriftProperties {

    private double warningThreshold = DriftConstants.DEFAULT_WARNING_THRESHOLD;
    private double alertThreshold = DriftConstants.DEFAULT_ALERT_THRESHOLD;
    private double criticalThreshold = DriftConstants.DEFAULT_CRITICAL_THRESHOLD;
    private int minCurrentSamples = DriftConstants.DEFAULT_MIN_CURRENT_SAMPLES;
    private int minReferenceSamples = DriftConstants.DEFAULT_MIN_REFERENCE_SAMPLES;
    private boolean psiBiasCorrection = true;
    private ReferenceSource referenceSource = ReferenceSource.PREDICTION_LOG;
    private int currentDays = DriftConstants.DEFAULT_CURRENT_DAYS;
    private int referenceDays = DriftConstants.DEFAULT_REFERENCE_DAYS;
    /** Held-out set used to re-score the production model; performance drift is skipped when blank. */
    private String heldOutSetId;
    private String cron = DriftConstants.DEFAULT_CRON;

    public double getWarningThreshold() {
        return warningThreshold;
    }

    public void setWarningThreshold(double warningThreshold) {
        this.warningThreshold = warningThreshold;
    }

    public double getAlertThreshold() {
        return alertThreshold;
    }

    public void setAlertThreshold(double alertThreshold) {
        this.alertThreshold = alertThreshold;
    }

    public double getCriticalThreshold() {
        return criticalThreshold;
    }

    public void setCriticalThreshold(double criticalThreshold) {
        this.criticalThreshold = criticalThreshold;
    }

    public int getMinCurrentSamples() {
        return minCurrentSamples;
    }

    public void setMinCurrentSamples(int minCurrentSamples) {
        this.minCurrentSamples = minCurrentSamples;
    }

    public int getMinReferenceSamples() {
        return minReferenceSamples;
    }

    public void setMinReferenceSamples(int minReferenceSamples) {
        this.minReferenceSamples = minReferenceSamples;
    }

    public boolean isPsiBiasCorrection() {
        return psiBiasCorrection;
    }

    public void setPsiBiasCorrection(boolean psiBiasCorrection) {
        this.psiBiasCorrection = psiBiasCorrection;
    }

    public ReferenceSource getReferenceSource() {
        return referenceSource;
    }

    public void setReferenceSource(ReferenceSource referenceSource) {
        this.referenceSource = referenceSource;
    }

    public int getCurrentDays() {
        return currentDays;
    }

    public void setCurrentDays(int currentDays) {
        this.currentDays = currentDays;
    }

    public int getReferenceDays() {
        return referenceDays;
    }

    public void setReferenceDays(int referenceDays) {
        this.referenceDays = referenceDays;
    }

    public String getHeldOutSetId() {
        return heldOutSetId;
    }

    public void setHeldOutSetId(String heldOutSetId) {
        this.heldOutSetId = heldOutSetId;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }
}
