package com.modelguard.modelguard.promotion;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Promotion gate configuration bound from {@code promotion.*}.
 */
@ConfigurationProperties(prefix = "promotion")
public class PromotionProperties {

    private double minAcceptableMetric = PromotionConstants.DEFAULT_MIN_ACCEPTABLE_METRIC;
    /** When false, decisions are still evaluated and recorded but no stage transition is requested. */
    private boolean autoPromotionEnabled = true;

    public double getMinAcceptableMetric() {
        return minAcceptableMetric;
    }

    public void setMinAcceptableMetric(double minAcceptableMetric) {
        this.minAcceptableMetric = minAcceptableMetric;
    }

    public boolean isAutoPromotionEnabled() {
        return autoPromotionEnabled;
    }

    public void setAutoPromotionEnabled(boolean autoPromotionEnabled) {
        this.autoPromotionEnabled = autoPromotionEnabled;
    }
}
