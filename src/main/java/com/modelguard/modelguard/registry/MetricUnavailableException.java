package com.modelguard.modelguard.registry;

import com.modelguard.modelguard.common.ModelGuardException;

/**
 * The registry holds the model version but not the metric needed to compare it.
 */
public class MetricUnavailableException extends ModelGuardException {

    public MetricUnavailableException(String modelName, String version, String metricKey) {
        super("METRIC_UNAVAILABLE", "Metric %s is not recorded for %s version %s".formatted(metricKey, modelName, version));
    }
}
