package com.modelguard.modelguard.drift;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the immutable thresholds and the engine from {@code drift.*}; bad values fail startup.
 */
@Configuration
@EnableConfigurationProperties(DriftProperties.class)
public class DriftConfig {

    @Bean
    public DriftThresholds driftThresholds(DriftProperties driftProperties) {
        if (driftProperties.getCurrentDays() < 1 || driftProperties.getReferenceDays() <= driftProperties.getCurrentDays()) {
            throw new IllegalArgumentException(DriftConstants.MSG_WINDOW_INVALID
                    .formatted(driftProperties.getReferenceDays(), driftProperties.getCurrentDays()));
        }
        return new DriftThresholds(
                driftProperties.getWarningThreshold(),
                driftProperties.getAlertThreshold(),
                driftProperties.getCriticalThreshold(),
                driftProperties.getMinCurrentSamples(),
                driftProperties.getMinReferenceSamples()
        );
    }

    @Bean
    public DriftEngine driftEngine(DriftProperties driftProperties) {
        return new DriftEngine(driftProperties.isPsiBiasCorrection());
    }
}
