package com.modelguard.modelguard.predictionlog;

import java.util.Map;

public final class PredictionLogModels {

    private PredictionLogModels() {
    }

    /**
     * One served prediction as reported by the serving process. {@code loggedAt} defaults to now.
     */
    public record PredictionLogRequest(
            Long loggedAt,
            Map<String, Object> inputSignals,
            String predictedClass,
            Double confidence,
            String servingModelVersion
    ) {
    }

    public record PredictionLogEntry(
            long predictionId,
            long loggedAt,
            Map<String, Object> inputSignals,
            String predictedClass,
            Double confidence,
            String servingModelVersion
    ) {
    }
}
