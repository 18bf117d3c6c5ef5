package com.modelguard.modelguard.drift;

import java.util.List;
import java.util.Map;

/**
 * Detail payload stored with a report. {@code worstSignals} lists every signal that reached its
 * category's score, so ties are all kept. {@code predictedClassPsi} is informational and never enters a
 * category score.
 */
public record DriftDetails(
        List<SignalScore> signalScores,
        Map<DriftCategory, List<String>> worstSignals,
        List<String> unseenPredictedClasses,
        PerformanceObservation performance,
        Double predictedClassPsi
) {

    public DriftDetails {
        signalScores = signalScores == null ? List.of() : List.copyOf(signalScores);
        worstSignals = worstSignals == null ? Map.of() : Map.copyOf(worstSignals);
        unseenPredictedClasses = unseenPredictedClasses == null ? List.of() : List.copyOf(unseenPredictedClasses);
    }
}
