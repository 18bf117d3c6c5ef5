package com.modelguard.modelguard.drift;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs the drift test battery over a pair of snapshots and reduces it to one verdict.
 * <p>
 * Every reduction is a maximum: a signal's category takes its worst signal and the overall score takes the
 * worst available category, so one badly drifted signal is never averaged away by stable ones. Data-drift
 * PSI is always the plain statistic; the small-sample correction only applies to the predicted-class PSI
 * kept in the details. The engine holds no state besides that setting and writes nothing.
 */
public class DriftEngine {

    private final boolean psiBiasCorrection;

    public DriftEngine(boolean psiBiasCorrection) {
        this.psiBiasCorrection = psiBiasCorrection;
    }

    public DriftReport evaluateDrift(
            DistributionSnapshot reference,
            DistributionSnapshot current,
            DriftThresholds thresholds
    ) {
        return evaluateDrift(reference, current, thresholds, null);
    }

    /**
     * @param performance held-out re-score of the serving model, or {@code null} when no held-out set is
     *                    configured; the performance category is then reported as {@code null}
     * @throws InsufficientSamplesException when either snapshot is below its configured minimum
     */
    public DriftReport evaluateDrift(
            DistributionSnapshot reference,
            DistributionSnapshot current,
            DriftThresholds thresholds,
            PerformanceObservation performance
    ) {
        requireSufficientSamples(reference, current, thresholds);

        List<SignalScore> scores = new ArrayList<>();
        scores.addAll(dataDrift(reference, current));

        List<String> unseenClasses = List.of();
        Double predictedClassPsi = null;
        if (!reference.predictedClassCounts().isEmpty() && !current.predictedClassCounts().isEmpty()) {
            predictedClassPsi = StatisticalTests.populationStabilityIndex(
                    reference.predictedClassCounts(), current.predictedClassCounts(), psiBiasCorrection);
            StatisticalTests.ChiSquareResult chiSquare = StatisticalTests.chiSquareGoodnessOfFit(
                    reference.predictedClassCounts(), current.predictedClassCounts());
            unseenClasses = chiSquare.unseenCategories();
            scores.add(new SignalScore(DriftCategory.PREDICTION, DriftConstants.SIGNAL_PREDICTED_CLASS,
                    DriftConstants.TEST_CHI_SQUARE, chiSquare.normalizedScore(), chiSquare.statistic(),
                    chiSquare.pValue()));
        }

        if (performance != null) {
            scores.add(new SignalScore(DriftCategory.PERFORMANCE, DriftConstants.SIGNAL_PERFORMANCE,
                    DriftConstants.TEST_METRIC_RATIO, performance.degradation(), performance.currentMetric(), null));
        }

        Double dataScore = categoryScore(scores, DriftCategory.DATA);
        Double predictionScore = categoryScore(scores, DriftCategory.PREDICTION);
        Double performanceScore = categoryScore(scores, DriftCategory.PERFORMANCE);
        double overall = DriftReport.overallOf(dataScore, predictionScore, performanceScore);
        Severity severity = thresholds.classify(overall);

        Map<DriftCategory, List<String>> worstSignals = new EnumMap<>(DriftCategory.class);
        for (DriftCategory category : DriftCategory.values()) {
            Double categoryScore = categoryScore(scores, category);
            if (categoryScore != null) {
                worstSignals.put(category, scores.stream()
                        .filter(score -> score.category() == category && score.score() == categoryScore)
                        .map(score -> score.signal() + ":" + score.test())
                        .toList());
            }
        }

        return new DriftReport(
                null,
                System.currentTimeMillis(),
                dataScore,
                predictionScore,
                performanceScore,
                overall,
                severity,
                severity != Severity.OK,
                thresholds,
                reference.sampleSize(),
                current.sampleSize(),
                new DriftDetails(scores, worstSignals, unseenClasses, performance, predictedClassPsi)
        );
    }

    public void requireSufficientSamples(
            DistributionSnapshot reference,
            DistributionSnapshot current,
            DriftThresholds thresholds
    ) {
        if (current.sampleSize() < thresholds.minCurrentSamples()) {
            throw new InsufficientSamplesException(SnapshotKind.CURRENT, current.sampleSize(),
                    thresholds.minCurrentSamples());
        }
        if (reference.sampleSize() < thresholds.minReferenceSamples()) {
            throw new InsufficientSamplesException(SnapshotKind.REFERENCE, reference.sampleSize(),
                    thresholds.minReferenceSamples());
        }
    }

    private List<SignalScore> dataDrift(DistributionSnapshot reference, DistributionSnapshot current) {
        List<SignalScore> scores = new ArrayList<>();

        Set<String> categorical = new TreeSet<>(reference.categoricalSignals().keySet());
        categorical.retainAll(current.categoricalSignals().keySet());
        for (String signal : categorical) {
            double psi = StatisticalTests.populationStabilityIndex(
                    reference.categoricalSignals().get(signal),
                    current.categoricalSignals().get(signal),
                    false);
            scores.add(new SignalScore(DriftCategory.DATA, signal, DriftConstants.TEST_PSI,
                    Math.min(psi, 1.0), psi, null));
        }

        Set<String> numeric = new TreeSet<>(reference.numericSignals().keySet());
        numeric.retainAll(current.numericSignals().keySet());
        for (String signal : numeric) {
            StatisticalTests.KsResult ks = StatisticalTests.kolmogorovSmirnov(
                    reference.numericSignals().get(signal),
                    current.numericSignals().get(signal));
            if (ks != null) {
                scores.add(new SignalScore(DriftCategory.DATA, signal, DriftConstants.TEST_KS,
                        ks.statistic(), ks.statistic(), ks.pValue()));
            }
        }
        return scores;
    }

    private static Double categoryScore(List<SignalScore> scores, DriftCategory category) {
        return scores.stream()
                .filter(score -> score.category() == category)
                .mapToDouble(SignalScore::score)
                .boxed()
                .max(Double::compare)
                .orElse(null);
    }
}
