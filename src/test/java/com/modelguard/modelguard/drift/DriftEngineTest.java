package com.modelguard.modelguard.drift;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DriftEngineTest {

    private static final DriftThresholds THRESHOLDS = new DriftThresholds(0.1, 0.2, 0.3, 50, 50);

    private final DriftEngine engine = new DriftEngine(true);

    @Test
    void shouldReportOkForIdenticalSnapshots() {
        DistributionSnapshot reference = snapshot(SnapshotKind.REFERENCE, 200, false);
        DistributionSnapshot current = snapshot(SnapshotKind.CURRENT, 200, false);

        DriftReport report = engine.evaluateDrift(reference, current, THRESHOLDS);

        assertEquals(Severity.OK, report.severity());
        assertFalse(report.driftDetected());
        assertEquals(0.0, report.overallScore(), 1e-12);
        assertNull(report.performanceDriftScore());
        assertEquals(200, report.referenceSampleSize());
    }

    @Test
    void shouldNotAverageAwayOneDegradedSignal() {
        DistributionSnapshot reference = snapshot(SnapshotKind.REFERENCE, 200, false);
        DistributionSnapshot current = snapshot(SnapshotKind.CURRENT, 200, false);
        PerformanceObservation performance = new PerformanceObservation("rakuten_classifier", "3", "holdout-v1",
                1.0, 0.1);

        DriftReport report = engine.evaluateDrift(reference, current, THRESHOLDS, performance);

        assertEquals(11, report.details().signalScores().size());
        assertEquals(0.0, report.dataDriftScore(), 1e-12);
        assertEquals(0.9, report.performanceDriftScore(), 1e-9);
        assertEquals(0.9, report.overallScore(), 1e-9);
        assertEquals(Severity.CRITICAL, report.severity());
        assertEquals(List.of("held_out_metric:METRIC_RATIO"),
                report.details().worstSignals().get(DriftCategory.PERFORMANCE));
    }

    @Test
    void shouldKeepFullPsiOfOneSkewedSignalAmongNineStableOnes() {
        long[] skewed = {36, 20, 12, 9, 7, 5, 4, 3, 2, 2};
        DistributionSnapshot.Builder reference = DistributionSnapshot.builder("ref", SnapshotKind.REFERENCE);
        DistributionSnapshot.Builder current = DistributionSnapshot.builder("cur", SnapshotKind.CURRENT);
        for (int i = 0; i < 100; i++) {
            reference.sample();
            current.sample();
            for (int signal = 0; signal < 10; signal++) {
                reference.category("signal_" + signal, "c" + (i % 10));
                if (signal < 9) {
                    current.category("signal_" + signal, "c" + (i % 10));
                }
            }
        }
        for (int bucket = 0; bucket < skewed.length; bucket++) {
            for (int n = 0; n < skewed[bucket]; n++) {
                current.category("signal_9", "c" + bucket);
            }
        }
        DistributionSnapshot referenceSnapshot = reference.build();
        DistributionSnapshot currentSnapshot = current.build();
        double plainPsi = StatisticalTests.populationStabilityIndex(
                referenceSnapshot.categoricalSignals().get("signal_9"),
                currentSnapshot.categoricalSignals().get("signal_9"),
                false);

        DriftReport report = engine.evaluateDrift(referenceSnapshot, currentSnapshot, THRESHOLDS);

        assertEquals(0.849, plainPsi, 1e-3);
        assertEquals(plainPsi, report.dataDriftScore(), 1e-12);
        assertEquals(Severity.CRITICAL, report.severity());
        assertEquals(List.of("signal_9:PSI"), report.details().worstSignals().get(DriftCategory.DATA));
        assertNull(report.details().predictedClassPsi());
    }

    @Test
    void shouldNotLetSmallSampleCorrectionLowerDataDriftSeverity() {
        // Raw PSI is about 0.18; subtracting (K-1)(1/n_ref + 1/n_cur) = 0.18 would report no drift.
        DistributionSnapshot.Builder reference = DistributionSnapshot.builder("ref", SnapshotKind.REFERENCE);
        DistributionSnapshot.Builder current = DistributionSnapshot.builder("cur", SnapshotKind.CURRENT);
        long[] shifted = {20, 15, 12, 10, 9, 9, 8, 7, 5, 5};
        for (int i = 0; i < 100; i++) {
            reference.sample().category("language", "l" + (i % 10)).predictedClass(i % 2 == 0 ? "10" : "40");
            current.sample().predictedClass(i % 2 == 0 ? "10" : "40");
        }
        for (int bucket = 0; bucket < shifted.length; bucket++) {
            for (int n = 0; n < shifted[bucket]; n++) {
                current.category("language", "l" + bucket);
            }
        }
        DistributionSnapshot referenceSnapshot = reference.build();
        DistributionSnapshot currentSnapshot = current.build();
        double plainPsi = StatisticalTests.populationStabilityIndex(
                referenceSnapshot.categoricalSignals().get("language"),
                currentSnapshot.categoricalSignals().get("language"),
                false);

        DriftReport report = engine.evaluateDrift(referenceSnapshot, currentSnapshot, THRESHOLDS);

        assertTrue(plainPsi >= 0.1, "plain PSI " + plainPsi);
        assertEquals(plainPsi, report.dataDriftScore(), 1e-12);
        assertTrue(report.driftDetected());
        assertEquals(0.0, report.details().predictedClassPsi(), 1e-12);
    }

    @Test
    void shouldTakeWorstDataSignal() {
        DistributionSnapshot reference = snapshot(SnapshotKind.REFERENCE, 200, false);
        DistributionSnapshot current = snapshot(SnapshotKind.CURRENT, 200, true);

        DriftReport report = engine.evaluateDrift(reference, current, THRESHOLDS);

        assertEquals(1.0, report.dataDriftScore(), 1e-12);
        assertEquals(Severity.CRITICAL, report.severity());
        assertEquals(List.of("signal_8:PSI"), report.details().worstSignals().get(DriftCategory.DATA));
    }

    @Test
    void shouldFlagUnseenPredictedClasses() {
        DistributionSnapshot reference = DistributionSnapshot.builder("ref", SnapshotKind.REFERENCE)
                .predictedClass("10").predictedClass("40")
                .build();
        DistributionSnapshot.Builder current = DistributionSnapshot.builder("cur", SnapshotKind.CURRENT);
        current.predictedClass("10").predictedClass("40").predictedClass("2583");
        DriftThresholds lenient = new DriftThresholds(0.1, 0.2, 0.3, 1, 1);

        DriftReport report = engine.evaluateDrift(withSamples(reference, 2), withSamples(current.build(), 3), lenient);

        assertEquals(List.of("2583"), report.details().unseenPredictedClasses());
        assertEquals(0.0, report.predictionDriftScore(), 1e-12);
    }

    @Test
    void shouldUseInclusiveLowerBounds() {
        assertEquals(Severity.OK, THRESHOLDS.classify(0.0999));
        assertEquals(Severity.WARNING, THRESHOLDS.classify(0.1));
        assertEquals(Severity.WARNING, THRESHOLDS.classify(0.1999));
        assertEquals(Severity.ALERT, THRESHOLDS.classify(0.2));
        assertEquals(Severity.ALERT, THRESHOLDS.classify(0.2999));
        assertEquals(Severity.CRITICAL, THRESHOLDS.classify(0.3));
        assertEquals(Severity.CRITICAL, THRESHOLDS.classify(1.0));
    }

    @Test
    void shouldSkipWhenCurrentSnapshotIsTooSmall() {
        DistributionSnapshot reference = snapshot(SnapshotKind.REFERENCE, 200, false);
        DistributionSnapshot current = snapshot(SnapshotKind.CURRENT, 40, false);

        InsufficientSamplesException ex = assertThrows(InsufficientSamplesException.class,
                () -> engine.evaluateDrift(reference, current, THRESHOLDS));

        assertEquals(SnapshotKind.CURRENT, ex.getKind());
        assertEquals(40, ex.getActual());
        assertEquals(50, ex.getRequired());
    }

    @Test
    void shouldSkipWhenReferenceSnapshotIsTooSmall() {
        DistributionSnapshot reference = snapshot(SnapshotKind.REFERENCE, 10, false);
        DistributionSnapshot current = snapshot(SnapshotKind.CURRENT, 200, false);

        InsufficientSamplesException ex = assertThrows(InsufficientSamplesException.class,
                () -> engine.evaluateDrift(reference, current, THRESHOLDS));

        assertEquals(SnapshotKind.REFERENCE, ex.getKind());
    }

    @Test
    void shouldProduceSameVerdictForSameInputs() {
        DistributionSnapshot reference = snapshot(SnapshotKind.REFERENCE, 200, false);
        DistributionSnapshot current = snapshot(SnapshotKind.CURRENT, 200, true);

        DriftReport first = engine.evaluateDrift(reference, current, THRESHOLDS);
        DriftReport second = engine.evaluateDrift(reference, current, THRESHOLDS);

        assertEquals(first.overallScore(), second.overallScore());
        assertEquals(first.severity(), second.severity());
        assertEquals(first.details().signalScores(), second.details().signalScores());
    }

    @Test
    void shouldRejectReportWithInconsistentSeverity() {
        assertThrows(IllegalStateException.class, () -> new DriftReport(null, 0L, 0.25, null, null, 0.25,
                Severity.WARNING, true, THRESHOLDS, 100, 100, null));
        assertThrows(IllegalStateException.class, () -> new DriftReport(null, 0L, 0.25, 0.05, null, 0.05,
                Severity.OK, false, THRESHOLDS, 100, 100, null));
        assertThrows(IllegalStateException.class, () -> new DriftReport(null, 0L, 0.05, null, null, 0.05,
                Severity.OK, true, THRESHOLDS, 100, 100, null));
    }

    @Test
    void shouldAcceptConsistentReport() {
        DriftReport report = new DriftReport(null, 0L, 0.25, 0.05, null, 0.25, Severity.ALERT, true, THRESHOLDS,
                100, 100, null);

        assertTrue(report.details().signalScores().isEmpty());
    }

    @Test
    void shouldRejectUnorderedThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new DriftThresholds(0.2, 0.1, 0.3, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new DriftThresholds(0.1, 0.2, 1.5, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new DriftThresholds(0.0, 0.2, 0.3, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new DriftThresholds(0.1, 0.2, 0.3, 0, 1));
    }

    /**
     * Eight categorical signals, one numeric and the predicted class; {@code shiftLast} moves the last
     * categorical signal entirely onto a category the reference never saw.
     */
    private static DistributionSnapshot snapshot(SnapshotKind kind, int samples, boolean shiftLast) {
        DistributionSnapshot.Builder builder = DistributionSnapshot.builder(kind.name(), kind);
        for (int i = 0; i < samples; i++) {
            builder.sample();
            for (int signal = 1; signal <= 8; signal++) {
                String category = shiftLast && signal == 8 ? "new" : (i % 2 == 0 ? "a" : "b");
                builder.category("signal_" + signal, category);
            }
            builder.numeric(DriftConstants.SIGNAL_TEXT_LENGTH, i % 50);
            builder.predictedClass(i % 3 == 0 ? "10" : "40");
        }
        return builder.build();
    }

    private static DistributionSnapshot withSamples(DistributionSnapshot snapshot, int samples) {
        return new DistributionSnapshot(snapshot.name(), snapshot.kind(), snapshot.windowStart(),
                snapshot.windowEnd(), snapshot.numericSignals(), snapshot.categoricalSignals(),
                snapshot.predictedClassCounts(), samples);
    }
}
