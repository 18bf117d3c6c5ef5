package com.modelguard.modelguard.drift;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatisticalTestsTest {

    @Test
    void psiShouldBeZeroForIdenticalHistograms() {
        Map<String, Long> counts = Map.of("fr", 600L, "en", 300L, "de", 100L);

        assertEquals(0.0, StatisticalTests.populationStabilityIndex(counts, counts, false), 1e-12);
        assertEquals(0.0, StatisticalTests.populationStabilityIndex(counts, counts, true), 1e-12);
    }

    @Test
    void psiShouldMatchHandComputedValue() {
        Map<String, Long> reference = Map.of("a", 50L, "b", 50L);
        Map<String, Long> current = Map.of("a", 80L, "b", 20L);
        double expected = (0.8 - 0.5) * Math.log(0.8 / 0.5) + (0.2 - 0.5) * Math.log(0.2 / 0.5);

        assertEquals(expected, StatisticalTests.populationStabilityIndex(reference, current, false), 1e-9);
        double corrected = expected - (1.0 / 100 + 1.0 / 100);
        assertEquals(corrected, StatisticalTests.populationStabilityIndex(reference, current, true), 1e-9);
    }

    @Test
    void psiShouldFloorCategoriesMissingOnOneSide() {
        Map<String, Long> reference = Map.of("a", 100L);
        Map<String, Long> current = Map.of("a", 50L, "b", 50L);

        double psi = StatisticalTests.populationStabilityIndex(reference, current, false);

        assertTrue(Double.isFinite(psi));
        assertTrue(psi > 1.0);
    }

    @Test
    void ksShouldReturnNullForTinySamples() {
        assertNull(StatisticalTests.kolmogorovSmirnov(List.of(1.0), List.of(1.0, 2.0)));
    }

    @Test
    void ksShouldSeparateShiftedSamples() {
        List<Double> reference = new ArrayList<>();
        List<Double> shifted = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            reference.add((double) i);
            shifted.add(i + 100.0);
        }

        StatisticalTests.KsResult same = StatisticalTests.kolmogorovSmirnov(reference, reference);
        StatisticalTests.KsResult moved = StatisticalTests.kolmogorovSmirnov(reference, shifted);

        assertEquals(0.0, same.statistic(), 1e-12);
        assertEquals(0.5, moved.statistic(), 1e-9);
        assertTrue(moved.pValue() < 0.001);
    }

    @Test
    void chiSquareShouldReportUnseenClassesAndScoreZeroWhenMatching() {
        Map<String, Long> reference = Map.of("10", 100L, "40", 100L);
        Map<String, Long> current = Map.of("10", 50L, "40", 50L, "2583", 7L);

        StatisticalTests.ChiSquareResult result = StatisticalTests.chiSquareGoodnessOfFit(reference, current);

        assertEquals(List.of("2583"), result.unseenCategories());
        assertEquals(1, result.degreesOfFreedom());
        assertEquals(100, result.observedTotal());
        assertEquals(0.0, result.normalizedScore(), 1e-12);
    }

    @Test
    void chiSquareScoreShouldReachOneForCompleteShift() {
        Map<String, Long> reference = Map.of("10", 100L, "40", 100L);
        Map<String, Long> current = Map.of("10", 100L);

        StatisticalTests.ChiSquareResult result = StatisticalTests.chiSquareGoodnessOfFit(reference, current);

        assertEquals(1.0, result.normalizedScore(), 1e-9);
    }

    @Test
    void chiSquareShouldScoreZeroWithSingleReferenceClass() {
        StatisticalTests.ChiSquareResult result = StatisticalTests.chiSquareGoodnessOfFit(
                Map.of("10", 100L), Map.of("10", 40L, "40", 60L));

        assertEquals(0.0, result.normalizedScore(), 1e-12);
        assertEquals(List.of("40"), result.unseenCategories());
    }
}
