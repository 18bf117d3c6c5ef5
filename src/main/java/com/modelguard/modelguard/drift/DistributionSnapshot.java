package com.modelguard.modelguard.drift;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary of the signals observed over one window: raw numeric samples, category counts and the
 * predicted-class histogram.
 */
public record DistributionSnapshot(
        String name,
        SnapshotKind kind,
        long windowStart,
        long windowEnd,
        Map<String, List<Double>> numericSignals,
        Map<String, Map<String, Long>> categoricalSignals,
        Map<String, Long> predictedClassCounts,
        int sampleSize
) {

    public DistributionSnapshot {
        if (sampleSize < 0) {
            throw new IllegalArgumentException("sampleSize must not be negative");
        }
        Map<String, List<Double>> numericCopy = new TreeMap<>();
        numericSignals.forEach((signal, values) -> numericCopy.put(signal, List.copyOf(values)));
        Map<String, Map<String, Long>> categoricalCopy = new TreeMap<>();
        categoricalSignals.forEach((signal, counts) -> categoricalCopy.put(signal, Map.copyOf(counts)));
        numericSignals = Map.copyOf(numericCopy);
        categoricalSignals = Map.copyOf(categoricalCopy);
        predictedClassCounts = Map.copyOf(predictedClassCounts);
    }

    public static Builder builder(String name, SnapshotKind kind) {
        return new Builder(name, kind);
    }

    public static final class Builder {

        private final String name;
        private final SnapshotKind kind;
        private long windowStart;
        private long windowEnd;
        private final Map<String, List<Double>> numericSignals = new LinkedHashMap<>();
        private final Map<String, Map<String, Long>> categoricalSignals = new LinkedHashMap<>();
        private final Map<String, Long> predictedClassCounts = new LinkedHashMap<>();
        private int sampleSize;

        private Builder(String name, SnapshotKind kind) {
            this.name = name;
            this.kind = kind;
        }

        public Builder window(long start, long end) {
            this.windowStart = start;
            this.windowEnd = end;
            return this;
        }

        /**
         * Counts one observation (one prediction or one ledger entity).
         */
        public Builder sample() {
            sampleSize++;
            return this;
        }

        public Builder numeric(String signal, double value) {
            if (Double.isFinite(value)) {
                numericSignals.computeIfAbsent(signal, key -> new ArrayList<>()).add(value);
            }
            return this;
        }

        public Builder category(String signal, String category) {
            if (category != null) {
                categoricalSignals.computeIfAbsent(signal, key -> new LinkedHashMap<>()).merge(category, 1L, Long::sum);
            }
            return this;
        }

        public Builder predictedClass(String predictedClass) {
            if (predictedClass != null) {
                predictedClassCounts.merge(predictedClass, 1L, Long::sum);
            }
            return this;
        }

        public DistributionSnapshot build() {
            return new DistributionSnapshot(name, kind, windowStart, windowEnd, numericSignals, categoricalSignals,
                    predictedClassCounts, sampleSize);
        }
    }
}
