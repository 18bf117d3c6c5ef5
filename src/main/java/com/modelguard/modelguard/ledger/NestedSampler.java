package com.modelguard.modelguard.ledger;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.List;

/**
 * Deterministic monotone sampling: every row gets a seeded hash key and the population is ranked by
 * that key once. A fraction selects a prefix of the ranking, so any row selected at a lower fraction
 * stays selected at every higher one.
 */
public final class NestedSampler {

    private final long seed;

    public NestedSampler(long seed) {
        this.seed = seed;
    }

    /**
     * Returns the selected rows in ranking order.
     */
    public List<SourceRecord> select(List<SourceRecord> population, int targetBasisPoints) {
        int rows = targetRowCount(population.size(), targetBasisPoints);
        return population.stream()
                .map(source -> new Ranked(rankKey(source.entityId()), source))
                .sorted(Comparator.comparingLong(Ranked::key)
                        .thenComparingLong(ranked -> ranked.source().entityId()))
                .limit(rows)
                .map(Ranked::source)
                .toList();
    }

    public static int targetRowCount(int total, int targetBasisPoints) {
        return (int) ((long) total * targetBasisPoints / LedgerConstants.BASIS_POINTS);
    }

    long rankKey(long entityId) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((seed + ":" + entityId).getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(hash, 0, Long.BYTES).getLong();
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }

    private record Ranked(long key, SourceRecord source) {
    }
}
