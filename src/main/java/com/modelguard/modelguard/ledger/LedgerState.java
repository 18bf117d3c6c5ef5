package com.modelguard.modelguard.ledger;

/**
 * Current loading state: what has been committed and what the next scheduled increment targets.
 */
public record LedgerState(
        double currentFraction,
        long entityCount,
        int sourcePopulationSize,
        String lastCompletedBatch,
        Long lastCompletedAt,
        double nextTargetFraction
) {
}
