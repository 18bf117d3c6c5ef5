package com.modelguard.modelguard.ledger;

/**
 * Service response for one loader invocation.
 */
public record BatchResult(
        BatchOutcome outcome,
        Long batchId,
        String batchName,
        double previousFraction,
        double targetFraction,
        int rowsAdded,
        int rowsUpdated,
        int totalRows
) {

    static BatchResult noOp(BatchOutcome outcome, double currentFraction, int totalRows) {
        return new BatchResult(outcome, null, null, currentFraction, currentFraction, 0, 0, totalRows);
    }
}
