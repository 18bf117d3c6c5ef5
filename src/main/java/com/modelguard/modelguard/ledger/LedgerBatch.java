package com.modelguard.modelguard.ledger;

import java.util.Map;

/**
 * One loader invocation as recorded in the batch table.
 */
public record LedgerBatch(
        long batchId,
        String batchName,
        double targetFraction,
        int rowsAdded,
        int rowsUpdated,
        int totalRows,
        long startedAt,
        Long completedAt,
        BatchStatus status,
        Map<String, Object> metadata,
        String failureMessage
) {

    public LedgerBatch {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
