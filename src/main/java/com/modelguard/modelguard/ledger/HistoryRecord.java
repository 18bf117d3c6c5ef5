package com.modelguard.modelguard.ledger;

/**
 * Audit row written for every entity mutation.
 */
public record HistoryRecord(
        long historyId,
        long entityId,
        LedgerEntity snapshot,
        OperationKind operation,
        long operatedAt,
        long batchId
) {
}
