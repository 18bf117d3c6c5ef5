package com.modelguard.modelguard.ledger;

import com.modelguard.modelguard.common.ModelGuardException;

/**
 * The insert phase of an opened batch failed. The batch is already marked failed and the entity
 * writes were rolled back when this is thrown.
 */
public class PartialCommitException extends ModelGuardException {

    private final long batchId;

    public PartialCommitException(long batchId, String batchName, Throwable cause) {
        super("PARTIAL_COMMIT", "Batch " + batchName + " failed during insert: " + cause.getMessage(), cause);
        this.batchId = batchId;
    }

    public long getBatchId() {
        return batchId;
    }
}
