package com.modelguard.modelguard.ledger;

import com.modelguard.modelguard.common.ModelGuardException;

public class DuplicateBatchNameException extends ModelGuardException {

    public DuplicateBatchNameException(String batchName) {
        super("DUPLICATE_BATCH_NAME", "Batch name already exists: " + batchName);
    }

    public DuplicateBatchNameException(String batchName, Throwable cause) {
        super("DUPLICATE_BATCH_NAME", "Batch name already exists: " + batchName, cause);
    }
}
