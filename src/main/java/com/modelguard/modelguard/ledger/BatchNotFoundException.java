package com.modelguard.modelguard.ledger;

import com.modelguard.modelguard.common.ModelGuardException;

public class BatchNotFoundException extends ModelGuardException {

    public BatchNotFoundException(long batchId) {
        super("BATCH_NOT_FOUND", LedgerConstants.MSG_BATCH_NOT_FOUND.formatted(batchId));
    }
}
