package com.modelguard.modelguard.ledger;

import com.modelguard.modelguard.common.SkippedRunException;

/**
 * Another batch is still running; the ledger admits a single writer. A scheduled run treats it as a skip.
 */
public class LoaderBusyException extends SkippedRunException {

    public LoaderBusyException(String runningBatchName) {
        super("LOADER_BUSY", "Batch " + runningBatchName + " is still running");
    }
}
