package com.modelguard.modelguard.ledger;

import com.modelguard.modelguard.common.SkippedRunException;

/**
 * The whole source population is already in the ledger; there is nothing left to load.
 */
public class SourceExhaustedException extends SkippedRunException {

    public SourceExhaustedException(double currentFraction) {
        super("SOURCE_EXHAUSTED", "Source population fully loaded (current fraction %.4f)".formatted(currentFraction));
    }
}
