package com.modelguard.modelguard.ledger;

public enum BatchOutcome {
    /** A new batch was committed. */
    COMPLETED,
    /** The requested fraction is already covered by a completed batch; nothing was written. */
    ALREADY_LOADED,
    /** The configured maximum fraction has been reached; nothing was written. */
    AT_MAXIMUM
}
