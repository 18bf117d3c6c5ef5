package com.modelguard.modelguard.drift;

/**
 * Where the reference snapshot of a scheduled drift check comes from.
 */
public enum ReferenceSource {
    /** An earlier window of the prediction log. */
    PREDICTION_LOG,
    /** The training data of the latest completed ledger batch. */
    LEDGER
}
