package com.modelguard.modelguard.ledger;

import java.util.List;

/**
 * Abstraction for obtaining the fixed source population from any backing store.
 */
public interface SourcePopulationReader {

    /**
     * Reads every row of the population. Implementations must return the same rows on every call.
     */
    List<SourceRecord> readAll();
}
