package com.modelguard.modelguard.ledger;

import java.util.Map;

/**
 * One row of the fixed source population, before it enters the ledger.
 */
public record SourceRecord(long entityId, Map<String, String> textFields, Map<String, String> metadata, String label) {

    public SourceRecord {
        textFields = textFields == null ? Map.of() : Map.copyOf(textFields);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
