package com.modelguard.modelguard.ledger;

import java.util.Map;
import java.util.Objects;

/**
 * Current state of one ledger entity. The same shape is stored as the history snapshot.
 */
public record LedgerEntity(
        long entityId,
        Map<String, String> textFields,
        Map<String, String> metadata,
        String label,
        int version,
        long createdAt,
        long updatedAt
) {

    public LedgerEntity {
        textFields = textFields == null ? Map.of() : Map.copyOf(textFields);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Total character length of the free-text fields; the numeric signal used for drift.
     */
    public int textLength() {
        return textFields.values().stream().mapToInt(value -> value == null ? 0 : value.length()).sum();
    }

    boolean sameContentAs(SourceRecord source) {
        return textFields.equals(source.textFields())
                && metadata.equals(source.metadata())
                && Objects.equals(label, source.label());
    }
}
