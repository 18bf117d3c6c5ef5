package com.modelguard.modelguard.ledger;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ClasspathSourcePopulationReaderTest {

    @Test
    void shouldReadConfiguredColumns() {
        LedgerProperties properties = new LedgerProperties();
        properties.setSourceFilePath("source/test-population.csv");
        properties.setSourceMetadataColumns(List.of("language"));

        List<SourceRecord> records = new ClasspathSourcePopulationReader(properties).readAll();

        assertEquals(12, records.size());
        SourceRecord first = records.get(0);
        assertEquals(11L, first.entityId());
        assertEquals("Peluche ourson", first.textFields().get("designation"));
        assertEquals("Jouet doux pour enfant", first.textFields().get("description"));
        assertEquals("fr", first.metadata().get("language"));
        assertEquals("1280", first.label());
        assertEquals("", records.get(1).textFields().get("description"));
    }

    @Test
    void shouldReadWithoutLabelColumn() {
        LedgerProperties properties = new LedgerProperties();
        properties.setSourceFilePath("source/test-population.csv");
        properties.setSourceLabelColumn("");

        assertNull(new ClasspathSourcePopulationReader(properties).readAll().get(0).label());
    }

    @Test
    void shouldFailOnMissingColumn() {
        LedgerProperties properties = new LedgerProperties();
        properties.setSourceFilePath("source/test-population.csv");
        properties.setSourceMetadataColumns(List.of("imageid"));

        assertThrows(IllegalStateException.class, () -> new ClasspathSourcePopulationReader(properties).readAll());
    }

    @Test
    void shouldFailOnMissingFile() {
        LedgerProperties properties = new LedgerProperties();
        properties.setSourceFilePath("source/does-not-exist.csv");

        assertThrows(IllegalStateException.class, () -> new ClasspathSourcePopulationReader(properties).readAll());
    }
}
