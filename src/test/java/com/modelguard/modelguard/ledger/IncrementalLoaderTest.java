package com.modelguard.modelguard.ledger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class IncrementalLoaderTest {

    @Autowired
    private IncrementalLoader incrementalLoader;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private LedgerProperties ledgerProperties;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TestSourcePopulationReader sourceReader;

    @BeforeEach
    void resetLedger() {
        jdbcTemplate.execute("DELETE FROM ledger_history");
        jdbcTemplate.execute("DELETE FROM ledger_entity");
        jdbcTemplate.execute("DELETE FROM ledger_batch");
        sourceReader.reset(population(8));
    }

    @AfterEach
    void restoreProperties() {
        ledgerProperties.setApplySourceCorrections(false);
    }

    @Test
    void shouldGrowLedgerByConfiguredStepAndKeepEarlierRows() {
        BatchResult first = incrementalLoader.loadNextIncrement();
        assertEquals(BatchOutcome.COMPLETED, first.outcome());
        assertEquals("load_02500", first.batchName());
        assertEquals(2, first.rowsAdded());
        assertEquals(2, first.totalRows());
        Set<Long> firstIds = ledgerStore.findEntityIds();

        BatchResult second = incrementalLoader.loadNextIncrement();
        assertEquals(0.25, second.previousFraction(), 1e-9);
        assertEquals(0.5, second.targetFraction(), 1e-9);
        assertEquals(2, second.rowsAdded());
        assertEquals(4, second.totalRows());
        assertTrue(ledgerStore.findEntityIds().containsAll(firstIds));

        LedgerState state = incrementalLoader.currentState();
        assertEquals(0.5, state.currentFraction(), 1e-9);
        assertEquals(4, state.entityCount());
        assertEquals(8, state.sourcePopulationSize());
        assertEquals("load_05000", state.lastCompletedBatch());
        assertEquals(0.75, state.nextTargetFraction(), 1e-9);
    }

    @Test
    void shouldTreatRepeatedTargetAsNoOp() {
        incrementalLoader.loadToFraction(0.5);
        int batchesBefore = ledgerStore.listBatches().size();
        long historyBefore = countHistory();

        BatchResult repeated = incrementalLoader.loadToFraction(0.5);
        BatchResult lower = incrementalLoader.loadToFraction(0.25);

        assertEquals(BatchOutcome.ALREADY_LOADED, repeated.outcome());
        assertEquals(BatchOutcome.ALREADY_LOADED, lower.outcome());
        assertNull(repeated.batchId());
        assertEquals(batchesBefore, ledgerStore.listBatches().size());
        assertEquals(historyBefore, countHistory());
        assertEquals(4, ledgerStore.countEntities());
    }

    @Test
    void shouldRefuseToLoadPastFullPopulation() {
        incrementalLoader.loadToFraction(1.0);

        assertThrows(SourceExhaustedException.class, () -> incrementalLoader.loadNextIncrement());
        assertEquals(8, ledgerStore.countEntities());
    }

    @Test
    void shouldReconstructDatasetAsOfEachBatchFromHistory() {
        BatchResult first = incrementalLoader.loadNextIncrement();
        Set<Long> afterFirst = ledgerStore.findEntityIds();
        BatchResult second = incrementalLoader.loadNextIncrement();

        Set<Long> reconstructedFirst = incrementalLoader.datasetAsOf(first.batchId()).stream()
                .map(LedgerEntity::entityId)
                .collect(Collectors.toSet());
        assertEquals(afterFirst, reconstructedFirst);

        List<LedgerEntity> replayedSecond = incrementalLoader.replayBatch(second.batchId());
        assertEquals(2, replayedSecond.size());
        replayedSecond.forEach(entity -> assertTrue(!afterFirst.contains(entity.entityId())));

        List<LedgerEntity> reconstructedSecond = incrementalLoader.datasetAsOf(second.batchId());
        assertEquals(ledgerStore.findAllEntities(), reconstructedSecond);
    }

    @Test
    void shouldLeaveLedgerUnchangedWhenBatchFails() {
        List<SourceRecord> broken = new ArrayList<>(population(8));
        SourceRecord last = broken.remove(broken.size() - 1);
        broken.add(new SourceRecord(last.entityId(), last.textFields(), last.metadata(), "x".repeat(300)));
        sourceReader.reset(broken);

        PartialCommitException ex = assertThrows(PartialCommitException.class,
                () -> incrementalLoader.loadToFraction(1.0));

        assertEquals(0, ledgerStore.countEntities());
        assertEquals(0, countHistory());
        LedgerBatch failed = ledgerStore.findBatch(ex.getBatchId()).orElseThrow();
        assertEquals(BatchStatus.FAILED, failed.status());
        assertTrue(ledgerStore.findLatestCompletedBatch().isEmpty());

        sourceReader.reset(population(8));
        BatchResult retried = incrementalLoader.loadToFraction(1.0);
        assertEquals("load_10000_r1", retried.batchName());
        assertEquals(8, retried.totalRows());
    }

    @Test
    void shouldRejectLoadWhileAnotherBatchIsRunningUntilRecovered() {
        jdbcTemplate.update(
                "INSERT INTO ledger_batch (batch_name, target_fraction, rows_added, rows_updated, total_rows, started_at, status)"
                        + " VALUES ('crashed', 0.25, 0, 0, 0, ?, 'running')",
                System.currentTimeMillis()
        );

        assertThrows(LoaderBusyException.class, () -> incrementalLoader.loadNextIncrement());

        incrementalLoader.recoverStaleBatches();
        LedgerBatch crashed = ledgerStore.findBatchByName("crashed").orElseThrow();
        assertEquals(BatchStatus.FAILED, crashed.status());
        assertEquals(LedgerConstants.MSG_STALE_RECOVERED, crashed.failureMessage());

        assertEquals(BatchOutcome.COMPLETED, incrementalLoader.loadNextIncrement().outcome());
    }

    @Test
    void shouldRejectDuplicateExplicitBatchName() {
        incrementalLoader.loadNextIncrement(0.25, "nightly");

        assertThrows(DuplicateBatchNameException.class, () -> incrementalLoader.loadToFraction(1.0, "nightly"));
        assertEquals(2, ledgerStore.countEntities());
    }

    @Test
    void shouldApplySourceCorrectionsAsVersionedUpdates() {
        incrementalLoader.loadToFraction(0.5);
        long correctedId = ledgerStore.findEntityIds().iterator().next();
        List<SourceRecord> corrected = population(8).stream()
                .map(source -> source.entityId() == correctedId
                        ? new SourceRecord(source.entityId(), Map.of("designation", "corrected"), source.metadata(),
                        source.label())
                        : source)
                .toList();
        sourceReader.reset(corrected);
        ledgerProperties.setApplySourceCorrections(true);

        BatchResult result = incrementalLoader.loadNextIncrement();

        assertEquals(1, result.rowsUpdated());
        LedgerEntity entity = ledgerStore.findEntity(correctedId).orElseThrow();
        assertEquals(2, entity.version());
        assertEquals("corrected", entity.textFields().get("designation"));
        List<HistoryRecord> history = incrementalLoader.getBatchHistory(result.batchId());
        assertTrue(history.stream().anyMatch(record -> record.operation() == OperationKind.UPDATE
                && record.entityId() == correctedId));
    }

    @Test
    void shouldRequireSeed() {
        LedgerProperties unseeded = new LedgerProperties();

        assertThrows(IllegalStateException.class,
                () -> new IncrementalLoader(sourceReader, ledgerStore, unseeded, null));
    }

    @Test
    void shouldRejectInvalidStepFraction() {
        assertThrows(IllegalArgumentException.class, () -> incrementalLoader.loadNextIncrement(0.0));
        assertThrows(IllegalArgumentException.class, () -> incrementalLoader.loadNextIncrement(1.5));
        assertTrue(ledgerStore.listBatches().isEmpty());
    }

    private long countHistory() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ledger_history", Long.class);
        return count == null ? 0L : count;
    }

    private static List<SourceRecord> population(int size) {
        List<SourceRecord> records = new ArrayList<>();
        for (int i = 1; i <= size; i++) {
            Map<String, String> text = new LinkedHashMap<>();
            text.put("designation", "Produit " + i);
            text.put("description", "Description " + i);
            records.add(new SourceRecord(1000L + i, text, Map.of("language", i % 2 == 0 ? "fr" : "en"),
                    String.valueOf(10 * (i % 3))));
        }
        return records;
    }

    @TestConfiguration
    static class TestConfig {
        @Bean
        @Primary
        TestSourcePopulationReader testSourcePopulationReader() {
            return new TestSourcePopulationReader();
        }
    }

    static class TestSourcePopulationReader implements SourcePopulationReader {
        private final List<SourceRecord> records = new ArrayList<>();

        void reset(List<SourceRecord> population) {
            Set<Long> ids = new HashSet<>();
            population.forEach(record -> ids.add(record.entityId()));
            if (ids.size() != population.size()) {
                throw new IllegalArgumentException("Duplicate ids in test population");
            }
            records.clear();
            records.addAll(population);
        }

        @Override
        public List<SourceRecord> readAll() {
            return List.copyOf(records);
        }
    }
}
