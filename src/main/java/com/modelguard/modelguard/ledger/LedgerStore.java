package com.modelguard.modelguard.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable ledger tables: current entities, batches and the append-only history.
 * <p>
 * Every entity-mutating method writes the entity row and its history row inside one transaction and
 * requires the id of the batch that is currently running. History rows are never updated or deleted.
 */
@Component
public class LedgerStore {

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    public LedgerStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Creates ledger tables at startup so the schema exists before the first load.
     */
    @PostConstruct
    public void initializeSchema() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + LedgerConstants.ENTITY_TABLE + " ("
                + "entity_id BIGINT PRIMARY KEY, "
                + "text_fields TEXT NOT NULL, "
                + "metadata_fields TEXT NOT NULL, "
                + "label VARCHAR(255), "
                + "version INT NOT NULL, "
                + "created_at BIGINT NOT NULL, "
                + "updated_at BIGINT NOT NULL"
                + ")");
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + LedgerConstants.BATCH_TABLE + " ("
                + "batch_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                + "batch_name VARCHAR(" + LedgerConstants.BATCH_NAME_MAX_LENGTH + ") NOT NULL UNIQUE, "
                + "target_fraction DOUBLE PRECISION NOT NULL, "
                + "rows_added INT NOT NULL, "
                + "rows_updated INT NOT NULL, "
                + "total_rows INT NOT NULL, "
                + "started_at BIGINT NOT NULL, "
                + "completed_at BIGINT, "
                + "status VARCHAR(20) NOT NULL, "
                + "metadata TEXT, "
                + "failure_message TEXT"
                + ")");
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + LedgerConstants.HISTORY_TABLE + " ("
                + "history_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                + "entity_id BIGINT NOT NULL, "
                + "snapshot TEXT NOT NULL, "
                + "operation VARCHAR(10) NOT NULL, "
                + "operated_at BIGINT NOT NULL, "
                + "batch_id BIGINT NOT NULL"
                + ")");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_ledger_batch_status ON "
                + LedgerConstants.BATCH_TABLE + "(status)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_ledger_history_batch ON "
                + LedgerConstants.HISTORY_TABLE + "(batch_id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_ledger_history_entity ON "
                + LedgerConstants.HISTORY_TABLE + "(entity_id)");
    }

    /**
     * Opens a batch in {@code running} state. Fails when another batch is running or the name is taken.
     */
    public LedgerBatch openBatch(String batchName, double targetFraction, Map<String, Object> metadata) {
        return transactionTemplate.execute(status -> {
            findRunningBatch().ifPresent(running -> {
                throw new LoaderBusyException(running.batchName());
            });
            if (batchNameExists(batchName)) {
                throw new DuplicateBatchNameException(batchName);
            }
            try {
                jdbcTemplate.update(
                        "INSERT INTO " + LedgerConstants.BATCH_TABLE
                                + " (batch_name, target_fraction, rows_added, rows_updated, total_rows, started_at, status, metadata)"
                                + " VALUES (?, ?, 0, 0, 0, ?, ?, ?)",
                        batchName,
                        targetFraction,
                        System.currentTimeMillis(),
                        BatchStatus.RUNNING.dbValue(),
                        writeJson(metadata)
                );
            } catch (DuplicateKeyException ex) {
                throw new DuplicateBatchNameException(batchName, ex);
            }
            return findBatchByName(batchName)
                    .orElseThrow(() -> new IllegalStateException("Batch vanished after insert: " + batchName));
        });
    }

    public void completeBatch(long activeBatchId, int rowsAdded, int rowsUpdated, int totalRows) {
        int updated = jdbcTemplate.update(
                "UPDATE " + LedgerConstants.BATCH_TABLE
                        + " SET status = ?, rows_added = ?, rows_updated = ?, total_rows = ?, completed_at = ?"
                        + " WHERE batch_id = ? AND status = ?",
                BatchStatus.COMPLETED.dbValue(),
                rowsAdded,
                rowsUpdated,
                totalRows,
                System.currentTimeMillis(),
                activeBatchId,
                BatchStatus.RUNNING.dbValue()
        );
        if (updated == 0) {
            throw new IllegalStateException(LedgerConstants.MSG_BATCH_NOT_RUNNING.formatted(activeBatchId));
        }
    }

    public void failBatch(long activeBatchId, String failureMessage) {
        jdbcTemplate.update(
                "UPDATE " + LedgerConstants.BATCH_TABLE
                        + " SET status = ?, completed_at = ?, failure_message = ? WHERE batch_id = ? AND status = ?",
                BatchStatus.FAILED.dbValue(),
                System.currentTimeMillis(),
                failureMessage,
                activeBatchId,
                BatchStatus.RUNNING.dbValue()
        );
    }

    /**
     * Marks every batch still in {@code running} state as failed. Called once on startup, when no load
     * can legitimately be in progress.
     */
    public int recoverStaleBatches() {
        return jdbcTemplate.update(
                "UPDATE " + LedgerConstants.BATCH_TABLE
                        + " SET status = ?, completed_at = ?, failure_message = ? WHERE status = ?",
                BatchStatus.FAILED.dbValue(),
                System.currentTimeMillis(),
                LedgerConstants.MSG_STALE_RECOVERED,
                BatchStatus.RUNNING.dbValue()
        );
    }

    /**
     * Inserts new entities and one {@code insert} history record each, atomically.
     */
    public int insertEntities(long activeBatchId, List<SourceRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        Integer inserted = transactionTemplate.execute(status -> {
            requireRunning(activeBatchId);
            long now = System.currentTimeMillis();
            for (int from = 0; from < records.size(); from += LedgerConstants.INSERT_CHUNK_SIZE) {
                List<SourceRecord> chunk = records.subList(from,
                        Math.min(records.size(), from + LedgerConstants.INSERT_CHUNK_SIZE));
                List<Object[]> entityRows = new ArrayList<>(chunk.size());
                List<Object[]> historyRows = new ArrayList<>(chunk.size());
                for (SourceRecord source : chunk) {
                    LedgerEntity entity = new LedgerEntity(source.entityId(), source.textFields(), source.metadata(),
                            source.label(), 1, now, now);
                    entityRows.add(new Object[]{
                            entity.entityId(),
                            writeJson(entity.textFields()),
                            writeJson(entity.metadata()),
                            entity.label(),
                            entity.version(),
                            entity.createdAt(),
                            entity.updatedAt()
                    });
                    historyRows.add(historyRow(entity, OperationKind.INSERT, now, activeBatchId));
                }
                jdbcTemplate.batchUpdate(
                        "INSERT INTO " + LedgerConstants.ENTITY_TABLE
                                + " (entity_id, text_fields, metadata_fields, label, version, created_at, updated_at)"
                                + " VALUES (?, ?, ?, ?, ?, ?, ?)",
                        entityRows
                );
                insertHistory(historyRows);
            }
            return records.size();
        });
        return inserted == null ? 0 : inserted;
    }

    /**
     * Applies a versioned update to one entity and records one {@code update} history record.
     */
    public LedgerEntity updateEntity(long activeBatchId, long entityId, int expectedVersion, SourceRecord content) {
        return transactionTemplate.execute(status -> {
            requireRunning(activeBatchId);
            long now = System.currentTimeMillis();
            int updated = jdbcTemplate.update(
                    "UPDATE " + LedgerConstants.ENTITY_TABLE
                            + " SET text_fields = ?, metadata_fields = ?, label = ?, version = version + 1, updated_at = ?"
                            + " WHERE entity_id = ? AND version = ?",
                    writeJson(content.textFields()),
                    writeJson(content.metadata()),
                    content.label(),
                    now,
                    entityId,
                    expectedVersion
            );
            if (updated == 0) {
                throw new StaleEntityVersionException(entityId, expectedVersion);
            }
            LedgerEntity entity = findEntity(entityId)
                    .orElseThrow(() -> new IllegalStateException("Entity vanished after update: " + entityId));
            insertHistory(List.<Object[]>of(historyRow(entity, OperationKind.UPDATE, now, activeBatchId)));
            return entity;
        });
    }

    public Set<Long> findEntityIds() {
        return new HashSet<>(jdbcTemplate.queryForList(
                "SELECT entity_id FROM " + LedgerConstants.ENTITY_TABLE, Long.class));
    }

    public Optional<LedgerEntity> findEntity(long entityId) {
        return jdbcTemplate.query(
                "SELECT * FROM " + LedgerConstants.ENTITY_TABLE + " WHERE entity_id = ?",
                this::mapEntity,
                entityId
        ).stream().findFirst();
    }

    public List<LedgerEntity> findAllEntities() {
        return jdbcTemplate.query(
                "SELECT * FROM " + LedgerConstants.ENTITY_TABLE + " ORDER BY entity_id",
                this::mapEntity
        );
    }

    public long countEntities() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + LedgerConstants.ENTITY_TABLE, Long.class);
        return count == null ? 0L : count;
    }

    public Optional<LedgerBatch> findBatch(long batchId) {
        return jdbcTemplate.query(
                "SELECT * FROM " + LedgerConstants.BATCH_TABLE + " WHERE batch_id = ?",
                this::mapBatch,
                batchId
        ).stream().findFirst();
    }

    public Optional<LedgerBatch> findBatchByName(String batchName) {
        return jdbcTemplate.query(
                "SELECT * FROM " + LedgerConstants.BATCH_TABLE + " WHERE batch_name = ?",
                this::mapBatch,
                batchName
        ).stream().findFirst();
    }

    public boolean batchNameExists(String batchName) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + LedgerConstants.BATCH_TABLE + " WHERE batch_name = ?",
                Integer.class,
                batchName
        );
        return count != null && count > 0;
    }

    public Optional<LedgerBatch> findRunningBatch() {
        return jdbcTemplate.query(
                "SELECT * FROM " + LedgerConstants.BATCH_TABLE + " WHERE status = ? ORDER BY batch_id LIMIT 1",
                this::mapBatch,
                BatchStatus.RUNNING.dbValue()
        ).stream().findFirst();
    }

    public Optional<LedgerBatch> findLatestCompletedBatch() {
        return jdbcTemplate.query(
                "SELECT * FROM " + LedgerConstants.BATCH_TABLE
                        + " WHERE status = ? ORDER BY target_fraction DESC, batch_id DESC LIMIT 1",
                this::mapBatch,
                BatchStatus.COMPLETED.dbValue()
        ).stream().findFirst();
    }

    public List<LedgerBatch> listBatches() {
        return jdbcTemplate.query(
                "SELECT * FROM " + LedgerConstants.BATCH_TABLE + " ORDER BY batch_id",
                this::mapBatch
        );
    }

    public List<HistoryRecord> findHistoryForBatch(long batchId) {
        return jdbcTemplate.query(
                "SELECT * FROM " + LedgerConstants.HISTORY_TABLE + " WHERE batch_id = ? ORDER BY history_id",
                this::mapHistory,
                batchId
        );
    }

    /**
     * Replays the history of one batch: the entities it wrote, in their state at the end of the batch.
     */
    public List<LedgerEntity> replayBatch(long batchId) {
        return replay(findHistoryForBatch(batchId));
    }

    /**
     * Rebuilds the full dataset as it stood right after the given completed batch, from history alone.
     */
    public List<LedgerEntity> datasetAsOf(long batchId) {
        LedgerBatch batch = findBatch(batchId)
                .orElseThrow(() -> new BatchNotFoundException(batchId));
        if (batch.status() != BatchStatus.COMPLETED) {
            throw new IllegalArgumentException("Batch " + batch.batchName() + " is " + batch.status().dbValue()
                    + "; only completed batches can be reconstructed");
        }
        List<HistoryRecord> history = jdbcTemplate.query(
                """
                SELECT h.*
                FROM __HISTORY_TABLE__ h
                JOIN __BATCH_TABLE__ b ON b.batch_id = h.batch_id
                WHERE b.status = ? AND b.batch_id <= ?
                ORDER BY h.history_id
                """
                        .replace("__HISTORY_TABLE__", LedgerConstants.HISTORY_TABLE)
                        .replace("__BATCH_TABLE__", LedgerConstants.BATCH_TABLE),
                this::mapHistory,
                BatchStatus.COMPLETED.dbValue(),
                batchId
        );
        return replay(history);
    }

    private List<LedgerEntity> replay(List<HistoryRecord> history) {
        Map<Long, LedgerEntity> state = new LinkedHashMap<>();
        for (HistoryRecord historyRecord : history) {
            state.put(historyRecord.entityId(), historyRecord.snapshot());
        }
        List<LedgerEntity> entities = new ArrayList<>(state.values());
        entities.sort(Comparator.comparingLong(LedgerEntity::entityId));
        return entities;
    }

    private void requireRunning(long activeBatchId) {
        String status = jdbcTemplate.query(
                "SELECT status FROM " + LedgerConstants.BATCH_TABLE + " WHERE batch_id = ?",
                rs -> rs.next() ? rs.getString("status") : null,
                activeBatchId
        );
        if (status == null || BatchStatus.fromDbValue(status) != BatchStatus.RUNNING) {
            throw new IllegalStateException(LedgerConstants.MSG_BATCH_NOT_RUNNING.formatted(activeBatchId));
        }
    }

    private Object[] historyRow(LedgerEntity entity, OperationKind operation, long operatedAt, long batchId) {
        return new Object[]{entity.entityId(), writeJson(entity), operation.dbValue(), operatedAt, batchId};
    }

    private void insertHistory(List<Object[]> historyRows) {
        jdbcTemplate.batchUpdate(
                "INSERT INTO " + LedgerConstants.HISTORY_TABLE
                        + " (entity_id, snapshot, operation, operated_at, batch_id) VALUES (?, ?, ?, ?, ?)",
                historyRows
        );
    }

    private LedgerEntity mapEntity(ResultSet rs, int rowNum) throws SQLException {
        return new LedgerEntity(
                rs.getLong("entity_id"),
                readJson(rs.getString("text_fields"), STRING_MAP),
                readJson(rs.getString("metadata_fields"), STRING_MAP),
                rs.getString("label"),
                rs.getInt("version"),
                rs.getLong("created_at"),
                rs.getLong("updated_at")
        );
    }

    private LedgerBatch mapBatch(ResultSet rs, int rowNum) throws SQLException {
        long completedAt = rs.getLong("completed_at");
        boolean completedNull = rs.wasNull();
        String metadata = rs.getString("metadata");
        return new LedgerBatch(
                rs.getLong("batch_id"),
                rs.getString("batch_name"),
                rs.getDouble("target_fraction"),
                rs.getInt("rows_added"),
                rs.getInt("rows_updated"),
                rs.getInt("total_rows"),
                rs.getLong("started_at"),
                completedNull ? null : completedAt,
                BatchStatus.fromDbValue(rs.getString("status")),
                metadata == null ? Map.of() : readJson(metadata, OBJECT_MAP),
                rs.getString("failure_message")
        );
    }

    private HistoryRecord mapHistory(ResultSet rs, int rowNum) throws SQLException {
        try {
            return new HistoryRecord(
                    rs.getLong("history_id"),
                    rs.getLong("entity_id"),
                    objectMapper.readValue(rs.getString("snapshot"), LedgerEntity.class),
                    OperationKind.fromDbValue(rs.getString("operation")),
                    rs.getLong("operated_at"),
                    rs.getLong("batch_id")
            );
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unreadable history snapshot " + rs.getLong("history_id"), ex);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize ledger value", ex);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to read ledger JSON column", ex);
        }
    }
}
