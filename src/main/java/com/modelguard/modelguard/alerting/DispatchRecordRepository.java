package com.modelguard.modelguard.alerting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelguard.modelguard.drift.Severity;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
public class DispatchRecordRepository {

    private static final TypeReference<Map<String, Object>> DETAIL_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public DispatchRecordRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        ensureTable();
    }

    /**
     * Inserts the record unless one already exists for the same subject.
     *
     * @return the stored record when this call created it, empty when the subject was already dispatched
     */
    public Optional<DispatchRecord> insertIfAbsent(DispatchRecord record) {
        String detailJson = writeJson(record.detail());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(connection -> {
                PreparedStatement statement = connection.prepareStatement(
                        """
                        INSERT INTO alert_dispatch (
                            subject_type, subject_id, severity, actions, summary, detail, escalate,
                            status, delivered_channels, attempts, last_error, created_at, updated_at
                        )
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                        new String[]{"dispatch_id"}
                );
                statement.setString(1, record.subjectType().name());
                statement.setLong(2, record.subjectId());
                statement.setString(3, record.severity().name());
                statement.setString(4, joinActions(record.actions()));
                statement.setString(5, record.summary());
                statement.setString(6, detailJson);
                statement.setBoolean(7, record.escalate());
                statement.setString(8, record.status().name());
                statement.setString(9, String.join(",", record.deliveredChannels()));
                statement.setInt(10, record.attempts());
                statement.setString(11, record.lastError());
                statement.setLong(12, record.createdAt());
                statement.setLong(13, record.updatedAt());
                return statement;
            }, keyHolder);
        } catch (DuplicateKeyException ex) {
            return Optional.empty();
        }

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Dispatch insert returned no key");
        }
        return findById(key.longValue());
    }

    public Optional<DispatchRecord> find(AlertSubjectType subjectType, long subjectId) {
        return jdbcTemplate.query(
                "SELECT * FROM alert_dispatch WHERE subject_type = ? AND subject_id = ?",
                this::mapRecord,
                subjectType.name(),
                subjectId
        ).stream().findFirst();
    }

    public Optional<DispatchRecord> findById(long dispatchId) {
        return jdbcTemplate.query(
                "SELECT * FROM alert_dispatch WHERE dispatch_id = ?",
                this::mapRecord,
                dispatchId
        ).stream().findFirst();
    }

    public void updateDelivery(
            long dispatchId,
            NotificationStatus status,
            Set<String> deliveredChannels,
            int attempts,
            String lastError,
            long updatedAt
    ) {
        jdbcTemplate.update(
                """
                UPDATE alert_dispatch
                SET status = ?, delivered_channels = ?, attempts = ?, last_error = ?, updated_at = ?
                WHERE dispatch_id = ?
                """,
                status.name(),
                String.join(",", deliveredChannels),
                attempts,
                lastError,
                updatedAt,
                dispatchId
        );
    }

    /**
     * Dispatches still owed a delivery, oldest first.
     */
    public List<DispatchRecord> findUndelivered(int maxAttempts) {
        return jdbcTemplate.query(
                """
                SELECT * FROM alert_dispatch
                WHERE status IN (?, ?) AND attempts < ?
                ORDER BY dispatch_id ASC
                """,
                this::mapRecord,
                NotificationStatus.PENDING.name(),
                NotificationStatus.FAILED.name(),
                maxAttempts
        );
    }

    public List<DispatchRecord> findRecent(int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        return jdbcTemplate.query(
                "SELECT * FROM alert_dispatch ORDER BY dispatch_id DESC LIMIT ?",
                this::mapRecord,
                safeLimit
        );
    }

    private DispatchRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        return new DispatchRecord(
                rs.getLong("dispatch_id"),
                AlertSubjectType.valueOf(rs.getString("subject_type")),
                rs.getLong("subject_id"),
                Severity.valueOf(rs.getString("severity")),
                parseActions(rs.getString("actions")),
                rs.getString("summary"),
                readJson(rs.getString("detail")),
                rs.getBoolean("escalate"),
                NotificationStatus.valueOf(rs.getString("status")),
                parseChannels(rs.getString("delivered_channels")),
                rs.getInt("attempts"),
                rs.getString("last_error"),
                rs.getLong("created_at"),
                rs.getLong("updated_at")
        );
    }

    private void ensureTable() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS alert_dispatch (
                    dispatch_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    subject_type VARCHAR(32) NOT NULL,
                    subject_id BIGINT NOT NULL,
                    severity VARCHAR(16) NOT NULL,
                    actions VARCHAR(128) NOT NULL,
                    summary VARCHAR(1024) NOT NULL,
                    detail TEXT NOT NULL,
                    escalate BOOLEAN NOT NULL,
                    status VARCHAR(16) NOT NULL,
                    delivered_channels VARCHAR(512) NOT NULL,
                    attempts INT NOT NULL,
                    last_error VARCHAR(1024),
                    created_at BIGINT NOT NULL,
                    updated_at BIGINT NOT NULL
                )
                """);
        jdbcTemplate.execute(
                "CREATE UNIQUE INDEX IF NOT EXISTS uq_alert_dispatch_subject ON alert_dispatch(subject_type, subject_id)"
        );
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_alert_dispatch_status ON alert_dispatch(status)");
    }

    private static String joinActions(Set<DispatchAction> actions) {
        return EnumSet.copyOf(actions).stream().map(DispatchAction::name).collect(Collectors.joining(","));
    }

    private static Set<DispatchAction> parseActions(String value) {
        Set<DispatchAction> actions = EnumSet.noneOf(DispatchAction.class);
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .map(DispatchAction::valueOf)
                .forEach(actions::add);
        return actions;
    }

    private static Set<String> parseChannels(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private String writeJson(Map<String, Object> detail) {
        try {
            return objectMapper.writeValueAsString(detail);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize dispatch detail", ex);
        }
    }

    private Map<String, Object> readJson(String json) {
        try {
            return objectMapper.readValue(json, DETAIL_TYPE);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unreadable dispatch detail", ex);
        }
    }
}
