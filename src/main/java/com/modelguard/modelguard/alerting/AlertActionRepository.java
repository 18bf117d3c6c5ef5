package com.modelguard.modelguard.alerting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Append-only operator action log. There is no update or delete path.
 */
@Repository
public class AlertActionRepository {

    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public AlertActionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        ensureTable();
    }

    public AlertModels.AlertAction append(
            AlertSubjectType targetType,
            long targetId,
            AlertActionType actionType,
            String actor,
            Map<String, Object> details
    ) {
        String detailsJson = details == null ? null : writeJson(details);
        long now = System.currentTimeMillis();
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement statement = connection.prepareStatement(
                    """
                    INSERT INTO alert_action (target_type, target_id, action_type, actor, details, created_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                    """,
                    new String[]{"action_id"}
            );
            statement.setString(1, targetType.name());
            statement.setLong(2, targetId);
            statement.setString(3, actionType.dbValue());
            statement.setString(4, actor);
            statement.setString(5, detailsJson);
            statement.setLong(6, now);
            return statement;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Alert action insert returned no key");
        }
        return new AlertModels.AlertAction(key.longValue(), targetType, targetId, actionType, actor, details, now);
    }

    public List<AlertModels.AlertAction> findAll(AlertSubjectType targetType, Long targetId, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        if (targetType != null && targetId != null) {
            return jdbcTemplate.query(
                    "SELECT * FROM alert_action WHERE target_type = ? AND target_id = ? ORDER BY action_id DESC LIMIT ?",
                    this::mapAction,
                    targetType.name(),
                    targetId,
                    safeLimit
            );
        }
        if (targetType != null) {
            return jdbcTemplate.query(
                    "SELECT * FROM alert_action WHERE target_type = ? ORDER BY action_id DESC LIMIT ?",
                    this::mapAction,
                    targetType.name(),
                    safeLimit
            );
        }
        return jdbcTemplate.query(
                "SELECT * FROM alert_action ORDER BY action_id DESC LIMIT ?",
                this::mapAction,
                safeLimit
        );
    }

    /**
     * Ids of targets of the given type that carry at least one acknowledgement.
     */
    public Set<Long> findAcknowledgedTargetIds(AlertSubjectType targetType) {
        return new HashSet<>(jdbcTemplate.queryForList(
                "SELECT DISTINCT target_id FROM alert_action WHERE target_type = ? AND action_type IN (?, ?)",
                Long.class,
                targetType.name(),
                AlertActionType.ACKNOWLEDGE.dbValue(),
                AlertActionType.BULK_ACKNOWLEDGE.dbValue()
        ));
    }

    private AlertModels.AlertAction mapAction(ResultSet rs, int rowNum) throws SQLException {
        String details = rs.getString("details");
        return new AlertModels.AlertAction(
                rs.getLong("action_id"),
                AlertSubjectType.valueOf(rs.getString("target_type")),
                rs.getLong("target_id"),
                AlertActionType.fromValue(rs.getString("action_type")),
                rs.getString("actor"),
                details == null ? null : readJson(details),
                rs.getLong("created_at")
        );
    }

    private void ensureTable() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS alert_action (
                    action_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    target_type VARCHAR(32) NOT NULL,
                    target_id BIGINT NOT NULL,
                    action_type VARCHAR(32) NOT NULL,
                    actor VARCHAR(128) NOT NULL,
                    details TEXT,
                    created_at BIGINT NOT NULL
                )
                """);
        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS idx_alert_action_target ON alert_action(target_type, target_id)"
        );
    }

    private String writeJson(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Alert action details are not serializable", ex);
        }
    }

    private Map<String, Object> readJson(String json) {
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unreadable alert action details", ex);
        }
    }
}
