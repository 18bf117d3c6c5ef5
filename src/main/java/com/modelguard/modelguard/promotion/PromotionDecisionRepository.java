package com.modelguard.modelguard.promotion;

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
import java.sql.Types;
import java.util.List;
import java.util.Optional;

/**
 * Promotion decisions. Only the {@code transitions_applied} flag changes after insert.
 */
@Repository
public class PromotionDecisionRepository {

    private static final TypeReference<List<StageTransition>> TRANSITION_LIST = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public PromotionDecisionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        ensureTable();
    }

    public PromotionDecision save(PromotionDecision decision) {
        String transitionsJson = writeJson(decision.requestedTransitions());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement statement = connection.prepareStatement(
                    """
                    INSERT INTO promotion_decision (
                        decided_at, model_name, challenger_version, challenger_metric, incumbent_version,
                        incumbent_metric, min_acceptable_metric, passed_minimum, beat_incumbent,
                        comparison_mode, outcome, justification, requested_transitions, transitions_applied
                    )
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    new String[]{"decision_id"}
            );
            statement.setLong(1, decision.decidedAt());
            statement.setString(2, decision.modelName());
            statement.setString(3, decision.challengerVersion());
            statement.setDouble(4, decision.challengerMetric());
            statement.setString(5, decision.incumbentVersion());
            if (decision.incumbentMetric() == null) {
                statement.setNull(6, Types.DOUBLE);
            } else {
                statement.setDouble(6, decision.incumbentMetric());
            }
            statement.setDouble(7, decision.minAcceptableMetric());
            statement.setBoolean(8, decision.passedMinimum());
            if (decision.beatIncumbent() == null) {
                statement.setNull(9, Types.BOOLEAN);
            } else {
                statement.setBoolean(9, decision.beatIncumbent());
            }
            statement.setString(10, decision.comparisonMode().name());
            statement.setString(11, decision.outcome().name());
            statement.setString(12, decision.justification());
            statement.setString(13, transitionsJson);
            statement.setBoolean(14, decision.transitionsApplied());
            return statement;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Promotion decision insert returned no key");
        }
        return decision.withDecisionId(key.longValue());
    }

    public void markTransitionsApplied(long decisionId) {
        jdbcTemplate.update("UPDATE promotion_decision SET transitions_applied = TRUE WHERE decision_id = ?", decisionId);
    }

    public Optional<PromotionDecision> findById(long decisionId) {
        return jdbcTemplate.query(
                "SELECT * FROM promotion_decision WHERE decision_id = ?",
                this::mapDecision,
                decisionId
        ).stream().findFirst();
    }

    public List<PromotionDecision> findRecent(int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        return jdbcTemplate.query(
                "SELECT * FROM promotion_decision ORDER BY decision_id DESC LIMIT ?",
                this::mapDecision,
                safeLimit
        );
    }

    private PromotionDecision mapDecision(ResultSet rs, int rowNum) throws SQLException {
        double incumbentMetric = rs.getDouble("incumbent_metric");
        boolean incumbentMetricNull = rs.wasNull();
        boolean beatIncumbent = rs.getBoolean("beat_incumbent");
        boolean beatIncumbentNull = rs.wasNull();
        return new PromotionDecision(
                rs.getLong("decision_id"),
                rs.getLong("decided_at"),
                rs.getString("model_name"),
                rs.getString("challenger_version"),
                rs.getDouble("challenger_metric"),
                rs.getString("incumbent_version"),
                incumbentMetricNull ? null : incumbentMetric,
                rs.getDouble("min_acceptable_metric"),
                rs.getBoolean("passed_minimum"),
                beatIncumbentNull ? null : beatIncumbent,
                ComparisonMode.valueOf(rs.getString("comparison_mode")),
                PromotionOutcome.valueOf(rs.getString("outcome")),
                rs.getString("justification"),
                readTransitions(rs.getString("requested_transitions")),
                rs.getBoolean("transitions_applied")
        );
    }

    private void ensureTable() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS promotion_decision (
                    decision_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    decided_at BIGINT NOT NULL,
                    model_name TEXT NOT NULL,
                    challenger_version TEXT NOT NULL,
                    challenger_metric DOUBLE PRECISION NOT NULL,
                    incumbent_version TEXT,
                    incumbent_metric DOUBLE PRECISION,
                    min_acceptable_metric DOUBLE PRECISION NOT NULL,
                    passed_minimum BOOLEAN NOT NULL,
                    beat_incumbent BOOLEAN,
                    comparison_mode VARCHAR(32) NOT NULL,
                    outcome VARCHAR(16) NOT NULL,
                    justification TEXT NOT NULL,
                    requested_transitions TEXT NOT NULL,
                    transitions_applied BOOLEAN NOT NULL
                )
                """);
    }

    private String writeJson(List<StageTransition> transitions) {
        try {
            return objectMapper.writeValueAsString(transitions);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize stage transitions", ex);
        }
    }

    private List<StageTransition> readTransitions(String json) {
        try {
            return objectMapper.readValue(json, TRANSITION_LIST);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unreadable stage transitions", ex);
        }
    }
}
