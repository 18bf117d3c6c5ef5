package com.modelguard.modelguard.predictionlog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only log of served predictions; the current window of the drift check reads from it.
 */
@Service
public class PredictionLogService {

    private static final TypeReference<Map<String, Object>> SIGNAL_MAP = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public PredictionLogService(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        ensureTable();
    }

    public PredictionLogModels.PredictionLogEntry append(PredictionLogModels.PredictionLogRequest request) {
        String predictedClass = normalizeRequired(request.predictedClass(), "predictedClass");
        Double confidence = request.confidence();
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "confidence must be in [0, 1]");
        }
        long loggedAt = request.loggedAt() == null ? System.currentTimeMillis() : request.loggedAt();
        Map<String, Object> inputSignals = request.inputSignals() == null
                ? Map.of()
                : new LinkedHashMap<>(request.inputSignals());
        String servingModelVersion = safeNullable(request.servingModelVersion());
        String signalsJson = writeJson(inputSignals);

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement statement = connection.prepareStatement(
                    """
                    INSERT INTO prediction_log (logged_at, input_signals, predicted_class, confidence, serving_model_version)
                    VALUES (?, ?, ?, ?, ?)
                    """,
                    new String[]{"prediction_id"}
            );
            statement.setLong(1, loggedAt);
            statement.setString(2, signalsJson);
            statement.setString(3, predictedClass);
            if (confidence == null) {
                statement.setNull(4, Types.DOUBLE);
            } else {
                statement.setDouble(4, confidence);
            }
            statement.setString(5, servingModelVersion);
            return statement;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Prediction log insert returned no key");
        }
        return new PredictionLogModels.PredictionLogEntry(
                key.longValue(), loggedAt, inputSignals, predictedClass, confidence, servingModelVersion);
    }

    /**
     * Entries with {@code fromInclusive <= loggedAt < toExclusive}, oldest first.
     */
    public List<PredictionLogModels.PredictionLogEntry> findBetween(long fromInclusive, long toExclusive) {
        return jdbcTemplate.query(
                """
                SELECT prediction_id, logged_at, input_signals, predicted_class, confidence, serving_model_version
                FROM prediction_log
                WHERE logged_at >= ? AND logged_at < ?
                ORDER BY logged_at, prediction_id
                """,
                this::mapEntry,
                fromInclusive,
                toExclusive
        );
    }

    public long countBetween(long fromInclusive, long toExclusive) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM prediction_log WHERE logged_at >= ? AND logged_at < ?",
                Long.class,
                fromInclusive,
                toExclusive
        );
        return count == null ? 0L : count;
    }

    private PredictionLogModels.PredictionLogEntry mapEntry(ResultSet rs, int rowNum) throws SQLException {
        double confidence = rs.getDouble("confidence");
        boolean confidenceNull = rs.wasNull();
        return new PredictionLogModels.PredictionLogEntry(
                rs.getLong("prediction_id"),
                rs.getLong("logged_at"),
                readJson(rs.getString("input_signals")),
                rs.getString("predicted_class"),
                confidenceNull ? null : confidence,
                rs.getString("serving_model_version")
        );
    }

    private void ensureTable() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS prediction_log (
                    prediction_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    logged_at BIGINT NOT NULL,
                    input_signals TEXT NOT NULL,
                    predicted_class TEXT NOT NULL,
                    confidence DOUBLE PRECISION,
                    serving_model_version TEXT
                )
                """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_prediction_log_logged_at ON prediction_log(logged_at)");
    }

    private String writeJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "inputSignals is not serializable", ex);
        }
    }

    private Map<String, Object> readJson(String json) {
        try {
            return objectMapper.readValue(json, SIGNAL_MAP);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unreadable prediction log signals", ex);
        }
    }

    private String normalizeRequired(String value, String fieldName) {
        String normalized = value == null ? "" : value.trim();
        if (normalized.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, fieldName + " is required");
        }
        return normalized;
    }

    private String safeNullable(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim();
        return normalized.isBlank() ? null : normalized;
    }
}
