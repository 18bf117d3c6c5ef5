package com.modelguard.modelguard.drift;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of drift reports. Reports are never updated once written.
 */
@Repository
public class DriftReportRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public DriftReportRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        ensureTable();
    }

    public DriftReport save(DriftReport report) {
        String detailsJson = writeJson(report.details());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement statement = connection.prepareStatement(
                    """
                    INSERT INTO drift_report (
                        created_at, data_drift_score, prediction_drift_score, performance_drift_score,
                        overall_score, severity, drift_detected, warning_threshold, alert_threshold,
                        critical_threshold, min_current_samples, min_reference_samples,
                        reference_sample_size, current_sample_size, details
                    )
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    new String[]{"report_id"}
            );
            DriftThresholds thresholds = report.thresholds();
            statement.setLong(1, report.createdAt());
            setNullableDouble(statement, 2, report.dataDriftScore());
            setNullableDouble(statement, 3, report.predictionDriftScore());
            setNullableDouble(statement, 4, report.performanceDriftScore());
            statement.setDouble(5, report.overallScore());
            statement.setString(6, report.severity().name());
            statement.setBoolean(7, report.driftDetected());
            statement.setDouble(8, thresholds.warning());
            statement.setDouble(9, thresholds.alert());
            statement.setDouble(10, thresholds.critical());
            statement.setInt(11, thresholds.minCurrentSamples());
            statement.setInt(12, thresholds.minReferenceSamples());
            statement.setInt(13, report.referenceSampleSize());
            statement.setInt(14, report.currentSampleSize());
            statement.setString(15, detailsJson);
            return statement;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Drift report insert returned no key");
        }
        return report.withReportId(key.longValue());
    }

    public Optional<DriftReport> findById(long reportId) {
        return jdbcTemplate.query(
                "SELECT * FROM drift_report WHERE report_id = ?",
                this::mapReport,
                reportId
        ).stream().findFirst();
    }

    public DriftReport getById(long reportId) {
        return findById(reportId).orElseThrow(() -> new DriftReportNotFoundException(reportId));
    }

    public List<DriftReport> findRecent(int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        return jdbcTemplate.query(
                "SELECT * FROM drift_report ORDER BY report_id DESC LIMIT ?",
                this::mapReport,
                safeLimit
        );
    }

    /**
     * Reports whose severity is {@code minimum} or worse, newest first.
     */
    public List<DriftReport> findBySeverityAtLeast(Severity minimum) {
        List<String> severities = Arrays.stream(Severity.values())
                .filter(severity -> severity.isAtLeast(minimum))
                .map(Severity::name)
                .toList();
        String placeholders = String.join(", ", Collections.nCopies(severities.size(), "?"));
        return jdbcTemplate.query(
                "SELECT * FROM drift_report WHERE severity IN (" + placeholders + ") ORDER BY report_id DESC",
                this::mapReport,
                severities.toArray()
        );
    }

    private DriftReport mapReport(ResultSet rs, int rowNum) throws SQLException {
        DriftThresholds thresholds = new DriftThresholds(
                rs.getDouble("warning_threshold"),
                rs.getDouble("alert_threshold"),
                rs.getDouble("critical_threshold"),
                rs.getInt("min_current_samples"),
                rs.getInt("min_reference_samples")
        );
        return new DriftReport(
                rs.getLong("report_id"),
                rs.getLong("created_at"),
                nullableDouble(rs, "data_drift_score"),
                nullableDouble(rs, "prediction_drift_score"),
                nullableDouble(rs, "performance_drift_score"),
                rs.getDouble("overall_score"),
                Severity.valueOf(rs.getString("severity")),
                rs.getBoolean("drift_detected"),
                thresholds,
                rs.getInt("reference_sample_size"),
                rs.getInt("current_sample_size"),
                readDetails(rs.getString("details"))
        );
    }

    private void ensureTable() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS drift_report (
                    report_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    created_at BIGINT NOT NULL,
                    data_drift_score DOUBLE PRECISION,
                    prediction_drift_score DOUBLE PRECISION,
                    performance_drift_score DOUBLE PRECISION,
                    overall_score DOUBLE PRECISION NOT NULL,
                    severity VARCHAR(16) NOT NULL,
                    drift_detected BOOLEAN NOT NULL,
                    warning_threshold DOUBLE PRECISION NOT NULL,
                    alert_threshold DOUBLE PRECISION NOT NULL,
                    critical_threshold DOUBLE PRECISION NOT NULL,
                    min_current_samples INT NOT NULL,
                    min_reference_samples INT NOT NULL,
                    reference_sample_size INT NOT NULL,
                    current_sample_size INT NOT NULL,
                    details TEXT NOT NULL
                )
                """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_drift_report_severity ON drift_report(severity)");
    }

    private static void setNullableDouble(PreparedStatement statement, int index, Double value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.DOUBLE);
        } else {
            statement.setDouble(index, value);
        }
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private String writeJson(DriftDetails details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize drift details", ex);
        }
    }

    private DriftDetails readDetails(String json) {
        try {
            return objectMapper.readValue(json, DriftDetails.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unreadable drift report details", ex);
        }
    }
}
