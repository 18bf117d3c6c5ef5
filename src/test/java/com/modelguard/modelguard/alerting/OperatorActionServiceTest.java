package com.modelguard.modelguard.alerting;

import com.modelguard.modelguard.drift.DriftReport;
import com.modelguard.modelguard.drift.DriftReportRepository;
import com.modelguard.modelguard.drift.DriftThresholds;
import com.modelguard.modelguard.drift.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@SpringBootTest
class OperatorActionServiceTest {

    @Autowired
    private OperatorActionService operatorActionService;

    @Autowired
    private DriftReportRepository driftReportRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetTables() {
        jdbcTemplate.execute("DELETE FROM alert_action");
        jdbcTemplate.execute("DELETE FROM drift_report");
    }

    @Test
    void shouldListUnacknowledgedReportsAtOrAboveSeverity() {
        DriftReport ok = saveReport(0.05, Severity.OK);
        DriftReport warning = saveReport(0.15, Severity.WARNING);
        DriftReport alert = saveReport(0.25, Severity.ALERT);
        DriftReport critical = saveReport(0.5, Severity.CRITICAL);

        assertEquals(List.of(critical.reportId(), alert.reportId(), warning.reportId()),
                ids(operatorActionService.listUnacknowledged(Severity.WARNING)));
        assertEquals(List.of(critical.reportId(), alert.reportId(), warning.reportId(), ok.reportId()),
                ids(operatorActionService.listUnacknowledged(Severity.OK)));

        operatorActionService.recordAction(new AlertModels.AlertActionRequest("DRIFT_REPORT", alert.reportId(),
                "acknowledge", "oncall", Map.of("note", "known seasonal shift")));

        assertEquals(List.of(critical.reportId(), warning.reportId()),
                ids(operatorActionService.listUnacknowledged(Severity.WARNING)));
    }

    @Test
    void shouldNotTreatInvestigationAsAcknowledgement() {
        DriftReport alert = saveReport(0.25, Severity.ALERT);

        AlertModels.AlertAction action = operatorActionService.recordAction(new AlertModels.AlertActionRequest(
                "drift_report", alert.reportId(), "investigate", "analyst", null));

        assertEquals(AlertActionType.INVESTIGATE, action.actionType());
        assertEquals(List.of(alert.reportId()), ids(operatorActionService.listUnacknowledged(Severity.ALERT)));
    }

    @Test
    void shouldBulkAcknowledgeAllOrNothing() {
        DriftReport first = saveReport(0.25, Severity.ALERT);
        DriftReport second = saveReport(0.35, Severity.CRITICAL);

        assertThrows(AlertTargetNotFoundException.class, () -> operatorActionService.bulkAcknowledge(
                new AlertModels.BulkAcknowledgeRequest("DRIFT_REPORT",
                        List.of(first.reportId(), second.reportId() + 1000), "oncall", null)));
        assertEquals(0, operatorActionService.listActions(null, null, 100).size());

        AlertModels.BulkAcknowledgeResponse response = operatorActionService.bulkAcknowledge(
                new AlertModels.BulkAcknowledgeRequest("DRIFT_REPORT",
                        List.of(first.reportId(), second.reportId()), "oncall", null));

        assertEquals(2, response.acknowledgedCount());
        response.actions().forEach(action -> assertEquals(AlertActionType.BULK_ACKNOWLEDGE, action.actionType()));
        assertEquals(List.of(), operatorActionService.listUnacknowledged(Severity.OK));
    }

    @Test
    void shouldRejectActionOnMissingTarget() {
        assertThrows(AlertTargetNotFoundException.class, () -> operatorActionService.recordAction(
                new AlertModels.AlertActionRequest("PROMOTION_DECISION", 999_999L, "rollback", "oncall", null)));
    }

    @Test
    void shouldValidateRequestFields() {
        DriftReport alert = saveReport(0.25, Severity.ALERT);

        ResponseStatusException unknownAction = assertThrows(ResponseStatusException.class,
                () -> operatorActionService.recordAction(new AlertModels.AlertActionRequest("DRIFT_REPORT",
                        alert.reportId(), "delete", "oncall", null)));
        assertEquals(HttpStatus.BAD_REQUEST, unknownAction.getStatusCode());
        assertThrows(ResponseStatusException.class, () -> operatorActionService.recordAction(
                new AlertModels.AlertActionRequest("DRIFT_REPORT", alert.reportId(), "acknowledge", " ", null)));
        assertThrows(ResponseStatusException.class, () -> operatorActionService.recordAction(
                new AlertModels.AlertActionRequest("MODEL", alert.reportId(), "acknowledge", "oncall", null)));
    }

    @Test
    void shouldListActionHistoryNewestFirst() {
        DriftReport alert = saveReport(0.25, Severity.ALERT);
        operatorActionService.recordAction(new AlertModels.AlertActionRequest("DRIFT_REPORT", alert.reportId(),
                "investigate", "analyst", null));
        operatorActionService.recordAction(new AlertModels.AlertActionRequest("DRIFT_REPORT", alert.reportId(),
                "force_retrain", "lead", Map.of("ticket", "ML-42")));

        List<AlertModels.AlertAction> history = operatorActionService.listActions("DRIFT_REPORT",
                alert.reportId(), 10);

        assertEquals(2, history.size());
        assertEquals(AlertActionType.FORCE_RETRAIN, history.get(0).actionType());
        assertEquals("ML-42", history.get(0).details().get("ticket"));
        assertEquals(AlertActionType.INVESTIGATE, history.get(1).actionType());
    }

    private DriftReport saveReport(double score, Severity severity) {
        return driftReportRepository.save(new DriftReport(null, System.currentTimeMillis(), score, null, null,
                score, severity, severity != Severity.OK, DriftThresholds.DEFAULT, 120, 150, null));
    }

    private static List<Long> ids(List<DriftReport> reports) {
        return reports.stream().map(DriftReport::reportId).toList();
    }
}
