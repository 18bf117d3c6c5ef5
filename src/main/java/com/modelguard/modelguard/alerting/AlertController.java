package com.modelguard.modelguard.alerting;

import com.modelguard.modelguard.drift.DriftReport;
import com.modelguard.modelguard.drift.Severity;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/alerts")
public class AlertController {

    private final OperatorActionService operatorActionService;
    private final AlertDispatcher alertDispatcher;

    public AlertController(OperatorActionService operatorActionService, AlertDispatcher alertDispatcher) {
        this.operatorActionService = operatorActionService;
        this.alertDispatcher = alertDispatcher;
    }

    @PostMapping("/actions")
    public ResponseEntity<AlertModels.AlertAction> recordAction(@RequestBody AlertModels.AlertActionRequest request) {
        return ResponseEntity.ok(operatorActionService.recordAction(request));
    }

    @PostMapping("/actions/bulk-acknowledge")
    public ResponseEntity<AlertModels.BulkAcknowledgeResponse> bulkAcknowledge(
            @RequestBody AlertModels.BulkAcknowledgeRequest request
    ) {
        return ResponseEntity.ok(operatorActionService.bulkAcknowledge(request));
    }

    @GetMapping("/actions")
    public ResponseEntity<List<AlertModels.AlertAction>> listActions(
            @RequestParam(required = false) String targetType,
            @RequestParam(required = false) Long targetId,
            @RequestParam(defaultValue = "100") int limit
    ) {
        return ResponseEntity.ok(operatorActionService.listActions(targetType, targetId, limit));
    }

    @GetMapping("/unacknowledged")
    public ResponseEntity<List<DriftReport>> listUnacknowledged(
            @RequestParam(defaultValue = "WARNING") Severity severity
    ) {
        return ResponseEntity.ok(operatorActionService.listUnacknowledged(severity));
    }

    @GetMapping("/dispatches")
    public ResponseEntity<List<DispatchRecord>> listDispatches(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(alertDispatcher.getRecentDispatches(limit));
    }

    @PostMapping("/dispatches/redeliver")
    public ResponseEntity<Integer> redeliver() {
        return ResponseEntity.ok(alertDispatcher.redeliverPending());
    }
}
