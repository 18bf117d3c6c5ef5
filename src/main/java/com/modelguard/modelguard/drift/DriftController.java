package com.modelguard.modelguard.drift;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/drift")
public class DriftController {

    private final DriftMonitorService driftMonitorService;

    public DriftController(DriftMonitorService driftMonitorService) {
        this.driftMonitorService = driftMonitorService;
    }

    /**
     * Runs one drift check now. A skip is a normal outcome, returned with status SKIPPED.
     */
    @PostMapping("/runs")
    public ResponseEntity<DriftRunOutcome> runCheck() {
        return ResponseEntity.ok(driftMonitorService.runScheduledCheck());
    }

    @GetMapping("/reports")
    public ResponseEntity<List<DriftReport>> getReports(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(driftMonitorService.getRecentReports(limit));
    }

    @GetMapping("/reports/{reportId}")
    public ResponseEntity<DriftReport> getReport(@PathVariable long reportId) {
        return ResponseEntity.ok(driftMonitorService.getReport(reportId));
    }
}
