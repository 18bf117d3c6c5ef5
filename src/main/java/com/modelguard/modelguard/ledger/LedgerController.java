package com.modelguard.modelguard.ledger;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Manual ledger increments and read access to batches and their audit history.
 */
@RestController
@RequestMapping("/api/ledger")
public class LedgerController {

    private final IncrementalLoader incrementalLoader;

    public LedgerController(IncrementalLoader incrementalLoader) {
        this.incrementalLoader = incrementalLoader;
    }

    /**
     * Loads one increment. {@code targetFraction} loads up to an explicit fraction instead of one step.
     */
    @PostMapping("/increments")
    public ResponseEntity<BatchResult> loadIncrement(
            @RequestParam(required = false) Double stepFraction,
            @RequestParam(required = false) Double targetFraction,
            @RequestParam(required = false) String batchName) {
        if (targetFraction != null) {
            return ResponseEntity.ok(incrementalLoader.loadToFraction(targetFraction, batchName));
        }
        if (stepFraction != null) {
            return ResponseEntity.ok(incrementalLoader.loadNextIncrement(stepFraction, batchName));
        }
        return ResponseEntity.ok(incrementalLoader.loadNextIncrement(
                incrementalLoader.currentStepFraction(), batchName));
    }

    @GetMapping("/state")
    public ResponseEntity<LedgerState> getState() {
        return ResponseEntity.ok(incrementalLoader.currentState());
    }

    @GetMapping("/batches")
    public ResponseEntity<List<LedgerBatch>> getBatches() {
        return ResponseEntity.ok(incrementalLoader.getBatches());
    }

    @GetMapping("/batches/{batchId}/history")
    public ResponseEntity<List<HistoryRecord>> getBatchHistory(@PathVariable long batchId) {
        return ResponseEntity.ok(incrementalLoader.getBatchHistory(batchId));
    }

    /**
     * Entities written by one batch, rebuilt from its history records.
     */
    @GetMapping("/batches/{batchId}/entities")
    public ResponseEntity<List<LedgerEntity>> replayBatch(@PathVariable long batchId) {
        return ResponseEntity.ok(incrementalLoader.replayBatch(batchId));
    }

    @GetMapping("/batches/{batchId}/dataset")
    public ResponseEntity<List<LedgerEntity>> getDatasetAsOf(@PathVariable long batchId) {
        return ResponseEntity.ok(incrementalLoader.datasetAsOf(batchId));
    }
}
