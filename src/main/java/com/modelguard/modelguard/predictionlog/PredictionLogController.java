package com.modelguard.modelguard.predictionlog;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Intake for the serving process: every served prediction is appended here.
 */
@RestController
@RequestMapping("/api/predictions")
public class PredictionLogController {

    private final PredictionLogService predictionLogService;

    public PredictionLogController(PredictionLogService predictionLogService) {
        this.predictionLogService = predictionLogService;
    }

    @PostMapping
    public ResponseEntity<PredictionLogModels.PredictionLogEntry> appendPrediction(
            @RequestBody PredictionLogModels.PredictionLogRequest request) {
        return ResponseEntity.ok(predictionLogService.append(request));
    }

    @GetMapping
    public ResponseEntity<List<PredictionLogModels.PredictionLogEntry>> getPredictions(
            @RequestParam long from,
            @RequestParam long to) {
        return ResponseEntity.ok(predictionLogService.findBetween(from, to));
    }
}
