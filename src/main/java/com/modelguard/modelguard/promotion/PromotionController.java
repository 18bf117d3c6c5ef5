package com.modelguard.modelguard.promotion;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Trigger for the training pipeline: evaluate a freshly registered version for promotion.
 */
@RestController
@RequestMapping("/api/promotion")
public class PromotionController {

    private final PromotionService promotionService;

    public PromotionController(PromotionService promotionService) {
        this.promotionService = promotionService;
    }

    @PostMapping("/evaluations")
    public ResponseEntity<PromotionDecision> evaluate(@RequestBody PromotionRequest request) {
        return ResponseEntity.ok(promotionService.evaluateAndApply(request));
    }

    @GetMapping("/decisions")
    public ResponseEntity<List<PromotionDecision>> getDecisions(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(promotionService.getRecentDecisions(limit));
    }

    @GetMapping("/decisions/{decisionId}")
    public ResponseEntity<PromotionDecision> getDecision(@PathVariable long decisionId) {
        return ResponseEntity.ok(promotionService.getDecision(decisionId));
    }
}
