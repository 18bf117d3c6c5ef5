package com.modelguard.modelguard.promotion;

import com.modelguard.modelguard.alerting.AlertDispatcher;
import com.modelguard.modelguard.registry.MetricUnavailableException;
import com.modelguard.modelguard.registry.ModelRegistryClient;
import com.modelguard.modelguard.registry.ModelStage;
import com.modelguard.modelguard.registry.ModelVersion;
import com.modelguard.modelguard.registry.RegistryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Reads the challenger and incumbent from the registry, records the engine's decision, requests its stage
 * transitions and hands the decision to the alert dispatcher.
 */
@Service
public class PromotionService {

    private static final Logger log = LoggerFactory.getLogger(PromotionService.class);

    private final PromotionEngine promotionEngine;
    private final PromotionThresholds promotionThresholds;
    private final PromotionProperties promotionProperties;
    private final PromotionDecisionRepository promotionDecisionRepository;
    private final ModelRegistryClient modelRegistryClient;
    private final RegistryProperties registryProperties;
    private final AlertDispatcher alertDispatcher;

    public PromotionService(
            PromotionEngine promotionEngine,
            PromotionThresholds promotionThresholds,
            PromotionProperties promotionProperties,
            PromotionDecisionRepository promotionDecisionRepository,
            ModelRegistryClient modelRegistryClient,
            RegistryProperties registryProperties,
            AlertDispatcher alertDispatcher
    ) {
        this.promotionEngine = promotionEngine;
        this.promotionThresholds = promotionThresholds;
        this.promotionProperties = promotionProperties;
        this.promotionDecisionRepository = promotionDecisionRepository;
        this.modelRegistryClient = modelRegistryClient;
        this.registryProperties = registryProperties;
        this.alertDispatcher = alertDispatcher;
    }

    public PromotionDecision evaluateAndApply(PromotionRequest request) {
        String modelName = request.modelName() == null || request.modelName().isBlank()
                ? registryProperties.getModelName()
                : request.modelName().trim();
        if (request.challengerVersion() == null || request.challengerVersion().isBlank()) {
            throw new IllegalArgumentException("challengerVersion is required");
        }
        String version = request.challengerVersion().trim();

        ModelStage challengerStage = modelRegistryClient.getStage(modelName, version);
        if (challengerStage == ModelStage.PRODUCTION) {
            throw new IllegalArgumentException(PromotionConstants.MSG_CHALLENGER_IS_INCUMBENT.formatted(modelName, version));
        }
        if (challengerStage != ModelStage.NONE && challengerStage != ModelStage.STAGING) {
            throw new IllegalArgumentException(PromotionConstants.MSG_CHALLENGER_NOT_CANDIDATE
                    .formatted(modelName, version, challengerStage.registryName()));
        }
        double challengerMetric = request.challengerMetric() != null
                ? request.challengerMetric()
                : modelRegistryClient.getMetric(modelName, version);

        PromotionDecision decision = promotionEngine.evaluatePromotion(
                new ChallengerMetric(modelName, version, challengerMetric),
                readIncumbent(modelName),
                promotionThresholds
        );
        PromotionDecision saved = promotionDecisionRepository.save(decision);
        log.info("Promotion decision recorded. decisionId={}, outcome={}, mode={}, justification={}",
                saved.decisionId(), saved.outcome(), saved.comparisonMode(), saved.justification());

        if (saved.outcome() == PromotionOutcome.PROMOTE) {
            if (!promotionProperties.isAutoPromotionEnabled()) {
                log.info("Auto-promotion disabled; transitions for decision {} recorded but not requested",
                        saved.decisionId());
            } else {
                try {
                    applyTransitions(saved);
                    saved = saved.withTransitionsApplied();
                } catch (RuntimeException ex) {
                    log.error("Stage transitions for decision {} failed: {}", saved.decisionId(), ex.getMessage());
                    alertDispatcher.dispatchTransitionFailure(saved, ex);
                    throw ex;
                }
            }
        }
        alertDispatcher.dispatch(saved);
        return saved;
    }

    public PromotionDecision getDecision(long decisionId) {
        return promotionDecisionRepository.findById(decisionId)
                .orElseThrow(() -> new PromotionDecisionNotFoundException(decisionId));
    }

    public List<PromotionDecision> getRecentDecisions(int limit) {
        return promotionDecisionRepository.findRecent(limit);
    }

    private IncumbentMetric readIncumbent(String modelName) {
        Optional<ModelVersion> production = modelRegistryClient.findVersionInStage(modelName, ModelStage.PRODUCTION);
        if (production.isEmpty()) {
            return IncumbentMetric.none();
        }
        String version = production.get().version();
        try {
            return IncumbentMetric.of(version, modelRegistryClient.getMetric(modelName, version));
        } catch (MetricUnavailableException ex) {
            log.warn("Incumbent {} version {} has no readable metric; comparison degraded: {}",
                    modelName, version, ex.getMessage());
            return IncumbentMetric.unavailable(version, ex.getMessage());
        }
    }

    // The incumbent is archived by the registry inside the promotion request, so a failed request leaves it
    // in Production.
    private void applyTransitions(PromotionDecision decision) {
        StageTransition promotion = decision.requestedTransitions().stream()
                .filter(transition -> transition.targetStage() == ModelStage.PRODUCTION)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "Decision %d promotes without a Production transition".formatted(decision.decisionId())));
        modelRegistryClient.requestStageTransition(decision.modelName(), promotion.version(), ModelStage.PRODUCTION,
                true);
        promotionDecisionRepository.markTransitionsApplied(decision.decisionId());
    }
}
