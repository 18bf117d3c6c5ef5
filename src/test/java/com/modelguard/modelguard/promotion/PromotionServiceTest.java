package com.modelguard.modelguard.promotion;

import com.modelguard.modelguard.alerting.AlertDispatcher;
import com.modelguard.modelguard.registry.MetricUnavailableException;
import com.modelguard.modelguard.registry.ModelRegistryClient;
import com.modelguard.modelguard.registry.ModelStage;
import com.modelguard.modelguard.registry.ModelVersion;
import com.modelguard.modelguard.registry.RegistryProperties;
import com.modelguard.modelguard.registry.RegistryUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PromotionServiceTest {

    private static final String MODEL = "rakuten_classifier";

    private ModelRegistryClient registry;
    private PromotionDecisionRepository repository;
    private AlertDispatcher alertDispatcher;
    private PromotionProperties promotionProperties;
    private PromotionService service;

    @BeforeEach
    void setUp() {
        registry = mock(ModelRegistryClient.class);
        repository = mock(PromotionDecisionRepository.class);
        alertDispatcher = mock(AlertDispatcher.class);
        promotionProperties = new PromotionProperties();
        service = new PromotionService(new PromotionEngine(), new PromotionThresholds(0.75), promotionProperties,
                repository, registry, new RegistryProperties(), alertDispatcher);

        when(repository.save(any(PromotionDecision.class)))
                .thenAnswer(invocation -> invocation.<PromotionDecision>getArgument(0).withDecisionId(7L));
        when(registry.getStage(MODEL, "4")).thenReturn(ModelStage.STAGING);
        when(registry.getMetric(MODEL, "4")).thenReturn(0.80);
    }

    @Test
    void shouldPromoteChallengerAndArchiveIncumbentInOneRegistryRequest() {
        givenIncumbent("3");
        when(registry.getMetric(MODEL, "3")).thenReturn(0.78);

        PromotionDecision decision = service.evaluateAndApply(new PromotionRequest(null, "4", null));

        assertEquals(PromotionOutcome.PROMOTE, decision.outcome());
        assertTrue(decision.transitionsApplied());
        InOrder order = inOrder(registry, repository, alertDispatcher);
        order.verify(registry).requestStageTransition(MODEL, "4", ModelStage.PRODUCTION, true);
        order.verify(repository).markTransitionsApplied(7L);
        order.verify(alertDispatcher).dispatch(decision);
        verify(registry, never()).requestStageTransition(MODEL, "3", ModelStage.ARCHIVED, false);
        verify(registry, never()).requestStageTransition(MODEL, "3", ModelStage.ARCHIVED, true);
    }

    @Test
    void shouldLeaveIncumbentServingWhenPromotionRequestFails() {
        StageTrackingRegistry trackingRegistry = new StageTrackingRegistry();
        trackingRegistry.put("3", ModelStage.PRODUCTION, 0.78);
        trackingRegistry.put("4", ModelStage.STAGING, 0.80);
        trackingRegistry.failProductionTransitions = true;
        PromotionService trackingService = new PromotionService(new PromotionEngine(), new PromotionThresholds(0.75),
                promotionProperties, repository, trackingRegistry, new RegistryProperties(), alertDispatcher);

        assertThrows(RegistryUnavailableException.class,
                () -> trackingService.evaluateAndApply(new PromotionRequest(MODEL, "4", null)));

        assertEquals(ModelStage.PRODUCTION, trackingRegistry.stages.get("3"));
        assertEquals(ModelStage.STAGING, trackingRegistry.stages.get("4"));
        verify(alertDispatcher).dispatchTransitionFailure(any(PromotionDecision.class),
                any(RegistryUnavailableException.class));
        verify(alertDispatcher, never()).dispatch(any(PromotionDecision.class));
    }

    @Test
    void shouldSwapStagesWhenPromotionRequestSucceeds() {
        StageTrackingRegistry trackingRegistry = new StageTrackingRegistry();
        trackingRegistry.put("3", ModelStage.PRODUCTION, 0.78);
        trackingRegistry.put("4", ModelStage.STAGING, 0.80);
        PromotionService trackingService = new PromotionService(new PromotionEngine(), new PromotionThresholds(0.75),
                promotionProperties, repository, trackingRegistry, new RegistryProperties(), alertDispatcher);

        trackingService.evaluateAndApply(new PromotionRequest(MODEL, "4", null));

        assertEquals(ModelStage.ARCHIVED, trackingRegistry.stages.get("3"));
        assertEquals(ModelStage.PRODUCTION, trackingRegistry.stages.get("4"));
    }

    @Test
    void shouldRecordRejectionWithoutTransitions() {
        givenIncumbent("3");
        when(registry.getMetric(MODEL, "3")).thenReturn(0.85);

        PromotionDecision decision = service.evaluateAndApply(new PromotionRequest(MODEL, "4", null));

        assertEquals(PromotionOutcome.REJECT, decision.outcome());
        verify(registry, never()).requestStageTransition(anyString(), anyString(), any(), anyBoolean());
        verify(repository, never()).markTransitionsApplied(anyLong());
        verify(alertDispatcher).dispatch(decision);
    }

    @Test
    void shouldDegradeComparisonWhenIncumbentMetricIsMissing() {
        givenIncumbent("3");
        when(registry.getMetric(MODEL, "3")).thenThrow(new MetricUnavailableException(MODEL, "3", "test_f1_weighted"));

        PromotionDecision decision = service.evaluateAndApply(new PromotionRequest(MODEL, "4", null));

        assertEquals(ComparisonMode.DEGRADED_COMPARISON, decision.comparisonMode());
        assertEquals(PromotionOutcome.PROMOTE, decision.outcome());
    }

    @Test
    void shouldUseSuppliedChallengerMetric() {
        when(registry.findVersionInStage(MODEL, ModelStage.PRODUCTION)).thenReturn(Optional.empty());

        PromotionDecision decision = service.evaluateAndApply(new PromotionRequest(MODEL, "4", 0.70));

        assertEquals(0.70, decision.challengerMetric(), 1e-12);
        assertEquals(PromotionOutcome.REJECT, decision.outcome());
    }

    @Test
    void shouldOnlyRecordWhenAutoPromotionIsDisabled() {
        promotionProperties.setAutoPromotionEnabled(false);
        when(registry.findVersionInStage(MODEL, ModelStage.PRODUCTION)).thenReturn(Optional.empty());

        PromotionDecision decision = service.evaluateAndApply(new PromotionRequest(MODEL, "4", null));

        assertEquals(PromotionOutcome.PROMOTE, decision.outcome());
        assertFalse(decision.transitionsApplied());
        verify(registry, never()).requestStageTransition(anyString(), anyString(), any(), anyBoolean());
    }

    @Test
    void shouldDispatchAndPropagateWhenTransitionFails() {
        when(registry.findVersionInStage(MODEL, ModelStage.PRODUCTION)).thenReturn(Optional.empty());
        doThrow(new RegistryUnavailableException("transition", new IOException("connection reset")))
                .when(registry).requestStageTransition(MODEL, "4", ModelStage.PRODUCTION, true);

        assertThrows(RegistryUnavailableException.class,
                () -> service.evaluateAndApply(new PromotionRequest(MODEL, "4", null)));

        verify(alertDispatcher).dispatchTransitionFailure(any(PromotionDecision.class),
                any(RegistryUnavailableException.class));
        verify(repository, never()).markTransitionsApplied(anyLong());
    }

    @Test
    void shouldRefuseChallengerAlreadyInProduction() {
        when(registry.getStage(MODEL, "3")).thenReturn(ModelStage.PRODUCTION);

        assertThrows(IllegalArgumentException.class,
                () -> service.evaluateAndApply(new PromotionRequest(MODEL, "3", null)));
        verify(repository, never()).save(any());
    }

    private void givenIncumbent(String version) {
        when(registry.findVersionInStage(MODEL, ModelStage.PRODUCTION))
                .thenReturn(Optional.of(new ModelVersion(MODEL, version, ModelStage.PRODUCTION, "run-" + version)));
    }

    /**
     * In-memory registry that applies transitions the way the registry does, including archiving the
     * versions already in the target stage.
     */
    private static final class StageTrackingRegistry implements ModelRegistryClient {

        private final Map<String, ModelStage> stages = new LinkedHashMap<>();
        private final Map<String, Double> metrics = new LinkedHashMap<>();
        private boolean failProductionTransitions;

        void put(String version, ModelStage stage, double metric) {
            stages.put(version, stage);
            metrics.put(version, metric);
        }

        @Override
        public double getMetric(String modelName, String version) {
            return metrics.get(version);
        }

        @Override
        public ModelStage getStage(String modelName, String version) {
            return stages.get(version);
        }

        @Override
        public Optional<ModelVersion> findVersionInStage(String modelName, ModelStage stage) {
            return stages.entrySet().stream()
                    .filter(entry -> entry.getValue() == stage)
                    .map(entry -> new ModelVersion(modelName, entry.getKey(), stage, "run-" + entry.getKey()))
                    .findFirst();
        }

        @Override
        public void requestStageTransition(String modelName, String version, ModelStage targetStage,
                                           boolean archiveExistingVersions) {
            if (failProductionTransitions && targetStage == ModelStage.PRODUCTION) {
                throw new RegistryUnavailableException("transition-stage", new IOException("connection reset"));
            }
            if (archiveExistingVersions) {
                stages.replaceAll((existing, stage) -> stage == targetStage ? ModelStage.ARCHIVED : stage);
            }
            stages.put(version, targetStage);
        }
    }
}
