package com.modelguard.modelguard.drift;

import com.modelguard.modelguard.alerting.AlertDispatcher;
import com.modelguard.modelguard.alerting.DispatchResult;
import com.modelguard.modelguard.registry.HeldOutScorer;
import com.modelguard.modelguard.registry.MetricUnavailableException;
import com.modelguard.modelguard.registry.ModelRegistryClient;
import com.modelguard.modelguard.registry.ModelStage;
import com.modelguard.modelguard.registry.ModelVersion;
import com.modelguard.modelguard.registry.RegistryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * One scheduled drift check: snapshot both windows, optionally re-score the production model, evaluate,
 * persist and dispatch.
 * <p>
 * Performance drift always re-scores the version that is in {@code Production} when the check runs, never a
 * challenger under evaluation.
 */
@Service
public class DriftMonitorService {

    private static final Logger log = LoggerFactory.getLogger(DriftMonitorService.class);

    private final DistributionSnapshotter snapshotter;
    private final DriftEngine driftEngine;
    private final DriftThresholds driftThresholds;
    private final DriftReportRepository driftReportRepository;
    private final DriftProperties driftProperties;
    private final ModelRegistryClient modelRegistryClient;
    private final HeldOutScorer heldOutScorer;
    private final RegistryProperties registryProperties;
    private final AlertDispatcher alertDispatcher;

    public DriftMonitorService(
            DistributionSnapshotter snapshotter,
            DriftEngine driftEngine,
            DriftThresholds driftThresholds,
            DriftReportRepository driftReportRepository,
            DriftProperties driftProperties,
            ModelRegistryClient modelRegistryClient,
            HeldOutScorer heldOutScorer,
            RegistryProperties registryProperties,
            AlertDispatcher alertDispatcher
    ) {
        this.snapshotter = snapshotter;
        this.driftEngine = driftEngine;
        this.driftThresholds = driftThresholds;
        this.driftReportRepository = driftReportRepository;
        this.driftProperties = driftProperties;
        this.modelRegistryClient = modelRegistryClient;
        this.heldOutScorer = heldOutScorer;
        this.registryProperties = registryProperties;
        this.alertDispatcher = alertDispatcher;
    }

    public DriftRunOutcome runScheduledCheck() {
        return runCheck(System.currentTimeMillis());
    }

    /**
     * Runs a check with windows ending at {@code now}. A snapshot below its minimum size ends the run as a
     * skip and writes nothing.
     */
    public DriftRunOutcome runCheck(long now) {
        long currentStart = now - Duration.ofDays(driftProperties.getCurrentDays()).toMillis();
        DistributionSnapshot current = snapshotter.fromPredictionLog(SnapshotKind.CURRENT, currentStart, now);
        DistributionSnapshot reference = driftProperties.getReferenceSource() == ReferenceSource.LEDGER
                ? snapshotter.fromLedger()
                : snapshotter.fromPredictionLog(SnapshotKind.REFERENCE,
                now - Duration.ofDays(driftProperties.getReferenceDays()).toMillis(), currentStart);

        DriftReport report;
        try {
            driftEngine.requireSufficientSamples(reference, current, driftThresholds);
            report = driftEngine.evaluateDrift(reference, current, driftThresholds, observePerformance());
        } catch (InsufficientSamplesException ex) {
            log.info("Drift check skipped. reason={}, snapshot={}, samples={}, required={}",
                    ex.getErrorCode(), ex.getKind(), ex.getActual(), ex.getRequired());
            return DriftRunOutcome.skipped(ex.getMessage());
        }

        DriftReport saved = driftReportRepository.save(report);
        log.info("Drift check complete. reportId={}, severity={}, overall={}, data={}, prediction={}, performance={}",
                saved.reportId(), saved.severity(), saved.overallScore(), saved.dataDriftScore(),
                saved.predictionDriftScore(), saved.performanceDriftScore());
        DispatchResult dispatch = alertDispatcher.dispatch(saved);
        return DriftRunOutcome.completed(saved, dispatch);
    }

    public List<DriftReport> getRecentReports(int limit) {
        return driftReportRepository.findRecent(limit);
    }

    public DriftReport getReport(long reportId) {
        return driftReportRepository.getById(reportId);
    }

    private PerformanceObservation observePerformance() {
        String heldOutSetId = driftProperties.getHeldOutSetId();
        if (heldOutSetId == null || heldOutSetId.isBlank()) {
            return null;
        }
        String modelName = registryProperties.getModelName();
        Optional<ModelVersion> production = modelRegistryClient.findVersionInStage(modelName, ModelStage.PRODUCTION);
        if (production.isEmpty()) {
            log.info("No {} version in Production; performance drift not evaluated", modelName);
            return null;
        }
        String version = production.get().version();
        double referenceMetric;
        try {
            referenceMetric = modelRegistryClient.getMetric(modelName, version);
        } catch (MetricUnavailableException ex) {
            log.warn("Performance drift not evaluated: {}", ex.getMessage());
            return null;
        }
        if (referenceMetric <= 0.0) {
            log.warn("Performance drift not evaluated: registered metric of {} version {} is {}",
                    modelName, version, referenceMetric);
            return null;
        }
        double currentMetric = heldOutScorer.score(modelName, version, heldOutSetId);
        return new PerformanceObservation(modelName, version, heldOutSetId, referenceMetric, currentMetric);
    }
}
