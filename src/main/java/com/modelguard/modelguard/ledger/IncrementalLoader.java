package com.modelguard.modelguard.ledger;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Grows the ledger one audited batch at a time from the fixed source population.
 * <p>
 * A batch is opened {@code running} in its own transaction. Inserts, corrections and the batch completion
 * then commit together; any failure in that phase rolls back every entity write and leaves the batch
 * {@code failed}.
 */
@Service
public class IncrementalLoader {

    private static final Logger log = LoggerFactory.getLogger(IncrementalLoader.class);

    private final SourcePopulationReader sourcePopulationReader;
    private final LedgerStore ledgerStore;
    private final LedgerProperties ledgerProperties;
    private final TransactionTemplate transactionTemplate;
    private final NestedSampler sampler;
    private final int maxBasisPoints;
    private final Integer initialBasisPoints;

    public IncrementalLoader(
            SourcePopulationReader sourcePopulationReader,
            LedgerStore ledgerStore,
            LedgerProperties ledgerProperties,
            TransactionTemplate transactionTemplate
    ) {
        if (ledgerProperties.getSeed() == null) {
            throw new IllegalStateException(LedgerConstants.MSG_SEED_REQUIRED);
        }
        this.sourcePopulationReader = sourcePopulationReader;
        this.ledgerStore = ledgerStore;
        this.ledgerProperties = ledgerProperties;
        this.transactionTemplate = transactionTemplate;
        this.sampler = new NestedSampler(ledgerProperties.getSeed());
        toBasisPoints("ledger.step-fraction", ledgerProperties.getStepFraction());
        this.maxBasisPoints = toBasisPoints("ledger.max-fraction", ledgerProperties.getMaxFraction());
        this.initialBasisPoints = ledgerProperties.getInitialFraction() == null
                ? null
                : toBasisPoints("ledger.initial-fraction", ledgerProperties.getInitialFraction());
    }

    @PostConstruct
    public void recoverStaleBatches() {
        int recovered = ledgerStore.recoverStaleBatches();
        if (recovered > 0) {
            log.warn("Marked {} stale running ledger batch(es) as failed on startup", recovered);
        }
    }

    /**
     * Loads the next configured step.
     */
    public BatchResult loadNextIncrement() {
        return loadNextIncrement(ledgerProperties.getStepFraction(), null);
    }

    public BatchResult loadNextIncrement(double stepFraction) {
        return loadNextIncrement(stepFraction, null);
    }

    /**
     * Loads {@code stepFraction} more of the source population on top of the last completed batch.
     *
     * @param batchName explicit batch name, or {@code null} to derive one from the target fraction
     */
    public BatchResult loadNextIncrement(double stepFraction, String batchName) {
        int stepBasisPoints = toBasisPoints("stepFraction", stepFraction);
        int currentBasisPoints = currentBasisPoints();
        if (currentBasisPoints >= LedgerConstants.BASIS_POINTS) {
            throw new SourceExhaustedException(toFraction(currentBasisPoints));
        }
        if (currentBasisPoints >= maxBasisPoints) {
            return BatchResult.noOp(BatchOutcome.AT_MAXIMUM, toFraction(currentBasisPoints), entityCount());
        }
        int targetBasisPoints = currentBasisPoints == 0 && initialBasisPoints != null
                ? Math.min(initialBasisPoints, maxBasisPoints)
                : Math.min(currentBasisPoints + stepBasisPoints, maxBasisPoints);
        return runBatch(currentBasisPoints, targetBasisPoints, batchName);
    }

    public BatchResult loadToFraction(double targetFraction) {
        return loadToFraction(targetFraction, null);
    }

    /**
     * Loads up to an explicit target fraction. A target at or below the committed fraction is a no-op.
     */
    public BatchResult loadToFraction(double targetFraction, String batchName) {
        int requestedBasisPoints = toBasisPoints("targetFraction", targetFraction);
        int currentBasisPoints = currentBasisPoints();
        if (requestedBasisPoints <= currentBasisPoints) {
            return BatchResult.noOp(BatchOutcome.ALREADY_LOADED, toFraction(currentBasisPoints), entityCount());
        }
        int targetBasisPoints = Math.min(requestedBasisPoints, maxBasisPoints);
        if (targetBasisPoints <= currentBasisPoints) {
            return BatchResult.noOp(BatchOutcome.AT_MAXIMUM, toFraction(currentBasisPoints), entityCount());
        }
        return runBatch(currentBasisPoints, targetBasisPoints, batchName);
    }

    public double currentStepFraction() {
        return ledgerProperties.getStepFraction();
    }

    public LedgerState currentState() {
        LedgerBatch lastCompleted = ledgerStore.findLatestCompletedBatch().orElse(null);
        int currentBasisPoints = lastCompleted == null ? 0 : toBasisPoints(lastCompleted.targetFraction());
        int nextBasisPoints;
        if (currentBasisPoints == 0 && initialBasisPoints != null) {
            nextBasisPoints = Math.min(initialBasisPoints, maxBasisPoints);
        } else {
            int stepBasisPoints = toBasisPoints("ledger.step-fraction", ledgerProperties.getStepFraction());
            nextBasisPoints = Math.min(currentBasisPoints + stepBasisPoints, maxBasisPoints);
        }
        return new LedgerState(
                toFraction(currentBasisPoints),
                ledgerStore.countEntities(),
                sourcePopulationReader.readAll().size(),
                lastCompleted == null ? null : lastCompleted.batchName(),
                lastCompleted == null ? null : lastCompleted.completedAt(),
                toFraction(Math.max(currentBasisPoints, nextBasisPoints))
        );
    }

    public List<LedgerBatch> getBatches() {
        return ledgerStore.listBatches();
    }

    public List<HistoryRecord> getBatchHistory(long batchId) {
        requireBatch(batchId);
        return ledgerStore.findHistoryForBatch(batchId);
    }

    public List<LedgerEntity> replayBatch(long batchId) {
        requireBatch(batchId);
        return ledgerStore.replayBatch(batchId);
    }

    public List<LedgerEntity> datasetAsOf(long batchId) {
        return ledgerStore.datasetAsOf(batchId);
    }

    private BatchResult runBatch(int currentBasisPoints, int targetBasisPoints, String explicitBatchName) {
        List<SourceRecord> population = sourcePopulationReader.readAll();
        List<SourceRecord> selected = sampler.select(population, targetBasisPoints);
        Set<Long> existingIds = ledgerStore.findEntityIds();

        List<SourceRecord> toInsert = selected.stream()
                .filter(source -> !existingIds.contains(source.entityId()))
                .toList();
        List<Correction> corrections = ledgerProperties.isApplySourceCorrections()
                ? findCorrections(selected, existingIds)
                : List.of();

        String batchName = resolveBatchName(explicitBatchName, targetBasisPoints);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("seed", ledgerProperties.getSeed());
        metadata.put("previousFraction", toFraction(currentBasisPoints));
        metadata.put("sourceFile", ledgerProperties.getSourceFilePath());
        metadata.put("sourcePopulationSize", population.size());
        metadata.put("selectedRows", selected.size());

        LedgerBatch batch = ledgerStore.openBatch(batchName, toFraction(targetBasisPoints), metadata);
        long activeBatchId = batch.batchId();
        int[] counts;
        try {
            counts = transactionTemplate.execute(status -> {
                int added = ledgerStore.insertEntities(activeBatchId, toInsert);
                for (Correction correction : corrections) {
                    ledgerStore.updateEntity(activeBatchId, correction.current().entityId(),
                            correction.current().version(), correction.source());
                }
                int total = Math.toIntExact(ledgerStore.countEntities());
                ledgerStore.completeBatch(activeBatchId, added, corrections.size(), total);
                return new int[]{added, corrections.size(), total};
            });
        } catch (RuntimeException ex) {
            ledgerStore.failBatch(activeBatchId, ex.getMessage());
            log.error("Ledger batch failed. batch={}, target={}, reason={}", batchName,
                    toFraction(targetBasisPoints), ex.getMessage());
            throw new PartialCommitException(activeBatchId, batchName, ex);
        }

        log.info("Ledger batch completed. batch={}, fraction={} -> {}, rowsAdded={}, rowsUpdated={}, totalRows={}",
                batchName, toFraction(currentBasisPoints), toFraction(targetBasisPoints),
                counts[0], counts[1], counts[2]);
        return new BatchResult(
                BatchOutcome.COMPLETED,
                activeBatchId,
                batchName,
                toFraction(currentBasisPoints),
                toFraction(targetBasisPoints),
                counts[0],
                counts[1],
                counts[2]
        );
    }

    private List<Correction> findCorrections(List<SourceRecord> selected, Set<Long> existingIds) {
        if (existingIds.isEmpty()) {
            return List.of();
        }
        Map<Long, LedgerEntity> current = ledgerStore.findAllEntities().stream()
                .collect(Collectors.toMap(LedgerEntity::entityId, Function.identity()));
        List<Correction> corrections = new ArrayList<>();
        for (SourceRecord source : selected) {
            LedgerEntity entity = current.get(source.entityId());
            if (entity != null && !entity.sameContentAs(source)) {
                corrections.add(new Correction(entity, source));
            }
        }
        return corrections;
    }

    private String resolveBatchName(String explicitBatchName, int targetBasisPoints) {
        if (explicitBatchName != null) {
            String trimmed = explicitBatchName.trim();
            if (trimmed.isEmpty() || trimmed.length() > LedgerConstants.BATCH_NAME_MAX_LENGTH) {
                throw new IllegalArgumentException("batchName must be 1-" + LedgerConstants.BATCH_NAME_MAX_LENGTH
                        + " characters");
            }
            return trimmed;
        }
        String base = "%s%05d".formatted(LedgerConstants.BATCH_NAME_PREFIX, targetBasisPoints);
        String candidate = base;
        int retry = 1;
        while (ledgerStore.batchNameExists(candidate)) {
            candidate = base + LedgerConstants.BATCH_RETRY_INFIX + retry++;
        }
        return candidate;
    }

    private int currentBasisPoints() {
        return ledgerStore.findLatestCompletedBatch()
                .map(batch -> toBasisPoints(batch.targetFraction()))
                .orElse(0);
    }

    private int entityCount() {
        return Math.toIntExact(ledgerStore.countEntities());
    }

    private void requireBatch(long batchId) {
        if (ledgerStore.findBatch(batchId).isEmpty()) {
            throw new BatchNotFoundException(batchId);
        }
    }

    private static int toBasisPoints(String name, double fraction) {
        if (Double.isNaN(fraction) || fraction <= 0.0 || fraction > 1.0) {
            throw new IllegalArgumentException(LedgerConstants.MSG_INVALID_FRACTION.formatted(name, fraction));
        }
        return Math.max(1, toBasisPoints(fraction));
    }

    private static int toBasisPoints(double fraction) {
        return (int) Math.round(fraction * LedgerConstants.BASIS_POINTS);
    }

    private static double toFraction(int basisPoints) {
        return basisPoints / (double) LedgerConstants.BASIS_POINTS;
    }

    private record Correction(LedgerEntity current, SourceRecord source) {
    }
}
