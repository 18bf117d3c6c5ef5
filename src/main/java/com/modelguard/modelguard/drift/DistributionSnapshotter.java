package com.modelguard.modelguard.drift;

import com.modelguard.modelguard.ledger.LedgerBatch;
import com.modelguard.modelguard.ledger.LedgerEntity;
import com.modelguard.modelguard.ledger.LedgerStore;
import com.modelguard.modelguard.predictionlog.PredictionLogModels;
import com.modelguard.modelguard.predictionlog.PredictionLogService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds distribution snapshots from the prediction log and from ledger training data.
 * <p>
 * Prediction-log input signals that are numbers become numeric signals; strings and booleans become
 * categorical signals. Ledger snapshots expose {@code text_length}, every metadata field as a categorical
 * signal and the label histogram as the expected class distribution.
 */
@Component
public class DistributionSnapshotter {

    private final PredictionLogService predictionLogService;
    private final LedgerStore ledgerStore;

    public DistributionSnapshotter(PredictionLogService predictionLogService, LedgerStore ledgerStore) {
        this.predictionLogService = predictionLogService;
        this.ledgerStore = ledgerStore;
    }

    public DistributionSnapshot fromPredictionLog(SnapshotKind kind, long windowStart, long windowEnd) {
        DistributionSnapshot.Builder builder = DistributionSnapshot.builder("prediction_log", kind)
                .window(windowStart, windowEnd);
        for (PredictionLogModels.PredictionLogEntry entry : predictionLogService.findBetween(windowStart, windowEnd)) {
            builder.sample().predictedClass(entry.predictedClass());
            if (entry.confidence() != null) {
                builder.numeric(DriftConstants.SIGNAL_CONFIDENCE, entry.confidence());
            }
            for (Map.Entry<String, Object> signal : entry.inputSignals().entrySet()) {
                Object value = signal.getValue();
                if (value instanceof Number number) {
                    builder.numeric(signal.getKey(), number.doubleValue());
                } else if (value instanceof String || value instanceof Boolean) {
                    builder.category(signal.getKey(), value.toString());
                }
            }
        }
        return builder.build();
    }

    /**
     * Reference snapshot of the training data as it stood after the latest completed batch. Empty when
     * nothing has been loaded yet.
     */
    public DistributionSnapshot fromLedger() {
        Optional<LedgerBatch> latest = ledgerStore.findLatestCompletedBatch();
        if (latest.isEmpty()) {
            return DistributionSnapshot.builder("ledger", SnapshotKind.REFERENCE).build();
        }
        LedgerBatch batch = latest.get();
        DistributionSnapshot.Builder builder = DistributionSnapshot.builder("ledger:" + batch.batchName(),
                SnapshotKind.REFERENCE).window(batch.startedAt(), batch.completedAt() == null ? batch.startedAt() : batch.completedAt());
        List<LedgerEntity> dataset = ledgerStore.datasetAsOf(batch.batchId());
        for (LedgerEntity entity : dataset) {
            builder.sample()
                    .numeric(DriftConstants.SIGNAL_TEXT_LENGTH, entity.textLength())
                    .predictedClass(entity.label());
            entity.metadata().forEach(builder::category);
        }
        return builder.build();
    }
}
