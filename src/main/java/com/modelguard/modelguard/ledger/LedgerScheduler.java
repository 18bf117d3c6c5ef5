package com.modelguard.modelguard.ledger;

import com.modelguard.modelguard.common.JobRunner;
import com.modelguard.modelguard.common.SkippedRunException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the periodic ledger increment based on the cron expression in configuration.
 */
@Component
public class LedgerScheduler {

    private static final Logger log = LoggerFactory.getLogger(LedgerScheduler.class);

    private final IncrementalLoader incrementalLoader;
    private final JobRunner jobRunner;

    public LedgerScheduler(IncrementalLoader incrementalLoader, JobRunner jobRunner) {
        this.incrementalLoader = incrementalLoader;
        this.jobRunner = jobRunner;
    }

    /**
     * Scheduled entry point that loads one configured step of the source population.
     */
    @Scheduled(cron = "${ledger.cron}")
    public void scheduledIncrement() {
        try {
            BatchResult result = jobRunner.run("ledger-increment", incrementalLoader::loadNextIncrement);
            log.info("Ledger increment finished. outcome={}, batch={}, fraction={}, rowsAdded={}, totalRows={}",
                    result.outcome(), result.batchName(), result.targetFraction(), result.rowsAdded(), result.totalRows());
        } catch (SkippedRunException ex) {
            log.info("Ledger increment skipped. reason={}, detail={}", ex.getErrorCode(), ex.getMessage());
        }
    }
}
