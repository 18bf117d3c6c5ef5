package com.modelguard.modelguard.drift;

import com.modelguard.modelguard.common.JobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the periodic drift check based on the cron expression in configuration.
 */
@Component
public class DriftScheduler {

    private static final Logger log = LoggerFactory.getLogger(DriftScheduler.class);

    private final DriftMonitorService driftMonitorService;
    private final JobRunner jobRunner;

    public DriftScheduler(DriftMonitorService driftMonitorService, JobRunner jobRunner) {
        this.driftMonitorService = driftMonitorService;
        this.jobRunner = jobRunner;
    }

    @Scheduled(cron = "${drift.cron}")
    public void scheduledCheck() {
        DriftRunOutcome outcome = jobRunner.run("drift-check", driftMonitorService::runScheduledCheck);
        if (outcome.status() == DriftRunOutcome.Status.COMPLETED) {
            log.info("Scheduled drift check finished. reportId={}, severity={}",
                    outcome.report().reportId(), outcome.report().severity());
        }
    }
}
