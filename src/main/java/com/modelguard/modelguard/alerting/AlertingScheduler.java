package com.modelguard.modelguard.alerting;

import com.modelguard.modelguard.common.JobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically retries notifications that have not reached every channel.
 */
@Component
public class AlertingScheduler {

    private static final Logger log = LoggerFactory.getLogger(AlertingScheduler.class);

    private final AlertDispatcher alertDispatcher;
    private final JobRunner jobRunner;

    public AlertingScheduler(AlertDispatcher alertDispatcher, JobRunner jobRunner) {
        this.alertDispatcher = alertDispatcher;
        this.jobRunner = jobRunner;
    }

    @Scheduled(cron = "${alerting.redelivery-cron}")
    public void redeliverPending() {
        int delivered = jobRunner.run("alert-redelivery", alertDispatcher::redeliverPending);
        if (delivered > 0) {
            log.info("Scheduled alert redelivery finished. delivered={}", delivered);
        }
    }
}
