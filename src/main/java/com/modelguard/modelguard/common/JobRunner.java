package com.modelguard.modelguard.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Wraps scheduled jobs with a bounded retry on transient infrastructure failures.
 * Any other failure, and the last transient one, propagates unchanged.
 */
@Component
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final int maxAttempts;
    private final Duration backoff;

    public JobRunner(
            @Value("${jobs.max-attempts:3}") int maxAttempts,
            @Value("${jobs.backoff-ms:500}") long backoffMillis
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("jobs.max-attempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = Duration.ofMillis(Math.max(0, backoffMillis));
    }

    public <T> T run(String jobName, Supplier<T> job) {
        return Mono.fromSupplier(job)
                .retryWhen(Retry.backoff(maxAttempts - 1L, backoff)
                        .filter(JobRunner::isTransient)
                        .doBeforeRetry(signal -> log.warn("Job {} failed transiently (attempt {}): {}",
                                jobName, signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .block();
    }

    static boolean isTransient(Throwable failure) {
        return failure instanceof TransientDataAccessException
                || failure instanceof TransientInfrastructureException;
    }
}
