package com.modelguard.modelguard.drift;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.modelguard.modelguard.alerting.DispatchResult;

/**
 * Result of one drift check run: either a persisted and dispatched report, or a structured skip.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DriftRunOutcome(Status status, DriftReport report, DispatchResult dispatch, String skipReason) {

    public enum Status {
        COMPLETED,
        SKIPPED
    }

    public static DriftRunOutcome completed(DriftReport report, DispatchResult dispatch) {
        return new DriftRunOutcome(Status.COMPLETED, report, dispatch, null);
    }

    public static DriftRunOutcome skipped(String skipReason) {
        return new DriftRunOutcome(Status.SKIPPED, null, null, skipReason);
    }
}
