package com.modelguard.modelguard.drift;

import com.modelguard.modelguard.common.SkippedRunException;

/**
 * A snapshot is too small to evaluate. The run is skipped and no report is written.
 */
public class InsufficientSamplesException extends SkippedRunException {

    private final SnapshotKind kind;
    private final int actual;
    private final int required;

    public InsufficientSamplesException(SnapshotKind kind, int actual, int required) {
        super("INSUFFICIENT_SAMPLES", DriftConstants.MSG_INSUFFICIENT_SAMPLES.formatted(kind, actual, required));
        this.kind = kind;
        this.actual = actual;
        this.required = required;
    }

    public SnapshotKind getKind() {
        return kind;
    }

    public int getActual() {
        return actual;
    }

    public int getRequired() {
        return required;
    }
}
