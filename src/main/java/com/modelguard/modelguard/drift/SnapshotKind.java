package com.modelguard.modelguard.drift;

public enum SnapshotKind {
    REFERENCE,
    CURRENT
}
