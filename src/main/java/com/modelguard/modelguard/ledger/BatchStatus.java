package com.modelguard.modelguard.ledger;

import java.util.Locale;

public enum BatchStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BatchStatus fromDbValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
