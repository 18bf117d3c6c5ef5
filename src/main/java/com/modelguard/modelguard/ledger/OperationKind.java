package com.modelguard.modelguard.ledger;

import java.util.Locale;

public enum OperationKind {
    INSERT,
    UPDATE;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OperationKind fromDbValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
