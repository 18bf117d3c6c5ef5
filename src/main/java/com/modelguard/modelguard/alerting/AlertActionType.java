package com.modelguard.modelguard.alerting;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum AlertActionType {
    ACKNOWLEDGE("acknowledge"),
    BULK_ACKNOWLEDGE("bulk_acknowledge"),
    FORCE_RETRAIN("force_retrain"),
    ROLLBACK("rollback"),
    INVESTIGATE("investigate"),
    THRESHOLD_ADJUST("threshold_adjust");

    private final String dbValue;

    AlertActionType(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public boolean acknowledges() {
        return this == ACKNOWLEDGE || this == BULK_ACKNOWLEDGE;
    }

    @JsonCreator
    public static AlertActionType fromValue(String value) {
        String normalized = value == null ? "" : value.trim();
        return Arrays.stream(values())
                .filter(type -> type.dbValue.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown alert action type: " + value));
    }
}
