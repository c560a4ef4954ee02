package com.autocoin.domain.model;

/**
 * Persisted lifecycle state of a position.
 */
public enum PositionStatus {
    ACTIVE,     // Held, watched by the risk loop
    CLOSED;     // Sold, exit fields recorded

    public String dbValue() {
        return name().toLowerCase();
    }

    public static PositionStatus fromDbValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
