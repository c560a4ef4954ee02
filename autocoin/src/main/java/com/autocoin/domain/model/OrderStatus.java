package com.autocoin.domain.model;

/**
 * Order status.
 */
public enum OrderStatus {
    WAITING,    // Accepted, not yet fully executed
    EXECUTED,   // Done
    CANCELED,   // Canceled on the exchange
    FAILED;     // Rejected, unknown state, or never reached the exchange

    /**
     * Map an exchange "state" field: wait, done, cancel. Anything else is FAILED.
     */
    public static OrderStatus fromExchangeState(String state) {
        if (state == null) {
            return FAILED;
        }
        return switch (state) {
            case "wait" -> WAITING;
            case "done" -> EXECUTED;
            case "cancel" -> CANCELED;
            default -> FAILED;
        };
    }

    public boolean isTerminal() {
        return this != WAITING;
    }
}
