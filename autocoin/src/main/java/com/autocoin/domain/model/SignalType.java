package com.autocoin.domain.model;

/**
 * Direction and strength of a trading suggestion.
 */
public enum SignalType {
    BUY,
    STRONG_BUY,
    SELL,
    STRONG_SELL,
    HOLD;

    public boolean isBuy() {
        return this == BUY || this == STRONG_BUY;
    }

    public boolean isSell() {
        return this == SELL || this == STRONG_SELL;
    }
}
