package com.autocoin.domain.model;

/**
 * Profit and loss of a position at a given price. Derived, never stored.
 */
public record PnL(
        double cost,
        double value,
        double profit,
        double profitRate) {
}
