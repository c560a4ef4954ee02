package com.autocoin.domain.model;

import java.time.Instant;

/**
 * Trading suggestion derived from ticks.
 *
 * @param confidence in [0, 1]
 */
public record Signal(
        String market,
        SignalType type,
        double confidence,
        String reason,
        Instant timestamp) {

    public Signal {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
    }

    public static Signal buy(String market, double confidence, String reason) {
        return new Signal(market, SignalType.BUY, confidence, reason, Instant.now());
    }

    public static Signal sell(String market, double confidence, String reason) {
        return new Signal(market, SignalType.SELL, confidence, reason, Instant.now());
    }

    public static Signal hold(String market) {
        return new Signal(market, SignalType.HOLD, 0.0, "No significant signal", Instant.now());
    }
}
