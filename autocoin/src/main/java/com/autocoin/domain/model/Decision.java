package com.autocoin.domain.model;

import java.time.Instant;

/**
 * Concrete action derived from a signal or a risk check.
 *
 * Tagged union over {@link Kind}: consumers dispatch with an exhaustive
 * {@code switch} on {@link #kind()}. A decision carries intent only, never state.
 *
 * @param market target market, null for a hold that is not market specific
 * @param amount quote currency (KRW) to spend for BUY, base volume to sell for SELL, 0 for HOLD
 */
public record Decision(
        Kind kind,
        String market,
        double amount,
        String reason,
        Instant timestamp) {

    public enum Kind {
        BUY,    // Market buy for a quote amount
        SELL,   // Market sell of a base volume
        HOLD    // Do nothing
    }

    public static Decision buy(String market, double amountQuote, String reason) {
        return new Decision(Kind.BUY, market, amountQuote, reason, Instant.now());
    }

    public static Decision sell(String market, double volume, String reason) {
        return new Decision(Kind.SELL, market, volume, reason, Instant.now());
    }

    public static Decision hold(String reason) {
        return new Decision(Kind.HOLD, null, 0.0, reason, Instant.now());
    }

    public static Decision hold(String market, String reason) {
        return new Decision(Kind.HOLD, market, 0.0, reason, Instant.now());
    }

    public boolean isHold() {
        return kind == Kind.HOLD;
    }
}
