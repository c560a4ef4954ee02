package com.autocoin.domain.model;

/**
 * One trade or ticker update for a market, as received from the stream.
 *
 * @param timestamp exchange timestamp, epoch millis
 */
public record Tick(
        String market,
        long timestamp,
        double tradePrice,
        double changeRate,
        double volume) {
}
