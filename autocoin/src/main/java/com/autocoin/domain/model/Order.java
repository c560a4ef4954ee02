package com.autocoin.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One execution attempt on the exchange. Persisted whether or not it succeeded.
 *
 * @param price  requested price; for a market buy this is the quote amount to spend
 * @param volume requested base volume; 0 for a market buy
 */
public record Order(
        String id,
        String market,
        OrderSide side,
        double price,
        double volume,
        OrderStatus status,
        double executedVolume,
        double executedAmount,
        Instant createdAt) {

    /**
     * Local record of an attempt that never produced an exchange order.
     */
    public static Order failed(String market, OrderSide side, double price, double volume) {
        return new Order(
            "local-" + UUID.randomUUID(),
            market,
            side,
            price,
            volume,
            OrderStatus.FAILED,
            0.0,
            0.0,
            Instant.now()
        );
    }

    public boolean hasFill() {
        return executedVolume > 0.0;
    }

    /**
     * Average execution price, falling back to the requested price before any fill.
     */
    public double averagePrice() {
        return executedVolume > 0.0 ? executedAmount / executedVolume : price;
    }
}
