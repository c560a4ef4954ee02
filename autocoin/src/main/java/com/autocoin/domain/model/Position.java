package com.autocoin.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A held market exposure with exit thresholds fixed at creation.
 *
 * At most one active position exists at any time.
 */
public record Position(
        String id,
        String market,
        double entryPrice,
        double amount,
        Instant entryTime,
        double stopLoss,
        double takeProfit) {

    /**
     * Open a position at the given fill price.
     *
     * stopLoss = entryPrice * (1 - stopLossRate), takeProfit = entryPrice * (1 + takeProfitRate).
     */
    public static Position open(String market, double entryPrice, double amount,
                                double stopLossRate, double takeProfitRate) {
        return new Position(
            UUID.randomUUID().toString(),
            market,
            entryPrice,
            amount,
            Instant.now(),
            entryPrice * (1.0 - stopLossRate),
            entryPrice * (1.0 + takeProfitRate)
        );
    }

    public PnL calculatePnl(double currentPrice) {
        double cost = amount * entryPrice;
        double value = amount * currentPrice;
        double profit = value - cost;
        double profitRate = entryPrice > 0 ? (currentPrice / entryPrice) - 1.0 : 0.0;
        return new PnL(cost, value, profit, profitRate);
    }

    public boolean shouldStopLoss(double currentPrice) {
        return currentPrice <= stopLoss;
    }

    public boolean shouldTakeProfit(double currentPrice) {
        return currentPrice >= takeProfit;
    }
}
