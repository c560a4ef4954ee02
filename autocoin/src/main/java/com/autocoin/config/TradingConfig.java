package com.autocoin.config;

import com.autocoin.util.Env;

/**
 * Strategy and risk parameters.
 *
 * @param targetCoins           how many KRW markets to subscribe to
 * @param takeProfitRate        take profit distance above entry (0.10 = +10%)
 * @param stopLossRate          stop loss distance below entry (0.05 = -5%)
 * @param surgeThreshold        minimum price change inside the lookback to call a surge
 * @param surgeTimeframeMinutes lookback window for surge detection
 * @param volumeMultiplier      minimum tick volume relative to the window average
 * @param minOrderAmount        smallest KRW balance that may open a position
 * @param maxPositionRatio      share of the balance spent per entry
 * @param maxPositions          concurrent positions; only 1 is supported
 */
public record TradingConfig(
        int targetCoins,
        double takeProfitRate,
        double stopLossRate,
        double surgeThreshold,
        int surgeTimeframeMinutes,
        double volumeMultiplier,
        double minOrderAmount,
        double maxPositionRatio,
        int maxPositions) {

    public static TradingConfig defaults() {
        return new TradingConfig(20, 0.10, 0.05, 0.05, 60, 2.0, 5000.0, 0.5, 1);
    }

    public static TradingConfig fromEnv() {
        TradingConfig d = defaults();
        return new TradingConfig(
            Env.getInt("TRADING_TARGET_COINS", d.targetCoins()),
            Env.getDouble("TARGET_PROFIT_RATE", d.takeProfitRate()),
            Env.getDouble("STOP_LOSS_RATE", d.stopLossRate()),
            Env.getDouble("SURGE_THRESHOLD", d.surgeThreshold()),
            Env.getInt("SURGE_TIMEFRAME_MINUTES", d.surgeTimeframeMinutes()),
            Env.getDouble("VOLUME_MULTIPLIER", d.volumeMultiplier()),
            Env.getDouble("MIN_ORDER_AMOUNT_KRW", d.minOrderAmount()),
            Env.getDouble("MAX_POSITION_RATIO", d.maxPositionRatio()),
            Env.getInt("MAX_POSITIONS", d.maxPositions())
        );
    }
}
