package com.autocoin.config;

import com.autocoin.util.Env;

/**
 * Complete process configuration, loaded once at startup.
 *
 * @param metricsPort 0 disables the metrics endpoint
 */
public record AppConfig(
        TradingConfig trading,
        ExchangeConfig exchange,
        PipelineConfig pipeline,
        NotificationConfig notification,
        String dbPath,
        int metricsPort) {

    public static AppConfig fromEnv() {
        return new AppConfig(
            TradingConfig.fromEnv(),
            ExchangeConfig.fromEnv(),
            PipelineConfig.fromEnv(),
            NotificationConfig.fromEnv(),
            Env.get("DB_PATH", "data/autocoin.db"),
            Env.getInt("METRICS_PORT", 9091)
        );
    }
}
