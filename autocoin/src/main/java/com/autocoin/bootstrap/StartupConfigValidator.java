package com.autocoin.bootstrap;

import com.autocoin.config.AppConfig;
import com.autocoin.config.ExchangeConfig;
import com.autocoin.config.PipelineConfig;
import com.autocoin.config.TradingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs before anything connects to the exchange. Every problem found is reported in one
 * IllegalStateException and the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private StartupConfigValidator() {
    }

    /**
     * @throws IllegalStateException listing every invalid setting
     */
    public static void validate(AppConfig config) {
        log.info("Running startup config validation...");

        List<String> problems = new ArrayList<>();
        checkExchange(config.exchange(), problems);
        checkTrading(config.trading(), problems);
        checkPipeline(config.pipeline(), problems);

        if (config.dbPath() == null || config.dbPath().isBlank()) {
            problems.add("DB_PATH must not be empty");
        }
        if (config.metricsPort() < 0 || config.metricsPort() > 65535) {
            problems.add("METRICS_PORT must be between 0 and 65535, got " + config.metricsPort());
        }
        if (!config.notification().isEnabled()) {
            log.warn("⚠️ DISCORD_WEBHOOK_URL not set - notifications disabled");
        }

        if (!problems.isEmpty()) {
            StringBuilder message = new StringBuilder("❌ INVALID CONFIG: system refuses to start\n");
            for (String problem : problems) {
                message.append("  - ").append(problem).append('\n');
            }
            throw new IllegalStateException(message.toString());
        }

        log.info("✅ Startup config validation passed");
    }

    private static void checkExchange(ExchangeConfig exchange, List<String> problems) {
        if (exchange.accessKey() == null || exchange.accessKey().isBlank()) {
            problems.add("UPBIT_ACCESS_KEY is required");
        }
        if (exchange.secretKey() == null || exchange.secretKey().isBlank()) {
            problems.add("UPBIT_SECRET_KEY is required");
        }
        if (exchange.rateLimitRequests() <= 0) {
            problems.add("UPBIT_RATE_LIMIT_REQUESTS must be positive");
        }
        if (exchange.rateLimitWindow().isNegative() || exchange.rateLimitWindow().isZero()) {
            problems.add("UPBIT_RATE_LIMIT_WINDOW_MS must be positive");
        }
        if (!"trade".equals(exchange.streamType()) && !"ticker".equals(exchange.streamType())) {
            problems.add("UPBIT_STREAM_TYPE must be 'trade' or 'ticker', got '" + exchange.streamType() + "'");
        }
    }

    private static void checkTrading(TradingConfig trading, List<String> problems) {
        if (trading.targetCoins() <= 0) {
            problems.add("TRADING_TARGET_COINS must be positive");
        }
        if (trading.takeProfitRate() <= 0.0 || trading.takeProfitRate() >= 1.0) {
            problems.add("TARGET_PROFIT_RATE must be between 0 and 1 (exclusive)");
        }
        if (trading.stopLossRate() <= 0.0 || trading.stopLossRate() >= 1.0) {
            problems.add("STOP_LOSS_RATE must be between 0 and 1 (exclusive)");
        }
        if (trading.surgeThreshold() <= 0.0) {
            problems.add("SURGE_THRESHOLD must be positive");
        }
        if (trading.surgeTimeframeMinutes() <= 0) {
            problems.add("SURGE_TIMEFRAME_MINUTES must be positive");
        }
        if (trading.volumeMultiplier() <= 0.0) {
            problems.add("VOLUME_MULTIPLIER must be positive");
        }
        if (trading.minOrderAmount() <= 0.0) {
            problems.add("MIN_ORDER_AMOUNT_KRW must be positive");
        }
        if (trading.maxPositionRatio() <= 0.0 || trading.maxPositionRatio() > 1.0) {
            problems.add("MAX_POSITION_RATIO must be in (0, 1]");
        }
        if (trading.maxPositions() != 1) {
            problems.add("MAX_POSITIONS must be 1; holding several positions is not supported");
        }
    }

    private static void checkPipeline(PipelineConfig pipeline, List<String> problems) {
        if (pipeline.channelCapacity() <= 0) {
            problems.add("CHANNEL_CAPACITY must be positive");
        }
        if (pipeline.tickWindowCapacity() <= 0) {
            problems.add("TICK_WINDOW_CAPACITY must be positive");
        }
        if (pipeline.orderMaxAttempts() <= 0) {
            problems.add("ORDER_MAX_ATTEMPTS must be at least 1");
        }
        if (pipeline.streamMaxRetries() < 0) {
            problems.add("STREAM_MAX_RETRIES must not be negative");
        }
        if (pipeline.orderFillPollAttempts() < 0) {
            problems.add("ORDER_FILL_POLL_ATTEMPTS must not be negative");
        }
    }
}
