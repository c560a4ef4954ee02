package com.autocoin.bootstrap;

import com.autocoin.application.port.output.ExchangeClient;
import com.autocoin.application.port.output.TradeNotifier;
import com.autocoin.application.service.TradingPipeline;
import com.autocoin.config.AppConfig;
import com.autocoin.domain.model.OrderResult;
import com.autocoin.domain.model.Signal;
import com.autocoin.infrastructure.exchange.ExchangeException;
import com.autocoin.infrastructure.exchange.RateLimiter;
import com.autocoin.infrastructure.exchange.UpbitExchangeClient;
import com.autocoin.infrastructure.metrics.MetricsServer;
import com.autocoin.infrastructure.metrics.PrometheusTradingMetrics;
import com.autocoin.infrastructure.notification.DiscordNotifier;
import com.autocoin.infrastructure.persistence.SchemaMigration;
import com.autocoin.infrastructure.persistence.SqliteTradingStore;
import com.autocoin.infrastructure.stream.TickDecoder;
import com.autocoin.infrastructure.stream.UpbitWebSocketConnection;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Process entry point for the live trading pipeline.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final List<String> FALLBACK_MARKETS = List.of("KRW-BTC");

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== AutoCoin Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        // ═══════════════════════════════════════════════════════════════
        // Configuration
        // ═══════════════════════════════════════════════════════════════
        AppConfig config = AppConfig.fromEnv();
        StartupConfigValidator.validate(config);
        log.info("Trading: {}", config.trading());
        log.info("Exchange: {}", config.exchange());
        log.info("Pipeline: {}", config.pipeline());

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config.dbPath());
        new SchemaMigration(dataSource).migrate();
        SqliteTradingStore store = new SqliteTradingStore(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        CollectorRegistry registry = CollectorRegistry.defaultRegistry;
        PrometheusTradingMetrics metrics = new PrometheusTradingMetrics(registry);
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Exchange
        // ═══════════════════════════════════════════════════════════════
        RateLimiter rateLimiter = new RateLimiter(
            config.exchange().rateLimitRequests(), config.exchange().rateLimitWindow(), metrics);
        ExchangeClient exchange = new UpbitExchangeClient(config.exchange(), rateLimiter);
        UpbitWebSocketConnection connection = new UpbitWebSocketConnection(
            config.exchange().wsUrl(), config.exchange().streamType(), new TickDecoder());

        // ═══════════════════════════════════════════════════════════════
        // Notifications
        // ═══════════════════════════════════════════════════════════════
        DiscordNotifier discord = config.notification().isEnabled()
            ? new DiscordNotifier(config.notification().webhookUrl())
            : null;
        TradeNotifier notifier = discord != null ? discord : new LoggingNotifier();

        // ═══════════════════════════════════════════════════════════════
        // Pipeline
        // ═══════════════════════════════════════════════════════════════
        List<String> markets = resolveMarkets(exchange, config.trading().targetCoins());

        TradingPipeline pipeline = TradingPipeline.builder()
            .tradingConfig(config.trading())
            .pipelineConfig(config.pipeline())
            .notificationConfig(config.notification())
            .exchange(exchange)
            .store(store)
            .connection(connection)
            .notifier(notifier)
            .metrics(metrics)
            .build();
        pipeline.start(markets);

        MetricsServer metricsServer = null;
        if (config.metricsPort() > 0) {
            metricsServer = new MetricsServer("0.0.0.0", config.metricsPort(), registry, pipeline::health);
            metricsServer.start();
        }

        if (discord != null) {
            discord.notifyInfo("AutoCoin started", "Watching " + markets.size() + " markets");
        }

        // ═══════════════════════════════════════════════════════════════
        // Shutdown
        // ═══════════════════════════════════════════════════════════════
        CountDownLatch shutdownLatch = new CountDownLatch(1);
        MetricsServer server = metricsServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[SHUTDOWN] Shutdown requested");
            try {
                pipeline.stop(config.pipeline().shutdownGrace());
                if (server != null) {
                    server.stop();
                }
            } finally {
                dataSource.close();
                shutdownLatch.countDown();
                log.info("[SHUTDOWN] ✓ Complete");
            }
        }, "shutdown-hook"));

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== AutoCoin Running ({} markets) ===", markets.size());
        log.info("═══════════════════════════════════════════════════════════════");

        try {
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static List<String> resolveMarkets(ExchangeClient exchange, int targetCoins) {
        try {
            List<String> markets = exchange.getTopKrwMarkets(targetCoins);
            if (!markets.isEmpty()) {
                return markets;
            }
            log.warn("⚠️ Exchange listed no KRW markets, falling back to {}", FALLBACK_MARKETS);
        } catch (ExchangeException e) {
            log.warn("⚠️ Failed to load markets, falling back to {}: {}", FALLBACK_MARKETS, e.getMessage());
        }
        return FALLBACK_MARKETS;
    }

    private static HikariDataSource createDataSource(String dbPath) {
        Path path = Path.of(dbPath).toAbsolutePath();
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to create database directory for " + path, e);
        }

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:sqlite:" + path);
        // SQLite allows a single writer
        config.setMaximumPoolSize(1);
        config.setConnectionTimeout(5000);
        config.setPoolName("autocoin-hikari");

        log.info("DB: path={}", path);
        return new HikariDataSource(config);
    }

    /**
     * Notifier used when no webhook is configured.
     */
    static final class LoggingNotifier implements TradeNotifier {
        @Override
        public void notifyOrderResult(OrderResult result) {
            log.info("[NOTIFY] Order {} {} success={} {}", result.order().side(), result.order().market(),
                result.success(), result.error() == null ? "" : result.error());
        }

        @Override
        public void notifySignal(Signal signal) {
            log.info("[NOTIFY] Signal {} {} ({})", signal.type(), signal.market(), signal.reason());
        }

        @Override
        public void notifyError(String title, String message) {
            log.error("[NOTIFY] {}: {}", title, message);
        }
    }
}
