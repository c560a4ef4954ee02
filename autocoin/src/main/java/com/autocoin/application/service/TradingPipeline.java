package com.autocoin.application.service;

import com.autocoin.application.channel.BoundedChannel;
import com.autocoin.application.channel.Broadcaster;
import com.autocoin.application.port.output.ExchangeClient;
import com.autocoin.application.port.output.TradeNotifier;
import com.autocoin.application.port.output.TradingStore;
import com.autocoin.config.NotificationConfig;
import com.autocoin.config.PipelineConfig;
import com.autocoin.config.TradingConfig;
import com.autocoin.domain.model.Decision;
import com.autocoin.domain.model.OrderResult;
import com.autocoin.domain.model.Signal;
import com.autocoin.domain.model.Tick;
import com.autocoin.infrastructure.stream.MarketDataConnection;
import com.autocoin.infrastructure.stream.MarketDataStream;
import com.autocoin.infrastructure.stream.StreamException;
import com.autocoin.infrastructure.metrics.TradingMetrics;
import com.autocoin.util.RateLimitedLogger;
import com.autocoin.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Wires the trading components together and owns their threads.
 *
 * Topology:
 * <pre>
 * MarketDataStream -> ticks ─┬─> SignalDetector -> signals -> DecisionMaker ─┐
 *                            └─> RiskManager ────────────────────────────────┴─> decisions -> ExecutionAgent -> results -> NotificationAgent
 * SignalDetector ··> signal alerts (best effort) ··> NotificationAgent
 * </pre>
 *
 * Each component runs on its own thread. A fatal stream failure raises an alert but
 * leaves the other components running.
 */
public final class TradingPipeline {
    private static final Logger log = LoggerFactory.getLogger(TradingPipeline.class);

    private static final Duration SUMMARY_INTERVAL = Duration.ofSeconds(60);
    private static final Duration WORKER_STOP_TIMEOUT = Duration.ofSeconds(5);

    private final TradingConfig tradingConfig;
    private final PipelineConfig pipelineConfig;
    private final NotificationConfig notificationConfig;
    private final ExchangeClient exchange;
    private final TradingStore store;
    private final MarketDataConnection connection;
    private final TradeNotifier notifier;
    private final TradingMetrics metrics;
    private final Sleeper sleeper;

    private final Map<String, ExecutorService> executors = new LinkedHashMap<>();
    private final Map<String, String> failedWorkers = new ConcurrentHashMap<>();

    private Broadcaster<Tick> ticks;
    private BoundedChannel<Signal> signals;
    private BoundedChannel<Signal> signalAlerts;
    private BoundedChannel<Decision> decisions;
    private BoundedChannel<OrderResult> results;

    private MarketDataStream stream;
    private SignalDetector signalDetector;
    private RiskManager riskManager;
    private DecisionMaker decisionMaker;
    private ExecutionAgent executionAgent;
    private NotificationAgent notificationAgent;

    private volatile boolean started = false;
    private volatile StreamException streamFailure;

    private TradingPipeline(Builder builder) {
        this.tradingConfig = builder.tradingConfig;
        this.pipelineConfig = builder.pipelineConfig;
        this.notificationConfig = builder.notificationConfig;
        this.exchange = builder.exchange;
        this.store = builder.store;
        this.connection = builder.connection;
        this.notifier = builder.notifier;
        this.metrics = builder.metrics;
        this.sleeper = builder.sleeper;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build the channels and components and start every thread.
     */
    public synchronized void start(List<String> markets) {
        if (started) {
            throw new IllegalStateException("Pipeline already started");
        }
        int capacity = pipelineConfig.channelCapacity();

        ticks = new Broadcaster<>("ticks");
        BoundedChannel<Tick> detectorTicks = ticks.subscribe("signal-detector", capacity);
        BoundedChannel<Tick> riskTicks = ticks.subscribe("risk-manager", capacity);
        signals = new BoundedChannel<>("signals", capacity);
        signalAlerts = new BoundedChannel<>("signal-alerts", capacity);
        decisions = new BoundedChannel<>("decisions", capacity);
        results = new BoundedChannel<>("order-results", capacity);

        stream = new MarketDataStream(connection, pipelineConfig.streamRetryDelay(),
            pipelineConfig.streamMaxRetries(), metrics, sleeper);
        signalDetector = new SignalDetector(tradingConfig, pipelineConfig.tickWindowCapacity(),
            detectorTicks, signals, signalAlerts, metrics,
            new RateLimitedLogger(LoggerFactory.getLogger(SignalDetector.class), SUMMARY_INTERVAL));
        riskManager = new RiskManager(store, riskTicks, decisions, metrics, pipelineConfig.riskPositionRefresh());
        decisionMaker = new DecisionMaker(tradingConfig, exchange, store, signals, decisions, metrics);
        executionAgent = new ExecutionAgent(exchange, store, tradingConfig, pipelineConfig,
            decisions, results, metrics, sleeper);
        notificationAgent = new NotificationAgent(notifier, notificationConfig, results, signalAlerts);

        // consumers first so nothing published early waits on an idle reader
        submit("notification-agent", notificationAgent);
        submit("execution-agent", executionAgent);
        submit("decision-maker", decisionMaker);
        submit("risk-manager", riskManager);
        submit("signal-detector", signalDetector);
        submit("market-data-stream", () -> runStream(markets));

        started = true;
        log.info("[PIPELINE] ✅ Started for {} markets: {}", markets.size(), markets);
    }

    /**
     * Stop in dependency order: the stream first, then the signal path, then let the
     * execution agent finish its current decision within {@code grace}.
     */
    public synchronized void stop(Duration grace) {
        if (!started) {
            return;
        }
        started = false;
        log.info("[PIPELINE] Stopping (grace {}s)", grace.toSeconds());

        stopNow("market-data-stream");

        signalDetector.stop();
        riskManager.stop();
        decisionMaker.stop();
        awaitStop("signal-detector", WORKER_STOP_TIMEOUT);
        awaitStop("risk-manager", WORKER_STOP_TIMEOUT);
        awaitStop("decision-maker", WORKER_STOP_TIMEOUT);

        executionAgent.stop();
        awaitStop("execution-agent", grace);
        if (decisions.size() > 0) {
            log.warn("[PIPELINE] {} queued decisions were not executed", decisions.size());
        }

        notificationAgent.stop();
        awaitStop("notification-agent", WORKER_STOP_TIMEOUT);

        log.info("[PIPELINE] Stopped");
    }

    /**
     * Snapshot for the health endpoint.
     */
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        boolean streamUp = stream != null && stream.isConnected();
        boolean degraded = streamFailure != null || !failedWorkers.isEmpty();
        health.put("status", !started ? "STOPPED" : (degraded ? "DEGRADED" : "UP"));
        health.put("streamConnected", streamUp);
        if (streamFailure != null) {
            health.put("streamError", streamFailure.getMessage());
        }
        if (!failedWorkers.isEmpty()) {
            health.put("failedWorkers", new LinkedHashMap<>(failedWorkers));
        }
        if (stream != null) {
            health.put("ticksPublished", stream.getTicksPublished());
        }

        Map<String, Object> channels = new LinkedHashMap<>();
        if (signals != null) {
            channels.put(signals.name(), signals.size());
            channels.put(signalAlerts.name(), signalAlerts.size());
            channels.put(signalAlerts.name() + ".dropped", signalAlerts.droppedCount());
            channels.put(decisions.name(), decisions.size());
            channels.put(results.name(), results.size());
        }
        health.put("channels", channels);

        if (decisionMaker != null) {
            health.put("balance", decisionMaker.getBalance());
        }
        if (riskManager != null) {
            health.put("monitoredMarket", riskManager.currentPosition().map(p -> p.market()).orElse(null));
        }
        return health;
    }

    public boolean isStreamFailed() {
        return streamFailure != null;
    }

    private void runStream(List<String> markets) {
        try {
            stream.run(markets, ticks);
        } catch (StreamException e) {
            streamFailure = e;
            log.error("[PIPELINE] ❌ Market data stream stopped: {}", e.getMessage());
            notificationAgent.notifyError("Market data stream stopped", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[PIPELINE] Market data stream interrupted");
        }
    }

    /**
     * Run a component on its own thread. A throwable escaping the component marks the
     * worker failed and degrades health.
     */
    private void submit(String name, Runnable task) {
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((thread, e) -> onWorkerDied(name, e));
            return t;
        });
        executors.put(name, executor);
        executor.execute(task);
    }

    private void onWorkerDied(String name, Throwable e) {
        failedWorkers.put(name, e.toString());
        log.error("[PIPELINE] ❌ Worker {} died", name, e);
    }

    public Map<String, String> getFailedWorkers() {
        return Map.copyOf(failedWorkers);
    }

    private void stopNow(String name) {
        ExecutorService executor = executors.get(name);
        executor.shutdownNow();
        awaitTermination(name, executor, WORKER_STOP_TIMEOUT);
    }

    private void awaitStop(String name, Duration timeout) {
        ExecutorService executor = executors.get(name);
        executor.shutdown();
        if (!awaitTermination(name, executor, timeout)) {
            log.warn("[PIPELINE] {} did not stop within {}s, interrupting", name, timeout.toSeconds());
            executor.shutdownNow();
        }
    }

    private static boolean awaitTermination(String name, ExecutorService executor, Duration timeout) {
        try {
            return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[PIPELINE] Interrupted while waiting for {}", name);
            return false;
        }
    }

    /**
     * Builder for TradingPipeline.
     */
    public static final class Builder {
        private TradingConfig tradingConfig = TradingConfig.defaults();
        private PipelineConfig pipelineConfig = PipelineConfig.defaults();
        private NotificationConfig notificationConfig = NotificationConfig.disabled();
        private ExchangeClient exchange;
        private TradingStore store;
        private MarketDataConnection connection;
        private TradeNotifier notifier;
        private TradingMetrics metrics;
        private Sleeper sleeper = Sleeper.SYSTEM;

        public Builder tradingConfig(TradingConfig tradingConfig) {
            this.tradingConfig = tradingConfig;
            return this;
        }

        public Builder pipelineConfig(PipelineConfig pipelineConfig) {
            this.pipelineConfig = pipelineConfig;
            return this;
        }

        public Builder notificationConfig(NotificationConfig notificationConfig) {
            this.notificationConfig = notificationConfig;
            return this;
        }

        public Builder exchange(ExchangeClient exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder store(TradingStore store) {
            this.store = store;
            return this;
        }

        public Builder connection(MarketDataConnection connection) {
            this.connection = connection;
            return this;
        }

        public Builder notifier(TradeNotifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder metrics(TradingMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public TradingPipeline build() {
            if (exchange == null || store == null || connection == null || notifier == null || metrics == null) {
                throw new IllegalStateException("exchange, store, connection, notifier and metrics are required");
            }
            return new TradingPipeline(this);
        }
    }
}
