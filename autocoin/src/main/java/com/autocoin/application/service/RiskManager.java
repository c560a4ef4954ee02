package com.autocoin.application.service;

import com.autocoin.application.channel.BoundedChannel;
import com.autocoin.application.port.output.TradingStore;
import com.autocoin.domain.model.Decision;
import com.autocoin.domain.model.PnL;
import com.autocoin.domain.model.Position;
import com.autocoin.domain.model.Tick;
import com.autocoin.infrastructure.metrics.TradingMetrics;
import com.autocoin.util.RateLimitedLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Watches the held position against every tick of its market and emits exit decisions.
 *
 * Position state comes from the store: loaded on start and re-read at most once per
 * refresh interval. After a Sell is emitted no further Sell is sent for the same
 * position until the store shows it closed or the exit retry window has passed.
 */
public final class RiskManager extends ChannelConsumer<Tick> {
    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    static final String SOURCE = "risk-manager";
    static final String STOP_LOSS_REASON = "stop loss triggered";
    static final String TAKE_PROFIT_REASON = "take profit reached";
    static final Duration EXIT_RETRY_WINDOW = Duration.ofSeconds(30);
    static final Duration ANOMALY_LOG_INTERVAL = Duration.ofMinutes(1);

    private final TradingStore store;
    private final BoundedChannel<Decision> decisions;
    private final TradingMetrics metrics;
    private final long refreshNanos;
    private final LongSupplier nanoClock;
    private final RateLimitedLogger anomalyLog;

    private Position position;
    private long lastRefreshNanos;
    private boolean loaded = false;

    private String pendingExitPositionId;
    private long pendingExitNanos;

    public RiskManager(TradingStore store,
                       BoundedChannel<Tick> ticks,
                       BoundedChannel<Decision> decisions,
                       TradingMetrics metrics,
                       Duration refreshInterval) {
        this(store, ticks, decisions, metrics, refreshInterval, System::nanoTime);
    }

    RiskManager(TradingStore store,
                BoundedChannel<Tick> ticks,
                BoundedChannel<Decision> decisions,
                TradingMetrics metrics,
                Duration refreshInterval,
                LongSupplier nanoClock) {
        super(SOURCE, ticks);
        this.store = store;
        this.decisions = decisions;
        this.metrics = metrics;
        this.refreshNanos = refreshInterval.toNanos();
        this.nanoClock = nanoClock;
        this.anomalyLog = new RateLimitedLogger(log, ANOMALY_LOG_INTERVAL, nanoClock);
    }

    @Override
    protected void onStart() {
        loadPosition();
        if (position != null) {
            log.info("[RISK] Monitoring {} entry={} stopLoss={} takeProfit={}",
                position.market(), position.entryPrice(), position.stopLoss(), position.takeProfit());
        } else {
            log.info("[RISK] No active position");
        }
    }

    @Override
    protected void handle(Tick tick) throws InterruptedException {
        Optional<Decision> decision = onTick(tick);
        if (decision.isPresent()) {
            decisions.send(decision.get());
        }
    }

    /**
     * Evaluate one tick against the held position.
     *
     * @return a Sell decision to forward, if the tick crosses an exit threshold
     */
    public Optional<Decision> onTick(Tick tick) {
        if (!loaded || nanoClock.getAsLong() - lastRefreshNanos >= refreshNanos) {
            loadPosition();
        }

        Position held = position;
        if (held == null || !held.market().equals(tick.market())) {
            return Optional.empty();
        }

        Optional<Decision> decision = evaluate(held, tick.tradePrice());
        if (decision.isEmpty()) {
            return Optional.empty();
        }

        long now = nanoClock.getAsLong();
        if (held.id().equals(pendingExitPositionId)
                && now - pendingExitNanos < EXIT_RETRY_WINDOW.toNanos()) {
            return Optional.empty();
        }
        pendingExitPositionId = held.id();
        pendingExitNanos = now;

        PnL pnl = held.calculatePnl(tick.tradePrice());
        log.warn("[RISK] {} {} at {} (entry={}, pnl={}%)",
            held.market(), decision.get().reason(), tick.tradePrice(), held.entryPrice(),
            String.format("%.2f", pnl.profitRate() * 100.0));
        metrics.recordDecision(Decision.Kind.SELL, SOURCE);
        return decision;
    }

    /**
     * Exit rule for a position at a price: stop loss first, then take profit.
     */
    public static Optional<Decision> evaluate(Position position, double price) {
        if (position.shouldStopLoss(price)) {
            return Optional.of(Decision.sell(position.market(), position.amount(), STOP_LOSS_REASON));
        }
        if (position.shouldTakeProfit(price)) {
            return Optional.of(Decision.sell(position.market(), position.amount(), TAKE_PROFIT_REASON));
        }
        return Optional.empty();
    }

    public Optional<Position> currentPosition() {
        return Optional.ofNullable(position);
    }

    long suppressedAnomalyCount() {
        return anomalyLog.getSuppressedCount();
    }

    private void loadPosition() {
        lastRefreshNanos = nanoClock.getAsLong();
        List<Position> active;
        try {
            active = store.getAllActivePositions();
        } catch (RuntimeException e) {
            log.warn("[RISK] Failed to load active positions, keeping cached state: {}", e.getMessage());
            return;
        }
        loaded = true;

        if (active.size() > 1) {
            anomalyLog.error("[RISK] Found {} active positions, expected at most one. Monitoring {} only",
                active.size(), active.get(0).market());
        }

        Position next = active.isEmpty() ? null : active.get(0);
        if (next == null || !next.id().equals(pendingExitPositionId)) {
            pendingExitPositionId = null;
        }
        if (next != null && (position == null || !position.id().equals(next.id()))) {
            log.info("[RISK] Now monitoring {} (position {})", next.market(), next.id());
        }
        position = next;
        metrics.setPositionOpen(next != null);
    }
}
