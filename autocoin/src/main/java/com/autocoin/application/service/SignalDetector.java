package com.autocoin.application.service;

import com.autocoin.application.channel.BoundedChannel;
import com.autocoin.config.TradingConfig;
import com.autocoin.domain.model.Signal;
import com.autocoin.domain.model.Tick;
import com.autocoin.infrastructure.metrics.TradingMetrics;
import com.autocoin.util.RateLimitedLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Surge detector.
 *
 * Keeps a rolling window of recent ticks (bounded across all markets, oldest evicted
 * first) and, for each tick, compares the tick's market over the lookback period:
 * a Buy signal is emitted when both the price change and the volume ratio clear their
 * thresholds. No signal means hold.
 *
 * The lookback is measured in event time, relative to the incoming tick's timestamp.
 */
public final class SignalDetector extends ChannelConsumer<Tick> {
    private static final Logger log = LoggerFactory.getLogger(SignalDetector.class);

    private final TradingConfig config;
    private final int windowCapacity;
    private final long lookbackMillis;
    private final BoundedChannel<Signal> signals;
    private final BoundedChannel<Signal> signalAlerts;
    private final TradingMetrics metrics;
    private final RateLimitedLogger summaryLog;

    private final Deque<Tick> window = new ArrayDeque<>();
    private final Map<String, Deque<Tick>> windowByMarket = new HashMap<>();
    private long ticksProcessed = 0;
    private long signalsEmitted = 0;

    /**
     * @param signalAlerts best-effort copy of every emitted signal for notifications, may be null
     */
    public SignalDetector(TradingConfig config,
                          int windowCapacity,
                          BoundedChannel<Tick> ticks,
                          BoundedChannel<Signal> signals,
                          BoundedChannel<Signal> signalAlerts,
                          TradingMetrics metrics,
                          RateLimitedLogger summaryLog) {
        super("signal-detector", ticks);
        if (windowCapacity <= 0) {
            throw new IllegalArgumentException("Window capacity must be positive: " + windowCapacity);
        }
        this.config = config;
        this.windowCapacity = windowCapacity;
        this.lookbackMillis = Duration.ofMinutes(config.surgeTimeframeMinutes()).toMillis();
        this.signals = signals;
        this.signalAlerts = signalAlerts;
        this.metrics = metrics;
        this.summaryLog = summaryLog;
    }

    @Override
    protected void handle(Tick tick) throws InterruptedException {
        metrics.recordTick(tick.market());

        Optional<Signal> signal = onTick(tick);
        if (signal.isPresent()) {
            Signal s = signal.get();
            signalsEmitted++;
            metrics.recordSignal(s.type());
            log.info("[SIGNAL] {} {} confidence={} - {}",
                s.market(), s.type(), String.format("%.2f", s.confidence()), s.reason());

            signals.send(s);
            if (signalAlerts != null && !signalAlerts.offer(s)) {
                metrics.recordDroppedMessage(signalAlerts.name());
            }
        }

        summaryLog.info("[SIGNAL] {} ticks processed, {} markets in window, {} signals emitted",
            ticksProcessed, windowByMarket.size(), signalsEmitted);
    }

    /**
     * Append the tick to the window and evaluate its market.
     *
     * @return a Buy signal when the market is surging
     */
    public Optional<Signal> onTick(Tick tick) {
        append(tick);
        ticksProcessed++;
        return analyze(tick);
    }

    public int windowSize() {
        return window.size();
    }

    private void append(Tick tick) {
        window.addLast(tick);
        windowByMarket.computeIfAbsent(tick.market(), m -> new ArrayDeque<>()).addLast(tick);

        while (window.size() > windowCapacity) {
            Tick evicted = window.pollFirst();
            Deque<Tick> marketTicks = windowByMarket.get(evicted.market());
            // per-market deques share the global insertion order, so the evicted tick is at the head
            marketTicks.pollFirst();
            if (marketTicks.isEmpty()) {
                windowByMarket.remove(evicted.market());
            }
        }
    }

    private Optional<Signal> analyze(Tick tick) {
        Deque<Tick> marketTicks = windowByMarket.get(tick.market());
        if (marketTicks == null) {
            return Optional.empty();
        }

        long reference = tick.timestamp();
        Tick oldest = null;
        Tick latest = null;
        int count = 0;
        double volumeSum = 0.0;

        for (Tick t : marketTicks) {
            if (reference - t.timestamp() > lookbackMillis) {
                continue;
            }
            if (oldest == null) {
                oldest = t;
            }
            latest = t;
            count++;
            volumeSum += t.volume();
        }

        if (count < 2 || oldest.tradePrice() <= 0.0) {
            return Optional.empty();
        }

        double priceChange = latest.tradePrice() / oldest.tradePrice() - 1.0;
        double avgVolume = volumeSum / count;
        double volumeRatio = avgVolume > 0.0 ? tick.volume() / avgVolume : 1.0;

        if (priceChange < config.surgeThreshold() || volumeRatio < config.volumeMultiplier()) {
            return Optional.empty();
        }

        double confidence = confidence(priceChange, volumeRatio,
            config.surgeThreshold(), config.volumeMultiplier());
        String reason = String.format("Price surged %.2f%% with %.1fx volume",
            priceChange * 100.0, volumeRatio);

        return Optional.of(Signal.buy(tick.market(), confidence, reason));
    }

    /**
     * Price contributes 60% (saturating at twice the threshold), volume 40%
     * (saturating at three times the multiplier).
     */
    static double confidence(double priceChange, double volumeRatio,
                             double surgeThreshold, double volumeMultiplier) {
        double priceScore = Math.min(2.0, priceChange / surgeThreshold) / 2.0;
        double volumeScore = Math.min(3.0, volumeRatio / volumeMultiplier) / 3.0;
        return Math.min(1.0, 0.6 * priceScore + 0.4 * volumeScore);
    }
}
