package com.autocoin.infrastructure.metrics;

import com.autocoin.domain.model.Decision;
import com.autocoin.domain.model.OrderSide;
import com.autocoin.domain.model.SignalType;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of TradingMetrics.
 *
 * Key Metrics:
 * - autocoin_ticks_total{market}
 * - autocoin_signals_total{type}
 * - autocoin_decisions_total{kind, source}
 * - autocoin_orders_total{side, status}
 * - autocoin_order_latency_seconds{side}
 * - autocoin_retries_total{operation, reason}
 * - autocoin_rate_limit_waits_total / autocoin_rate_limit_wait_seconds
 * - autocoin_stream_events_total{event}, autocoin_stream_connected
 * - autocoin_channel_dropped_total{channel}
 * - autocoin_position_open
 *
 * Exposed by {@link MetricsServer} at /metrics.
 */
public class PrometheusTradingMetrics implements TradingMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusTradingMetrics.class);

    private final CollectorRegistry registry;

    private final Counter tickCounter;
    private final Counter signalCounter;
    private final Counter decisionCounter;

    private final Counter orderCounter;
    private final Histogram orderLatency;

    private final Counter retryCounter;
    private final Histogram retryAttempts;

    private final Counter rateLimitWaitCounter;
    private final Histogram rateLimitWaitSeconds;

    private final Counter streamEventCounter;
    private final Gauge streamConnected;

    private final Counter droppedCounter;
    private final Gauge positionOpen;

    public PrometheusTradingMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusTradingMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.tickCounter = Counter.build()
            .name("autocoin_ticks_total")
            .help("Total number of ticks received from the stream")
            .labelNames("market")
            .register(registry);

        this.signalCounter = Counter.build()
            .name("autocoin_signals_total")
            .help("Total number of signals emitted")
            .labelNames("type")
            .register(registry);

        this.decisionCounter = Counter.build()
            .name("autocoin_decisions_total")
            .help("Total number of decisions emitted")
            .labelNames("kind", "source")
            .register(registry);

        this.orderCounter = Counter.build()
            .name("autocoin_orders_total")
            .help("Total number of order attempts by outcome")
            .labelNames("side", "status")
            .register(registry);

        this.orderLatency = Histogram.build()
            .name("autocoin_order_latency_seconds")
            .help("Order execution latency in seconds, retries included")
            .labelNames("side")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 15.0, 30.0)
            .register(registry);

        this.retryCounter = Counter.build()
            .name("autocoin_retries_total")
            .help("Total number of retry attempts")
            .labelNames("operation", "reason")
            .register(registry);

        this.retryAttempts = Histogram.build()
            .name("autocoin_retry_attempts")
            .help("Attempt number at which a retry was scheduled")
            .labelNames("operation")
            .buckets(1, 2, 3, 5, 10)
            .register(registry);

        this.rateLimitWaitCounter = Counter.build()
            .name("autocoin_rate_limit_waits_total")
            .help("Number of times a caller waited on the request rate limiter")
            .register(registry);

        this.rateLimitWaitSeconds = Histogram.build()
            .name("autocoin_rate_limit_wait_seconds")
            .help("Time spent waiting on the request rate limiter")
            .buckets(0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.0)
            .register(registry);

        this.streamEventCounter = Counter.build()
            .name("autocoin_stream_events_total")
            .help("Market data stream lifecycle events")
            .labelNames("event")
            .register(registry);

        this.streamConnected = Gauge.build()
            .name("autocoin_stream_connected")
            .help("Market data stream status (1=connected, 0=disconnected)")
            .register(registry);

        this.droppedCounter = Counter.build()
            .name("autocoin_channel_dropped_total")
            .help("Messages dropped by best-effort channels")
            .labelNames("channel")
            .register(registry);

        this.positionOpen = Gauge.build()
            .name("autocoin_position_open")
            .help("Whether a position is currently held (1=open, 0=flat)")
            .register(registry);

        log.info("[PrometheusTradingMetrics] Initialized");
    }

    @Override
    public void recordTick(String market) {
        tickCounter.labels(market).inc();
    }

    @Override
    public void recordSignal(SignalType type) {
        signalCounter.labels(type.name()).inc();
    }

    @Override
    public void recordDecision(Decision.Kind kind, String source) {
        decisionCounter.labels(kind.name(), source).inc();
    }

    @Override
    public void recordOrder(OrderSide side, boolean success, Duration latency) {
        orderCounter.labels(side.name(), success ? "success" : "failure").inc();
        orderLatency.labels(side.name()).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordRetry(String operation, int attemptNumber, String reason) {
        retryCounter.labels(operation, reason).inc();
        retryAttempts.labels(operation).observe(attemptNumber);
    }

    @Override
    public void recordRateLimitWait(Duration waited) {
        rateLimitWaitCounter.inc();
        rateLimitWaitSeconds.observe(waited.toMillis() / 1000.0);
    }

    @Override
    public void recordStreamEvent(StreamEvent event) {
        streamEventCounter.labels(event.name()).inc();

        if (event == StreamEvent.CONNECTED) {
            streamConnected.set(1);
        } else if (event == StreamEvent.DISCONNECTED || event == StreamEvent.FATAL) {
            streamConnected.set(0);
        }
    }

    @Override
    public void recordDroppedMessage(String channel) {
        droppedCounter.labels(channel).inc();
    }

    @Override
    public void setPositionOpen(boolean open) {
        positionOpen.set(open ? 1 : 0);
    }

    public boolean isStreamConnected() {
        return streamConnected.get() > 0;
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
