package com.autocoin.infrastructure.metrics;

import com.autocoin.domain.model.Decision;
import com.autocoin.domain.model.OrderSide;
import com.autocoin.domain.model.SignalType;

import java.time.Duration;

/**
 * Trading pipeline metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Tick throughput per market
 * - Signals and decisions by kind
 * - Order success/failure and latency
 * - Retries, rate limiter waits and stream reconnects
 * - Telemetry dropped under backpressure
 */
public interface TradingMetrics {

    /**
     * Stream lifecycle events.
     */
    enum StreamEvent {
        CONNECTED,      // Subscription sent on a fresh connection
        DISCONNECTED,   // Connection lost, timed out or closed by peer
        RECONNECTING,   // Waiting before the next attempt
        FATAL           // Retries exhausted
    }

    void recordTick(String market);

    void recordSignal(SignalType type);

    /**
     * @param source component that produced the decision ("decision-maker", "risk-manager")
     */
    void recordDecision(Decision.Kind kind, String source);

    /**
     * Record an order attempt outcome.
     *
     * @param latency time from first attempt to final outcome, retries included
     */
    void recordOrder(OrderSide side, boolean success, Duration latency);

    /**
     * Record retry attempt.
     *
     * @param operation what is being retried ("buy", "sell", "stream")
     * @param attemptNumber failed attempts so far (1, 2, 3...)
     * @param reason error kind or message
     */
    void recordRetry(String operation, int attemptNumber, String reason);

    void recordRateLimitWait(Duration waited);

    void recordStreamEvent(StreamEvent event);

    void recordDroppedMessage(String channel);

    void setPositionOpen(boolean open);
}
