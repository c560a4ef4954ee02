package com.autocoin.infrastructure.stream;

import com.autocoin.application.channel.Broadcaster;
import com.autocoin.domain.model.Tick;
import com.autocoin.infrastructure.common.RetryPolicy;
import com.autocoin.infrastructure.metrics.TradingMetrics;
import com.autocoin.infrastructure.metrics.TradingMetrics.StreamEvent;
import com.autocoin.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Reconnecting market data stream.
 *
 * Every failed session counts against the retry budget and is followed by a fixed
 * delay; a session that got as far as subscribing resets the count. Once the budget
 * is spent {@link #run} gives up with a fatal {@link StreamException}.
 */
public class MarketDataStream {
    private static final Logger log = LoggerFactory.getLogger(MarketDataStream.class);

    private final MarketDataConnection connection;
    private final Duration retryDelay;
    private final int maxRetries;
    private final TradingMetrics metrics;
    private final Sleeper sleeper;

    private volatile boolean connected = false;
    private volatile long ticksPublished = 0;

    public MarketDataStream(MarketDataConnection connection,
                            Duration retryDelay,
                            int maxRetries,
                            TradingMetrics metrics,
                            Sleeper sleeper) {
        this.connection = connection;
        this.retryDelay = retryDelay;
        this.maxRetries = maxRetries;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    /**
     * Stream ticks for {@code markets} to every subscriber of {@code out}.
     *
     * Returns only by exception: a fatal {@link StreamException} when retries are
     * exhausted, or {@link InterruptedException} on shutdown.
     */
    public void run(List<String> markets, Broadcaster<Tick> out) throws InterruptedException {
        RetryPolicy policy = RetryPolicy.forStream(retryDelay, maxRetries);
        log.info("[STREAM] Starting for {} markets (retry every {}s, max {} retries)",
            markets.size(), retryDelay.toSeconds(), maxRetries);

        while (true) {
            StreamException failure;
            try {
                connection.streamUntilClosed(markets, new MarketDataConnection.Listener() {
                    @Override
                    public void onConnected() {
                        policy.recordSuccess();
                        connected = true;
                        metrics.recordStreamEvent(StreamEvent.CONNECTED);
                        log.info("[STREAM] ✓ Subscribed to {} markets", markets.size());
                    }

                    @Override
                    public void onTick(Tick tick) throws InterruptedException {
                        out.publish(tick);
                        ticksPublished++;
                    }
                });
                failure = new StreamException("Session ended without error");
            } catch (StreamException e) {
                failure = e;
            } finally {
                connected = false;
            }

            metrics.recordStreamEvent(StreamEvent.DISCONNECTED);
            int failures = policy.recordFailure();

            if (policy.isExhausted()) {
                metrics.recordStreamEvent(StreamEvent.FATAL);
                log.error("[STREAM] ❌ Giving up after {} consecutive failures: {}", failures, failure.getMessage());
                throw StreamException.fatal("Max retries exceeded (" + maxRetries + "): " + failure.getMessage(), failure);
            }

            Duration delay = policy.getNextDelay();
            log.warn("[STREAM] Connection failed ({}/{}): {}. Retrying in {}ms",
                failures, maxRetries, failure.getMessage(), delay.toMillis());
            metrics.recordStreamEvent(StreamEvent.RECONNECTING);
            metrics.recordRetry("stream", failures, "connection_lost");
            sleeper.sleep(delay);
        }
    }

    public boolean isConnected() {
        return connected;
    }

    public long getTicksPublished() {
        return ticksPublished;
    }
}
