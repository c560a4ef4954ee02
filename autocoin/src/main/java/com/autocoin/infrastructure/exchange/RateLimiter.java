package com.autocoin.infrastructure.exchange;

import com.autocoin.infrastructure.metrics.TradingMetrics;
import com.autocoin.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Fixed-window request throttle shared by every outbound exchange call.
 *
 * At most {@code maxRequests} acquisitions per window. A caller arriving at a full
 * window sleeps until the window ends, then starts a fresh one. Callers are
 * serialized on the limiter's monitor, so waiting callers queue behind the sleeper.
 */
public final class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final int maxRequests;
    private final long windowNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private final TradingMetrics metrics;

    private long windowStart;
    private int requestCount = 0;

    public RateLimiter(int maxRequests, Duration window, TradingMetrics metrics) {
        this(maxRequests, window, System::nanoTime, Sleeper.SYSTEM, metrics);
    }

    public RateLimiter(int maxRequests, Duration window, LongSupplier nanoClock,
                       Sleeper sleeper, TradingMetrics metrics) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxRequests = maxRequests;
        this.windowNanos = window.toNanos();
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
        this.metrics = metrics;
        this.windowStart = nanoClock.getAsLong();
    }

    /**
     * Take one request slot, waiting for the next window when the current one is full.
     */
    public synchronized void acquire() throws InterruptedException {
        long now = nanoClock.getAsLong();
        long elapsed = now - windowStart;

        if (elapsed >= windowNanos) {
            windowStart = now;
            requestCount = 0;
        } else if (requestCount >= maxRequests) {
            Duration wait = Duration.ofNanos(windowNanos - elapsed);
            log.debug("[RATE LIMIT] Window full ({} requests), waiting {}ms", requestCount, wait.toMillis());
            metrics.recordRateLimitWait(wait);
            sleeper.sleep(wait);
            windowStart = nanoClock.getAsLong();
            requestCount = 0;
        }

        requestCount++;
    }

    public synchronized int getRequestCount() {
        return requestCount;
    }
}
