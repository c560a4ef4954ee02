package com.autocoin.util;

import org.slf4j.Logger;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Logger wrapper that emits at most one line per interval.
 *
 * Each component owns its own instance, so throttling state is never shared across
 * the process. Suppressed lines are counted and the count is appended to the next
 * line that gets through.
 *
 * Usage:
 * <pre>
 * RateLimitedLogger summary = new RateLimitedLogger(log, Duration.ofSeconds(30));
 * summary.info("[SIGNAL] processed {} ticks", count);
 * </pre>
 */
public final class RateLimitedLogger {

    private final Logger delegate;
    private final long intervalNanos;
    private final LongSupplier nanoClock;

    private long lastEmitNanos;
    private boolean emitted = false;
    private long suppressed = 0;

    public RateLimitedLogger(Logger delegate, Duration interval) {
        this(delegate, interval, System::nanoTime);
    }

    public RateLimitedLogger(Logger delegate, Duration interval, LongSupplier nanoClock) {
        this.delegate = delegate;
        this.intervalNanos = interval.toNanos();
        this.nanoClock = nanoClock;
    }

    /**
     * @return true if the line was written, false if it was suppressed
     */
    public boolean info(String format, Object... args) {
        Long skipped = tryAcquire();
        if (skipped == null) {
            return false;
        }
        delegate.info(withSuppressed(format, skipped), args);
        return true;
    }

    public boolean warn(String format, Object... args) {
        Long skipped = tryAcquire();
        if (skipped == null) {
            return false;
        }
        delegate.warn(withSuppressed(format, skipped), args);
        return true;
    }

    public boolean error(String format, Object... args) {
        Long skipped = tryAcquire();
        if (skipped == null) {
            return false;
        }
        delegate.error(withSuppressed(format, skipped), args);
        return true;
    }

    public synchronized long getSuppressedCount() {
        return suppressed;
    }

    private synchronized Long tryAcquire() {
        long now = nanoClock.getAsLong();
        if (emitted && now - lastEmitNanos < intervalNanos) {
            suppressed++;
            return null;
        }
        long skipped = suppressed;
        suppressed = 0;
        emitted = true;
        lastEmitNanos = now;
        return skipped;
    }

    static String withSuppressed(String format, long skipped) {
        if (skipped == 0) {
            return format;
        }
        return format + " (" + skipped + " similar messages suppressed)";
    }
}
