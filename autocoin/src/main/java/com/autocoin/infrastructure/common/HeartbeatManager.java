package com.autocoin.infrastructure.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keepalive for a streaming connection.
 *
 * Sends a ping every {@code pingInterval} and fires the timeout callback once when no
 * inbound activity (data frame or pong) has been recorded for {@code timeout}.
 * One instance per connection; it cannot be restarted after {@link #stop()}.
 *
 * Usage:
 * <pre>
 * HeartbeatManager heartbeat = new HeartbeatManager(
 *     "upbit-stream",
 *     Duration.ofSeconds(30),   // ping every 30 seconds
 *     Duration.ofSeconds(60),   // give up after 60 seconds of silence
 *     () -> webSocket.sendPing(ByteBuffer.allocate(0)),
 *     () -> abort("heartbeat timeout"));
 *
 * heartbeat.start();
 * // on every inbound frame or pong:
 * heartbeat.recordActivity();
 * heartbeat.stop();
 * </pre>
 */
public class HeartbeatManager {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatManager.class);

    private final String name;
    private final Duration pingInterval;
    private final Duration timeout;
    private final Runnable pingFunction;
    private final Runnable timeoutCallback;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pingTask;
    private volatile Instant lastActivity;
    private volatile boolean running = false;
    private volatile boolean timedOut = false;

    public HeartbeatManager(String name, Duration pingInterval, Duration timeout,
                            Runnable pingFunction, Runnable timeoutCallback) {
        this.name = name;
        this.pingInterval = pingInterval;
        this.timeout = timeout;
        this.pingFunction = pingFunction;
        this.timeoutCallback = timeoutCallback;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("[{}] Heartbeat already running", name);
            return;
        }

        log.debug("[{}] Starting heartbeat (ping every {}ms, timeout {}ms)",
            name, pingInterval.toMillis(), timeout.toMillis());

        running = true;
        timedOut = false;
        lastActivity = Instant.now();

        pingTask = scheduler.scheduleAtFixedRate(this::tick,
            pingInterval.toMillis(), pingInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        running = false;

        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Record any inbound frame or pong.
     */
    public void recordActivity() {
        lastActivity = Instant.now();
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    /**
     * @return time since the last inbound activity, or null before start
     */
    public Duration getTimeSinceLastActivity() {
        Instant last = lastActivity;
        if (last == null) {
            return null;
        }
        return Duration.between(last, Instant.now());
    }

    private void tick() {
        if (!running || timedOut) {
            return;
        }

        Duration silence = getTimeSinceLastActivity();
        if (silence != null && silence.compareTo(timeout) >= 0) {
            timedOut = true;
            log.warn("[{}] Heartbeat timeout - no inbound activity for {}ms", name, silence.toMillis());
            try {
                timeoutCallback.run();
            } catch (RuntimeException e) {
                log.error("[{}] Timeout callback threw exception", name, e);
            }
            return;
        }

        try {
            pingFunction.run();
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to send ping: {}", name, e.getMessage());
        }
    }
}
