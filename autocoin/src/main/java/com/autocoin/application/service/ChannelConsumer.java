package com.autocoin.application.service;

import com.autocoin.application.channel.BoundedChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Run loop shared by the pipeline components: take one message at a time from an
 * input channel and handle it.
 *
 * A failure in {@link #onStart()} or handling one message is logged and the loop
 * moves on. The loop ends when
 * {@link #stop()} is called (after the message in hand is finished) or when the
 * thread is interrupted.
 */
abstract class ChannelConsumer<T> implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ChannelConsumer.class);

    static final Duration POLL_TIMEOUT = Duration.ofMillis(200);

    private final String name;
    private final BoundedChannel<T> input;
    private volatile boolean running = true;

    protected ChannelConsumer(String name, BoundedChannel<T> input) {
        this.name = name;
        this.input = input;
    }

    @Override
    public final void run() {
        log.info("[{}] Started", name);
        try {
            try {
                onStart();
            } catch (RuntimeException e) {
                log.error("[{}] Startup step failed, continuing", name, e);
            }
            while (running && !Thread.currentThread().isInterrupted()) {
                T message = input.poll(POLL_TIMEOUT);
                if (message != null) {
                    try {
                        handle(message);
                    } catch (RuntimeException e) {
                        log.error("[{}] Failed to handle {}", name, message, e);
                    }
                }
                try {
                    afterPoll();
                } catch (RuntimeException e) {
                    log.error("[{}] Periodic step failed", name, e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[{}] Stopped", name);
    }

    /**
     * Ask the loop to exit once the current message is done.
     */
    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    public String getName() {
        return name;
    }

    protected void onStart() throws InterruptedException {
    }

    protected abstract void handle(T message) throws InterruptedException;

    /**
     * Called after every poll, whether or not a message arrived.
     */
    protected void afterPoll() throws InterruptedException {
    }
}
