package com.autocoin.application.channel;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded FIFO channel between two pipeline components.
 *
 * Two send modes:
 * - {@link #send(Object)} blocks the producer while the buffer is full. Used for
 *   decisions and order results, which must never be lost.
 * - {@link #offer(Object)} never blocks and drops the message when the buffer is full.
 *   Used for telemetry and notifications.
 *
 * Any number of producers may share one channel (fan-in). Order is FIFO per producer;
 * nothing is guaranteed across producers.
 */
public final class BoundedChannel<T> {

    private final String name;
    private final int capacity;
    private final BlockingQueue<T> queue;
    private final AtomicLong dropped = new AtomicLong();

    public BoundedChannel(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Channel capacity must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * Blocking send; waits for space.
     */
    public void send(T message) throws InterruptedException {
        queue.put(message);
    }

    /**
     * Best-effort send.
     *
     * @return false if the channel was full and the message was dropped
     */
    public boolean offer(T message) {
        boolean accepted = queue.offer(message);
        if (!accepted) {
            dropped.incrementAndGet();
        }
        return accepted;
    }

    /**
     * Wait up to {@code timeout} for the next message.
     *
     * @return the message, or null on timeout
     */
    public T poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public String name() {
        return name;
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        return queue.size();
    }

    public long droppedCount() {
        return dropped.get();
    }
}
