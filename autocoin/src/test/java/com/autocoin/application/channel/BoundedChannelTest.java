package com.autocoin.application.channel;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BoundedChannel.
 *
 * Tests:
 * - FIFO delivery
 * - Best-effort offer drops and counts when full
 * - Blocking send waits for space
 * - Poll timeout
 */
class BoundedChannelTest {

    @Test
    void testFifoOrder() throws InterruptedException {
        BoundedChannel<Integer> channel = new BoundedChannel<>("numbers", 5);
        channel.send(1);
        channel.send(2);
        channel.send(3);

        assertEquals(1, channel.poll(Duration.ZERO));
        assertEquals(2, channel.poll(Duration.ZERO));
        assertEquals(3, channel.poll(Duration.ZERO));
        assertNull(channel.poll(Duration.ofMillis(10)), "Empty channel returns null on timeout");
    }

    @Test
    void testOfferDropsWhenFull() {
        BoundedChannel<String> channel = new BoundedChannel<>("alerts", 2);

        assertTrue(channel.offer("a"));
        assertTrue(channel.offer("b"));
        assertFalse(channel.offer("c"), "Third message exceeds capacity");
        assertFalse(channel.offer("d"));

        assertEquals(2, channel.size());
        assertEquals(2, channel.droppedCount());
    }

    @Test
    void testSendBlocksUntilSpace() throws InterruptedException {
        BoundedChannel<String> channel = new BoundedChannel<>("decisions", 1);
        channel.send("first");

        AtomicBoolean delivered = new AtomicBoolean(false);
        CountDownLatch done = new CountDownLatch(1);
        Thread producer = new Thread(() -> {
            try {
                channel.send("second");
                delivered.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
        });
        producer.start();

        assertFalse(done.await(100, TimeUnit.MILLISECONDS), "Producer must wait while full");
        assertEquals("first", channel.poll(Duration.ZERO));
        assertTrue(done.await(1, TimeUnit.SECONDS));
        assertTrue(delivered.get());
        assertEquals("second", channel.poll(Duration.ZERO));
        assertEquals(0, channel.droppedCount(), "Blocking send never drops");
    }

    @Test
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedChannel<>("bad", 0));
    }
}
