package com.autocoin.infrastructure.stream;

import com.autocoin.application.channel.BoundedChannel;
import com.autocoin.application.channel.Broadcaster;
import com.autocoin.domain.model.Tick;
import com.autocoin.infrastructure.metrics.TradingMetrics;
import com.autocoin.infrastructure.metrics.TradingMetrics.StreamEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MarketDataStreamTest {

    private static final List<String> MARKETS = List.of("KRW-BTC");

    @Mock
    private MarketDataConnection connection;
    @Mock
    private TradingMetrics metrics;

    private final List<Duration> sleeps = new ArrayList<>();
    private MarketDataStream stream;

    @BeforeEach
    void setUp() {
        stream = new MarketDataStream(connection, Duration.ofSeconds(5), 5, metrics, sleeps::add);
    }

    @Test
    void run_givesUpAfterMaxRetriesWithoutSeventhAttempt() throws Exception {
        doThrow(new StreamException("connection refused"))
            .when(connection).streamUntilClosed(anyList(), any());

        StreamException e = assertThrows(StreamException.class,
            () -> stream.run(MARKETS, new Broadcaster<>("ticks")));

        assertTrue(e.isFatal());
        assertTrue(e.getMessage().startsWith("Max retries exceeded"));
        verify(connection, times(6)).streamUntilClosed(anyList(), any());
        assertEquals(5, sleeps.size(), "One fixed delay between each pair of attempts");
        assertTrue(sleeps.stream().allMatch(d -> d.equals(Duration.ofSeconds(5))));
        verify(metrics).recordStreamEvent(StreamEvent.FATAL);
    }

    @Test
    void run_successfulConnectResetsRetryCounter() throws Exception {
        int[] calls = {0};
        doAnswer(inv -> {
            calls[0]++;
            if (calls[0] == 4) {
                MarketDataConnection.Listener listener = inv.getArgument(1);
                listener.onConnected();
            }
            throw new StreamException("dropped");
        }).when(connection).streamUntilClosed(anyList(), any());

        assertThrows(StreamException.class, () -> stream.run(MARKETS, new Broadcaster<>("ticks")));

        // 3 failures, then a session that connected (counter reset, counts as failure 1), then 5 more
        assertEquals(9, calls[0]);
        verify(metrics).recordStreamEvent(StreamEvent.CONNECTED);
    }

    @Test
    void run_publishesTicksToEverySubscriber() throws Exception {
        Broadcaster<Tick> ticks = new Broadcaster<>("ticks");
        BoundedChannel<Tick> first = ticks.subscribe("a", 10);
        BoundedChannel<Tick> second = ticks.subscribe("b", 10);
        Tick tick = new Tick("KRW-BTC", 1L, 100.0, 0.0, 1.0);

        doAnswer(inv -> {
            MarketDataConnection.Listener listener = inv.getArgument(1);
            listener.onConnected();
            listener.onTick(tick);
            throw new StreamException("closed");
        }).doThrow(new StreamException("closed"))
            .when(connection).streamUntilClosed(anyList(), any());

        assertThrows(StreamException.class, () -> stream.run(MARKETS, ticks));

        assertEquals(tick, first.poll(Duration.ZERO));
        assertEquals(tick, second.poll(Duration.ZERO));
        assertEquals(1, stream.getTicksPublished());
        assertFalse(stream.isConnected());
    }

    @Test
    void run_interruptedSleepEndsStream() throws Exception {
        MarketDataStream interruptible = new MarketDataStream(connection, Duration.ofSeconds(5), 5, metrics,
            d -> {
                throw new InterruptedException("shutdown");
            });
        doThrow(new StreamException("dropped")).when(connection).streamUntilClosed(anyList(), any());

        assertThrows(InterruptedException.class, () -> interruptible.run(MARKETS, new Broadcaster<>("ticks")));
        verify(connection, times(1)).streamUntilClosed(anyList(), any());
    }
}
