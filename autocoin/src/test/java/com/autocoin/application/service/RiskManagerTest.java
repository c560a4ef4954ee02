package com.autocoin.application.service;

import com.autocoin.application.channel.BoundedChannel;
import com.autocoin.application.port.output.TradingStore;
import com.autocoin.domain.model.Decision;
import com.autocoin.domain.model.Position;
import com.autocoin.domain.model.Tick;
import com.autocoin.infrastructure.metrics.TradingMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RiskManager.
 *
 * Tests:
 * - Stop loss and take profit exits
 * - Ticks of other markets are ignored
 * - One Sell per position inside the exit retry window
 * - Position refresh interval and store failures
 */
@ExtendWith(MockitoExtension.class)
class RiskManagerTest {

    @Mock
    private TradingStore store;
    @Mock
    private TradingMetrics metrics;

    private final AtomicLong clock = new AtomicLong(0);
    private BoundedChannel<Decision> decisions;
    private RiskManager riskManager;
    private Position position;

    @BeforeEach
    void setUp() {
        decisions = new BoundedChannel<>("decisions", 10);
        riskManager = new RiskManager(store, new BoundedChannel<>("ticks", 10), decisions, metrics,
            Duration.ofSeconds(1), clock::get);
        position = Position.open("KRW-BTC", 100_000.0, 0.01, 0.05, 0.10);
    }

    private static Tick tick(String market, double price) {
        return new Tick(market, System.currentTimeMillis(), price, 0.0, 1.0);
    }

    @Test
    void priceBelowStopLossEmitsSell() {
        when(store.getAllActivePositions()).thenReturn(List.of(position));

        Optional<Decision> decision = riskManager.onTick(tick("KRW-BTC", 94_000.0));

        assertTrue(decision.isPresent());
        assertEquals(Decision.Kind.SELL, decision.get().kind());
        assertEquals("KRW-BTC", decision.get().market());
        assertEquals(0.01, decision.get().amount(), 1e-12);
        assertEquals("stop loss triggered", decision.get().reason());
        verify(metrics).recordDecision(Decision.Kind.SELL, "risk-manager");
    }

    @Test
    void priceInsideBandEmitsNothing() {
        when(store.getAllActivePositions()).thenReturn(List.of(position));

        assertTrue(riskManager.onTick(tick("KRW-BTC", 96_000.0)).isEmpty());
        assertTrue(riskManager.onTick(tick("KRW-BTC", 105_000.0)).isEmpty());
    }

    @Test
    void priceAboveTakeProfitEmitsSell() {
        when(store.getAllActivePositions()).thenReturn(List.of(position));

        Optional<Decision> decision = riskManager.onTick(tick("KRW-BTC", 111_000.0));

        assertTrue(decision.isPresent());
        assertEquals("take profit reached", decision.get().reason());
    }

    @Test
    void otherMarketTicksAreIgnored() {
        when(store.getAllActivePositions()).thenReturn(List.of(position));

        assertTrue(riskManager.onTick(tick("KRW-ETH", 1.0)).isEmpty());
    }

    @Test
    void noPositionMeansNoDecision() {
        when(store.getAllActivePositions()).thenReturn(List.of());

        assertTrue(riskManager.onTick(tick("KRW-BTC", 1.0)).isEmpty());
        assertTrue(riskManager.currentPosition().isEmpty());
        verify(metrics).setPositionOpen(false);
    }

    @Test
    void repeatedBreachesSellOnceUntilRetryWindowPasses() {
        when(store.getAllActivePositions()).thenReturn(List.of(position));

        assertTrue(riskManager.onTick(tick("KRW-BTC", 94_000.0)).isPresent());
        clock.addAndGet(Duration.ofSeconds(5).toNanos());
        assertTrue(riskManager.onTick(tick("KRW-BTC", 93_000.0)).isEmpty(), "Exit already pending");

        clock.addAndGet(Duration.ofSeconds(30).toNanos());
        assertTrue(riskManager.onTick(tick("KRW-BTC", 93_000.0)).isPresent(), "Exit retried after window");
    }

    @Test
    void positionIsReloadedOnlyAfterRefreshInterval() {
        when(store.getAllActivePositions()).thenReturn(List.of(position));

        riskManager.onTick(tick("KRW-BTC", 100_000.0));
        clock.addAndGet(Duration.ofMillis(500).toNanos());
        riskManager.onTick(tick("KRW-BTC", 100_000.0));
        verify(store, times(1)).getAllActivePositions();

        clock.addAndGet(Duration.ofMillis(600).toNanos());
        riskManager.onTick(tick("KRW-BTC", 100_000.0));
        verify(store, times(2)).getAllActivePositions();
    }

    @Test
    void newPositionIsPickedUpAfterRefresh() {
        when(store.getAllActivePositions())
            .thenReturn(List.of())
            .thenReturn(List.of(position));

        assertTrue(riskManager.onTick(tick("KRW-BTC", 94_000.0)).isEmpty());

        clock.addAndGet(Duration.ofSeconds(1).toNanos());
        assertTrue(riskManager.onTick(tick("KRW-BTC", 94_000.0)).isPresent());
        assertEquals(position, riskManager.currentPosition().orElseThrow());
    }

    @Test
    void storeFailureKeepsCachedPosition() {
        when(store.getAllActivePositions())
            .thenReturn(List.of(position))
            .thenThrow(new RuntimeException("database is locked"));

        riskManager.onTick(tick("KRW-BTC", 100_000.0));
        clock.addAndGet(Duration.ofSeconds(2).toNanos());

        assertTrue(riskManager.onTick(tick("KRW-BTC", 94_000.0)).isPresent());
    }

    @Test
    void multiplePositionsAnomalyIsLoggedOncePerInterval() {
        Position other = Position.open("KRW-ETH", 3_000_000.0, 0.01, 0.05, 0.10);
        when(store.getAllActivePositions()).thenReturn(List.of(position, other));

        for (int i = 0; i < 5; i++) {
            riskManager.onTick(tick("KRW-BTC", 100_000.0));
            clock.addAndGet(Duration.ofSeconds(1).toNanos());
        }
        assertEquals(4, riskManager.suppressedAnomalyCount());
        assertEquals("KRW-BTC", riskManager.currentPosition().orElseThrow().market());

        clock.addAndGet(RiskManager.ANOMALY_LOG_INTERVAL.toNanos());
        riskManager.onTick(tick("KRW-BTC", 100_000.0));
        assertEquals(0, riskManager.suppressedAnomalyCount());
    }

    @Test
    void handleForwardsSellToDecisions() throws InterruptedException {
        when(store.getAllActivePositions()).thenReturn(List.of(position));

        riskManager.handle(tick("KRW-BTC", 94_000.0));

        Decision forwarded = decisions.poll(Duration.ZERO);
        assertNotNull(forwarded);
        assertEquals(Decision.Kind.SELL, forwarded.kind());
    }

    @Test
    void evaluateChecksStopLossBeforeTakeProfit() {
        Position inverted = new Position("p", "KRW-BTC", 100.0, 1.0, position.entryTime(), 120.0, 110.0);

        Optional<Decision> decision = RiskManager.evaluate(inverted, 115.0);

        assertEquals("stop loss triggered", decision.orElseThrow().reason());
    }
}
