package com.autocoin.application.service;

import com.autocoin.application.channel.BoundedChannel;
import com.autocoin.application.port.output.ExchangeClient;
import com.autocoin.application.port.output.TradingStore;
import com.autocoin.config.TradingConfig;
import com.autocoin.domain.model.Decision;
import com.autocoin.domain.model.Position;
import com.autocoin.domain.model.Signal;
import com.autocoin.infrastructure.exchange.ExchangeException;
import com.autocoin.infrastructure.exchange.ExchangeException.ErrorKind;
import com.autocoin.infrastructure.metrics.TradingMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DecisionMaker.
 *
 * Tests:
 * - Buy sized from the refreshed balance
 * - Single position rule
 * - Minimum balance
 * - Sell only against a matching position
 * - Store and exchange failures
 */
@ExtendWith(MockitoExtension.class)
class DecisionMakerTest {

    @Mock
    private ExchangeClient exchange;
    @Mock
    private TradingStore store;
    @Mock
    private TradingMetrics metrics;

    private BoundedChannel<Decision> decisions;
    private DecisionMaker decisionMaker;

    @BeforeEach
    void setUp() {
        decisions = new BoundedChannel<>("decisions", 10);
        decisionMaker = new DecisionMaker(TradingConfig.defaults(), exchange, store,
            new BoundedChannel<>("signals", 10), decisions, metrics);
    }

    private static Position btcPosition() {
        return Position.open("KRW-BTC", 100_000.0, 0.01, 0.05, 0.10);
    }

    @Test
    void buySignalWithoutPositionSpendsHalfTheBalance() {
        when(store.getAllActivePositions()).thenReturn(List.of());
        when(exchange.getBalance()).thenReturn(100_000.0);

        Decision decision = decisionMaker.decide(Signal.buy("KRW-BTC", 0.8, "Price surged 6.00% with 2.5x volume"));

        assertEquals(Decision.Kind.BUY, decision.kind());
        assertEquals("KRW-BTC", decision.market());
        assertEquals(50_000.0, decision.amount(), 1e-9);
        assertEquals("Price surged 6.00% with 2.5x volume", decision.reason());
        assertEquals(100_000.0, decisionMaker.getBalance(), 1e-9);
    }

    @Test
    void buySignalWithExistingPositionHolds() {
        when(store.getAllActivePositions()).thenReturn(List.of(btcPosition()));

        Decision decision = decisionMaker.decide(Signal.buy("KRW-ETH", 0.9, "surge"));

        assertEquals(Decision.Kind.HOLD, decision.kind());
        assertEquals("Position already exists", decision.reason());
        verifyNoInteractions(exchange);
    }

    @Test
    void buySignalBelowMinimumBalanceHolds() {
        when(store.getAllActivePositions()).thenReturn(List.of());
        when(exchange.getBalance()).thenReturn(3_000.0);

        Decision decision = decisionMaker.decide(Signal.buy("KRW-BTC", 0.8, "surge"));

        assertEquals(Decision.Kind.HOLD, decision.kind());
        assertEquals("Insufficient balance", decision.reason());
    }

    @Test
    void balanceRefreshFailureUsesLastKnownBalance() {
        when(store.getAllActivePositions()).thenReturn(List.of());
        when(exchange.getBalance())
            .thenReturn(20_000.0)
            .thenThrow(new ExchangeException(ErrorKind.NETWORK, "get_balance", "timeout"));

        decisionMaker.decide(Signal.buy("KRW-BTC", 0.8, "surge"));
        Decision second = decisionMaker.decide(Signal.buy("KRW-BTC", 0.8, "surge"));

        assertEquals(Decision.Kind.BUY, second.kind());
        assertEquals(10_000.0, second.amount(), 1e-9);
    }

    @Test
    void unreadableStoreHolds() {
        when(store.getAllActivePositions()).thenThrow(new RuntimeException("database is locked"));

        Decision decision = decisionMaker.decide(Signal.buy("KRW-BTC", 0.8, "surge"));

        assertEquals(Decision.Kind.HOLD, decision.kind());
        assertEquals("Position state unavailable", decision.reason());
        verifyNoInteractions(exchange);
    }

    @Test
    void sellSignalSellsWholeMatchingPosition() {
        when(store.getAllActivePositions()).thenReturn(List.of(btcPosition()));

        Decision decision = decisionMaker.decide(Signal.sell("KRW-BTC", 0.7, "momentum faded"));

        assertEquals(Decision.Kind.SELL, decision.kind());
        assertEquals("KRW-BTC", decision.market());
        assertEquals(0.01, decision.amount(), 1e-12);
    }

    @Test
    void sellSignalWithoutMatchingPositionHolds() {
        when(store.getAllActivePositions()).thenReturn(List.of(btcPosition()));

        Decision decision = decisionMaker.decide(Signal.sell("KRW-ETH", 0.7, "momentum faded"));

        assertEquals(Decision.Kind.HOLD, decision.kind());
        assertEquals("No matching position to sell", decision.reason());
    }

    @Test
    void holdSignalIsRepeatableAndTouchesNothing() {
        Decision first = decisionMaker.decide(Signal.hold("KRW-BTC"));
        Decision second = decisionMaker.decide(Signal.hold("KRW-BTC"));

        assertEquals(Decision.Kind.HOLD, first.kind());
        assertEquals(first.reason(), second.reason());
        verifyNoInteractions(store, exchange);
    }

    @Test
    void handleForwardsEveryDecision() throws InterruptedException {
        decisionMaker.handle(Signal.hold("KRW-BTC"));

        Decision forwarded = decisions.poll(Duration.ZERO);
        assertNotNull(forwarded);
        assertTrue(forwarded.isHold());
        verify(metrics).recordDecision(Decision.Kind.HOLD, "decision-maker");
    }
}
