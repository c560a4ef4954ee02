package com.autocoin.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class OrderTest {

    @Test
    void averagePriceFromExecution() {
        Order order = new Order("ord-1", "KRW-BTC", OrderSide.BID, 50_000.0, 0.0,
            OrderStatus.EXECUTED, 0.0005, 50_000.0, Instant.now());

        assertTrue(order.hasFill());
        assertEquals(100_000_000.0, order.averagePrice(), 1e-3);
    }

    @Test
    void averagePriceFallsBackToRequestedPriceWithoutFill() {
        Order order = new Order("ord-2", "KRW-BTC", OrderSide.BID, 50_000.0, 0.0,
            OrderStatus.WAITING, 0.0, 0.0, Instant.now());

        assertFalse(order.hasFill());
        assertEquals(50_000.0, order.averagePrice(), 1e-9);
    }

    @Test
    void failedOrderHasLocalId() {
        Order failed = Order.failed("KRW-BTC", OrderSide.ASK, 0.0, 0.01);

        assertTrue(failed.id().startsWith("local-"));
        assertEquals(OrderStatus.FAILED, failed.status());
    }

    @Test
    void exchangeStatesMapToStatus() {
        assertEquals(OrderStatus.WAITING, OrderStatus.fromExchangeState("wait"));
        assertEquals(OrderStatus.EXECUTED, OrderStatus.fromExchangeState("done"));
        assertEquals(OrderStatus.CANCELED, OrderStatus.fromExchangeState("cancel"));
        assertEquals(OrderStatus.FAILED, OrderStatus.fromExchangeState("watch"));
        assertEquals(OrderStatus.FAILED, OrderStatus.fromExchangeState(null));
    }

    @Test
    void sideWireValues() {
        assertEquals("bid", OrderSide.BID.wireValue());
        assertEquals(OrderSide.ASK, OrderSide.fromWireValue("ask"));
        assertThrows(IllegalArgumentException.class, () -> OrderSide.fromWireValue("both"));
    }
}
