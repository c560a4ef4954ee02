package com.autocoin.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SignalTest {

    @Test
    void confidenceMustBeInUnitRange() {
        assertThrows(IllegalArgumentException.class, () -> Signal.buy("KRW-BTC", 1.5, "too sure"));
        assertThrows(IllegalArgumentException.class, () -> Signal.sell("KRW-BTC", -0.1, "negative"));
    }

    @Test
    void holdCarriesNoConfidence() {
        Signal hold = Signal.hold("KRW-BTC");
        assertEquals(SignalType.HOLD, hold.type());
        assertEquals(0.0, hold.confidence());
    }

    @Test
    void typeDirection() {
        assertTrue(SignalType.STRONG_BUY.isBuy());
        assertTrue(SignalType.STRONG_SELL.isSell());
        assertFalse(SignalType.HOLD.isBuy());
        assertFalse(SignalType.HOLD.isSell());
    }
}
