package com.autocoin.domain.model;

/**
 * Order side, exchange wire values "bid" and "ask".
 */
public enum OrderSide {
    BID,    // Buy
    ASK;    // Sell

    public String wireValue() {
        return name().toLowerCase();
    }

    public static OrderSide fromWireValue(String value) {
        if ("bid".equalsIgnoreCase(value)) return BID;
        if ("ask".equalsIgnoreCase(value)) return ASK;
        throw new IllegalArgumentException("Unknown order side: " + value);
    }
}
