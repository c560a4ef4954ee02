package com.autocoin.infrastructure.stream;

import com.autocoin.domain.model.Tick;

import java.util.List;

/**
 * One streaming session with the exchange.
 */
public interface MarketDataConnection {

    /**
     * Callbacks for a single session, invoked on the thread that called
     * {@link #streamUntilClosed(List, Listener)}.
     */
    interface Listener {

        /**
         * Connected and subscribed.
         */
        void onConnected();

        /**
         * May block to apply downstream backpressure.
         */
        void onTick(Tick tick) throws InterruptedException;
    }

    /**
     * Connect, subscribe to {@code markets} and deliver ticks until the session ends.
     *
     * Never returns normally: a lost, timed out or closed connection ends with a
     * {@link StreamException}.
     */
    void streamUntilClosed(List<String> markets, Listener listener) throws InterruptedException;
}
