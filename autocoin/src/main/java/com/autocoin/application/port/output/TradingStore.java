package com.autocoin.application.port.output;

import com.autocoin.domain.model.Order;
import com.autocoin.domain.model.Position;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for positions and orders.
 */
public interface TradingStore {

    void savePosition(Position position);

    /**
     * Transition the active position of {@code market} to closed.
     *
     * @return true if an active position was closed
     */
    boolean closePosition(String market, double exitPrice, double pnl, double pnlRate);

    List<Position> getAllActivePositions();

    Optional<Position> getActivePosition(String market);

    /**
     * Insert, or update status and execution fields of an existing order with the same id.
     */
    void saveOrder(Order order);
}
