package com.autocoin.application.service;

import com.autocoin.application.channel.BoundedChannel;
import com.autocoin.application.port.output.ExchangeClient;
import com.autocoin.application.port.output.TradingStore;
import com.autocoin.config.TradingConfig;
import com.autocoin.domain.model.Decision;
import com.autocoin.domain.model.Position;
import com.autocoin.domain.model.Signal;
import com.autocoin.infrastructure.exchange.ExchangeException;
import com.autocoin.infrastructure.metrics.TradingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Turns each signal into exactly one decision.
 *
 * Position state is read from the store for every signal, so a buy that was just
 * executed is visible to the next signal without waiting for a pushed snapshot.
 * The balance is refreshed from the exchange before a buy is sized; if that call
 * fails the last known balance is used.
 */
public final class DecisionMaker extends ChannelConsumer<Signal> {
    private static final Logger log = LoggerFactory.getLogger(DecisionMaker.class);

    static final String SOURCE = "decision-maker";

    private final TradingConfig config;
    private final ExchangeClient exchange;
    private final TradingStore store;
    private final BoundedChannel<Decision> decisions;
    private final TradingMetrics metrics;

    private volatile double balance = 0.0;

    public DecisionMaker(TradingConfig config,
                         ExchangeClient exchange,
                         TradingStore store,
                         BoundedChannel<Signal> signals,
                         BoundedChannel<Decision> decisions,
                         TradingMetrics metrics) {
        super(SOURCE, signals);
        this.config = config;
        this.exchange = exchange;
        this.store = store;
        this.decisions = decisions;
        this.metrics = metrics;
    }

    @Override
    protected void onStart() {
        refreshBalance();
        log.info("[DECISION] Initial balance: {} KRW", balance);
    }

    @Override
    protected void handle(Signal signal) throws InterruptedException {
        Decision decision = decide(signal);
        metrics.recordDecision(decision.kind(), SOURCE);

        if (decision.isHold()) {
            log.debug("[DECISION] {} -> HOLD ({})", signal.market(), decision.reason());
        } else {
            log.info("[DECISION] {} -> {} amount={} ({})",
                decision.market(), decision.kind(), decision.amount(), decision.reason());
        }
        decisions.send(decision);
    }

    public Decision decide(Signal signal) {
        return switch (signal.type()) {
            case BUY, STRONG_BUY -> decideBuy(signal);
            case SELL, STRONG_SELL -> decideSell(signal);
            case HOLD -> Decision.hold(signal.market(), "No significant signal");
        };
    }

    public double getBalance() {
        return balance;
    }

    private Decision decideBuy(Signal signal) {
        Optional<List<Position>> active = activePositions();
        if (active.isEmpty()) {
            return Decision.hold(signal.market(), "Position state unavailable");
        }
        if (!active.get().isEmpty()) {
            return Decision.hold(signal.market(), "Position already exists");
        }

        refreshBalance();
        double available = balance;
        if (available < config.minOrderAmount()) {
            return Decision.hold(signal.market(), "Insufficient balance");
        }

        double orderAmount = available * config.maxPositionRatio();
        if (orderAmount > available * 0.5) {
            log.warn("[DECISION] ⚠️ Order amount {} KRW is more than half of balance {} KRW",
                orderAmount, available);
        }
        return Decision.buy(signal.market(), orderAmount, signal.reason());
    }

    private Decision decideSell(Signal signal) {
        Optional<List<Position>> active = activePositions();
        if (active.isEmpty()) {
            return Decision.hold(signal.market(), "Position state unavailable");
        }
        return active.get().stream()
            .filter(p -> p.market().equals(signal.market()))
            .findFirst()
            .map(p -> Decision.sell(p.market(), p.amount(), signal.reason()))
            .orElseGet(() -> Decision.hold(signal.market(), "No matching position to sell"));
    }

    /**
     * @return empty if the store could not be read
     */
    private Optional<List<Position>> activePositions() {
        try {
            return Optional.of(store.getAllActivePositions());
        } catch (RuntimeException e) {
            log.error("[DECISION] Failed to read active positions: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void refreshBalance() {
        try {
            balance = exchange.getBalance();
        } catch (ExchangeException e) {
            log.warn("[DECISION] Balance refresh failed, using last known {} KRW: {}",
                balance, e.getMessage());
        }
    }
}
