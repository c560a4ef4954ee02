package com.autocoin.application.service;

import com.autocoin.application.channel.BoundedChannel;
import com.autocoin.application.port.output.ExchangeClient;
import com.autocoin.application.port.output.TradingStore;
import com.autocoin.config.PipelineConfig;
import com.autocoin.config.TradingConfig;
import com.autocoin.domain.model.Decision;
import com.autocoin.domain.model.Order;
import com.autocoin.domain.model.OrderResult;
import com.autocoin.domain.model.OrderSide;
import com.autocoin.domain.model.PnL;
import com.autocoin.domain.model.Position;
import com.autocoin.infrastructure.common.RetryPolicy;
import com.autocoin.infrastructure.exchange.ExchangeException;
import com.autocoin.infrastructure.metrics.TradingMetrics;
import com.autocoin.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Executes decisions on the exchange and records the outcome.
 *
 * Order placement is retried on retryable {@link ExchangeException}s with exponential
 * backoff from the error's base delay. A failed decision produces a failed
 * {@link OrderResult} and the agent moves on to the next decision.
 *
 * Once the exchange has filled an order the result is always emitted, even when
 * recording the position or order in the store fails.
 *
 * An order still unfilled after the fill polls is persisted as it stands and kept
 * pending. Its position is opened or closed only once a later lookup reports a fill;
 * a pending buy blocks further buys and a pending sell blocks another sell of the
 * same market.
 */
public final class ExecutionAgent extends ChannelConsumer<Decision> {
    private static final Logger log = LoggerFactory.getLogger(ExecutionAgent.class);

    private static final Duration RECONCILE_INTERVAL = Duration.ofSeconds(5);

    private final ExchangeClient exchange;
    private final TradingStore store;
    private final TradingConfig tradingConfig;
    private final PipelineConfig pipelineConfig;
    private final BoundedChannel<OrderResult> results;
    private final TradingMetrics metrics;
    private final Sleeper sleeper;

    // touched only from the agent thread
    private final Map<String, Order> pendingOrders = new LinkedHashMap<>();
    private long lastReconcileNanos = System.nanoTime();

    public ExecutionAgent(ExchangeClient exchange,
                          TradingStore store,
                          TradingConfig tradingConfig,
                          PipelineConfig pipelineConfig,
                          BoundedChannel<Decision> decisions,
                          BoundedChannel<OrderResult> results,
                          TradingMetrics metrics,
                          Sleeper sleeper) {
        super("execution-agent", decisions);
        this.exchange = exchange;
        this.store = store;
        this.tradingConfig = tradingConfig;
        this.pipelineConfig = pipelineConfig;
        this.results = results;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    @Override
    protected void handle(Decision decision) throws InterruptedException {
        Optional<OrderResult> result = execute(decision);
        if (result.isPresent()) {
            results.send(result.get());
        }
    }

    @Override
    protected void afterPoll() {
        if (!pendingOrders.isEmpty()
                && System.nanoTime() - lastReconcileNanos >= RECONCILE_INTERVAL.toNanos()) {
            reconcilePendingOrders();
        }
    }

    /**
     * Carry out one decision.
     *
     * @return the outcome, or empty for a hold
     */
    public Optional<OrderResult> execute(Decision decision) throws InterruptedException {
        if (!pendingOrders.isEmpty()) {
            reconcilePendingOrders();
        }
        return switch (decision.kind()) {
            case BUY -> Optional.of(executeBuy(decision));
            case SELL -> Optional.of(executeSell(decision));
            case HOLD -> Optional.empty();
        };
    }

    private OrderResult executeBuy(Decision decision) throws InterruptedException {
        String market = decision.market();
        double amountQuote = decision.amount();
        long start = System.nanoTime();

        Optional<String> blocked = checkNoActivePosition();
        if (blocked.isPresent()) {
            log.warn("[EXECUTION] Skipping buy {}: {}", market, blocked.get());
            Order rejected = Order.failed(market, OrderSide.BID, amountQuote, 0.0);
            metrics.recordOrder(OrderSide.BID, false, Duration.ofNanos(System.nanoTime() - start));
            return OrderResult.failure(rejected, blocked.get());
        }

        log.info("[EXECUTION] Buying {} for {} KRW ({})", market, amountQuote, decision.reason());
        Order order;
        try {
            order = placeWithRetry("buy", () -> exchange.buyMarketOrder(market, amountQuote));
        } catch (ExchangeException e) {
            return recordFailure(Order.failed(market, OrderSide.BID, amountQuote, 0.0), e, start);
        }

        order = awaitFill(order);
        if (!order.hasFill()) {
            return deferUnfilled(order, start);
        }

        recordBuyFill(order);
        persistOrder(order);
        metrics.recordOrder(OrderSide.BID, true, Duration.ofNanos(System.nanoTime() - start));
        return OrderResult.success(order);
    }

    private OrderResult executeSell(Decision decision) throws InterruptedException {
        String market = decision.market();
        double volume = decision.amount();
        long start = System.nanoTime();

        Optional<Order> pendingSell = pendingOrder(OrderSide.ASK, market);
        if (pendingSell.isPresent()) {
            log.warn("[EXECUTION] Skipping sell {}: order {} still pending", market, pendingSell.get().id());
            metrics.recordOrder(OrderSide.ASK, false, Duration.ofNanos(System.nanoTime() - start));
            return OrderResult.failure(Order.failed(market, OrderSide.ASK, 0.0, volume), "Sell order pending fill");
        }

        log.info("[EXECUTION] Selling {} volume={} ({})", market, volume, decision.reason());
        Order order;
        try {
            order = placeWithRetry("sell", () -> exchange.sellMarketOrder(market, volume));
        } catch (ExchangeException e) {
            return recordFailure(Order.failed(market, OrderSide.ASK, 0.0, volume), e, start);
        }

        order = awaitFill(order);
        if (!order.hasFill()) {
            return deferUnfilled(order, start);
        }

        recordSellFill(order);
        persistOrder(order);
        metrics.recordOrder(OrderSide.ASK, true, Duration.ofNanos(System.nanoTime() - start));
        return OrderResult.success(order);
    }

    /**
     * Check every pending order once. Filled orders get their position bookkeeping,
     * canceled or failed ones are dropped, the rest stay pending.
     */
    void reconcilePendingOrders() {
        lastReconcileNanos = System.nanoTime();
        Iterator<Map.Entry<String, Order>> it = pendingOrders.entrySet().iterator();
        while (it.hasNext()) {
            Order pending = it.next().getValue();
            Order current;
            try {
                current = exchange.getOrder(pending.id());
            } catch (ExchangeException e) {
                log.warn("[EXECUTION] Lookup of pending order {} failed: {}", pending.id(), e.getMessage());
                continue;
            }

            if (current.hasFill()) {
                log.info("[EXECUTION] Pending {} order {} filled", current.side(), current.id());
                if (current.side() == OrderSide.BID) {
                    recordBuyFill(current);
                } else {
                    recordSellFill(current);
                }
                persistOrder(current);
                it.remove();
            } else if (current.status().isTerminal()) {
                log.warn("[EXECUTION] Pending order {} ended {} without a fill", current.id(), current.status());
                persistOrder(current);
                it.remove();
            }
        }
    }

    int pendingOrderCount() {
        return pendingOrders.size();
    }

    private OrderResult deferUnfilled(Order order, long startNanos) {
        log.warn("[EXECUTION] {} {} order {} not filled yet (status={}), position update deferred",
            order.side(), order.market(), order.id(), order.status());
        persistOrder(order);
        if (!order.status().isTerminal()) {
            pendingOrders.put(order.id(), order);
        }
        metrics.recordOrder(order.side(), true, Duration.ofNanos(System.nanoTime() - startNanos));
        return OrderResult.success(order);
    }

    private void recordBuyFill(Order order) {
        Position position = Position.open(order.market(), order.averagePrice(), order.executedVolume(),
            tradingConfig.stopLossRate(), tradingConfig.takeProfitRate());
        try {
            store.savePosition(position);
        } catch (RuntimeException e) {
            log.error("[EXECUTION] Failed to save position for filled buy {}", order.id(), e);
        }
        metrics.setPositionOpen(true);
        log.info("[EXECUTION] ✓ Bought {} volume={} avgPrice={} stopLoss={} takeProfit={}",
            order.market(), order.executedVolume(), position.entryPrice(), position.stopLoss(), position.takeProfit());
    }

    private void recordSellFill(Order order) {
        String market = order.market();
        double exitPrice = order.averagePrice();
        try {
            Optional<Position> position = store.getActivePosition(market);
            if (position.isPresent()) {
                PnL pnl = position.get().calculatePnl(exitPrice);
                store.closePosition(market, exitPrice, pnl.profit(), pnl.profitRate());
                log.info("[EXECUTION] ✓ Closed {} at {} pnl={} KRW ({}%)", market, exitPrice,
                    String.format("%.0f", pnl.profit()), String.format("%.2f", pnl.profitRate() * 100.0));
            } else {
                log.warn("[EXECUTION] Sold {} but no active position was recorded", market);
            }
        } catch (RuntimeException e) {
            log.error("[EXECUTION] Failed to close position for filled sell {}", order.id(), e);
        }
        metrics.setPositionOpen(false);
    }

    private Optional<Order> pendingOrder(OrderSide side, String market) {
        return pendingOrders.values().stream()
            .filter(o -> o.side() == side && (market == null || o.market().equals(market)))
            .findFirst();
    }

    /**
     * @return the reason a buy must not be placed, if any
     */
    private Optional<String> checkNoActivePosition() {
        if (pendingOrder(OrderSide.BID, null).isPresent()) {
            return Optional.of("Buy order pending fill");
        }
        try {
            List<Position> active = store.getAllActivePositions();
            return active.isEmpty() ? Optional.empty() : Optional.of("Position already exists");
        } catch (RuntimeException e) {
            log.error("[EXECUTION] Failed to read active positions: {}", e.getMessage());
            return Optional.of("Position state unavailable");
        }
    }

    private Order placeWithRetry(String operation, Supplier<Order> call) throws InterruptedException {
        RetryPolicy policy = RetryPolicy.forOrders(pipelineConfig.orderMaxAttempts());
        while (true) {
            try {
                return call.get();
            } catch (ExchangeException e) {
                int failures = policy.recordFailure();
                if (!e.isRetryable()) {
                    log.error("[EXECUTION] {} failed with non-retryable error: {}", operation, e.getMessage());
                    throw e;
                }
                if (policy.isExhausted()) {
                    log.error("[EXECUTION] {} failed after {} attempts: {}", operation, failures, e.getMessage());
                    throw e;
                }

                Duration delay = policy.getNextDelay(e.retryDelay());
                log.warn("[EXECUTION] {} attempt {}/{} failed ({}), retrying in {}ms",
                    operation, failures, policy.getMaxAttempts(), e.getKind(), delay.toMillis());
                metrics.recordRetry(operation, failures, e.getKind().name());
                sleeper.sleep(delay);
            }
        }
    }

    /**
     * Market orders may be acknowledged before any fill is reported; poll until one is.
     */
    private Order awaitFill(Order order) throws InterruptedException {
        Order current = order;
        int attempts = 0;
        while (!current.hasFill() && attempts < pipelineConfig.orderFillPollAttempts()) {
            attempts++;
            sleeper.sleep(pipelineConfig.orderFillPollInterval());
            try {
                current = exchange.getOrder(current.id());
            } catch (ExchangeException e) {
                log.warn("[EXECUTION] Fill check {} for order {} failed: {}", attempts, order.id(), e.getMessage());
            }
        }
        return current;
    }

    private OrderResult recordFailure(Order failed, ExchangeException e, long startNanos) {
        persistOrder(failed);
        metrics.recordOrder(failed.side(), false, Duration.ofNanos(System.nanoTime() - startNanos));
        log.error("[EXECUTION] ❌ {} {} failed: {}", failed.side(), failed.market(), e.getMessage());
        return OrderResult.failure(failed, e.getMessage());
    }

    private void persistOrder(Order order) {
        try {
            store.saveOrder(order);
        } catch (RuntimeException e) {
            log.error("[EXECUTION] Failed to save order {}", order.id(), e);
        }
    }
}
