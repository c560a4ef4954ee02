package com.autocoin.application.service;

import com.autocoin.application.channel.BoundedChannel;
import com.autocoin.application.port.output.TradeNotifier;
import com.autocoin.config.NotificationConfig;
import com.autocoin.domain.model.OrderResult;
import com.autocoin.domain.model.OrderSide;
import com.autocoin.domain.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Forwards order results and signal alerts to the operator notifier.
 *
 * Results arrive on a blocking channel; signal alerts on a best-effort channel that is
 * drained between results. Notifier failures are logged and never reach the pipeline.
 */
public final class NotificationAgent extends ChannelConsumer<OrderResult> {
    private static final Logger log = LoggerFactory.getLogger(NotificationAgent.class);

    private static final int MAX_ALERTS_PER_POLL = 10;

    private final TradeNotifier notifier;
    private final NotificationConfig config;
    private final BoundedChannel<Signal> signalAlerts;

    public NotificationAgent(TradeNotifier notifier,
                             NotificationConfig config,
                             BoundedChannel<OrderResult> results,
                             BoundedChannel<Signal> signalAlerts) {
        super("notification-agent", results);
        this.notifier = notifier;
        this.config = config;
        this.signalAlerts = signalAlerts;
    }

    @Override
    protected void handle(OrderResult result) {
        if (!shouldNotify(result)) {
            return;
        }
        try {
            notifier.notifyOrderResult(result);
        } catch (RuntimeException e) {
            log.warn("[NOTIFY] Failed to send order result for {}: {}", result.order().market(), e.getMessage());
        }
    }

    @Override
    protected void afterPoll() throws InterruptedException {
        if (signalAlerts == null) {
            return;
        }
        for (int i = 0; i < MAX_ALERTS_PER_POLL; i++) {
            Signal signal = signalAlerts.poll(Duration.ZERO);
            if (signal == null) {
                return;
            }
            notifySignal(signal);
        }
    }

    void notifySignal(Signal signal) {
        if (!config.notifyOnSignal()) {
            return;
        }
        try {
            notifier.notifySignal(signal);
        } catch (RuntimeException e) {
            log.warn("[NOTIFY] Failed to send signal alert for {}: {}", signal.market(), e.getMessage());
        }
    }

    /**
     * Escalate a process-level failure such as a lost exchange connection.
     */
    public void notifyError(String title, String message) {
        if (!config.notifyOnError()) {
            return;
        }
        try {
            notifier.notifyError(title, message);
        } catch (RuntimeException e) {
            log.warn("[NOTIFY] Failed to send error alert '{}': {}", title, e.getMessage());
        }
    }

    private boolean shouldNotify(OrderResult result) {
        if (!result.success()) {
            return config.notifyOnError();
        }
        return result.order().side() == OrderSide.BID ? config.notifyOnBuy() : config.notifyOnSell();
    }
}
