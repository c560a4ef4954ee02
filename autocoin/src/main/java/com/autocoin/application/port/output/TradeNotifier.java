package com.autocoin.application.port.output;

import com.autocoin.domain.model.OrderResult;
import com.autocoin.domain.model.Signal;

/**
 * Outbound operator notifications. Callers treat every method as fire-and-forget.
 */
public interface TradeNotifier {

    void notifyOrderResult(OrderResult result);

    void notifySignal(Signal signal);

    void notifyError(String title, String message);
}
