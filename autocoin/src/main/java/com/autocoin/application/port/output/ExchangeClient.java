package com.autocoin.application.port.output;

import com.autocoin.domain.model.Order;

import java.util.List;

/**
 * Authenticated exchange REST operations used by the pipeline.
 *
 * Implementations throw {@code ExchangeException}; its kind tells callers whether a
 * retry is worthwhile.
 */
public interface ExchangeClient {

    /**
     * Market buy spending {@code amountQuote} of the quote currency.
     */
    Order buyMarketOrder(String market, double amountQuote);

    /**
     * Market sell of {@code volume} units of the base currency.
     */
    Order sellMarketOrder(String market, double volume);

    Order getOrder(String orderId);

    /**
     * Available quote currency (KRW) balance, excluding locked funds.
     */
    double getBalance();

    /**
     * First {@code limit} KRW-quoted markets listed by the exchange.
     */
    List<String> getTopKrwMarkets(int limit);
}
