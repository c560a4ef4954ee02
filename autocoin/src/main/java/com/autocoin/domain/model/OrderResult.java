package com.autocoin.domain.model;

/**
 * Outcome of executing one decision.
 *
 * @param error null on success
 */
public record OrderResult(
        Order order,
        boolean success,
        String error) {

    public static OrderResult success(Order order) {
        return new OrderResult(order, true, null);
    }

    public static OrderResult failure(Order order, String error) {
        return new OrderResult(order, false, error);
    }
}
