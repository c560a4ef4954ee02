package com.autocoin.infrastructure.common;

import java.time.Duration;

/**
 * Bounded retry policy with fixed or exponential backoff.
 *
 * Counts consecutive failures. After failure {@code n} the delay before the next
 * attempt is {@code base * multiplier^n}, capped at maxDelay. A multiplier of 1.0 gives
 * a fixed delay. Once {@code maxAttempts} attempts have failed the policy is exhausted.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.forOrders(3);
 *
 * while (true) {
 *     try {
 *         return placeOrder();
 *     } catch (ExchangeException e) {
 *         policy.recordFailure();
 *         if (!e.isRetryable() || policy.isExhausted()) throw e;
 *         sleeper.sleep(policy.getNextDelay(e.retryDelay()));
 *     }
 * }
 * </pre>
 *
 * Instances are stateful; create one per retry loop.
 */
public class RetryPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int failureCount = 0;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Record a failed attempt.
     *
     * @return number of consecutive failures so far
     */
    public synchronized int recordFailure() {
        failureCount++;
        return failureCount;
    }

    /**
     * Record a successful attempt. Resets the failure counter.
     */
    public synchronized void recordSuccess() {
        failureCount = 0;
    }

    /**
     * @return true once maxAttempts consecutive attempts have failed
     */
    public synchronized boolean isExhausted() {
        return failureCount >= maxAttempts;
    }

    /**
     * Delay before the next attempt, derived from the configured initial delay.
     */
    public synchronized Duration getNextDelay() {
        return getNextDelay(initialDelay);
    }

    /**
     * Delay before the next attempt for an error-specific base delay.
     */
    public synchronized Duration getNextDelay(Duration base) {
        double factor = Math.pow(multiplier, failureCount);
        long millis = (long) (base.toMillis() * factor);
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fixed-delay reconnection: {@code maxRetries} retries after the first attempt.
     */
    public static RetryPolicy forStream(Duration retryDelay, int maxRetries) {
        return builder()
            .initialDelay(retryDelay)
            .maxDelay(retryDelay)
            .multiplier(1.0)
            .maxAttempts(maxRetries + 1)
            .build();
    }

    /**
     * Exponential backoff (x2) for order placement, {@code maxAttempts} attempts in total.
     */
    public static RetryPolicy forOrders(int maxAttempts) {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofMinutes(2))
            .multiplier(2.0)
            .maxAttempts(maxAttempts)
            .build();
    }

    /**
     * Builder for RetryPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double multiplier = 2.0;
        private int maxAttempts = 3;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative()) {
                throw new IllegalArgumentException("Initial delay must not be negative");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("Max delay must not be negative");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
