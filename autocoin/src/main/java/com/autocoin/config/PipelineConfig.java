package com.autocoin.config;

import com.autocoin.util.Env;

import java.time.Duration;

/**
 * Channel sizes, retry budgets and shutdown timing for the pipeline.
 */
public record PipelineConfig(
        int channelCapacity,
        int tickWindowCapacity,
        int orderMaxAttempts,
        int streamMaxRetries,
        Duration streamRetryDelay,
        int orderFillPollAttempts,
        Duration orderFillPollInterval,
        Duration shutdownGrace,
        Duration riskPositionRefresh) {

    public static PipelineConfig defaults() {
        return new PipelineConfig(
            1000,
            10_000,
            3,
            5,
            Duration.ofSeconds(5),
            5,
            Duration.ofMillis(500),
            Duration.ofSeconds(60),
            Duration.ofSeconds(1)
        );
    }

    public static PipelineConfig fromEnv() {
        PipelineConfig d = defaults();
        return new PipelineConfig(
            Env.getInt("CHANNEL_CAPACITY", d.channelCapacity()),
            Env.getInt("TICK_WINDOW_CAPACITY", d.tickWindowCapacity()),
            Env.getInt("ORDER_MAX_ATTEMPTS", d.orderMaxAttempts()),
            Env.getInt("STREAM_MAX_RETRIES", d.streamMaxRetries()),
            Duration.ofMillis(Env.getLong("STREAM_RETRY_DELAY_MS", d.streamRetryDelay().toMillis())),
            Env.getInt("ORDER_FILL_POLL_ATTEMPTS", d.orderFillPollAttempts()),
            Duration.ofMillis(Env.getLong("ORDER_FILL_POLL_INTERVAL_MS", d.orderFillPollInterval().toMillis())),
            Duration.ofSeconds(Env.getLong("SHUTDOWN_GRACE_SECONDS", d.shutdownGrace().toSeconds())),
            Duration.ofMillis(Env.getLong("RISK_POSITION_REFRESH_MS", d.riskPositionRefresh().toMillis()))
        );
    }
}
