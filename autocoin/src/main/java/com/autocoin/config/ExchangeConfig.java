package com.autocoin.config;

import com.autocoin.util.Env;

import java.time.Duration;

/**
 * Exchange endpoints, credentials and request budget.
 *
 * @param streamType subscription type sent on connect, "trade" or "ticker"
 */
public record ExchangeConfig(
        String accessKey,
        String secretKey,
        String apiUrl,
        String wsUrl,
        int rateLimitRequests,
        Duration rateLimitWindow,
        String streamType) {

    public static final String DEFAULT_API_URL = "https://api.upbit.com/v1";
    public static final String DEFAULT_WS_URL = "wss://api.upbit.com/websocket/v1";

    public static ExchangeConfig fromEnv() {
        return new ExchangeConfig(
            Env.get("UPBIT_ACCESS_KEY", ""),
            Env.get("UPBIT_SECRET_KEY", ""),
            Env.get("UPBIT_API_URL", DEFAULT_API_URL),
            Env.get("UPBIT_WS_URL", DEFAULT_WS_URL),
            Env.getInt("UPBIT_RATE_LIMIT_REQUESTS", 10),
            Duration.ofMillis(Env.getLong("UPBIT_RATE_LIMIT_WINDOW_MS", 1000)),
            Env.get("UPBIT_STREAM_TYPE", "trade")
        );
    }

    @Override
    public String toString() {
        // keep credentials out of logs
        return "ExchangeConfig[apiUrl=" + apiUrl + ", wsUrl=" + wsUrl
            + ", rateLimit=" + rateLimitRequests + "/" + rateLimitWindow.toMillis() + "ms"
            + ", streamType=" + streamType + "]";
    }
}
