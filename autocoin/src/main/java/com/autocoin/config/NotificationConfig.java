package com.autocoin.config;

import com.autocoin.util.Env;

/**
 * Discord webhook target and per-event switches. An empty URL disables notifications.
 */
public record NotificationConfig(
        String webhookUrl,
        boolean notifyOnBuy,
        boolean notifyOnSell,
        boolean notifyOnSignal,
        boolean notifyOnError) {

    public static NotificationConfig disabled() {
        return new NotificationConfig("", false, false, false, false);
    }

    public static NotificationConfig fromEnv() {
        return new NotificationConfig(
            Env.get("DISCORD_WEBHOOK_URL", ""),
            Env.getBool("NOTIFY_ON_BUY", true),
            Env.getBool("NOTIFY_ON_SELL", true),
            Env.getBool("NOTIFY_ON_SIGNAL", true),
            Env.getBool("NOTIFY_ON_ERROR", true)
        );
    }

    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }
}
