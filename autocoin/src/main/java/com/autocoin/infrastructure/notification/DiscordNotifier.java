package com.autocoin.infrastructure.notification;

import com.autocoin.application.port.output.TradeNotifier;
import com.autocoin.domain.model.Order;
import com.autocoin.domain.model.OrderResult;
import com.autocoin.domain.model.OrderSide;
import com.autocoin.domain.model.Signal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

/**
 * Posts embeds to a Discord webhook.
 *
 * Delivery is best effort: every failure is logged here and nothing is thrown.
 */
public class DiscordNotifier implements TradeNotifier {
    private static final Logger log = LoggerFactory.getLogger(DiscordNotifier.class);

    static final int COLOR_BUY = 3066993;
    static final int COLOR_SELL = 15158332;
    static final int COLOR_SIGNAL = 16776960;
    static final int COLOR_ERROR = 15105570;
    static final int COLOR_INFO = 3447003;

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(TIMEOUT)
        .build();

    private final String webhookUrl;

    public DiscordNotifier(String webhookUrl) {
        this.webhookUrl = webhookUrl;
    }

    @Override
    public void notifyOrderResult(OrderResult result) {
        Order order = result.order();
        if (!result.success()) {
            ObjectNode embed = embed("Order failed", COLOR_ERROR);
            field(embed, "Market", order.market(), true);
            field(embed, "Side", order.side().name(), true);
            field(embed, "Error", result.error() == null ? "unknown" : result.error(), false);
            send(embed);
            return;
        }

        boolean buy = order.side() == OrderSide.BID;
        String outcome = order.hasFill() ? "executed" : "placed, awaiting fill";
        ObjectNode embed = embed((buy ? "Buy " : "Sell ") + outcome, buy ? COLOR_BUY : COLOR_SELL);
        field(embed, "Market", order.market(), true);
        field(embed, "Price", String.format("%.0f KRW", order.averagePrice()), true);
        field(embed, "Volume", String.format("%.6f", order.executedVolume()), true);
        field(embed, "Amount", String.format("%.0f KRW", order.executedAmount()), true);
        field(embed, "Order", order.id(), false);
        send(embed);
    }

    @Override
    public void notifySignal(Signal signal) {
        ObjectNode embed = embed("Signal: " + signal.type(), COLOR_SIGNAL);
        embed.put("description", signal.reason());
        field(embed, "Market", signal.market(), true);
        field(embed, "Confidence", String.format("%.0f%%", signal.confidence() * 100.0), true);
        send(embed);
    }

    @Override
    public void notifyError(String title, String message) {
        ObjectNode embed = embed(title, COLOR_ERROR);
        embed.put("description", message);
        send(embed);
    }

    /**
     * Plain informational message, used for lifecycle events.
     */
    public void notifyInfo(String title, String message) {
        ObjectNode embed = embed(title, COLOR_INFO);
        embed.put("description", message);
        send(embed);
    }

    private ObjectNode embed(String title, int color) {
        ObjectNode embed = objectMapper.createObjectNode();
        embed.put("title", title);
        embed.put("color", color);
        embed.put("timestamp", Instant.now().toString());
        embed.putArray("fields");
        return embed;
    }

    private static void field(ObjectNode embed, String name, String value, boolean inline) {
        ObjectNode field = ((ArrayNode) embed.get("fields")).addObject();
        field.put("name", name);
        field.put("value", value);
        field.put("inline", inline);
    }

    private void send(ObjectNode embed) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.putArray("embeds").add(embed);

        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(webhookUrl))
                .timeout(TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.warn("[DISCORD] Webhook returned HTTP {}: {}", response.statusCode(), response.body());
            }
        } catch (JsonProcessingException e) {
            log.warn("[DISCORD] Failed to encode payload: {}", e.getMessage());
        } catch (IOException | IllegalArgumentException e) {
            log.warn("[DISCORD] Failed to send webhook: {}", e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[DISCORD] Interrupted while sending webhook");
        }
    }
}
