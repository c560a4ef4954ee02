package com.autocoin.infrastructure.exchange;

import com.autocoin.application.port.output.ExchangeClient;
import com.autocoin.config.ExchangeConfig;
import com.autocoin.domain.model.Order;
import com.autocoin.domain.model.OrderSide;
import com.autocoin.domain.model.OrderStatus;
import com.autocoin.infrastructure.exchange.ExchangeException.ErrorKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Upbit REST client.
 *
 * Features:
 * - Market buy (ord_type=price, spend a KRW amount) and market sell (ord_type=market, volume)
 * - Order lookup by uuid
 * - KRW balance (balance minus locked)
 * - KRW market listing
 *
 * Every call goes through the shared {@link RateLimiter}. Failures are reported as
 * {@link ExchangeException}; HTTP 429 is RATE_LIMITED, 401/403 INVALID_CREDENTIALS,
 * 5xx SERVER_ERROR, other 4xx REJECTED, I/O failures NETWORK.
 *
 * API Docs: https://docs.upbit.com/reference
 */
public class UpbitExchangeClient implements ExchangeClient {
    private static final Logger log = LoggerFactory.getLogger(UpbitExchangeClient.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .build();

    private final String baseUrl;
    private final UpbitJwtSigner signer;
    private final RateLimiter rateLimiter;

    public UpbitExchangeClient(ExchangeConfig config, RateLimiter rateLimiter) {
        this.baseUrl = stripTrailingSlash(config.apiUrl());
        this.signer = new UpbitJwtSigner(config.accessKey(), config.secretKey());
        this.rateLimiter = rateLimiter;
    }

    @Override
    public Order buyMarketOrder(String market, double amountQuote) {
        log.info("[UPBIT] Placing market buy: {} for {} KRW", market, amountQuote);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("market", market);
        params.put("side", OrderSide.BID.wireValue());
        params.put("ord_type", "price");
        params.put("price", plain(amountQuote));

        Order order = parseOrder("buy", postSigned("buy", "/orders", params));
        log.info("[UPBIT] Buy accepted: id={} status={} executedVolume={}",
            order.id(), order.status(), order.executedVolume());
        return order;
    }

    @Override
    public Order sellMarketOrder(String market, double volume) {
        log.info("[UPBIT] Placing market sell: {} volume={}", market, volume);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("market", market);
        params.put("side", OrderSide.ASK.wireValue());
        params.put("ord_type", "market");
        params.put("volume", plain(volume));

        Order order = parseOrder("sell", postSigned("sell", "/orders", params));
        log.info("[UPBIT] Sell accepted: id={} status={} executedVolume={}",
            order.id(), order.status(), order.executedVolume());
        return order;
    }

    @Override
    public Order getOrder(String orderId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("uuid", orderId);
        return parseOrder("get_order", getSigned("get_order", "/order", params));
    }

    @Override
    public double getBalance() {
        JsonNode accounts = getSigned("get_balance", "/accounts", Map.of());
        if (!accounts.isArray()) {
            throw new ExchangeException(ErrorKind.MALFORMED_RESPONSE, "get_balance",
                "Expected an array of accounts");
        }

        for (JsonNode account : accounts) {
            if ("KRW".equals(account.path("currency").asText())) {
                double balance = account.path("balance").asDouble(0.0);
                double locked = account.path("locked").asDouble(0.0);
                return balance - locked;
            }
        }
        return 0.0;
    }

    @Override
    public List<String> getTopKrwMarkets(int limit) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/market/all"))
            .timeout(REQUEST_TIMEOUT)
            .header("Accept", "application/json")
            .GET()
            .build();

        JsonNode markets = execute("get_markets", request);
        if (!markets.isArray()) {
            throw new ExchangeException(ErrorKind.MALFORMED_RESPONSE, "get_markets",
                "Expected an array of markets");
        }

        List<String> result = new ArrayList<>();
        for (JsonNode m : markets) {
            String code = m.path("market").asText("");
            if (code.startsWith("KRW-")) {
                result.add(code);
                if (result.size() >= limit) {
                    break;
                }
            }
        }
        log.info("[UPBIT] Loaded {} KRW markets", result.size());
        return result;
    }

    private JsonNode getSigned(String operation, String path, Map<String, String> params) {
        String query = queryString(params);
        String uri = baseUrl + path + (query.isEmpty() ? "" : "?" + query);

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(uri))
            .timeout(REQUEST_TIMEOUT)
            .header("Authorization", "Bearer " + signer.token(query))
            .header("Accept", "application/json")
            .GET()
            .build();

        return execute(operation, request);
    }

    private JsonNode postSigned(String operation, String path, Map<String, String> params) {
        ObjectNode body = objectMapper.createObjectNode();
        params.forEach(body::put);

        String payload;
        try {
            payload = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ExchangeException(ErrorKind.REJECTED, operation, "Failed to encode request", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(REQUEST_TIMEOUT)
            .header("Authorization", "Bearer " + signer.token(queryString(params)))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(payload))
            .build();

        return execute(operation, request);
    }

    private JsonNode execute(String operation, HttpRequest request) {
        HttpResponse<String> response;
        try {
            rateLimiter.acquire();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeException(ErrorKind.NETWORK, operation, "Interrupted", e);
        } catch (IOException e) {
            log.warn("[UPBIT] {} request failed: {}", operation, e.toString());
            throw new ExchangeException(ErrorKind.NETWORK, operation, "Request failed: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String detail = errorDetail(response.body());
            log.error("[UPBIT] {} HTTP {}: {}", operation, status, detail);
            throw ExchangeException.fromHttpStatus(operation, status, detail);
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new ExchangeException(ErrorKind.MALFORMED_RESPONSE, operation,
                "Unparseable response body", e);
        }
    }

    private Order parseOrder(String operation, JsonNode node) {
        String id = node.path("uuid").asText(null);
        String market = node.path("market").asText(null);
        if (id == null || market == null) {
            throw new ExchangeException(ErrorKind.MALFORMED_RESPONSE, operation,
                "Order response missing uuid or market");
        }

        OrderSide side;
        try {
            side = OrderSide.fromWireValue(node.path("side").asText(""));
        } catch (IllegalArgumentException e) {
            throw new ExchangeException(ErrorKind.MALFORMED_RESPONSE, operation, e.getMessage(), e);
        }

        double executedAmount = node.has("executed_amount")
            ? node.path("executed_amount").asDouble(0.0)
            : node.path("executed_funds").asDouble(0.0);

        return new Order(
            id,
            market,
            side,
            node.path("price").asDouble(0.0),
            node.path("volume").asDouble(0.0),
            OrderStatus.fromExchangeState(node.path("state").asText(null)),
            node.path("executed_volume").asDouble(0.0),
            executedAmount,
            parseTime(node.path("created_at").asText(null))
        );
    }

    private String errorDetail(String body) {
        if (body == null || body.isBlank()) {
            return "empty body";
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isObject()) {
                return error.path("name").asText("unknown") + " - " + error.path("message").asText("");
            }
        } catch (JsonProcessingException e) {
            log.debug("[UPBIT] Non-JSON error body: {}", e.getMessage());
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    private static Instant parseTime(String value) {
        if (value == null || value.isEmpty()) {
            return Instant.now();
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return Instant.now();
        }
    }

    static String queryString(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        params.forEach((k, v) -> joiner.add(
            URLEncoder.encode(k, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(v, StandardCharsets.UTF_8)));
        return joiner.toString();
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
