package com.autocoin.infrastructure.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Embedded Undertow server exposing /metrics (Prometheus) and /health (JSON).
 *
 * /metrics honours the Accept header (text 0.0.4 or OpenMetrics) and an optional
 * {@code name[]} query parameter selecting metric families.
 */
public final class MetricsServer {
    private static final Logger log = LoggerFactory.getLogger(MetricsServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String host;
    private final int port;
    private final CollectorRegistry registry;
    private final Supplier<Map<String, Object>> healthSupplier;

    private Undertow server;

    public MetricsServer(String host, int port, CollectorRegistry registry,
                         Supplier<Map<String, Object>> healthSupplier) {
        this.host = host;
        this.port = port;
        this.registry = registry;
        this.healthSupplier = healthSupplier;
    }

    public synchronized void start() {
        if (server != null) {
            return;
        }
        server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(Handlers.path()
                .addExactPath("/metrics", this::handleMetrics)
                .addExactPath("/health", this::handleHealth))
            .build();
        server.start();
        log.info("[METRICS] ✓ Serving /metrics and /health on http://{}:{}", host, port);
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop();
            server = null;
            log.info("[METRICS] Stopped");
        }
    }

    private void handleMetrics(HttpServerExchange exchange) {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Deque<String> names = exchange.getQueryParameters().get("name[]");
        Set<String> included = names == null ? Set.of() : new HashSet<>(names);

        try {
            Writer writer = new StringWriter();
            TextFormat.writeFormat(contentType, writer, included.isEmpty()
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(included));
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
            exchange.setStatusCode(200);
            exchange.getResponseSender().send(writer.toString());
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }

    private void handleHealth(HttpServerExchange exchange) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        try {
            Map<String, Object> status = healthSupplier.get();
            exchange.setStatusCode(200);
            exchange.getResponseSender().send(MAPPER.writeValueAsString(status));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[METRICS] Health check failed: {}", e.getMessage());
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("{\"status\":\"error\"}");
        }
    }
}
