package com.autocoin.infrastructure.stream;

import com.autocoin.domain.model.Tick;
import com.autocoin.util.RateLimitedLogger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Decodes Upbit stream frames into ticks.
 *
 * Frames are JSON objects (or arrays of them) tagged with {@code "type": "trade"} or
 * {@code "ticker"}. Binary frames carry the same JSON as UTF-8, behind a leading zero
 * flag byte, or raw-deflate compressed. Anything that does not decode yields no ticks.
 */
public class TickDecoder {
    private static final Logger log = LoggerFactory.getLogger(TickDecoder.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RateLimitedLogger malformedLog;

    public TickDecoder() {
        this(new RateLimitedLogger(log, Duration.ofSeconds(30)));
    }

    public TickDecoder(RateLimitedLogger malformedLog) {
        this.malformedLog = malformedLog;
    }

    public List<Tick> decodeText(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            malformedLog.warn("[STREAM] Skipping unparseable frame: {}", e.getOriginalMessage());
            return List.of();
        }
        if (root == null) {
            return List.of();
        }

        List<Tick> ticks = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode node : root) {
                decodeMessage(node, ticks);
            }
        } else {
            decodeMessage(root, ticks);
        }
        return ticks;
    }

    public List<Tick> decodeBinary(byte[] data) {
        if (data == null || data.length == 0) {
            return List.of();
        }

        byte first = data[0];
        if (first == '{' || first == '[') {
            return decodeText(new String(data, StandardCharsets.UTF_8));
        }
        if (first == 0) {
            return decodeText(new String(data, 1, data.length - 1, StandardCharsets.UTF_8));
        }

        try {
            return decodeText(inflate(data));
        } catch (DataFormatException e) {
            malformedLog.warn("[STREAM] Skipping undecodable binary frame (first byte {}): {}",
                first & 0xff, e.getMessage());
            return List.of();
        }
    }

    private void decodeMessage(JsonNode node, List<Tick> out) {
        String type = node.path("type").asText("");
        if (!"trade".equals(type) && !"ticker".equals(type)) {
            log.debug("[STREAM] Ignoring frame of type '{}'", type);
            return;
        }

        String code = node.path("code").asText(null);
        JsonNode price = node.get("trade_price");
        if (code == null || price == null || !price.isNumber()) {
            malformedLog.warn("[STREAM] Skipping {} frame without code or trade_price", type);
            return;
        }

        out.add(new Tick(
            code,
            node.path("timestamp").asLong(System.currentTimeMillis()),
            price.asDouble(),
            node.path("change_rate").asDouble(0.0),
            node.path("trade_volume").asDouble(0.0)
        ));
    }

    private static String inflate(byte[] data) throws DataFormatException {
        Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(data);
            ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * 4);
            byte[] buffer = new byte[4096];
            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0) {
                    if (inflater.needsInput() || inflater.needsDictionary()) {
                        break;
                    }
                }
                out.write(buffer, 0, n);
            }
            if (out.size() == 0) {
                throw new DataFormatException("No data inflated from " + Arrays.toString(
                    Arrays.copyOf(data, Math.min(4, data.length))) + "...");
            }
            return out.toString(StandardCharsets.UTF_8);
        } finally {
            inflater.end();
        }
    }
}
