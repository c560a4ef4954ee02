package com.autocoin.infrastructure.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UpbitWebSocketConnectionTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void subscriptionMessage_isSingleObjectWithTicketTypeAndCodes() throws Exception {
        String json = UpbitWebSocketConnection.subscriptionMessage(
            "ticket-1", "trade", List.of("KRW-BTC", "KRW-ETH"));

        JsonNode node = objectMapper.readTree(json);
        assertTrue(node.isObject());
        assertEquals("ticket-1", node.path("ticket").asText());
        assertEquals("trade", node.path("type").asText());
        assertEquals(2, node.path("codes").size());
        assertEquals("KRW-BTC", node.path("codes").get(0).asText());
        assertEquals("KRW-ETH", node.path("codes").get(1).asText());
    }

    @Test
    void subscriptionMessage_emptyMarketsGivesEmptyCodes() throws Exception {
        JsonNode node = objectMapper.readTree(
            UpbitWebSocketConnection.subscriptionMessage("t", "ticker", List.of()));

        assertTrue(node.path("codes").isArray());
        assertEquals(0, node.path("codes").size());
    }
}
