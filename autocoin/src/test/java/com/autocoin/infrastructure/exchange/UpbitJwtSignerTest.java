package com.autocoin.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class UpbitJwtSignerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final UpbitJwtSigner signer = new UpbitJwtSigner("access-123", "secret-456");

    @Test
    void token_withoutQueryHasNoQueryHash() throws Exception {
        JsonNode claims = claims(signer.token());

        assertEquals("access-123", claims.get("access_key").asText());
        assertFalse(claims.get("nonce").asText().isEmpty());
        assertTrue(claims.get("timestamp").asLong() > 0);
        assertFalse(claims.has("query_hash"));
    }

    @Test
    void token_withQueryCarriesSha512Hash() throws Exception {
        String query = "market=KRW-BTC&side=bid";
        JsonNode claims = claims(signer.token(query));

        assertEquals(UpbitJwtSigner.sha512Hex(query), claims.get("query_hash").asText());
        assertEquals("SHA512", claims.get("query_hash_alg").asText());
    }

    @Test
    void token_signatureIsHmacSha256OfHeaderAndPayload() throws Exception {
        String token = signer.token("uuid=abc");
        String[] parts = token.split("\\.");
        assertEquals(3, parts.length);

        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec("secret-456".getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        String expected = Base64.getUrlEncoder().withoutPadding()
            .encodeToString(mac.doFinal((parts[0] + "." + parts[1]).getBytes(StandardCharsets.UTF_8)));

        assertEquals(expected, parts[2]);
        JsonNode header = objectMapper.readTree(Base64.getUrlDecoder().decode(parts[0]));
        assertEquals("HS256", header.get("alg").asText());
    }

    @Test
    void token_usesFreshNonceEveryCall() throws Exception {
        assertNotEquals(claims(signer.token()).get("nonce").asText(), claims(signer.token()).get("nonce").asText());
    }

    @Test
    void sha512Hex_matchesKnownDigest() {
        assertEquals("ddaf35a193617abacc417349ae20413112e6fa4e89a97ea20a9eeee64b55d39a"
                + "2192992a274fc1a836ba3c23a3feebbd454d4423643ce80e2a9ac94fa54ca49f",
            UpbitJwtSigner.sha512Hex("abc"));
    }

    private JsonNode claims(String token) throws Exception {
        String payload = token.split("\\.")[1];
        return objectMapper.readTree(Base64.getUrlDecoder().decode(payload));
    }
}
