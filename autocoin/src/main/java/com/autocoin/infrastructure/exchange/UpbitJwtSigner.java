package com.autocoin.infrastructure.exchange;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.UUID;

/**
 * Builds the HS256 bearer token Upbit expects on authenticated calls.
 *
 * Claims: access_key, nonce (random UUID), timestamp (epoch millis) and, when the
 * request carries parameters, query_hash (hex SHA-512 of the query string) with
 * query_hash_alg=SHA512.
 */
public final class UpbitJwtSigner {

    private static final String HEADER = base64Url("{\"alg\":\"HS256\",\"typ\":\"JWT\"}");

    private final String accessKey;
    private final String secretKey;

    public UpbitJwtSigner(String accessKey, String secretKey) {
        this.accessKey = accessKey;
        this.secretKey = secretKey;
    }

    public String token() {
        return token(null);
    }

    /**
     * @param queryString url-encoded parameters ({@code a=1&b=2}), or null when there are none
     */
    public String token(String queryString) {
        StringBuilder claims = new StringBuilder()
            .append("{\"access_key\":\"").append(accessKey).append('"')
            .append(",\"nonce\":\"").append(UUID.randomUUID()).append('"')
            .append(",\"timestamp\":").append(System.currentTimeMillis());

        if (queryString != null && !queryString.isEmpty()) {
            claims.append(",\"query_hash\":\"").append(sha512Hex(queryString)).append('"')
                .append(",\"query_hash_alg\":\"SHA512\"");
        }
        claims.append('}');

        String payload = base64Url(claims.toString());
        return HEADER + "." + payload + "." + sign(HEADER + "." + payload);
    }

    private String sign(String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to sign JWT", e);
        }
    }

    static String sha512Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-512");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 not available", e);
        }
    }

    private static String base64Url(String data) {
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(data.getBytes(StandardCharsets.UTF_8));
    }
}
