package com.zonecast.core.auth;

import com.fasterxml.jackson.core.type.TypeReference;
import com.zonecast.core.hash.Hashers;
import com.zonecast.core.util.JsonUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HMAC-signed, expiring claim tokens.
 * <p>
 * <b>Token format:</b> {@code base64url(claimsJson).hmacHex}
 * <ul>
 *   <li>{@code claimsJson}: JSON object of claims, always containing {@code exp} (epoch seconds)</li>
 *   <li>{@code hmacHex}: HMAC-SHA256 over the encoded claims part</li>
 * </ul>
 * </p>
 * <p>
 * Used for room access tokens, admin socket tokens (claim {@code authorizedRoomIds})
 * and the chat credentials fabricated by the gateway (claim {@code jid}).
 * </p>
 */
public final class SignedToken {
    public static final String EXPIRES_AT = "exp";

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String DELIMITER = ".";
    private static final TypeReference<LinkedHashMap<String, Object>> CLAIMS_TYPE = new TypeReference<>() {
    };

    private SignedToken() {
    }

    /**
     * Generates a signed token.
     *
     * @param claims    Claims to embed (must be JSON serializable)
     * @param expiresAt Expiry instant
     * @param secret    HMAC secret key (must be same across cluster)
     * @return token string
     */
    public static String generate(Map<String, ?> claims, Instant expiresAt, String secret) {
        Map<String, Object> payload = new LinkedHashMap<>(claims);
        payload.put(EXPIRES_AT, expiresAt.getEpochSecond());
        String encoded = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(JsonUtils.writeValueAsBytes(payload));
        return encoded + DELIMITER + computeHmac(encoded, secret);
    }

    /**
     * Verifies a token and returns its claims.
     *
     * @param token  token string
     * @param secret HMAC secret key
     * @param now    verification instant
     * @return claims, including {@code exp}
     * @throws SignedTokenException if the token is malformed, its signature mismatches or it expired
     */
    public static Map<String, Object> verify(String token, String secret, Instant now) {
        if (token == null || token.isBlank()) {
            throw new SignedTokenException("Token is empty");
        }
        int sep = token.lastIndexOf(DELIMITER);
        if (sep <= 0 || sep == token.length() - 1) {
            throw new SignedTokenException("Token is malformed");
        }
        String encoded = token.substring(0, sep);
        String providedHmac = token.substring(sep + 1);

        String expectedHmac = computeHmac(encoded, secret);
        if (!MessageDigest.isEqual(expectedHmac.getBytes(StandardCharsets.UTF_8),
                providedHmac.getBytes(StandardCharsets.UTF_8))) {
            throw new SignedTokenException("Invalid token signature");
        }

        Map<String, Object> claims;
        try {
            String json = new String(Base64.getUrlDecoder().decode(encoded), StandardCharsets.UTF_8);
            claims = JsonUtils.readValue(json, CLAIMS_TYPE);
        } catch (RuntimeException e) {
            throw new SignedTokenException("Token claims are unreadable", e);
        }

        Object exp = claims.get(EXPIRES_AT);
        if (!(exp instanceof Number)) {
            throw new SignedTokenException("Token has no expiry");
        }
        if (now.getEpochSecond() >= ((Number) exp).longValue()) {
            throw new SignedTokenException("Token expired");
        }
        return claims;
    }

    public static Map<String, Object> verify(String token, String secret) {
        return verify(token, secret, Instant.now());
    }

    private static String computeHmac(String data, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            SecretKeySpec keySpec = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
            mac.init(keySpec);
            return Hashers.toHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute HMAC", e);
        }
    }
}
