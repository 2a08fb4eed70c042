package com.zonecast.pusher.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a pusher node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class PusherConfig {

    String nodeId;
    int httpPort;

    /**
     * Protocol version hash clients must present; any other value is refused with a 419.
     */
    String apiVersionHash;
    boolean disableAnonymous;

    /**
     * HMAC secret of room access tokens.
     */
    String secretKey;

    /**
     * HMAC secret of admin socket tokens. {@code null} disables the admin overlay.
     */
    String adminSocketsToken;

    /**
     * Base URL of the admin API. {@code null} selects the local member-data provider.
     */
    String adminApiUrl;
    String adminApiToken;

    String chatDomain;

    /**
     * Secret used to sign fabricated chat credentials. {@code null} yields a placeholder password.
     */
    String chatJwtSecret;

    String textureBaseUrl;

    int zoneWidth;
    int zoneHeight;

    Duration batchDelay;
    int batchMaxMessages;
    long maxBackpressureBytes;
    int maxDeferredMessages;

    Duration pingInterval;
    Duration pongTimeout;
    Duration idleTimeout;
    int maxPayloadLength;

    public boolean isAdminOverlayEnabled() {
        return adminSocketsToken != null && !adminSocketsToken.isBlank();
    }

    public static PusherConfig fromEnv() {
        return PusherConfig.builder()
                .nodeId(getEnv("NODE_ID", "pusher-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .apiVersionHash(getEnv("API_VERSION_HASH", "dev"))
                .disableAnonymous(Boolean.parseBoolean(getEnv("DISABLE_ANONYMOUS", "false")))
                .secretKey(getEnv("SECRET_KEY", "change-me"))
                .adminSocketsToken(getEnv("ADMIN_SOCKETS_TOKEN", null))
                .adminApiUrl(getEnv("ADMIN_API_URL", null))
                .adminApiToken(getEnv("ADMIN_API_TOKEN", null))
                .chatDomain(getEnv("EJABBERD_DOMAIN", "chat.zonecast.localhost"))
                .chatJwtSecret(getEnv("EJABBERD_JWT_SECRET", null))
                .textureBaseUrl(getEnv("TEXTURE_BASE_URL", "/resources/characters/"))
                .zoneWidth(Integer.parseInt(getEnv("ZONE_WIDTH", "320")))
                .zoneHeight(Integer.parseInt(getEnv("ZONE_HEIGHT", "320")))
                .batchDelay(Duration.ofMillis(Long.parseLong(getEnv("BATCH_DELAY_MS", "100"))))
                .batchMaxMessages(Integer.parseInt(getEnv("BATCH_MAX_MESSAGES", "100")))
                .maxBackpressureBytes(Long.parseLong(getEnv("MAX_BACKPRESSURE_BYTES", "65536")))
                .maxDeferredMessages(Integer.parseInt(getEnv("MAX_DEFERRED_MESSAGES", "1000")))
                .pingInterval(Duration.ofSeconds(Long.parseLong(getEnv("PING_INTERVAL_SEC", "29"))))
                .pongTimeout(Duration.ofSeconds(Long.parseLong(getEnv("PONG_TIMEOUT_SEC", "20"))))
                .idleTimeout(Duration.ofSeconds(Long.parseLong(getEnv("SOCKET_IDLE_TIMER_SEC", "120"))))
                .maxPayloadLength(Integer.parseInt(getEnv("MAX_PAYLOAD_LENGTH", String.valueOf(16 * 1024 * 1024))))
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
