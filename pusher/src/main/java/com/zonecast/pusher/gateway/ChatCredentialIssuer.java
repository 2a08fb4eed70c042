package com.zonecast.pusher.gateway;

import com.zonecast.core.auth.SignedToken;
import lombok.Value;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Chat identities handed to clients on join.
 * <p>
 * Members the admin API knows keep their chat id with a fresh resource appended. Everyone
 * else gets {@code identifier@domain/resource} and, when a signing secret is configured,
 * a one-day signed password.
 * </p>
 */
public class ChatCredentialIssuer {
    public static final String PLACEHOLDER_PASSWORD = "no_password_set";
    static final Duration PASSWORD_VALIDITY = Duration.ofDays(1);

    private final String domain;
    private final String secret;
    private final Clock clock;

    public ChatCredentialIssuer(String domain, String secret, Clock clock) {
        this.domain = domain;
        this.secret = secret;
        this.clock = clock;
    }

    public ChatCredentials issue(String identifier, String knownJid, String knownPassword) {
        String resource = UUID.randomUUID().toString();
        if (knownJid != null && !knownJid.isEmpty()) {
            return new ChatCredentials(knownJid + "/" + resource, knownPassword);
        }
        String jid = identifier + "@" + domain + "/" + resource;
        if (secret == null || secret.isEmpty()) {
            return new ChatCredentials(jid, PLACEHOLDER_PASSWORD);
        }
        String password = SignedToken.generate(Map.of("jid", jid), clock.instant().plus(PASSWORD_VALIDITY), secret);
        return new ChatCredentials(jid, password);
    }

    @Value
    public static class ChatCredentials {
        String jid;
        String password;
    }
}
