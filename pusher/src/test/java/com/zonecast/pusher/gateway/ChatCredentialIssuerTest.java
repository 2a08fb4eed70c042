package com.zonecast.pusher.gateway;

import com.zonecast.core.auth.SignedToken;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatCredentialIssuerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void knownMembersKeepTheirChatId() {
        ChatCredentialIssuer issuer = new ChatCredentialIssuer("chat.test", "secret", CLOCK);

        ChatCredentialIssuer.ChatCredentials credentials = issuer.issue("alice", "alice@chat.corp", "pw");

        assertTrue(credentials.getJid().startsWith("alice@chat.corp/"));
        assertEquals("pw", credentials.getPassword());
    }

    @Test
    void everyConnectionGetsItsOwnResource() {
        ChatCredentialIssuer issuer = new ChatCredentialIssuer("chat.test", null, CLOCK);

        assertNotEquals(issuer.issue("alice", null, null).getJid(), issuer.issue("alice", null, null).getJid());
    }

    @Test
    void fabricatedPasswordIsASignedTokenValidForOneDay() {
        ChatCredentialIssuer issuer = new ChatCredentialIssuer("chat.test", "secret", CLOCK);

        ChatCredentialIssuer.ChatCredentials credentials = issuer.issue("bob", null, null);

        assertTrue(credentials.getJid().startsWith("bob@chat.test/"));
        Map<String, Object> claims = SignedToken.verify(credentials.getPassword(), "secret", NOW.plusSeconds(3600));
        assertEquals(credentials.getJid(), claims.get("jid"));
    }

    @Test
    void withoutSecretThePasswordIsAPlaceholder() {
        ChatCredentialIssuer issuer = new ChatCredentialIssuer("chat.test", "", CLOCK);

        assertEquals(ChatCredentialIssuer.PLACEHOLDER_PASSWORD, issuer.issue("bob", null, null).getPassword());
    }
}
