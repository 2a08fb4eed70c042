package com.zonecast.pusher.admin;

import com.zonecast.core.auth.SignedToken;
import com.zonecast.core.auth.SignedTokenException;
import com.zonecast.pusher.external.InvalidTokenException;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Verifies admin socket tokens. The {@code authorizedRoomIds} claim lists the rooms the
 * bearer may listen to and message.
 */
public class AdminTokenVerifier {
    public static final String AUTHORIZED_ROOM_IDS = "authorizedRoomIds";

    private final String secret;
    private final Clock clock;

    public AdminTokenVerifier(String secret, Clock clock) {
        this.secret = secret;
        this.clock = clock;
    }

    public Set<String> verify(String token) {
        Map<String, Object> claims;
        try {
            claims = SignedToken.verify(token, secret, clock.instant());
        } catch (SignedTokenException e) {
            throw new InvalidTokenException(e.getMessage(), e);
        }
        Object rooms = claims.get(AUTHORIZED_ROOM_IDS);
        if (!(rooms instanceof List)) {
            throw new InvalidTokenException("Token has no " + AUTHORIZED_ROOM_IDS);
        }
        Set<String> authorized = new LinkedHashSet<>();
        for (Object room : (List<?>) rooms) {
            if (room instanceof String) {
                authorized.add((String) room);
            }
        }
        return authorized;
    }
}
