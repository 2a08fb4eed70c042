package com.zonecast.pusher.external;

import com.zonecast.core.auth.SignedToken;
import com.zonecast.core.auth.SignedTokenException;

import java.time.Clock;
import java.util.Map;

/**
 * Verifies room tokens signed with the node's secret key. Claims: {@code identifier} and,
 * for logged users, {@code accessToken}.
 */
public class SignedTokenIdentityVerifier implements IdentityVerifier {
    public static final String IDENTIFIER = "identifier";
    public static final String ACCESS_TOKEN = "accessToken";

    private final String secretKey;
    private final Clock clock;

    public SignedTokenIdentityVerifier(String secretKey) {
        this(secretKey, Clock.systemUTC());
    }

    public SignedTokenIdentityVerifier(String secretKey, Clock clock) {
        this.secretKey = secretKey;
        this.clock = clock;
    }

    @Override
    public Identity verify(String token) {
        Map<String, Object> claims;
        try {
            claims = SignedToken.verify(token, secretKey, clock.instant());
        } catch (SignedTokenException e) {
            throw new InvalidTokenException(e.getMessage(), e);
        }
        Object identifier = claims.get(IDENTIFIER);
        if (!(identifier instanceof String) || ((String) identifier).isEmpty()) {
            throw new InvalidTokenException("Token has no identifier");
        }
        Object accessToken = claims.get(ACCESS_TOKEN);
        return new Identity((String) identifier, accessToken instanceof String ? (String) accessToken : null);
    }
}
