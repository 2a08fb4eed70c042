package com.zonecast.pusher.external;

public interface IdentityVerifier {

    /**
     * @throws InvalidTokenException when the token does not verify
     */
    Identity verify(String token);
}
