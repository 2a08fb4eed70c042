package com.zonecast.pusher.external;

import lombok.Value;

/**
 * Who a verified room token belongs to.
 */
@Value
public class Identity {
    String identifier;

    /**
     * Present for logged-in users only.
     */
    String accessToken;

    public boolean isLogged() {
        return accessToken != null && !accessToken.isEmpty();
    }
}
