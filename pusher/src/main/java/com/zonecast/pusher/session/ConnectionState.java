package com.zonecast.pusher.session;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one room connection.
 */
public enum ConnectionState {
    CONNECTING,
    REJECTED,
    UPGRADED,
    JOINED,
    STREAMING,
    CLOSING,
    CLOSED;

    static {
        CONNECTING.next = EnumSet.of(REJECTED, UPGRADED);
        REJECTED.next = EnumSet.noneOf(ConnectionState.class);
        UPGRADED.next = EnumSet.of(JOINED, CLOSING);
        JOINED.next = EnumSet.of(STREAMING, CLOSING);
        STREAMING.next = EnumSet.of(CLOSING);
        CLOSING.next = EnumSet.of(CLOSED);
        CLOSED.next = EnumSet.noneOf(ConnectionState.class);
    }

    private Set<ConnectionState> next;

    public boolean canTransitionTo(ConnectionState target) {
        return next.contains(target);
    }
}
