package com.zonecast.pusher.session;

/**
 * Ephemeral, node-local identifier of one room connection.
 */
public record SessionId(long value) {

    @Override
    public String toString() {
        return "session-" + value;
    }
}
