package com.zonecast.pusher.session;

import com.zonecast.pusher.batch.OutboundChannel;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates sessions with node-unique ids.
 */
public class SessionFactory {
    private final AtomicLong nextId = new AtomicLong(1);

    public Session create(SessionSeed seed, OutboundChannel channel, ConnectionStateMachine state) {
        return new Session(new SessionId(nextId.getAndIncrement()), seed, channel, state);
    }
}
