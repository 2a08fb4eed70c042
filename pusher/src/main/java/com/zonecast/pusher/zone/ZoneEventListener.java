package com.zonecast.pusher.zone;

import com.zonecast.pusher.session.Session;

import java.util.Collection;

/**
 * Receives zone membership changes. Called while the owning room is locked, so
 * implementations must not block.
 */
public interface ZoneEventListener {

    /**
     * {@code entering} started listening to {@code zone}; {@code occupants} were already there.
     * Both sides are to be told about each other.
     */
    void onEnter(ZoneKey zone, Session entering, Collection<Session> occupants);

    /**
     * {@code leaving} stopped listening to {@code zone}; {@code occupants} remain.
     */
    void onLeave(ZoneKey zone, Session leaving, Collection<Session> occupants);

    /**
     * {@code mover} changed position; {@code observers} share at least one zone with it.
     */
    void onMove(Session mover, Collection<Session> observers);
}
