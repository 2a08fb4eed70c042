package com.zonecast.pusher.room;

import com.zonecast.pusher.session.Session;
import com.zonecast.pusher.zone.ZoneIndex;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Sessions connected to one room URL, and the zones they listen to.
 * <p>
 * All state is guarded by the room's own monitor.
 * </p>
 */
public class Room {
    @Getter
    private final String id;
    private final Set<Session> sessions = new LinkedHashSet<>();
    @Getter(AccessLevel.PACKAGE)
    private final ZoneIndex zones = new ZoneIndex();

    Room(String id) {
        this.id = id;
    }

    synchronized void add(Session session) {
        sessions.add(session);
    }

    synchronized boolean remove(Session session) {
        return sessions.remove(session);
    }

    public synchronized boolean isEmpty() {
        return sessions.isEmpty();
    }

    public synchronized int sessionCount() {
        return sessions.size();
    }

    public synchronized List<Session> sessions() {
        return List.copyOf(sessions);
    }

    public synchronized int zoneCount() {
        return zones.zoneCount();
    }
}
