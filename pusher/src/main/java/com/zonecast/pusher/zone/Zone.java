package com.zonecast.pusher.zone;

import com.zonecast.pusher.session.Session;
import lombok.Getter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Sessions whose viewport overlaps one cell. Not thread-safe: owned by a {@link ZoneIndex}.
 */
public class Zone {
    @Getter
    private final ZoneKey key;
    private final Set<Session> listeners = new LinkedHashSet<>();

    Zone(ZoneKey key) {
        this.key = key;
    }

    boolean add(Session session) {
        return listeners.add(session);
    }

    boolean remove(Session session) {
        return listeners.remove(session);
    }

    boolean isEmpty() {
        return listeners.isEmpty();
    }

    public List<Session> listeners() {
        return List.copyOf(listeners);
    }
}
