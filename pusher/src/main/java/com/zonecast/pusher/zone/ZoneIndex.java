package com.zonecast.pusher.zone;

import com.zonecast.pusher.session.Session;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Zones of one room. Zones are created on their first listener and dropped with their last.
 * <p>
 * Not thread-safe; callers hold the room monitor.
 * </p>
 */
public class ZoneIndex {
    private final Map<ZoneKey, Zone> zones = new HashMap<>();

    /**
     * Moves {@code session} to exactly {@code target} zones, firing leave events before enter events.
     */
    public ZoneDelta apply(Session session, Set<ZoneKey> target, ZoneEventListener listener) {
        Set<ZoneKey> current = session.getListenedZones();

        Set<ZoneKey> left = new LinkedHashSet<>(current);
        left.removeAll(target);
        Set<ZoneKey> entered = new LinkedHashSet<>(target);
        entered.removeAll(current);

        if (left.isEmpty() && entered.isEmpty()) {
            return ZoneDelta.EMPTY;
        }

        for (ZoneKey key : left) {
            Zone zone = zones.get(key);
            current.remove(key);
            if (zone == null || !zone.remove(session)) {
                continue;
            }
            List<Session> occupants = zone.listeners();
            if (zone.isEmpty()) {
                zones.remove(key);
            }
            listener.onLeave(key, session, occupants);
        }

        for (ZoneKey key : entered) {
            Zone zone = zones.computeIfAbsent(key, Zone::new);
            List<Session> occupants = zone.listeners();
            zone.add(session);
            current.add(key);
            listener.onEnter(key, session, occupants);
        }

        return new ZoneDelta(Set.copyOf(entered), Set.copyOf(left));
    }

    public ZoneDelta removeAll(Session session, ZoneEventListener listener) {
        return apply(session, Set.of(), listener);
    }

    /**
     * Sessions sharing at least one zone with {@code session}, each once, itself excluded.
     */
    public Collection<Session> observersOf(Session session) {
        Set<Session> observers = new LinkedHashSet<>();
        for (ZoneKey key : session.getListenedZones()) {
            Zone zone = zones.get(key);
            if (zone != null) {
                observers.addAll(zone.listeners());
            }
        }
        observers.remove(session);
        return observers;
    }

    public int zoneCount() {
        return zones.size();
    }
}
