package com.zonecast.pusher.room;

import com.zonecast.core.model.Position;
import com.zonecast.core.model.Viewport;
import com.zonecast.pusher.session.Session;
import com.zonecast.pusher.zone.ZoneDelta;
import com.zonecast.pusher.zone.ZoneEventListener;
import com.zonecast.pusher.zone.ZoneGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Node-wide registry of rooms.
 * <p>
 * Rooms are created by the first join and removed by the last leave, both inside
 * {@link ConcurrentHashMap#compute} so a join never lands in a room that is being destroyed.
 * Zone bookkeeping and the notifications it triggers run under the room monitor.
 * </p>
 */
public class RoomRegistry {
    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final Map<String, Set<AdminRoomListener>> adminListeners = new ConcurrentHashMap<>();
    private final ZoneGrid grid;
    private final ZoneEventListener zoneListener;

    public RoomRegistry(ZoneGrid grid, ZoneEventListener zoneListener) {
        this.grid = grid;
        this.zoneListener = zoneListener;
    }

    /**
     * Adds the session to its room and to the zones its viewport overlaps.
     */
    public Room join(Session session) {
        Room room = rooms.compute(session.getRoomId(), (id, existing) -> {
            Room target = existing != null ? existing : new Room(id);
            target.add(session);
            return target;
        });

        synchronized (room) {
            room.getZones().apply(session, grid.zonesFor(room.getId(), session.getViewport()), zoneListener);
        }
        log.debug("Session {} joined room {}", session, room.getId());

        for (AdminRoomListener listener : adminListenersOf(room.getId())) {
            listener.onMemberJoin(session);
        }
        return room;
    }

    /**
     * Stores the new viewport and moves the session between zones. Unchanged viewports are a no-op.
     */
    public ZoneDelta updateViewport(Session session, Viewport viewport) {
        if (Objects.equals(session.getViewport(), viewport)) {
            return ZoneDelta.EMPTY;
        }
        Room room = rooms.get(session.getRoomId());
        if (room == null) {
            session.setViewport(viewport);
            return ZoneDelta.EMPTY;
        }
        synchronized (room) {
            session.setViewport(viewport);
            return room.getZones().apply(session, grid.zonesFor(room.getId(), viewport), zoneListener);
        }
    }

    /**
     * Stores the new position, applies the viewport when one is given, and tells every session
     * sharing a zone with the mover.
     */
    public void updatePosition(Session session, Position position, Viewport viewport) {
        session.setPosition(position);
        if (viewport != null) {
            updateViewport(session, viewport);
        }
        Room room = rooms.get(session.getRoomId());
        if (room == null) {
            return;
        }
        synchronized (room) {
            zoneListener.onMove(session, room.getZones().observersOf(session));
        }
    }

    /**
     * Removes the session from its zones and its room, destroying the room when it empties.
     */
    public void leave(Session session) {
        Room room = rooms.get(session.getRoomId());
        if (room == null) {
            return;
        }
        synchronized (room) {
            room.getZones().removeAll(session, zoneListener);
        }
        boolean[] removed = {false};
        rooms.computeIfPresent(room.getId(), (id, existing) -> {
            removed[0] = existing.remove(session);
            if (existing.isEmpty()) {
                log.debug("Room {} is empty, destroying it", id);
                return null;
            }
            return existing;
        });

        if (removed[0]) {
            log.debug("Session {} left room {}", session, room.getId());
            for (AdminRoomListener listener : adminListenersOf(room.getId())) {
                listener.onMemberLeave(session);
            }
        }
    }

    public Optional<Room> find(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    /**
     * Sessions of {@code userUuid} currently connected to {@code roomId}.
     */
    public List<Session> sessionsOf(String roomId, String userUuid) {
        return find(roomId)
            .map(room -> room.sessions().stream()
                .filter(session -> session.getUserUuid().equals(userUuid))
                .collect(Collectors.toList()))
            .orElse(List.of());
    }

    public int roomCount() {
        return rooms.size();
    }

    public void addAdminListener(String roomId, AdminRoomListener listener) {
        adminListeners.computeIfAbsent(roomId, id -> ConcurrentHashMap.newKeySet()).add(listener);
    }

    /**
     * Detaches the listener from every room it listens to.
     */
    public void removeAdminListener(AdminRoomListener listener) {
        for (String roomId : List.copyOf(adminListeners.keySet())) {
            adminListeners.computeIfPresent(roomId, (id, listeners) -> {
                listeners.remove(listener);
                return listeners.isEmpty() ? null : listeners;
            });
        }
    }

    private Set<AdminRoomListener> adminListenersOf(String roomId) {
        return adminListeners.getOrDefault(roomId, Set.of());
    }
}
