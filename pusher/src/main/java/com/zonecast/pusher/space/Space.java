package com.zonecast.pusher.space;

import com.zonecast.core.model.SpaceUser;
import com.zonecast.pusher.session.Session;
import com.zonecast.pusher.session.SessionId;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named group spanning rooms: the users published into it and the watchers with their filters.
 * <p>
 * Guarded by its own monitor; see {@link SpaceRegistry}.
 * </p>
 */
public class Space {
    @Getter
    private final String name;
    private final Map<SessionId, SpaceUser> users = new LinkedHashMap<>();
    private final Map<SessionId, Watcher> watchers = new LinkedHashMap<>();

    Space(String name) {
        this.name = name;
    }

    /**
     * Published users, in publication order.
     */
    public synchronized List<SpaceUser> users() {
        return new ArrayList<>(users.values());
    }

    public synchronized List<String> filterNames(Session session) {
        Watcher watcher = watchers.get(session.getId());
        return watcher == null ? List.of() : List.copyOf(watcher.filters.keySet());
    }

    synchronized boolean isEmpty() {
        return users.isEmpty() && watchers.isEmpty();
    }

    Map<SessionId, SpaceUser> usersById() {
        return users;
    }

    Map<SessionId, Watcher> watchers() {
        return watchers;
    }

    synchronized Watcher addWatcher(Session session) {
        return watchers.computeIfAbsent(session.getId(), id -> new Watcher(session));
    }

    /**
     * A session watching this space and the filters it registered, by name.
     */
    static final class Watcher {
        final Session session;
        final Map<String, FilterRegistration> filters = new LinkedHashMap<>();

        Watcher(Session session) {
            this.session = session;
        }
    }
}
