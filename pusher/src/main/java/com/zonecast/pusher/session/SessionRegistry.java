package com.zonecast.pusher.session;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open room sessions of this node.
 */
public class SessionRegistry {
    private final Map<SessionId, Session> sessions = new ConcurrentHashMap<>();

    public void add(Session session) {
        sessions.put(session.getId(), session);
    }

    public void remove(Session session) {
        sessions.remove(session.getId());
    }

    public int size() {
        return sessions.size();
    }

    public List<Session> all() {
        return List.copyOf(sessions.values());
    }
}
