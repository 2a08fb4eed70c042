package com.zonecast.pusher.drain;

import com.zonecast.pusher.session.Session;
import com.zonecast.pusher.session.SessionRegistry;
import com.zonecast.pusher.ws.CloseCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Graceful shutdown: refuse new room connections, then close the open ones.
 */
public class DrainService {
    private static final Logger log = LoggerFactory.getLogger(DrainService.class);

    static final String REASON = "Server shutting down";

    private final SessionRegistry sessions;
    private final AtomicBoolean draining = new AtomicBoolean(false);

    public DrainService(SessionRegistry sessions) {
        this.sessions = sessions;
    }

    public boolean isDraining() {
        return draining.get();
    }

    /**
     * @return number of sessions asked to close
     */
    public int drainAll() {
        if (!draining.compareAndSet(false, true)) {
            log.warn("Drain already in progress");
            return 0;
        }
        List<Session> open = sessions.all();
        log.info("Draining {} room connections", open.size());
        for (Session session : open) {
            session.getChannel().close(CloseCodes.GOING_AWAY, REASON);
        }
        return open.size();
    }
}
