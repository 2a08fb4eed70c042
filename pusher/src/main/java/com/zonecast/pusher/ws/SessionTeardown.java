package com.zonecast.pusher.ws;

import com.zonecast.pusher.batch.MessageBatcher;
import com.zonecast.pusher.external.TelemetrySink;
import com.zonecast.pusher.room.RoomRegistry;
import com.zonecast.pusher.session.ConnectionState;
import com.zonecast.pusher.session.LivenessMonitor;
import com.zonecast.pusher.session.Session;
import com.zonecast.pusher.session.SessionRegistry;
import com.zonecast.pusher.space.SpaceRegistry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Releases everything a closed room connection holds. Runs once per session; a failing step is
 * reported and the remaining steps still run.
 */
@RequiredArgsConstructor
public class SessionTeardown {
    private static final Logger log = LoggerFactory.getLogger(SessionTeardown.class);

    private final SessionRegistry sessions;
    private final RoomRegistry rooms;
    private final SpaceRegistry spaces;
    private final MessageBatcher batcher;
    private final TelemetrySink telemetry;

    public void teardown(Session session) {
        if (!session.markDisconnecting()) {
            return;
        }
        session.getState().beginClosing();
        log.debug("Tearing down {}", session);

        step(session, "liveness", () -> {
            LivenessMonitor liveness = session.getLiveness();
            if (liveness != null) {
                liveness.stop();
            }
        });
        step(session, "batch", () -> batcher.discard(session));
        step(session, "spaces", () -> spaces.leaveAll(session));
        step(session, "room", () -> rooms.leave(session));
        step(session, "registry", () -> sessions.remove(session));

        if (session.getState().current() == ConnectionState.CLOSING) {
            session.getState().transition(ConnectionState.CLOSED);
        }
    }

    private void step(Session session, String name, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Teardown step '{}' failed for {}", name, session, e);
            telemetry.report(e);
        }
    }
}
