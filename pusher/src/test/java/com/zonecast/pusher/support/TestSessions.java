package com.zonecast.pusher.support;

import com.zonecast.core.model.AvailabilityStatus;
import com.zonecast.core.model.Colors;
import com.zonecast.core.model.Position;
import com.zonecast.core.model.SpaceUser;
import com.zonecast.core.model.Viewport;
import com.zonecast.pusher.config.PusherConfig;
import com.zonecast.pusher.session.ConnectionStateMachine;
import com.zonecast.pusher.session.Session;
import com.zonecast.pusher.session.SessionFactory;
import com.zonecast.pusher.session.SessionSeed;

import java.time.Duration;
import java.util.List;

/**
 * Builders for sessions and configuration used across tests.
 */
public final class TestSessions {
    public static final String ROOM = "https://play.example/@/acme/campus/lobby";

    private TestSessions() {
    }

    public static PusherConfig config() {
        return PusherConfig.builder()
            .nodeId("test-node")
            .httpPort(0)
            .apiVersionHash("v2")
            .disableAnonymous(false)
            .secretKey("room-secret")
            .adminSocketsToken("admin-secret")
            .chatDomain("chat.test")
            .textureBaseUrl("http://textures.test/")
            .zoneWidth(320)
            .zoneHeight(320)
            .batchDelay(Duration.ofMillis(100))
            .batchMaxMessages(100)
            .maxBackpressureBytes(64 * 1024)
            .maxDeferredMessages(1000)
            .pingInterval(Duration.ofSeconds(29))
            .pongTimeout(Duration.ofSeconds(20))
            .idleTimeout(Duration.ofSeconds(120))
            .maxPayloadLength(1024 * 1024)
            .build();
    }

    public static SessionSeed.SessionSeedBuilder seed(String name, String roomId, Viewport viewport) {
        return SessionSeed.builder()
            .token("")
            .userUuid("uuid-" + name)
            .userIdentifier(name)
            .roomId(roomId)
            .name(name)
            .position(Position.builder().x(0).y(0).direction(Position.Direction.DOWN).build())
            .viewport(viewport)
            .availabilityStatus(AvailabilityStatus.ONLINE)
            .spaceUser(SpaceUser.builder()
                .uuid("uuid-" + name)
                .name(name)
                .playUri(roomId)
                .availabilityStatus(AvailabilityStatus.ONLINE)
                .color(Colors.colorFor(name))
                .tags(List.of())
                .build());
    }

    public static Session session(SessionFactory factory, String name, Viewport viewport) {
        return factory.create(seed(name, ROOM, viewport).build(), new RecordingChannel(),
            new ConnectionStateMachine());
    }

    public static Session session(SessionFactory factory, String name, Viewport viewport, List<String> tags) {
        SessionSeed base = seed(name, ROOM, viewport).build();
        SessionSeed seed = base.toBuilder()
            .tags(tags)
            .spaceUser(base.getSpaceUser().toBuilder().tags(tags).build())
            .build();
        return factory.create(seed, new RecordingChannel(), new ConnectionStateMachine());
    }

    public static RecordingChannel channel(Session session) {
        return (RecordingChannel) session.getChannel();
    }
}
