package com.zonecast.pusher.ws;

import com.zonecast.core.metrics.MetricsNames;
import com.zonecast.core.msg.ClientMessage;
import com.zonecast.core.msg.ServerMessages;
import com.zonecast.core.util.JsonUtils;
import com.zonecast.pusher.batch.MessageBatcher;
import com.zonecast.pusher.config.PusherConfig;
import com.zonecast.pusher.external.TelemetrySink;
import com.zonecast.pusher.metrics.MetricsService;
import com.zonecast.pusher.room.RoomRegistry;
import com.zonecast.pusher.session.ConnectionState;
import com.zonecast.pusher.session.ConnectionStateMachine;
import com.zonecast.pusher.session.LivenessMonitor;
import com.zonecast.pusher.session.Session;
import com.zonecast.pusher.session.SessionFactory;
import com.zonecast.pusher.session.SessionRegistry;
import com.zonecast.pusher.session.SessionSeed;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Lifecycle of an accepted room socket.
 * <p>
 * Protocol (server → client): {@code roomJoinedMessage} first, then any pending
 * {@code sendUserMessage}, then {@code batchMessage} frames. Protocol (client → server): one
 * JSON message per text frame, handled strictly in arrival order.
 * </p>
 */
public class RoomSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(RoomSocketHandler.class);

    private final PusherConfig config;
    private final SessionFactory sessionFactory;
    private final SessionRegistry sessions;
    private final RoomRegistry rooms;
    private final MessageBatcher batcher;
    private final MessageDispatcher dispatcher;
    private final SessionTeardown teardown;
    private final TelemetrySink telemetry;
    private final MetricsService metrics;
    private final Scheduler timers;

    public RoomSocketHandler(
            PusherConfig config,
            SessionFactory sessionFactory,
            SessionRegistry sessions,
            RoomRegistry rooms,
            MessageBatcher batcher,
            MessageDispatcher dispatcher,
            SessionTeardown teardown,
            TelemetrySink telemetry,
            MetricsService metrics,
            Scheduler timers
    ) {
        this.config = config;
        this.sessionFactory = sessionFactory;
        this.sessions = sessions;
        this.rooms = rooms;
        this.batcher = batcher;
        this.dispatcher = dispatcher;
        this.teardown = teardown;
        this.telemetry = telemetry;
        this.metrics = metrics;
        this.timers = timers;

        metrics.registerGauge(MetricsNames.ACTIVE_SESSIONS, "Open room sessions", sessions::size);
    }

    /**
     * @param seed    what the gateway accepted
     * @param state   lifecycle of the connection, still {@code CONNECTING}
     * @param aborted true once the client is gone
     */
    public Mono<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound, SessionSeed seed,
                             ConnectionStateMachine state, BooleanSupplier aborted) {
        if (aborted.getAsBoolean()) {
            log.info("Client of {} disconnected before the socket opened", seed.getRoomId());
            return Mono.empty();
        }

        AtomicReference<Session> created = new AtomicReference<>();
        inbound.withConnection(connection -> {
            Session session = sessionFactory.create(seed, new NettyOutboundChannel(
                connection.channel(), outbound, config.getMaxBackpressureBytes()), state);
            created.set(session);
            connection.onDispose(() -> teardown.teardown(session));
        });
        Session session = created.get();

        try {
            open(session, seed);
        } catch (RuntimeException e) {
            log.error("Failed to open session {}", session, e);
            telemetry.report(e);
            teardown.teardown(session);
            return outbound.sendClose(CloseCodes.GOING_AWAY, "Internal error");
        }

        return receive(inbound, session)
            .doFinally(signal -> teardown.teardown(session));
    }

    void open(Session session, SessionSeed seed) {
        MDC.put("userUuid", session.getUserUuid());
        session.getState().transition(ConnectionState.UPGRADED);
        sessions.add(session);
        batcher.attach(session);

        batcher.sendImmediately(session, ServerMessages.RoomJoinedMessage.builder()
            .userId(session.getUserId())
            .userUuid(session.getUserUuid())
            .roomId(session.getRoomId())
            .tags(session.getTags())
            .canEdit(session.isCanEdit())
            .userRoomToken(session.getUserRoomToken())
            .jabberId(session.getJabberId())
            .jabberPassword(session.getJabberPassword())
            .characterTextures(session.getCharacterTextures())
            .companionTexture(session.getCompanionTexture())
            .lastCommandId(session.getLastCommandId())
            .build());
        for (ServerMessages.SendUserMessage message : seed.getPendingMessages()) {
            batcher.sendImmediately(session, message);
        }

        rooms.join(session);
        if (session.isDisconnecting()) {
            // closed while joining, teardown may have missed the room
            rooms.leave(session);
            return;
        }
        session.getState().transition(ConnectionState.JOINED);

        LivenessMonitor liveness = new LivenessMonitor(config.getPingInterval(), config.getPongTimeout(), timers,
            () -> session.getChannel().sendPing(),
            () -> {
                log.info("No pong from {} in {}, closing", session, config.getPongTimeout());
                metrics.recordPongTimeout();
                session.getChannel().close(CloseCodes.GOING_AWAY, "Pong timeout");
            });
        session.setLiveness(liveness);
        liveness.start();

        session.getState().transition(ConnectionState.STREAMING);
        metrics.recordConnectionAccepted();
        log.info("Session {} streaming in room {}", session, session.getRoomId());
    }

    private Mono<Void> receive(WebsocketInbound inbound, Session session) {
        return inbound.aggregateFrames(config.getMaxPayloadLength())
            .receiveFrames()
            .<String>handle((frame, sink) -> {
                if (frame instanceof PongWebSocketFrame) {
                    LivenessMonitor liveness = session.getLiveness();
                    if (liveness != null) {
                        liveness.onPong();
                    }
                } else if (frame instanceof TextWebSocketFrame) {
                    sink.next(((TextWebSocketFrame) frame).text());
                }
            })
            .concatMap(text -> handleText(session, text))
            .doOnError(err -> {
                if (!(err instanceof AbortedException)) {
                    log.error("Fatal error in inbound stream for {}", session, err);
                    telemetry.report(err);
                }
            })
            .onErrorResume(err -> Mono.empty())
            .then();
    }

    Mono<Void> handleText(Session session, String text) {
        if (text.isBlank()) {
            log.warn("Empty frame from {}", session);
            return Mono.empty();
        }
        ClientMessage message;
        try {
            message = JsonUtils.readValue(text, ClientMessage.class);
        } catch (RuntimeException e) {
            log.warn("Unreadable message from {}: {}", session, e.getMessage());
            metrics.recordMalformedInbound();
            return Mono.empty();
        }
        if (message == null) {
            metrics.recordMalformedInbound();
            return Mono.empty();
        }
        return dispatcher.dispatch(session, message)
            .onErrorResume(err -> {
                log.warn("Error processing {} from {}: {}", message.kind(), session, err.getMessage());
                telemetry.report(err);
                return Mono.empty();
            });
    }
}
