package com.zonecast.pusher.admin;

import com.zonecast.core.msg.AdminMessages;
import com.zonecast.core.msg.ServerMessages;
import com.zonecast.core.util.JsonUtils;
import com.zonecast.pusher.batch.MessageBatcher;
import com.zonecast.pusher.external.InvalidTokenException;
import com.zonecast.pusher.external.TelemetrySink;
import com.zonecast.pusher.metrics.MetricsService;
import com.zonecast.pusher.room.AdminRoomListener;
import com.zonecast.pusher.room.RoomRegistry;
import com.zonecast.pusher.session.Session;
import com.zonecast.pusher.ws.CloseCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Control-plane requests coming from admin sockets.
 * <p>
 * Every request carries a token listing the rooms it may act on. A {@code listen} naming any
 * other room is refused as a whole, and the connection is closed. {@code user-message}
 * requests act only on authorized rooms of the requested world.
 * </p>
 */
public class AdminOverlay {
    private static final Logger log = LoggerFactory.getLogger(AdminOverlay.class);

    static final String INVALID_MESSAGE = "Invalid message received! The connection has been closed.";
    static final String ACCESS_REFUSED = "Access refused";
    static final String BANNED = "Banned";

    private final AdminTokenVerifier tokenVerifier;
    private final RoomRegistry rooms;
    private final MessageBatcher batcher;
    private final MetricsService metrics;
    private final TelemetrySink telemetry;

    private final Map<AdminConnection, AdminRoomListener> listeners = new ConcurrentHashMap<>();

    public AdminOverlay(AdminTokenVerifier tokenVerifier, RoomRegistry rooms, MessageBatcher batcher,
                        MetricsService metrics, TelemetrySink telemetry) {
        this.tokenVerifier = tokenVerifier;
        this.rooms = rooms;
        this.batcher = batcher;
        this.metrics = metrics;
        this.telemetry = telemetry;
    }

    public void onMessage(AdminConnection connection, String text) {
        AdminMessages.AdminRequest request;
        try {
            request = JsonUtils.readValue(text, AdminMessages.AdminRequest.class);
        } catch (RuntimeException e) {
            log.warn("Unreadable admin message: {}", e.getMessage());
            invalid(connection, "unreadable", e);
            return;
        }
        if (request == null || request.getJwt() == null) {
            invalid(connection, "no_token", null);
            return;
        }

        Set<String> authorized;
        try {
            authorized = tokenVerifier.verify(request.getJwt());
        } catch (InvalidTokenException e) {
            log.warn("Admin socket refused: {}", e.getMessage());
            refuse(connection, "Admin socket access refused: " + e.getMessage(), "token_invalid", e);
            return;
        }

        if (request instanceof AdminMessages.ListenRequest) {
            listen(connection, (AdminMessages.ListenRequest) request, authorized);
        } else if (request instanceof AdminMessages.UserMessageRequest) {
            userMessage(connection, (AdminMessages.UserMessageRequest) request, authorized);
        }
    }

    /**
     * Detaches the connection from every room it listened to.
     */
    public void onClose(AdminConnection connection) {
        AdminRoomListener listener = listeners.remove(connection);
        if (listener != null) {
            rooms.removeAdminListener(listener);
        }
    }

    private void listen(AdminConnection connection, AdminMessages.ListenRequest request, Set<String> authorized) {
        List<String> roomIds = request.getRoomIds();
        if (roomIds == null || roomIds.isEmpty()) {
            invalid(connection, "no_rooms", null);
            return;
        }
        List<String> notAllowed = roomIds.stream()
            .filter(roomId -> !authorized.contains(roomId))
            .collect(Collectors.toList());
        if (!notAllowed.isEmpty()) {
            log.warn("Admin socket refused for rooms {}", notAllowed);
            refuse(connection, "Admin socket refused for client on rooms: " + String.join(", ", notAllowed),
                "room_not_authorized", null);
            return;
        }

        AdminRoomListener listener = listeners.computeIfAbsent(connection, RoomEventForwarder::new);
        for (String roomId : roomIds) {
            rooms.addAdminListener(roomId, listener);
        }
        log.info("Admin socket listening to {}", roomIds);
    }

    private void userMessage(AdminConnection connection, AdminMessages.UserMessageRequest request,
                             Set<String> authorized) {
        AdminMessages.UserMessage message = request.getMessage();
        if (message == null || message.getUserUuid() == null || message.getType() == null || request.getWorld() == null) {
            invalid(connection, "no_message", null);
            return;
        }
        for (String roomId : authorized) {
            if (!request.getWorld().equals(worldOf(roomId))) {
                continue;
            }
            for (Session session : rooms.sessionsOf(roomId, message.getUserUuid())) {
                deliver(session, message);
            }
        }
    }

    private void deliver(Session session, AdminMessages.UserMessage message) {
        switch (message.getType()) {
            case AdminMessages.TYPE_BAN -> batcher.sendImmediately(session,
                new ServerMessages.SendUserMessage(message.getType(), message.getMessage()));
            case AdminMessages.TYPE_BANNED -> {
                log.info("Banning {}", session);
                batcher.sendImmediately(session,
                    new ServerMessages.BanUserMessage(message.getType(), message.getMessage()));
                session.getChannel().close(CloseCodes.NORMAL, BANNED);
            }
            default -> log.warn("Unknown admin user message type '{}'", message.getType());
        }
    }

    /**
     * World slug of a room URL: {@code https://host/@/org/world/room} yields {@code world}.
     */
    static String worldOf(String roomId) {
        String[] segments = roomId.split("/");
        return segments.length > 5 ? segments[5] : null;
    }

    /**
     * @param cause reported to telemetry when present, otherwise the reason is
     */
    private void invalid(AdminConnection connection, String reason, Throwable cause) {
        metrics.recordAdminRefused(reason);
        report("Invalid admin message (" + reason + ")", cause);
        connection.send(AdminMessages.AdminEvent.error(INVALID_MESSAGE));
        connection.close(CloseCodes.INVALID_PAYLOAD, "Invalid message");
    }

    private void refuse(AdminConnection connection, String message, String reason, Throwable cause) {
        metrics.recordAdminRefused(reason);
        report(message, cause);
        connection.send(AdminMessages.AdminEvent.error(message));
        connection.close(CloseCodes.POLICY_VIOLATION, ACCESS_REFUSED);
    }

    private void report(String message, Throwable cause) {
        if (cause != null) {
            telemetry.report(cause);
        } else {
            telemetry.report(message);
        }
    }

    /**
     * Forwards member changes of the rooms a connection listens to.
     */
    private static final class RoomEventForwarder implements AdminRoomListener {
        private final AdminConnection connection;

        RoomEventForwarder(AdminConnection connection) {
            this.connection = connection;
        }

        @Override
        public void onMemberJoin(Session session) {
            connection.send(new AdminMessages.AdminEvent("MemberJoin", memberData(session)));
        }

        @Override
        public void onMemberLeave(Session session) {
            connection.send(new AdminMessages.AdminEvent("MemberLeave", memberData(session)));
        }

        private static Map<String, Object> memberData(Session session) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("uuid", session.getUserUuid());
            data.put("name", session.getName());
            data.put("ipAddress", session.getIpAddress());
            data.put("roomId", session.getRoomId());
            return data;
        }
    }
}
