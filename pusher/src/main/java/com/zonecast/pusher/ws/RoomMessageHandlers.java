package com.zonecast.pusher.ws;

import com.zonecast.core.model.AvailabilityStatus;
import com.zonecast.core.model.SpaceUserUpdate;
import com.zonecast.core.msg.ClientMessages;
import com.zonecast.core.msg.MessageKind;
import com.zonecast.core.msg.ServerMessages;
import com.zonecast.pusher.batch.MessageBatcher;
import com.zonecast.pusher.external.MemberDataProvider;
import com.zonecast.pusher.external.TelemetrySink;
import com.zonecast.pusher.metrics.MetricsService;
import com.zonecast.pusher.room.RoomRegistry;
import com.zonecast.pusher.session.LivenessMonitor;
import com.zonecast.pusher.session.Session;
import com.zonecast.pusher.space.SpaceRegistry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Handlers of every message a room client may send.
 */
@RequiredArgsConstructor
public class RoomMessageHandlers {
    private static final Logger log = LoggerFactory.getLogger(RoomMessageHandlers.class);

    private final RoomRegistry rooms;
    private final SpaceRegistry spaces;
    private final MessageBatcher batcher;
    private final MemberDataProvider memberDataProvider;
    private final TelemetrySink telemetry;
    private final MetricsService metrics;

    public MessageDispatcher dispatcher() {
        return MessageDispatcher.builder(metrics)
            .on(MessageKind.VIEWPORT, ClientMessages.ViewportMessage.class, this::viewport)
            .on(MessageKind.USER_MOVES, ClientMessages.UserMovesMessage.class, this::userMoves)
            .on(MessageKind.REPORT_PLAYER, ClientMessages.ReportPlayerMessage.class, this::reportPlayer)
            .on(MessageKind.ADD_SPACE_FILTER, ClientMessages.AddSpaceFilterMessage.class, this::addSpaceFilter)
            .on(MessageKind.UPDATE_SPACE_FILTER, ClientMessages.UpdateSpaceFilterMessage.class, this::updateSpaceFilter)
            .on(MessageKind.REMOVE_SPACE_FILTER, ClientMessages.RemoveSpaceFilterMessage.class, this::removeSpaceFilter)
            .on(MessageKind.SET_PLAYER_DETAILS, ClientMessages.SetPlayerDetailsMessage.class, this::setPlayerDetails)
            .on(MessageKind.WATCH_SPACE, ClientMessages.WatchSpaceMessage.class, this::watchSpace)
            .on(MessageKind.UNWATCH_SPACE, ClientMessages.UnwatchSpaceMessage.class, this::unwatchSpace)
            .on(MessageKind.CAMERA_STATE, ClientMessages.CameraStateMessage.class, (session, msg) ->
                publish(session, SpaceUserUpdate.builder().cameraState(msg.isValue()).build()))
            .on(MessageKind.MICROPHONE_STATE, ClientMessages.MicrophoneStateMessage.class, (session, msg) ->
                publish(session, SpaceUserUpdate.builder().microphoneState(msg.isValue()).build()))
            .on(MessageKind.SCREEN_SHARING_STATE, ClientMessages.ScreenSharingStateMessage.class, (session, msg) ->
                publish(session, SpaceUserUpdate.builder().screenSharing(msg.isValue()).build()))
            .on(MessageKind.MEGAPHONE_STATE, ClientMessages.MegaphoneStateMessage.class, (session, msg) ->
                publish(session, SpaceUserUpdate.builder().megaphoneState(msg.isValue()).build()))
            .on(MessageKind.PING, ClientMessages.PingMessage.class, this::ping)
            .build();
    }

    private Mono<Void> viewport(Session session, ClientMessages.ViewportMessage message) {
        rooms.updateViewport(session, message.toViewport());
        return Mono.empty();
    }

    private Mono<Void> userMoves(Session session, ClientMessages.UserMovesMessage message) {
        if (message.getPosition() == null) {
            log.warn("Ignoring move without position from {}", session);
            return Mono.empty();
        }
        rooms.updatePosition(session, message.getPosition(), message.getViewport());
        return Mono.empty();
    }

    private Mono<Void> reportPlayer(Session session, ClientMessages.ReportPlayerMessage message) {
        return memberDataProvider.reportPlayer(
                message.getReportedUserUuid(), message.getReportComment(), session.getUserUuid(), session.getRoomId())
            .onErrorResume(err -> {
                log.warn("Report of {} by {} failed: {}", message.getReportedUserUuid(), session, err.getMessage());
                telemetry.report(err);
                return Mono.empty();
            });
    }

    private Mono<Void> addSpaceFilter(Session session, ClientMessages.AddSpaceFilterMessage message) {
        spaces.addFilter(session, message.getSpaceName(), message.getFilterName(), message.getFilter());
        return Mono.empty();
    }

    private Mono<Void> updateSpaceFilter(Session session, ClientMessages.UpdateSpaceFilterMessage message) {
        spaces.updateFilter(session, message.getSpaceName(), message.getFilterName(), message.getFilter());
        return Mono.empty();
    }

    private Mono<Void> removeSpaceFilter(Session session, ClientMessages.RemoveSpaceFilterMessage message) {
        spaces.removeFilter(session, message.getSpaceName(), message.getFilterName());
        return Mono.empty();
    }

    private Mono<Void> setPlayerDetails(Session session, ClientMessages.SetPlayerDetailsMessage message) {
        AvailabilityStatus status = message.getAvailabilityStatus();
        return publish(session, SpaceUserUpdate.builder()
            .availabilityStatus(status == AvailabilityStatus.UNCHANGED ? null : status)
            .visitCardUrl(message.getVisitCardUrl())
            .build());
    }

    private Mono<Void> watchSpace(Session session, ClientMessages.WatchSpaceMessage message) {
        spaces.watch(session, message.getSpaceName(), message.getFilterName(), message.getFilter());
        return Mono.empty();
    }

    private Mono<Void> unwatchSpace(Session session, ClientMessages.UnwatchSpaceMessage message) {
        spaces.unwatch(session, message.getSpaceName());
        return Mono.empty();
    }

    private Mono<Void> ping(Session session, ClientMessages.PingMessage message) {
        LivenessMonitor liveness = session.getLiveness();
        if (liveness != null) {
            liveness.onPong();
        }
        batcher.enqueue(session, new ServerMessages.PongMessage());
        batcher.flush(session);
        return Mono.empty();
    }

    private Mono<Void> publish(Session session, SpaceUserUpdate update) {
        spaces.updatePublished(session, update);
        return Mono.empty();
    }
}
