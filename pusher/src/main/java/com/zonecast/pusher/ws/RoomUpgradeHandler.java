package com.zonecast.pusher.ws;

import com.zonecast.core.util.JsonUtils;
import com.zonecast.pusher.config.PusherConfig;
import com.zonecast.pusher.drain.DrainService;
import com.zonecast.pusher.external.TelemetrySink;
import com.zonecast.pusher.gateway.ConnectionGateway;
import com.zonecast.pusher.gateway.InvalidUpgradeRequestException;
import com.zonecast.pusher.gateway.UpgradeRequest;
import com.zonecast.pusher.gateway.UpgradeResult;
import com.zonecast.pusher.metrics.MetricsService;
import com.zonecast.pusher.session.ConnectionStateMachine;
import io.netty.handler.codec.http.HttpHeaderNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.WebsocketServerSpec;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handles room socket upgrades.
 * <p>
 * Query parameters are validated before anything else; a bad query gets a plain 400 and no
 * WebSocket. Refused connections are still upgraded so the client receives a typed rejection
 * frame, then closed with the rejection's close code.
 * </p>
 */
public class RoomUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(RoomUpgradeHandler.class);

    private final ConnectionGateway gateway;
    private final RoomSocketHandler socketHandler;
    private final DrainService drainService;
    private final TelemetrySink telemetry;
    private final MetricsService metrics;
    private final WebsocketServerSpec websocketSpec;

    public RoomUpgradeHandler(
            PusherConfig config,
            ConnectionGateway gateway,
            RoomSocketHandler socketHandler,
            DrainService drainService,
            TelemetrySink telemetry,
            MetricsService metrics
    ) {
        this.gateway = gateway;
        this.socketHandler = socketHandler;
        this.drainService = drainService;
        this.telemetry = telemetry;
        this.metrics = metrics;
        this.websocketSpec = WebsocketServerSpec.builder()
            .maxFramePayloadLength(config.getMaxPayloadLength())
            .build();
    }

    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        if (drainService.isDraining()) {
            log.warn("Rejecting new room connection - node is draining");
            return res.status(503)
                .sendString(Mono.just("Service unavailable - node is draining"))
                .then();
        }

        UpgradeRequest request;
        try {
            request = UpgradeRequest.parse(req.uri(), clientAddress(req),
                req.requestHeaders().get(HttpHeaderNames.ACCEPT_LANGUAGE));
        } catch (InvalidUpgradeRequestException e) {
            log.debug("Bad upgrade request {}: {}", req.uri(), e.getMessage());
            return res.status(400).sendString(Mono.just(e.getMessage())).then();
        }

        AtomicBoolean aborted = new AtomicBoolean(false);
        req.withConnection(connection -> connection.onDispose(() -> aborted.set(true)));

        ConnectionStateMachine state = new ConnectionStateMachine();
        return gateway.upgrade(request, state, aborted::get)
            .flatMap(result -> {
                if (result instanceof UpgradeResult.Accepted) {
                    UpgradeResult.Accepted accepted = (UpgradeResult.Accepted) result;
                    return res.sendWebsocket(
                        (in, out) -> socketHandler.handle(in, out, accepted.getSeed(), state, aborted::get),
                        websocketSpec);
                }
                UpgradeResult.Rejected rejected = (UpgradeResult.Rejected) result;
                metrics.recordConnectionRejected(rejected.metricTag());
                log.info("Refused connection to {}: {} {} {}", request.getRoomId(), rejected.getReason(),
                    rejected.getStatus(), rejected.getMessage());
                return res.sendWebsocket((in, out) -> out
                    .sendString(Mono.just(JsonUtils.writeValueAsString(rejected.toClientMessage())))
                    .then(out.sendClose(rejected.closeCode(), CloseCodes.reason(rejected.getMessage()))),
                    websocketSpec);
            })
            .onErrorResume(err -> {
                log.error("Upgrade of {} failed", request.getRoomId(), err);
                telemetry.report(err);
                return res.status(500).send().then();
            });
    }

    private static String clientAddress(HttpServerRequest req) {
        String forwarded = req.requestHeaders().get("x-forwarded-for");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        SocketAddress remote = req.remoteAddress();
        return remote instanceof InetSocketAddress ? ((InetSocketAddress) remote).getHostString() : null;
    }
}
