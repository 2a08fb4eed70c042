package com.zonecast.pusher.admin;

import com.zonecast.core.msg.AdminMessages;
import com.zonecast.core.util.JsonUtils;
import com.zonecast.pusher.external.TelemetrySink;
import com.zonecast.pusher.ws.CloseCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * Admin rooms socket. Inbound frames go to the {@link AdminOverlay}; events flow back
 * through a per-connection sink.
 */
public class AdminSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(AdminSocketHandler.class);

    private final AdminOverlay overlay;
    private final TelemetrySink telemetry;

    public AdminSocketHandler(AdminOverlay overlay, TelemetrySink telemetry) {
        this.overlay = overlay;
        this.telemetry = telemetry;
    }

    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        return res.sendWebsocket(this::session);
    }

    Mono<Void> session(WebsocketInbound inbound, WebsocketOutbound outbound) {
        SinkConnection connection = new SinkConnection();
        log.debug("Admin socket opened");

        Mono<Void> send = outbound.sendString(connection.events.asFlux())
            .then()
            .then(Mono.defer(() -> connection.closeFrame == null
                ? Mono.<Void>empty()
                : outbound.sendClose(connection.closeFrame.code(), connection.closeFrame.reason())));
        Mono<Void> receive = inbound.aggregateFrames()
            .receive()
            .asString()
            .doOnNext(text -> overlay.onMessage(connection, text))
            .doOnError(err -> {
                if (!(err instanceof AbortedException)) {
                    log.error("Fatal error in admin inbound stream", err);
                    telemetry.report(err);
                }
            })
            .onErrorResume(err -> Mono.empty())
            .then(Mono.fromRunnable(connection::complete));

        return Mono.when(send, receive)
            .doFinally(signal -> {
                log.debug("Admin socket closed");
                overlay.onClose(connection);
            });
    }

    /**
     * Serializes events onto the outbound sink. Closing completes the sink, which ends the
     * socket after pending events are written.
     */
    private static final class SinkConnection implements AdminConnection {
        private final Sinks.Many<String> events = Sinks.many().unicast().onBackpressureBuffer();
        private volatile CloseFrame closeFrame;

        @Override
        public synchronized void send(AdminMessages.AdminEvent event) {
            Sinks.EmitResult result = events.tryEmitNext(JsonUtils.writeValueAsString(event));
            if (result.isFailure()) {
                log.debug("Dropped admin event {}: {}", event.getType(), result);
            }
        }

        synchronized void complete() {
            events.tryEmitComplete();
        }

        @Override
        public synchronized void close(int code, String reason) {
            if (closeFrame == null) {
                closeFrame = new CloseFrame(code, CloseCodes.reason(reason));
                events.tryEmitComplete();
            }
        }
    }

    private record CloseFrame(int code, String reason) {
    }
}
