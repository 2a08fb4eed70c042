package com.zonecast.pusher.http;

import com.zonecast.pusher.admin.AdminSocketHandler;
import com.zonecast.pusher.config.PusherConfig;
import com.zonecast.pusher.drain.DrainService;
import com.zonecast.pusher.metrics.PrometheusMetricsExporter;
import com.zonecast.pusher.ws.RoomUpgradeHandler;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.RequiredArgsConstructor;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.function.Function;

/**
 * The pusher's single listening port.
 * <ul>
 *   <li>{@code GET /room}: room socket upgrade</li>
 *   <li>{@code GET /admin/rooms}: admin socket upgrade, only when the overlay is enabled</li>
 *   <li>{@code GET /ping}: liveness, always {@code pong}</li>
 *   <li>{@code GET /healthz}: readiness, 503 once draining</li>
 *   <li>{@code GET /metrics}: Prometheus scrape</li>
 * </ul>
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final PusherConfig config;
    private final RoomUpgradeHandler roomUpgradeHandler;
    /**
     * {@code null} when the admin overlay is disabled.
     */
    private final AdminSocketHandler adminSocketHandler;
    private final PrometheusMetricsExporter metricsExporter;
    private final DrainService drainService;
    private DisposableServer server;

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .idleTimeout(config.getIdleTimeout())
            .metrics(true, Function.identity())
            .route(this::routes)
            .bindNow(Duration.ofSeconds(45));

        log.info("Listening on port {} (admin overlay {})", server.port(),
            adminSocketHandler == null ? "off" : "on");
        return server;
    }

    private void routes(HttpServerRoutes routes) {
        routes
            .get("/ping", (req, res) -> res.sendString(Mono.just("pong")))
            .get("/healthz", this::health)
            .get("/metrics", this::metrics)
            .get("/room", roomUpgradeHandler::handle);
        if (adminSocketHandler != null) {
            routes.get("/admin/rooms", adminSocketHandler::handle);
        }
    }

    private Publisher<Void> health(HttpServerRequest req, HttpServerResponse res) {
        if (drainService.isDraining()) {
            return res.status(HttpResponseStatus.SERVICE_UNAVAILABLE).sendString(Mono.just("draining"));
        }
        return res.sendString(Mono.just("ok"));
    }

    private Publisher<Void> metrics(HttpServerRequest req, HttpServerResponse res) {
        return res.header("Content-Type", PROMETHEUS_CONTENT_TYPE)
            .sendString(Mono.fromSupplier(metricsExporter::scrape));
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
            log.info("Listener on port {} closed", server.port());
        }
    }
}
