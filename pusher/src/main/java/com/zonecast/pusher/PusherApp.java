package com.zonecast.pusher;

import com.zonecast.core.metrics.MetricsNames;
import com.zonecast.pusher.admin.AdminOverlay;
import com.zonecast.pusher.admin.AdminSocketHandler;
import com.zonecast.pusher.admin.AdminTokenVerifier;
import com.zonecast.pusher.batch.MessageBatcher;
import com.zonecast.pusher.config.PusherConfig;
import com.zonecast.pusher.drain.DrainService;
import com.zonecast.pusher.external.HttpMemberDataProvider;
import com.zonecast.pusher.external.LocalMemberDataProvider;
import com.zonecast.pusher.external.LoggingTelemetrySink;
import com.zonecast.pusher.external.MemberDataProvider;
import com.zonecast.pusher.external.SignedTokenIdentityVerifier;
import com.zonecast.pusher.external.TelemetrySink;
import com.zonecast.pusher.gateway.ChatCredentialIssuer;
import com.zonecast.pusher.gateway.ConnectionGateway;
import com.zonecast.pusher.http.HttpServer;
import com.zonecast.pusher.metrics.MetricsService;
import com.zonecast.pusher.metrics.PrometheusMetricsExporter;
import com.zonecast.pusher.room.RoomRegistry;
import com.zonecast.pusher.session.SessionFactory;
import com.zonecast.pusher.session.SessionRegistry;
import com.zonecast.pusher.space.SpaceNotifier;
import com.zonecast.pusher.space.SpaceRegistry;
import com.zonecast.pusher.ws.RoomMessageHandlers;
import com.zonecast.pusher.ws.RoomSocketHandler;
import com.zonecast.pusher.ws.RoomUpgradeHandler;
import com.zonecast.pusher.ws.SessionTeardown;
import com.zonecast.pusher.zone.ZoneGrid;
import com.zonecast.pusher.zone.ZoneNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Main entry point for a pusher node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve room sockets at /room (query: roomId, name, textures, position, viewport, version, token)</li>
 *   <li>Track rooms, zones and spaces and batch their events to clients</li>
 *   <li>Serve the admin rooms socket at /admin/rooms when an admin token secret is configured</li>
 *   <li>Expose /healthz and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class PusherApp {
    private static final Logger log = LoggerFactory.getLogger(PusherApp.class);

    public static void main(String[] args) {
        PusherConfig config = PusherConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting pusher node: {}", config.getNodeId());
        log.info("  Admin API: {}", config.getAdminApiUrl() == null ? "none (local member data)" : config.getAdminApiUrl());
        log.info("  Admin overlay: {}", config.isAdminOverlayEnabled() ? "enabled" : "disabled");

        // Setup metrics registry with Prometheus support
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        Scheduler timers = Schedulers.parallel();
        TelemetrySink telemetry = new LoggingTelemetrySink(metricsService, Schedulers.boundedElastic());
        MemberDataProvider memberDataProvider = config.getAdminApiUrl() != null
            ? new HttpMemberDataProvider(config.getAdminApiUrl(), config.getAdminApiToken())
            : new LocalMemberDataProvider(config.getTextureBaseUrl());

        MessageBatcher batcher = new MessageBatcher(config, timers, metricsService);
        RoomRegistry rooms = new RoomRegistry(
            new ZoneGrid(config.getZoneWidth(), config.getZoneHeight()), new ZoneNotifier(batcher));
        SpaceRegistry spaces = new SpaceRegistry(new SpaceNotifier(batcher));
        metricsService.registerGauge(MetricsNames.ACTIVE_ROOMS, "Rooms with at least one session", rooms::roomCount);
        metricsService.registerGauge(MetricsNames.ACTIVE_SPACES, "Spaces with at least one member", spaces::spaceCount);

        SessionRegistry sessions = new SessionRegistry();
        DrainService drainService = new DrainService(sessions);
        SessionTeardown teardown = new SessionTeardown(sessions, rooms, spaces, batcher, telemetry);
        RoomMessageHandlers handlers = new RoomMessageHandlers(
            rooms, spaces, batcher, memberDataProvider, telemetry, metricsService);

        ConnectionGateway gateway = new ConnectionGateway(
            config,
            new SignedTokenIdentityVerifier(config.getSecretKey()),
            memberDataProvider,
            telemetry,
            new ChatCredentialIssuer(config.getChatDomain(), config.getChatJwtSecret(), Clock.systemUTC())
        );
        RoomSocketHandler socketHandler = new RoomSocketHandler(
            config, new SessionFactory(), sessions, rooms, batcher, handlers.dispatcher(),
            teardown, telemetry, metricsService, timers);
        RoomUpgradeHandler upgradeHandler = new RoomUpgradeHandler(
            config, gateway, socketHandler, drainService, telemetry, metricsService);

        AdminSocketHandler adminSocketHandler = null;
        if (config.isAdminOverlayEnabled()) {
            AdminOverlay overlay = new AdminOverlay(
                new AdminTokenVerifier(config.getAdminSocketsToken(), Clock.systemUTC()),
                rooms, batcher, metricsService, telemetry);
            adminSocketHandler = new AdminSocketHandler(overlay, telemetry);
        }

        HttpServer httpServer = new HttpServer(config, upgradeHandler, adminSocketHandler, metricsExporter, drainService);
        httpServer.start();

        log.info("Pusher node {} is ready", config.getNodeId());

        handleShutdown(config, drainService, httpServer);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(PusherConfig config, DrainService drainService, HttpServer httpServer) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            int drained = drainService.drainAll();
            log.info("Asked {} room connections to close", drained);

            httpServer.stop();

            log.info("Shutdown complete");
        }));
    }
}
