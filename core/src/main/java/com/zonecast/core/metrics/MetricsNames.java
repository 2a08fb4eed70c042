package com.zonecast.core.metrics;

/**
 * Micrometer metric names used by the pusher.
 * <p>
 * <b>Naming convention:</b> {@code zonecast.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: WebSocket upgrades accepted.
     */
    public static final String CONNECTIONS_ACCEPTED_TOTAL = "zonecast.gateway.connections.accepted.total";

    /**
     * Counter: WebSocket upgrades rejected.
     * <p>
     * Tags: reason
     * </p>
     */
    public static final String CONNECTIONS_REJECTED_TOTAL = "zonecast.gateway.connections.rejected.total";

    /**
     * Gauge: Sessions currently joined to a room on this node.
     */
    public static final String ACTIVE_SESSIONS = "zonecast.pusher.sessions.active";

    /**
     * Gauge: Rooms currently alive on this node.
     */
    public static final String ACTIVE_ROOMS = "zonecast.pusher.rooms.active";

    /**
     * Gauge: Spaces currently alive on this node.
     */
    public static final String ACTIVE_SPACES = "zonecast.pusher.spaces.active";

    /**
     * Counter: Batches flushed to the wire.
     */
    public static final String BATCHES_FLUSHED_TOTAL = "zonecast.batcher.flushed.total";

    /**
     * Distribution Summary: Sub-messages per flushed batch.
     */
    public static final String BATCH_SIZE = "zonecast.batcher.batch.size";

    /**
     * Counter: Flushes deferred because the transport was over its backpressure ceiling.
     */
    public static final String FLUSHES_DEFERRED_TOTAL = "zonecast.batcher.deferred.total";

    /**
     * Counter: Sub-messages dropped.
     * <p>
     * Tags: reason (backpressure/disconnected)
     * </p>
     */
    public static final String DROPS_TOTAL = "zonecast.batcher.drops.total";

    /**
     * Gauge: Bytes written to sockets but not yet acknowledged by the transport.
     */
    public static final String BUFFERED_BYTES = "zonecast.batcher.buffered.bytes";

    /**
     * Counter: Inbound frames received.
     * <p>
     * Tags: type
     * </p>
     */
    public static final String INBOUND_MESSAGES_TOTAL = "zonecast.ws.inbound.total";

    /**
     * Counter: Inbound frames that could not be decoded.
     */
    public static final String INBOUND_MALFORMED_TOTAL = "zonecast.ws.inbound.malformed.total";

    /**
     * Counter: Connections closed because no pong was received in time.
     */
    public static final String PONG_TIMEOUTS_TOTAL = "zonecast.ws.pong.timeouts.total";

    /**
     * Counter: Errors handed to the telemetry sink.
     */
    public static final String TELEMETRY_REPORTS_TOTAL = "zonecast.telemetry.reports.total";

    /**
     * Counter: Admin overlay requests refused.
     * <p>
     * Tags: reason
     * </p>
     */
    public static final String ADMIN_REFUSED_TOTAL = "zonecast.admin.refused.total";
}
