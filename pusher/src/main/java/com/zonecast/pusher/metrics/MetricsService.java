package com.zonecast.pusher.metrics;

import com.zonecast.core.metrics.MetricsNames;
import com.zonecast.core.metrics.MetricsTags;
import com.zonecast.core.msg.MessageKind;
import com.zonecast.pusher.config.PusherConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Centralized metrics service for a pusher node.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String nodeId;

    private final Counter connectionsAccepted;
    private final Counter batchesFlushed;
    private final Counter flushesDeferred;
    private final Counter malformedInbound;
    private final Counter pongTimeouts;
    private final Counter telemetryReports;

    private final DistributionSummary batchSize;

    public MetricsService(MeterRegistry registry, PusherConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        connectionsAccepted = Counter.builder(MetricsNames.CONNECTIONS_ACCEPTED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Room socket upgrades accepted")
            .register(registry);

        batchesFlushed = Counter.builder(MetricsNames.BATCHES_FLUSHED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Batches written to room sockets")
            .register(registry);

        flushesDeferred = Counter.builder(MetricsNames.FLUSHES_DEFERRED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Flushes postponed because the socket was over its backpressure ceiling")
            .register(registry);

        malformedInbound = Counter.builder(MetricsNames.INBOUND_MALFORMED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Inbound frames that could not be decoded")
            .register(registry);

        pongTimeouts = Counter.builder(MetricsNames.PONG_TIMEOUTS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Connections closed because no pong arrived in time")
            .register(registry);

        telemetryReports = Counter.builder(MetricsNames.TELEMETRY_REPORTS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Errors reported to telemetry")
            .register(registry);

        batchSize = DistributionSummary.builder(MetricsNames.BATCH_SIZE)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Sub-messages per flushed batch")
            .register(registry);
    }

    /**
     * Registers a gauge backed by a live supplier (room count, buffered bytes, ...).
     *
     * @param name        metric name
     * @param description human readable description
     * @param supplier    current value
     */
    public void registerGauge(String name, String description, Supplier<Number> supplier) {
        Gauge.builder(name, supplier)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description(description)
            .register(registry);
    }

    public void recordConnectionAccepted() {
        connectionsAccepted.increment();
    }

    /**
     * @param reason rejection reason tag ("unknown" when the gateway gave none)
     */
    public void recordConnectionRejected(String reason) {
        Counter.builder(MetricsNames.CONNECTIONS_REJECTED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, reason)
            .register(registry)
            .increment();
    }

    public void recordBatchFlushed(int messages) {
        batchesFlushed.increment();
        batchSize.record(messages);
    }

    public void recordFlushDeferred() {
        flushesDeferred.increment();
    }

    public void recordDrop(String reason) {
        Counter.builder(MetricsNames.DROPS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, reason)
            .register(registry)
            .increment();
    }

    public void recordInbound(MessageKind kind) {
        Counter.builder(MetricsNames.INBOUND_MESSAGES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, kind.name().toLowerCase(Locale.ROOT))
            .register(registry)
            .increment();
    }

    public void recordMalformedInbound() {
        malformedInbound.increment();
    }

    public void recordPongTimeout() {
        pongTimeouts.increment();
    }

    public void recordTelemetryReport() {
        telemetryReports.increment();
    }

    public void recordAdminRefused(String reason) {
        Counter.builder(MetricsNames.ADMIN_REFUSED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, reason)
            .register(registry)
            .increment();
    }
}
