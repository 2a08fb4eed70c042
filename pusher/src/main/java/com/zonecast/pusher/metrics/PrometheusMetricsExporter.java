package com.zonecast.pusher.metrics;

import com.zonecast.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Backs {@code GET /metrics}.
 * <p>
 * Reactor Netty publishes its HTTP server meters to its global composite registry, so pusher
 * meters go there too and a single Prometheus registry attached to it sees both. Every meter
 * is tagged with the node id.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        prometheusRegistry.config().commonTags(MetricsTags.NODE_ID, nodeId);

        this.registry = Metrics.REGISTRY;
        if (registry instanceof CompositeMeterRegistry) {
            ((CompositeMeterRegistry) registry).add(prometheusRegistry);
        } else {
            log.warn("Reactor Netty registry is not composite, /metrics will only show pusher meters");
        }
        log.info("Prometheus registry attached for node {}", nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
