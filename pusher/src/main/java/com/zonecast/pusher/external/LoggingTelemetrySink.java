package com.zonecast.pusher.external;

import com.zonecast.pusher.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;

/**
 * Reports errors to the log and counts them. Logging happens off the calling thread so
 * event loops never wait on appenders.
 */
public class LoggingTelemetrySink implements TelemetrySink {
    private static final Logger log = LoggerFactory.getLogger(LoggingTelemetrySink.class);

    private final MetricsService metrics;
    private final Scheduler scheduler;

    public LoggingTelemetrySink(MetricsService metrics, Scheduler scheduler) {
        this.metrics = metrics;
        this.scheduler = scheduler;
    }

    @Override
    public void report(Throwable error) {
        metrics.recordTelemetryReport();
        scheduler.schedule(() -> log.error("Reported error: {}", error.getMessage(), error));
    }

    @Override
    public void report(String message) {
        metrics.recordTelemetryReport();
        scheduler.schedule(() -> log.error("Reported: {}", message));
    }
}
