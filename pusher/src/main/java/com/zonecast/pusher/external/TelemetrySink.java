package com.zonecast.pusher.external;

/**
 * Fire-and-forget error reporting.
 */
public interface TelemetrySink {
    void report(Throwable error);

    void report(String message);
}
