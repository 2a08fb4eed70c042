package com.zonecast.core.metrics;

/**
 * Tag keys shared by the meters in {@link MetricsNames}.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "node_id";

    /**
     * Client message kind, e.g. {@code viewport} or {@code add_space_filter}.
     */
    public static final String TYPE = "type";

    /**
     * Why a connection was refused or a message dropped.
     */
    public static final String REASON = "reason";
}
