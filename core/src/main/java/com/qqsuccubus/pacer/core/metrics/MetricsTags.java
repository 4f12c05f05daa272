package com.qqsuccubus.pacer.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for a decision action (grow/shrink/none, increase/decrease/hold).
     */
    public static final String ACTION = "action";

    /**
     * Tag key for the execution path a failure came from (map/batch).
     */
    public static final String PATH = "path";

    /**
     * Tag key for a rate limiter mode (global/per_host).
     */
    public static final String MODE = "mode";
}
