package com.qqsuccubus.pacer.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code pacer.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: duration of a blocking wait</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Current worker count of the adaptive pool.
     */
    public static final String POOL_WORKERS = "pacer.pool.workers";

    /**
     * Gauge: Generation of the current execution substrate.
     */
    public static final String POOL_GENERATION = "pacer.pool.generation";

    /**
     * Gauge: Submitted units of work not yet started.
     */
    public static final String POOL_PENDING = "pacer.pool.pending";

    /**
     * Gauge: Units of work currently executing.
     */
    public static final String POOL_ACTIVE = "pacer.pool.active";

    /**
     * Counter: Sizing decisions made.
     * <p>
     * Tags: action (grow/shrink/none)
     * </p>
     */
    public static final String POOL_SIZING_DECISIONS_TOTAL = "pacer.pool.sizing.decisions.total";

    /**
     * Counter: Units of work that failed inside map or batch execution.
     * <p>
     * Tags: path (map/batch)
     * </p>
     */
    public static final String POOL_TASK_FAILURES_TOTAL = "pacer.pool.task.failures.total";

    /**
     * Gauge: CPU percent of the most recent sample.
     */
    public static final String SAMPLER_CPU = "pacer.sampler.cpu";

    /**
     * Gauge: Memory percent of the most recent sample.
     */
    public static final String SAMPLER_MEMORY = "pacer.sampler.memory";

    /**
     * Counter: Sampling cycles that failed.
     */
    public static final String SAMPLER_ERRORS_TOTAL = "pacer.sampler.errors.total";

    /**
     * Counter: Retry attempts scheduled after a failure.
     */
    public static final String SCHEDULER_RETRIES_TOTAL = "pacer.scheduler.retries.total";

    /**
     * Counter: Units of work that failed after every retry.
     */
    public static final String SCHEDULER_RETRY_EXHAUSTED_TOTAL = "pacer.scheduler.retry.exhausted.total";

    /**
     * Timer: Time callers spent blocked waiting for rate limiter capacity.
     */
    public static final String RATELIMIT_WAIT = "pacer.ratelimit.wait";

    /**
     * Counter: Requests that had to wait for capacity.
     */
    public static final String RATELIMIT_THROTTLED_TOTAL = "pacer.ratelimit.throttled.total";

    /**
     * Gauge: Shared allowed request rate per host window.
     */
    public static final String RATE_CURRENT = "pacer.rate.current";

    /**
     * Counter: Adaptive rate window rollovers.
     * <p>
     * Tags: action (increase/decrease/hold)
     * </p>
     */
    public static final String RATE_ADJUSTMENTS_TOTAL = "pacer.rate.adjustments.total";

    /**
     * Timer: Pre-request delays applied.
     */
    public static final String DELAY_APPLIED = "pacer.delay.applied";
}
