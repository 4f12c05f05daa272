package com.qqsuccubus.pacer.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Point-in-time reading of host load and worker pool depth.
 * <p>
 * Produced only by the resource sampler; consumed by the worker pool's sizing step
 * and by callers that need the current load (for example, to pick a thread count).
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class ResourceSnapshot {
    /**
     * Host CPU utilization as a percentage (0.0 to 100.0).
     */
    double cpuPercent;

    /**
     * Host physical memory utilization as a percentage (0.0 to 100.0).
     */
    double memoryPercent;

    /**
     * Number of units of work currently executing in the worker pool.
     */
    int activeWorkerCount;

    /**
     * Number of submitted units of work that have not started yet.
     */
    int pendingQueueDepth;

    /**
     * Live JVM threads at sampling time.
     */
    int liveThreadCount;

    /**
     * Timestamp when this snapshot was taken (milliseconds since epoch).
     */
    long timestampMs;
}
