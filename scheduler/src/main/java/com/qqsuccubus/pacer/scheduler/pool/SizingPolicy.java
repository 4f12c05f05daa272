package com.qqsuccubus.pacer.scheduler.pool;

import com.qqsuccubus.pacer.core.model.ResourceSnapshot;
import com.qqsuccubus.pacer.core.model.SizingDecision;

/**
 * Computes worker pool sizing decisions from a resource snapshot.
 * <p>
 * Rules:
 * <pre>
 *   cpu > cpuThreshold OR mem > memThreshold                          -> shrink by 2 (not below min)
 *   cpu < 0.6 * cpuThreshold AND mem < 0.6 * memThreshold
 *       AND pending > current                                         -> grow by 2 (not above max)
 *   otherwise                                                         -> none
 * </pre>
 * </p>
 */
public class SizingPolicy {
    static final int STEP = 2;
    static final double HEADROOM_RATIO = 0.6;

    private final int minWorkers;
    private final int maxWorkers;
    private final double cpuThreshold;
    private final double memoryThreshold;

    public SizingPolicy(int minWorkers, int maxWorkers, double cpuThreshold, double memoryThreshold) {
        this.minWorkers = minWorkers;
        this.maxWorkers = maxWorkers;
        this.cpuThreshold = cpuThreshold;
        this.memoryThreshold = memoryThreshold;
    }

    public SizingDecision decide(int currentWorkers, ResourceSnapshot snapshot) {
        double cpu = snapshot.getCpuPercent();
        double mem = snapshot.getMemoryPercent();
        int pending = snapshot.getPendingQueueDepth();
        long now = System.currentTimeMillis();

        if (cpu > cpuThreshold || mem > memoryThreshold) {
            int target = Math.max(minWorkers, currentWorkers - STEP);
            if (target < currentWorkers) {
                return decision(SizingDecision.Action.SHRINK, currentWorkers, target,
                        String.format("High resource usage (cpu=%.1f%%, mem=%.1f%%)", cpu, mem), now);
            }
            return decision(SizingDecision.Action.NONE, currentWorkers, currentWorkers,
                    "High resource usage but already at minimum workers", now);
        }

        if (cpu < cpuThreshold * HEADROOM_RATIO
                && mem < memoryThreshold * HEADROOM_RATIO
                && pending > currentWorkers) {
            int target = Math.min(maxWorkers, currentWorkers + STEP);
            if (target > currentWorkers) {
                return decision(SizingDecision.Action.GROW, currentWorkers, target,
                        String.format("Low resource usage (cpu=%.1f%%, mem=%.1f%%, pending=%d)", cpu, mem, pending),
                        now);
            }
            return decision(SizingDecision.Action.NONE, currentWorkers, currentWorkers,
                    "Work is queueing but already at maximum workers", now);
        }

        return decision(SizingDecision.Action.NONE, currentWorkers, currentWorkers, "Within thresholds", now);
    }

    private static SizingDecision decision(SizingDecision.Action action, int from, int to, String reason, long now) {
        return SizingDecision.builder()
                .action(action)
                .previousWorkers(from)
                .targetWorkers(to)
                .reason(reason)
                .timestampMs(now)
                .build();
    }
}
