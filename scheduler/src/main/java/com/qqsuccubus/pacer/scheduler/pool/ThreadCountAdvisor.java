package com.qqsuccubus.pacer.scheduler.pool;

import com.qqsuccubus.pacer.core.model.ResourceSnapshot;

/**
 * Suggests a thread count for callers that size their own fan-out.
 * <pre>
 *   cpu > 80 OR mem > 80   -> max(1, base / 2)
 *   cpu < 30 AND mem < 50  -> min(50, base * 2)
 *   otherwise              -> base
 * </pre>
 */
public final class ThreadCountAdvisor {
    public static final int MAX_THREADS = 50;

    private ThreadCountAdvisor() {
    }

    public static int optimalThreadCount(int baseCount, ResourceSnapshot snapshot) {
        double cpu = snapshot.getCpuPercent();
        double mem = snapshot.getMemoryPercent();
        if (cpu > 80 || mem > 80) {
            return Math.max(1, baseCount / 2);
        }
        if (cpu < 30 && mem < 50) {
            return Math.min(MAX_THREADS, baseCount * 2);
        }
        return baseCount;
    }
}
