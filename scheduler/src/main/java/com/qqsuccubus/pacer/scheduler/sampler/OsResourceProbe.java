package com.qqsuccubus.pacer.scheduler.sampler;

import com.qqsuccubus.pacer.core.util.Sleeper;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.time.Duration;

/**
 * {@link IResourceProbe} backed by the platform management beans.
 * <p>
 * Uses the {@code com.sun.management} extension for system CPU and physical memory when the
 * JVM provides it; otherwise falls back to load average per core and JVM heap usage.
 * </p>
 */
public class OsResourceProbe implements IResourceProbe {

    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    private final Sleeper sleeper;

    public OsResourceProbe(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    @Override
    public double cpuPercent(Duration observationWindow) throws InterruptedException {
        if (observationWindow.isZero() || observationWindow.isNegative()) {
            // First reading after JVM start may be negative (not yet available)
            return Math.max(0.0, readCpu());
        }
        readCpu(); // prime the delta
        sleeper.sleep(observationWindow);
        double cpu = readCpu();
        if (cpu < 0) {
            throw new IllegalStateException("System CPU load is not available on this platform");
        }
        return cpu;
    }

    @Override
    public double memoryPercent() {
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            long total = sunOs.getTotalMemorySize();
            long free = sunOs.getFreeMemorySize();
            if (total <= 0) {
                throw new IllegalStateException("Total physical memory is not available");
            }
            return clamp((total - free) * 100.0 / total);
        }
        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        return clamp(used * 100.0 / runtime.maxMemory());
    }

    @Override
    public int liveThreadCount() {
        return ManagementFactory.getThreadMXBean().getThreadCount();
    }

    private double readCpu() {
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            double load = sunOs.getCpuLoad();
            return load < 0 ? -1.0 : clamp(load * 100.0);
        }
        double loadAverage = os.getSystemLoadAverage();
        if (loadAverage < 0) {
            return -1.0;
        }
        return clamp(loadAverage / os.getAvailableProcessors() * 100.0);
    }

    private static double clamp(double percent) {
        return Math.max(0.0, Math.min(100.0, percent));
    }
}
