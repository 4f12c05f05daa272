package com.qqsuccubus.pacer.scheduler.config;

import com.google.common.base.Preconditions;
import com.qqsuccubus.pacer.core.settings.ISettingsStore;
import com.qqsuccubus.pacer.core.settings.InMemorySettingsStore;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for the adaptive worker pool, resource sampler and task scheduler.
 */
@Value
@Builder(toBuilder = true)
public class SchedulerConfig {

    // Pool bounds
    @Builder.Default
    int minWorkers = 2;
    @Builder.Default
    int maxWorkers = 15;
    @Builder.Default
    int initialWorkers = 0;     // 0 = start at minWorkers

    // Sizing thresholds (percent)
    @Builder.Default
    double cpuThreshold = 85.0;
    @Builder.Default
    double memoryThreshold = 85.0;

    // Sampling cadence
    @Builder.Default
    Duration observationWindow = Duration.ofSeconds(1);
    @Builder.Default
    Duration sampleInterval = Duration.ofSeconds(2);
    @Builder.Default
    int historyCapacity = 100;
    @Builder.Default
    int historyRetain = 50;

    // Retry defaults
    @Builder.Default
    int maxRetries = 3;
    @Builder.Default
    Duration backoffFactor = Duration.ofSeconds(1);

    @Builder.Default
    Duration shutdownTimeout = Duration.ofSeconds(30);

    public static SchedulerConfig fromEnv() {
        return from(InMemorySettingsStore.fromEnv());
    }

    public static SchedulerConfig from(ISettingsStore settings) {
        return SchedulerConfig.builder()
                .minWorkers(settings.getInt("POOL_MIN_WORKERS", 2))
                .maxWorkers(settings.getInt("POOL_MAX_WORKERS", 15))
                .initialWorkers(settings.getInt("POOL_INITIAL_WORKERS", 0))
                .cpuThreshold(settings.getDouble("POOL_CPU_THRESHOLD", 85.0))
                .memoryThreshold(settings.getDouble("POOL_MEMORY_THRESHOLD", 85.0))
                .observationWindow(Duration.ofMillis(settings.getLong("SAMPLER_OBSERVATION_MS", 1000)))
                .sampleInterval(Duration.ofMillis(settings.getLong("SAMPLER_INTERVAL_MS", 2000)))
                .maxRetries(settings.getInt("RETRY_MAX_RETRIES", 3))
                .backoffFactor(Duration.ofMillis(settings.getLong("RETRY_BACKOFF_MS", 1000)))
                .shutdownTimeout(Duration.ofSeconds(settings.getLong("SHUTDOWN_TIMEOUT_SEC", 30)))
                .build();
    }

    /**
     * Worker count the pool starts with, clamped to the bounds.
     */
    public int effectiveInitialWorkers() {
        if (initialWorkers <= 0) {
            return minWorkers;
        }
        return Math.max(minWorkers, Math.min(maxWorkers, initialWorkers));
    }

    /**
     * Rejects bounds under which {@code minWorkers <= currentWorkers <= maxWorkers} cannot hold.
     *
     * @return this config
     * @throws IllegalArgumentException on invalid bounds
     */
    public SchedulerConfig validate() {
        Preconditions.checkArgument(minWorkers >= 1, "minWorkers must be >= 1, got %s", minWorkers);
        Preconditions.checkArgument(maxWorkers >= minWorkers,
                "maxWorkers (%s) must be >= minWorkers (%s)", maxWorkers, minWorkers);
        Preconditions.checkArgument(cpuThreshold > 0 && memoryThreshold > 0,
                "thresholds must be positive (cpu=%s, memory=%s)", cpuThreshold, memoryThreshold);
        Preconditions.checkArgument(!observationWindow.isNegative() && !sampleInterval.isNegative(),
                "sampling durations must not be negative");
        Preconditions.checkArgument(historyRetain >= 1 && historyCapacity >= historyRetain,
                "historyCapacity (%s) must be >= historyRetain (%s) >= 1", historyCapacity, historyRetain);
        Preconditions.checkArgument(maxRetries >= 0, "maxRetries must be >= 0, got %s", maxRetries);
        Preconditions.checkArgument(!backoffFactor.isNegative(), "backoffFactor must not be negative");
        return this;
    }
}
