package com.qqsuccubus.pacer.scheduler.sampler;

import java.time.Duration;

/**
 * Reads host utilization for the resource sampler.
 */
public interface IResourceProbe {

    /**
     * Measures host CPU utilization over an observation window.
     *
     * @param observationWindow How long to observe; {@link Duration#ZERO} for an immediate reading
     * @return CPU utilization percent (0.0 to 100.0)
     * @throws InterruptedException if interrupted while observing
     */
    double cpuPercent(Duration observationWindow) throws InterruptedException;

    /**
     * @return Physical memory utilization percent (0.0 to 100.0)
     */
    double memoryPercent();

    /**
     * @return Live JVM thread count
     */
    int liveThreadCount();
}
