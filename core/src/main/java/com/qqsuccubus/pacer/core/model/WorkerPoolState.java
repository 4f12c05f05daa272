package com.qqsuccubus.pacer.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Sizing state of the adaptive worker pool.
 * <p>
 * {@code minWorkers <= currentWorkers <= maxWorkers} holds for every published instance.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class WorkerPoolState {
    int minWorkers;
    int maxWorkers;
    int currentWorkers;
    double cpuThreshold;
    double memoryThreshold;

    /**
     * Incremented every time the execution substrate is rebuilt.
     */
    long generation;
}
