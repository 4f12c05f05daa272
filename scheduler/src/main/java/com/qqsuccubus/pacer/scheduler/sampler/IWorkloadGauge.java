package com.qqsuccubus.pacer.scheduler.sampler;

/**
 * Exposes the current concurrency depth of the worker pool to the sampler.
 */
public interface IWorkloadGauge {

    /**
     * @return Units of work currently executing
     */
    int activeCount();

    /**
     * @return Submitted units of work that have not started yet
     */
    int pendingCount();
}
