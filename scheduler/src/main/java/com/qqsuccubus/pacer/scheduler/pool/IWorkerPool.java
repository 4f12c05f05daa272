package com.qqsuccubus.pacer.scheduler.pool;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * Executes caller-supplied units of work on pooled worker threads.
 */
public interface IWorkerPool {

    /**
     * Enqueues a unit of work.
     *
     * @param work Unit of work
     * @return Handle to the eventual result
     */
    <T> Future<T> submit(Callable<T> work);

    /**
     * Runs {@code fn} over every item and waits for all of them.
     *
     * @return One slot per item in item order; {@code null} where the item's work failed
     * @throws InterruptedException if interrupted while waiting
     */
    <I, O> List<O> map(CheckedFunction<? super I, ? extends O> fn, List<? extends I> items)
            throws InterruptedException;

    /**
     * @return Current worker count
     */
    int getWorkerCount();

    /**
     * Stops sampling and releases workers.
     *
     * @param wait Whether to block until in-flight work drains
     */
    void shutdown(boolean wait);
}
