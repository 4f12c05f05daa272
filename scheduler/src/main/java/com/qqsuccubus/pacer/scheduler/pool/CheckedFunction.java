package com.qqsuccubus.pacer.scheduler.pool;

/**
 * Function that may throw a checked exception; the per-item work of {@link IWorkerPool#map}.
 */
@FunctionalInterface
public interface CheckedFunction<I, O> {
    O apply(I input) throws Exception;
}
