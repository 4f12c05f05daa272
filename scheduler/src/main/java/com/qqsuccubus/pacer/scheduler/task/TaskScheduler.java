package com.qqsuccubus.pacer.scheduler.task;

import com.google.common.base.Preconditions;
import com.qqsuccubus.pacer.core.metrics.MetricsNames;
import com.qqsuccubus.pacer.core.metrics.MetricsTags;
import com.qqsuccubus.pacer.core.util.Backoff;
import com.qqsuccubus.pacer.core.util.Sleeper;
import com.qqsuccubus.pacer.scheduler.config.SchedulerConfig;
import com.qqsuccubus.pacer.scheduler.pool.IWorkerPool;
import com.qqsuccubus.pacer.scheduler.pool.TaskResults;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Higher-level scheduling on top of a worker pool: sequential retry with exponential
 * backoff, and wave-by-wave batch execution.
 */
public class TaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private final IWorkerPool pool;
    private final SchedulerConfig config;
    private final Sleeper sleeper;

    private final Counter retries;
    private final Counter retriesExhausted;
    private final Counter batchFailures;

    public TaskScheduler(IWorkerPool pool, SchedulerConfig config, Sleeper sleeper, MeterRegistry meterRegistry) {
        this.pool = pool;
        this.config = config;
        this.sleeper = sleeper;

        retries = Counter.builder(MetricsNames.SCHEDULER_RETRIES_TOTAL)
                .description("Retry attempts scheduled after a failure")
                .register(meterRegistry);
        retriesExhausted = Counter.builder(MetricsNames.SCHEDULER_RETRY_EXHAUSTED_TOTAL)
                .description("Units of work that failed after every retry")
                .register(meterRegistry);
        batchFailures = Counter.builder(MetricsNames.POOL_TASK_FAILURES_TOTAL)
                .tag(MetricsTags.PATH, "batch")
                .register(meterRegistry);
    }

    /**
     * Runs {@code work} with the configured retry budget and backoff factor.
     *
     * @see #scheduleWithBackoff(Callable, int, Duration)
     */
    public <T> T scheduleWithBackoff(Callable<T> work) throws Exception {
        return scheduleWithBackoff(work, config.getMaxRetries(), config.getBackoffFactor());
    }

    /**
     * Submits {@code work} to the pool and blocks for its result, retrying on failure.
     * <p>
     * After failed attempt {@code n} (0-based) the caller sleeps {@code backoffFactor * 2^n}
     * before the next attempt. Up to {@code maxRetries + 1} attempts are made in total.
     * </p>
     *
     * @param work          Unit of work
     * @param maxRetries    Retries after the first attempt
     * @param backoffFactor Pause after the first failure
     * @return Result of the first successful attempt
     * @throws InterruptedException if the caller is interrupted; the running attempt is cancelled
     *                              and the interrupt flag stays set
     * @throws Exception the failure of the last attempt once retries are exhausted
     */
    public <T> T scheduleWithBackoff(Callable<T> work, int maxRetries, Duration backoffFactor) throws Exception {
        Preconditions.checkArgument(maxRetries >= 0, "maxRetries must be >= 0, got %s", maxRetries);
        Preconditions.checkArgument(!backoffFactor.isNegative(), "backoffFactor must not be negative");

        for (int attempt = 0; ; attempt++) {
            Future<T> future = pool.submit(work);
            try {
                return future.get();
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                log.debug("Interrupted while waiting for attempt {}, attempt cancelled", attempt + 1);
                throw e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (attempt >= maxRetries) {
                    retriesExhausted.increment();
                    log.error("Task failed after {} attempts: {}", attempt + 1, cause.toString());
                    throw asException(cause);
                }

                Duration pause = Backoff.exponential(attempt, backoffFactor);
                retries.increment();
                log.debug("Attempt {} failed ({}), retrying in {}ms", attempt + 1, cause.toString(), pause.toMillis());
                sleeper.sleep(pause);
            }
        }
    }

    /**
     * Runs tasks in waves sized to the pool's current worker count.
     *
     * @see #scheduleBatch(List, int)
     */
    public <T> List<T> scheduleBatch(List<? extends Callable<? extends T>> tasks) throws InterruptedException {
        return scheduleBatch(tasks, pool.getWorkerCount());
    }

    /**
     * Splits {@code tasks} into consecutive waves of {@code maxConcurrent}, submits a whole wave,
     * waits for every member, then moves to the next wave.
     *
     * @param tasks         Units of work
     * @param maxConcurrent Wave size
     * @return Slot {@code i} holds the result of task {@code i}, or {@code null} if it failed
     * @throws InterruptedException if interrupted while waiting for a wave; the unfinished
     *                              members of that wave are cancelled
     */
    public <T> List<T> scheduleBatch(List<? extends Callable<? extends T>> tasks, int maxConcurrent)
            throws InterruptedException {
        Preconditions.checkArgument(maxConcurrent > 0, "maxConcurrent must be > 0, got %s", maxConcurrent);

        List<T> results = new ArrayList<>(tasks.size());
        int waves = 0;
        for (int start = 0; start < tasks.size(); start += maxConcurrent) {
            List<? extends Callable<? extends T>> wave = tasks.subList(start, Math.min(tasks.size(), start + maxConcurrent));

            List<Future<? extends T>> futures = new ArrayList<>(wave.size());
            for (Callable<? extends T> task : wave) {
                futures.add(pool.submit(task));
            }

            // Wait for the current wave to finish
            try {
                for (Future<? extends T> future : futures) {
                    results.add(TaskResults.<T>awaitOrNull(future, err -> {
                        batchFailures.increment();
                        log.error("Batch task error: {}", err.toString(), err);
                    }));
                }
            } catch (InterruptedException e) {
                futures.forEach(future -> future.cancel(true));
                Thread.currentThread().interrupt();
                throw e;
            }
            waves++;
        }

        log.debug("Batch of {} tasks completed in {} waves of up to {}", tasks.size(), waves, maxConcurrent);
        return results;
    }

    private static Exception asException(Throwable cause) {
        if (cause instanceof Error error) {
            throw error;
        }
        if (cause instanceof Exception exception) {
            return exception;
        }
        return new ExecutionException(cause);
    }
}
