package com.qqsuccubus.pacer.scheduler.pool;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.qqsuccubus.pacer.core.metrics.MetricsNames;
import com.qqsuccubus.pacer.core.metrics.MetricsTags;
import com.qqsuccubus.pacer.core.model.ResourceSnapshot;
import com.qqsuccubus.pacer.core.model.SizingDecision;
import com.qqsuccubus.pacer.core.model.WorkerPoolState;
import com.qqsuccubus.pacer.scheduler.config.SchedulerConfig;
import com.qqsuccubus.pacer.scheduler.sampler.IResourceProbe;
import com.qqsuccubus.pacer.scheduler.sampler.IWorkloadGauge;
import com.qqsuccubus.pacer.scheduler.sampler.ResourceSampler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Worker pool whose size follows host load.
 * <p>
 * The pool owns a {@link ResourceSampler}; every sample runs the {@link SizingPolicy}
 * and, when the worker count changes, swaps in a new execution substrate (a fixed-size
 * {@link ThreadPoolExecutor} tagged with a generation number) under the pool lock.
 * Work already handed to the previous generation finishes there; only new submissions
 * observe the new capacity.
 * </p>
 */
public class DynamicWorkerPool implements IWorkerPool, IWorkloadGauge, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DynamicWorkerPool.class);

    private final SchedulerConfig config;
    private final SizingPolicy sizingPolicy;
    private final ResourceSampler sampler;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Generation current;
    // Previous generations still draining; guarded by lock
    private final List<ThreadPoolExecutor> retired = new ArrayList<>();

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private final Counter growDecisions;
    private final Counter shrinkDecisions;
    private final Counter noneDecisions;
    private final Counter mapFailures;

    public DynamicWorkerPool(SchedulerConfig config, IResourceProbe probe, MeterRegistry meterRegistry) {
        this.config = config.validate();
        this.sizingPolicy = new SizingPolicy(config.getMinWorkers(), config.getMaxWorkers(),
                config.getCpuThreshold(), config.getMemoryThreshold());
        this.current = new Generation(1, config.effectiveInitialWorkers());
        this.sampler = new ResourceSampler(config, probe, this, this::adjustWorkers, meterRegistry);

        // Metrics
        growDecisions = Counter.builder(MetricsNames.POOL_SIZING_DECISIONS_TOTAL)
                .tag(MetricsTags.ACTION, "grow")
                .register(meterRegistry);
        shrinkDecisions = Counter.builder(MetricsNames.POOL_SIZING_DECISIONS_TOTAL)
                .tag(MetricsTags.ACTION, "shrink")
                .register(meterRegistry);
        noneDecisions = Counter.builder(MetricsNames.POOL_SIZING_DECISIONS_TOTAL)
                .tag(MetricsTags.ACTION, "none")
                .register(meterRegistry);
        mapFailures = Counter.builder(MetricsNames.POOL_TASK_FAILURES_TOTAL)
                .tag(MetricsTags.PATH, "map")
                .register(meterRegistry);

        Gauge.builder(MetricsNames.POOL_WORKERS, this, DynamicWorkerPool::getWorkerCount)
                .register(meterRegistry);
        Gauge.builder(MetricsNames.POOL_GENERATION, this, p -> p.current.id)
                .register(meterRegistry);
        Gauge.builder(MetricsNames.POOL_PENDING, pending, AtomicInteger::get)
                .register(meterRegistry);
        Gauge.builder(MetricsNames.POOL_ACTIVE, active, AtomicInteger::get)
                .register(meterRegistry);

        log.info("Worker pool created (workers={}, min={}, max={}, cpuThreshold={}, memoryThreshold={})",
                current.size, config.getMinWorkers(), config.getMaxWorkers(),
                config.getCpuThreshold(), config.getMemoryThreshold());
    }

    /**
     * Starts background resource sampling, which drives pool sizing.
     *
     * @return this pool
     */
    public DynamicWorkerPool start() {
        if (shutdown.get()) {
            throw new IllegalStateException("Worker pool is shut down");
        }
        sampler.start();
        return this;
    }

    @Override
    public <T> Future<T> submit(Callable<T> work) {
        if (shutdown.get()) {
            throw new RejectedExecutionException("Worker pool is shut down");
        }
        TrackedTask<T> task = new TrackedTask<>(work);
        pending.incrementAndGet();

        while (true) {
            Generation generation = current;
            try {
                generation.executor.execute(task);
                return task;
            } catch (RejectedExecutionException e) {
                if (shutdown.get() || generation == current) {
                    task.leaveQueue();
                    throw e;
                }
                // Substrate was swapped between the read and the submit; use the new one
            }
        }
    }

    @Override
    public <I, O> List<O> map(CheckedFunction<? super I, ? extends O> fn, List<? extends I> items)
            throws InterruptedException {
        List<Future<O>> futures = new ArrayList<>(items.size());
        for (I item : items) {
            futures.add(submit(() -> fn.apply(item)));
        }

        List<O> results = new ArrayList<>(futures.size());
        for (Future<O> future : futures) {
            results.add(TaskResults.awaitOrNull(future, err -> {
                mapFailures.increment();
                log.error("Task error: {}", err.toString(), err);
            }));
        }
        return results;
    }

    /**
     * Runs one sizing step against a fresh snapshot and rebuilds the pool if the worker count changes.
     *
     * @param snapshot Latest resource snapshot
     * @return The decision taken
     */
    public SizingDecision adjustWorkers(ResourceSnapshot snapshot) {
        lock.lock();
        try {
            int workers = current.size;
            if (shutdown.get()) {
                return SizingDecision.builder()
                        .action(SizingDecision.Action.NONE)
                        .previousWorkers(workers)
                        .targetWorkers(workers)
                        .reason("Pool is shut down")
                        .timestampMs(System.currentTimeMillis())
                        .build();
            }

            SizingDecision decision = sizingPolicy.decide(workers, snapshot);
            switch (decision.getAction()) {
                case SHRINK -> {
                    shrinkDecisions.increment();
                    log.info("Reducing workers to {} due to high resource usage ({})",
                            decision.getTargetWorkers(), decision.getReason());
                    rebuild(decision.getTargetWorkers());
                }
                case GROW -> {
                    growDecisions.increment();
                    log.info("Increasing workers to {} due to low resource usage ({})",
                            decision.getTargetWorkers(), decision.getReason());
                    rebuild(decision.getTargetWorkers());
                }
                default -> noneDecisions.increment();
            }
            return decision;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getWorkerCount() {
        return current.size;
    }

    public WorkerPoolState getState() {
        Generation generation = current;
        return WorkerPoolState.builder()
                .minWorkers(config.getMinWorkers())
                .maxWorkers(config.getMaxWorkers())
                .currentWorkers(generation.size)
                .cpuThreshold(config.getCpuThreshold())
                .memoryThreshold(config.getMemoryThreshold())
                .generation(generation.id)
                .build();
    }

    public ResourceSnapshot currentSnapshot() {
        return sampler.currentSnapshot();
    }

    public List<ResourceSnapshot> history() {
        return sampler.history();
    }

    public ResourceSampler getSampler() {
        return sampler;
    }

    @Override
    public int activeCount() {
        return active.get();
    }

    @Override
    public int pendingCount() {
        return pending.get();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    @Override
    public void shutdown(boolean wait) {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down worker pool (wait={})", wait);
        sampler.stop(config.getShutdownTimeout());

        List<ThreadPoolExecutor> executors;
        lock.lock();
        try {
            executors = new ArrayList<>(retired);
            executors.add(current.executor);
            retired.clear();
        } finally {
            lock.unlock();
        }
        executors.forEach(ThreadPoolExecutor::shutdown);

        if (!wait) {
            return;
        }
        long deadline = System.nanoTime() + config.getShutdownTimeout().toNanos();
        try {
            for (ThreadPoolExecutor executor : executors) {
                long remaining = deadline - System.nanoTime();
                if (!executor.awaitTermination(Math.max(0, remaining), TimeUnit.NANOSECONDS)) {
                    log.warn("Worker pool did not drain within {}ms, forcing shutdown",
                            config.getShutdownTimeout().toMillis());
                    executors.forEach(ThreadPoolExecutor::shutdownNow);
                    return;
                }
            }
            log.info("Worker pool drained");
        } catch (InterruptedException e) {
            executors.forEach(ThreadPoolExecutor::shutdownNow);
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown(true);
    }

    // Caller holds lock
    private void rebuild(int workers) {
        Generation previous = current;
        current = new Generation(previous.id + 1, workers);
        previous.executor.shutdown();
        retired.removeIf(ThreadPoolExecutor::isTerminated);
        retired.add(previous.executor);
        log.debug("Worker pool generation {} -> {} ({} workers)", previous.id, current.id, workers);
    }

    /**
     * One execution substrate: a fixed-size executor and the generation it belongs to.
     */
    /**
     * Queued work that leaves the pending count exactly once: when a worker picks it up,
     * or when it is cancelled before that.
     */
    private final class TrackedTask<T> extends FutureTask<T> {
        private final AtomicBoolean dequeued = new AtomicBoolean(false);

        TrackedTask(Callable<T> work) {
            super(work);
        }

        @Override
        public void run() {
            if (!leaveQueue()) {
                // Cancelled while queued
                return;
            }
            active.incrementAndGet();
            try {
                super.run();
            } finally {
                active.decrementAndGet();
            }
        }

        @Override
        protected void done() {
            leaveQueue();
        }

        boolean leaveQueue() {
            if (dequeued.compareAndSet(false, true)) {
                pending.decrementAndGet();
                return true;
            }
            return false;
        }
    }

    private static final class Generation {
        final long id;
        final int size;
        final ThreadPoolExecutor executor;

        Generation(long id, int size) {
            this.id = id;
            this.size = size;
            this.executor = new ThreadPoolExecutor(
                    size, size,
                    0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(),
                    new ThreadFactoryBuilder()
                            .setNameFormat("pacer-worker-g" + id + "-%d")
                            .build());
        }
    }
}
