package com.qqsuccubus.pacer.scheduler.sampler;

import com.qqsuccubus.pacer.core.metrics.MetricsNames;
import com.qqsuccubus.pacer.core.model.ResourceSnapshot;
import com.qqsuccubus.pacer.scheduler.config.SchedulerConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Periodically samples host CPU/memory and worker pool depth.
 * <p>
 * Each cycle observes CPU over {@code observationWindow}, builds a {@link ResourceSnapshot},
 * appends it to a bounded history and hands it to the listener (the pool's sizing step).
 * The next cycle starts {@code sampleInterval} after the observation ends.
 * </p>
 * <p>
 * History keeps at most {@code historyCapacity} snapshots; when exceeded it is trimmed
 * to the most recent {@code historyRetain}.
 * </p>
 */
public class ResourceSampler {
    private static final Logger log = LoggerFactory.getLogger(ResourceSampler.class);

    private final SchedulerConfig config;
    private final IResourceProbe probe;
    private final IWorkloadGauge workload;
    private final Consumer<ResourceSnapshot> listener;

    private final Deque<ResourceSnapshot> history = new ArrayDeque<>();
    private final Counter samplingErrors;

    private volatile ResourceSnapshot latest;
    private Scheduler samplingScheduler;
    private Disposable samplingTask;

    public ResourceSampler(SchedulerConfig config,
                           IResourceProbe probe,
                           IWorkloadGauge workload,
                           Consumer<ResourceSnapshot> listener,
                           MeterRegistry meterRegistry) {
        this.config = config;
        this.probe = probe;
        this.workload = workload;
        this.listener = listener;

        samplingErrors = Counter.builder(MetricsNames.SAMPLER_ERRORS_TOTAL)
                .description("Sampling cycles that failed")
                .register(meterRegistry);

        Gauge.builder(MetricsNames.SAMPLER_CPU, this, s -> s.latest != null ? s.latest.getCpuPercent() : 0.0)
                .baseUnit("percent")
                .register(meterRegistry);
        Gauge.builder(MetricsNames.SAMPLER_MEMORY, this, s -> s.latest != null ? s.latest.getMemoryPercent() : 0.0)
                .baseUnit("percent")
                .register(meterRegistry);
    }

    /**
     * Starts the periodic sampling loop on a dedicated thread.
     *
     * @return Disposable that cancels future cycles
     */
    public synchronized Disposable start() {
        if (samplingTask != null && !samplingTask.isDisposed()) {
            return samplingTask;
        }
        Duration period = config.getObservationWindow().plus(config.getSampleInterval());
        samplingScheduler = Schedulers.newSingle("pacer-resource-sampler", true);
        samplingTask = Flux.interval(Duration.ZERO, period, samplingScheduler)
                .subscribe(tick -> sampleOnce(),
                        err -> log.error("Resource sampler terminated unexpectedly", err));

        log.info("Resource sampler started (observation={}ms, interval={}ms)",
                config.getObservationWindow().toMillis(), config.getSampleInterval().toMillis());
        return samplingTask;
    }

    /**
     * Runs one sampling cycle.
     * <p>
     * Never throws: probe and listener failures are logged and counted.
     * </p>
     *
     * @return the new snapshot, or empty if the cycle failed
     */
    public Optional<ResourceSnapshot> sampleOnce() {
        try {
            double cpu = probe.cpuPercent(config.getObservationWindow());
            ResourceSnapshot snapshot = readSnapshot(cpu);
            record(snapshot);
            log.debug("Sampled {}", snapshot);

            listener.accept(snapshot);
            return Optional.of(snapshot);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Resource sampling interrupted");
            return Optional.empty();
        } catch (Exception e) {
            samplingErrors.increment();
            log.error("Resource monitor error: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Returns the most recent snapshot, taking an immediate reading if nothing was sampled yet.
     *
     * @throws IllegalStateException if interrupted while taking the immediate reading and no
     *                               sample exists yet; the interrupt flag stays set
     */
    public ResourceSnapshot currentSnapshot() {
        ResourceSnapshot snapshot = latest;
        if (snapshot != null) {
            return snapshot;
        }
        try {
            return readSnapshot(probe.cpuPercent(Duration.ZERO));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            snapshot = latest;
            if (snapshot != null) {
                return snapshot;
            }
            throw new IllegalStateException("Interrupted while reading host resources", e);
        }
    }

    /**
     * @return Copy of the retained history, oldest first
     */
    public List<ResourceSnapshot> history() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    /**
     * Stops sampling and waits for an in-progress cycle to finish.
     *
     * @param timeout Maximum time to wait for the sampling thread
     */
    public synchronized void stop(Duration timeout) {
        if (samplingTask == null) {
            return;
        }
        samplingTask.dispose();
        Scheduler scheduler = samplingScheduler;
        scheduler.disposeGracefully()
                .timeout(timeout)
                .doOnError(err -> {
                    log.warn("Resource sampler did not stop within {}ms, forcing", timeout.toMillis());
                    scheduler.dispose();
                })
                .onErrorComplete()
                .block();
        samplingTask = null;
        samplingScheduler = null;
        log.info("Resource sampler stopped");
    }

    public synchronized boolean isRunning() {
        return samplingTask != null && !samplingTask.isDisposed();
    }

    private ResourceSnapshot readSnapshot(double cpu) {
        return ResourceSnapshot.builder()
                .cpuPercent(cpu)
                .memoryPercent(probe.memoryPercent())
                .activeWorkerCount(workload.activeCount())
                .pendingQueueDepth(workload.pendingCount())
                .liveThreadCount(probe.liveThreadCount())
                .timestampMs(System.currentTimeMillis())
                .build();
    }

    private void record(ResourceSnapshot snapshot) {
        synchronized (history) {
            history.addLast(snapshot);
            if (history.size() > config.getHistoryCapacity()) {
                while (history.size() > config.getHistoryRetain()) {
                    history.removeFirst();
                }
            }
        }
        latest = snapshot;
    }
}
