package com.qqsuccubus.pacer.engine;

import com.google.common.base.Ticker;
import com.qqsuccubus.pacer.core.model.RateAdjustment;
import com.qqsuccubus.pacer.core.model.ResourceSnapshot;
import com.qqsuccubus.pacer.core.settings.ISettingsStore;
import com.qqsuccubus.pacer.core.settings.InMemorySettingsStore;
import com.qqsuccubus.pacer.core.util.Sleeper;
import com.qqsuccubus.pacer.scheduler.config.SchedulerConfig;
import com.qqsuccubus.pacer.scheduler.pool.DynamicWorkerPool;
import com.qqsuccubus.pacer.scheduler.pool.ThreadCountAdvisor;
import com.qqsuccubus.pacer.scheduler.sampler.IResourceProbe;
import com.qqsuccubus.pacer.scheduler.sampler.OsResourceProbe;
import com.qqsuccubus.pacer.scheduler.task.TaskScheduler;
import com.qqsuccubus.pacer.throttle.adaptive.AdaptiveRateController;
import com.qqsuccubus.pacer.throttle.config.ThrottleConfig;
import com.qqsuccubus.pacer.throttle.delay.DelayInjector;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;

/**
 * Process-wide pacing context: one worker pool, one task scheduler, one adaptive rate
 * controller and one delay injector, created together and shut down together.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Run units of work with retry on the adaptive pool</li>
 *   <li>Pace outbound requests per host (delay first, then rate-limiter wait)</li>
 *   <li>Feed request outcomes back into the adaptive rate</li>
 *   <li>Stop sampling and drain the pool on shutdown</li>
 * </ul>
 * </p>
 */
public class PacerContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PacerContext.class);

    private final DynamicWorkerPool pool;
    private final TaskScheduler scheduler;
    private final AdaptiveRateController rateController;
    private final DelayInjector delayInjector;
    private final int baseThreadCount;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private PacerContext(Builder builder) {
        ISettingsStore settings = builder.settings;
        SchedulerConfig schedulerConfig = builder.schedulerConfig != null
                ? builder.schedulerConfig : SchedulerConfig.from(settings);
        ThrottleConfig throttleConfig = builder.throttleConfig != null
                ? builder.throttleConfig : ThrottleConfig.from(settings);
        IResourceProbe probe = builder.probe != null ? builder.probe : new OsResourceProbe(builder.sleeper);

        this.baseThreadCount = settings.getInt("THREAD_NUM", 10);
        this.pool = new DynamicWorkerPool(schedulerConfig, probe, builder.meterRegistry);
        this.scheduler = new TaskScheduler(pool, schedulerConfig, builder.sleeper, builder.meterRegistry);
        this.rateController = new AdaptiveRateController(throttleConfig, builder.ticker, builder.sleeper,
                builder.meterRegistry);
        this.delayInjector = new DelayInjector(throttleConfig.getBaseDelay(), throttleConfig.getDelayJitter(),
                builder.random, builder.sleeper, builder.meterRegistry);

        if (builder.startSampling) {
            pool.start();
        }
        if (builder.shutdownHook || settings.getBoolean("PACER_SHUTDOWN_HOOK", false)) {
            handleShutdown(this);
        }
        log.info("Pacer context ready (workers={}, rate={}, threadNum={})",
                pool.getWorkerCount(), rateController.currentRate(), baseThreadCount);
    }

    public static PacerContext fromEnv() {
        return builder().settings(InMemorySettingsStore.fromEnv()).build();
    }

    public static PacerContext create(ISettingsStore settings) {
        return builder().settings(settings).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs {@code work} on the pool with the configured retry budget.
     *
     * @throws Exception the last failure once retries are exhausted
     */
    public <T> T submitTask(Callable<T> work) throws Exception {
        return scheduler.scheduleWithBackoff(work);
    }

    /**
     * Paces one request to {@code host}: the injected delay, then the host's rate-limiter wait.
     *
     * @return Total time blocked
     */
    public Duration waitBeforeRequest(String host) throws InterruptedException {
        Duration delay = delayInjector.applyDelay(host);
        Duration wait = rateController.waitIfNeeded(host);
        return delay.plus(wait);
    }

    public Optional<RateAdjustment> reportRequestResult(String host, boolean success) {
        return rateController.reportResult(host, success);
    }

    public void setHostRateLimit(String host, int rate) {
        rateController.setHostRate(host, rate);
    }

    public boolean shouldDelayRequest(String host) {
        return rateController.shouldDelayRequest(host);
    }

    public void setHostDelay(String host, Duration delay) {
        delayInjector.setHostDelay(host, delay);
    }

    /**
     * Suggested fan-out for the configured {@code THREAD_NUM} under current load.
     */
    public int optimalThreadCount() {
        return optimalThreadCount(baseThreadCount);
    }

    /**
     * Falls back to {@code baseCount} when no reading is available because the caller was interrupted.
     */
    public int optimalThreadCount(int baseCount) {
        ResourceSnapshot snapshot;
        try {
            snapshot = pool.currentSnapshot();
        } catch (IllegalStateException e) {
            log.warn("No resource reading available, keeping {} threads: {}", baseCount, e.getMessage());
            return baseCount;
        }
        return ThreadCountAdvisor.optimalThreadCount(baseCount, snapshot);
    }

    public ResourceSnapshot currentSnapshot() {
        return pool.currentSnapshot();
    }

    public int workerCount() {
        return pool.getWorkerCount();
    }

    public DynamicWorkerPool getPool() {
        return pool;
    }

    public TaskScheduler getScheduler() {
        return scheduler;
    }

    public AdaptiveRateController getRateController() {
        return rateController;
    }

    public DelayInjector getDelayInjector() {
        return delayInjector;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops sampling and shuts the pool down. Later calls do nothing.
     *
     * @param wait whether to block until in-flight work drains
     */
    public void shutdown(boolean wait) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down pacer context");
        pool.shutdown(wait);
        log.info("Pacer context shut down");
    }

    @Override
    public void close() {
        shutdown(true);
    }

    private static void handleShutdown(PacerContext context) {
        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, closing pacer context...");
            context.close();
        }, "pacer-shutdown"));
    }

    /**
     * Assembles a context; every collaborator has a production default.
     */
    public static final class Builder {
        private ISettingsStore settings = new InMemorySettingsStore();
        private SchedulerConfig schedulerConfig;
        private ThrottleConfig throttleConfig;
        private IResourceProbe probe;
        private MeterRegistry meterRegistry = Metrics.globalRegistry;
        private Ticker ticker = Ticker.systemTicker();
        private Sleeper sleeper = Sleeper.SYSTEM;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();
        private boolean startSampling = true;
        private boolean shutdownHook;

        private Builder() {
        }

        public Builder settings(ISettingsStore settings) {
            this.settings = settings;
            return this;
        }

        /**
         * Overrides the pool settings otherwise read from the settings store.
         */
        public Builder schedulerConfig(SchedulerConfig schedulerConfig) {
            this.schedulerConfig = schedulerConfig;
            return this;
        }

        /**
         * Overrides the throttle settings otherwise read from the settings store.
         */
        public Builder throttleConfig(ThrottleConfig throttleConfig) {
            this.throttleConfig = throttleConfig;
            return this;
        }

        public Builder probe(IResourceProbe probe) {
            this.probe = probe;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public Builder startSampling(boolean startSampling) {
            this.startSampling = startSampling;
            return this;
        }

        public Builder shutdownHook(boolean shutdownHook) {
            this.shutdownHook = shutdownHook;
            return this;
        }

        public PacerContext build() {
            return new PacerContext(this);
        }
    }
}
