package com.qqsuccubus.pacer.throttle.delay;

import com.google.common.base.Preconditions;
import com.qqsuccubus.pacer.core.metrics.MetricsNames;
import com.qqsuccubus.pacer.core.util.Backoff;
import com.qqsuccubus.pacer.core.util.Sleeper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.DoubleSupplier;

/**
 * Jittered pre-request pause, independent of rate limiting.
 * <p>
 * A host's delay is its override (or the base delay) plus a uniform offset in
 * {@code [-jitter, +jitter]}, clamped at zero.
 * </p>
 */
public class DelayInjector {
    private static final Logger log = LoggerFactory.getLogger(DelayInjector.class);

    private final Duration baseDelay;
    private final Duration jitter;
    private final DoubleSupplier random;
    private final Sleeper sleeper;
    private final Map<String, Duration> hostDelays = new ConcurrentHashMap<>();

    private final Timer applied;

    public DelayInjector(Duration baseDelay,
                         Duration jitter,
                         DoubleSupplier random,
                         Sleeper sleeper,
                         MeterRegistry meterRegistry) {
        Preconditions.checkArgument(!jitter.isNegative(), "jitter must not be negative, got %s", jitter);
        this.baseDelay = baseDelay;
        this.jitter = jitter;
        this.random = random;
        this.sleeper = sleeper;

        applied = Timer.builder(MetricsNames.DELAY_APPLIED)
                .description("Pre-request delays applied")
                .register(meterRegistry);
    }

    /**
     * Computes a fresh delay for the host; each call draws new jitter.
     */
    public Duration getDelay(String host) {
        Duration base = host != null ? hostDelays.getOrDefault(host, baseDelay) : baseDelay;
        return Backoff.jittered(base, jitter, random);
    }

    public void setHostDelay(String host, Duration delay) {
        Preconditions.checkNotNull(host, "host");
        Preconditions.checkNotNull(delay, "delay");
        hostDelays.put(host, delay);
        log.info("Base delay for host {} set to {}ms", host, delay.toMillis());
    }

    public void clearHostDelay(String host) {
        if (hostDelays.remove(host) != null) {
            log.info("Base delay override for host {} cleared", host);
        }
    }

    /**
     * Sleeps for {@link #getDelay(String)} if it is positive.
     *
     * @return the delay slept
     */
    public Duration applyDelay(String host) throws InterruptedException {
        Duration delay = getDelay(host);
        if (delay.isZero()) {
            return delay;
        }
        sleeper.sleep(delay);
        applied.record(delay);
        return delay;
    }
}
