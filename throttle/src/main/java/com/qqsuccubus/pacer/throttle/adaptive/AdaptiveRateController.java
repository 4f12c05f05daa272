package com.qqsuccubus.pacer.throttle.adaptive;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableSet;
import com.qqsuccubus.pacer.core.metrics.MetricsNames;
import com.qqsuccubus.pacer.core.metrics.MetricsTags;
import com.qqsuccubus.pacer.core.model.RateAdjustment;
import com.qqsuccubus.pacer.core.util.Sleeper;
import com.qqsuccubus.pacer.throttle.config.ThrottleConfig;
import com.qqsuccubus.pacer.throttle.limiter.SlidingWindowRateLimiter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Retunes the allowed request rate from observed request outcomes.
 * <p>
 * <b>Algorithm:</b> successes and failures are counted in a rolling window of
 * {@code rateWindow}. The first report after the window has elapsed closes it:
 * <ul>
 *   <li>success rate above 0.9: rate grows by 10% (truncated)</li>
 *   <li>success rate below 0.7: rate shrinks by 10% (truncated)</li>
 *   <li>otherwise the rate holds</li>
 * </ul>
 * The result is clamped to {@code [minRate, maxRate]} and pushed to every per-host limiter.
 * </p>
 * <p>
 * There is a single rate signal: outcomes from all hosts feed the same counters and a
 * retune applies to every host, although each host keeps its own sliding window.
 * </p>
 */
public class AdaptiveRateController {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveRateController.class);

    private static final double HIGH_SUCCESS = 0.9;
    private static final double LOW_SUCCESS = 0.7;
    private static final double INCREASE_FACTOR = 1.1;
    private static final double DECREASE_FACTOR = 0.9;

    private final ThrottleConfig config;
    private final Ticker ticker;
    private final Sleeper sleeper;
    private final MeterRegistry meterRegistry;

    // Guards everything below
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SlidingWindowRateLimiter> limiters = new HashMap<>();
    private int currentRate;
    private long successCount;
    private long failureCount;
    private long windowStart;

    private final Counter increases;
    private final Counter decreases;
    private final Counter holds;

    public AdaptiveRateController(ThrottleConfig config, Ticker ticker, Sleeper sleeper, MeterRegistry meterRegistry) {
        this.config = config.validate();
        this.ticker = ticker;
        this.sleeper = sleeper;
        this.meterRegistry = meterRegistry;
        this.currentRate = config.getInitialRate();
        this.windowStart = ticker.read();

        increases = Counter.builder(MetricsNames.RATE_ADJUSTMENTS_TOTAL)
                .tag(MetricsTags.ACTION, "increase")
                .register(meterRegistry);
        decreases = Counter.builder(MetricsNames.RATE_ADJUSTMENTS_TOTAL)
                .tag(MetricsTags.ACTION, "decrease")
                .register(meterRegistry);
        holds = Counter.builder(MetricsNames.RATE_ADJUSTMENTS_TOTAL)
                .tag(MetricsTags.ACTION, "hold")
                .register(meterRegistry);
        Gauge.builder(MetricsNames.RATE_CURRENT, this, AdaptiveRateController::currentRate)
                .description("Shared allowed request rate per host window")
                .register(meterRegistry);
    }

    /**
     * Returns the host's limiter, creating it at the current rate on first access.
     */
    public SlidingWindowRateLimiter limiterFor(String host) {
        lock.lock();
        try {
            return limiters.computeIfAbsent(host, h -> {
                log.debug("Creating rate limiter for host {} at {} requests per {}ms",
                        h, currentRate, config.getLimiterWindow().toMillis());
                return new SlidingWindowRateLimiter(currentRate, config.getLimiterWindow(), false,
                        ticker, sleeper, meterRegistry);
            });
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records one request outcome and closes the window if it has elapsed.
     *
     * @param host    Host the request went to
     * @param success Whether the request succeeded
     * @return the adjustment made, if this report closed a window
     */
    public Optional<RateAdjustment> reportResult(String host, boolean success) {
        lock.lock();
        try {
            if (success) {
                successCount++;
            } else {
                failureCount++;
            }

            long now = ticker.read();
            if (now - windowStart < config.getRateWindow().toNanos()) {
                return Optional.empty();
            }
            return Optional.of(rollover(now));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the host's limiter admits a request.
     *
     * @return How long the caller waited
     */
    public Duration waitIfNeeded(String host) throws InterruptedException {
        return limiterFor(host).waitIfNeeded(host);
    }

    /**
     * Non-blocking: while another caller sleeps in {@link #waitIfNeeded(String)} for the same
     * host, the window is reported as full.
     *
     * @return true if the host's window is full right now; records nothing
     */
    public boolean shouldDelayRequest(String host) {
        return !limiterFor(host).canMakeRequest(host);
    }

    /**
     * Overrides one host's allowed requests per window. The next retune overwrites it.
     */
    public void setHostRate(String host, int rate) {
        Preconditions.checkArgument(rate >= 1, "rate must be >= 1, got %s", rate);
        limiterFor(host).setMaxRequests(rate);
        log.info("Rate limit for host {} set to {}", host, rate);
    }

    public int currentRate() {
        lock.lock();
        try {
            return currentRate;
        } finally {
            lock.unlock();
        }
    }

    public Set<String> hosts() {
        lock.lock();
        try {
            return ImmutableSet.copyOf(limiters.keySet());
        } finally {
            lock.unlock();
        }
    }

    // Caller holds lock
    private RateAdjustment rollover(long now) {
        long total = successCount + failureCount;
        double successRate = total == 0 ? 1.0 : (double) successCount / total;

        int previous = currentRate;
        RateAdjustment.Action action;
        if (successRate > HIGH_SUCCESS) {
            currentRate = Math.min(config.getMaxRate(), (int) (currentRate * INCREASE_FACTOR));
            action = RateAdjustment.Action.INCREASE;
            increases.increment();
        } else if (successRate < LOW_SUCCESS) {
            currentRate = Math.max(config.getMinRate(), (int) (currentRate * DECREASE_FACTOR));
            action = RateAdjustment.Action.DECREASE;
            decreases.increment();
        } else {
            action = RateAdjustment.Action.HOLD;
            holds.increment();
        }

        RateAdjustment adjustment = RateAdjustment.builder()
                .action(action)
                .previousRate(previous)
                .currentRate(currentRate)
                .successes(successCount)
                .failures(failureCount)
                .successRate(successRate)
                .build();

        windowStart = now;
        successCount = 0;
        failureCount = 0;

        for (SlidingWindowRateLimiter limiter : limiters.values()) {
            limiter.setMaxRequests(currentRate);
        }

        if (previous != currentRate) {
            log.info("Adjusted request rate {} -> {} (success rate {})",
                    previous, currentRate, String.format("%.2f", successRate));
        } else {
            log.debug("Request rate holds at {} (success rate {})", currentRate, String.format("%.2f", successRate));
        }
        return adjustment;
    }
}
