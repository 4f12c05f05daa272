package com.qqsuccubus.pacer.throttle.limiter;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.qqsuccubus.pacer.core.metrics.MetricsNames;
import com.qqsuccubus.pacer.core.metrics.MetricsTags;
import com.qqsuccubus.pacer.core.util.Sleeper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounds requests to {@code maxRequests} per trailing {@code timeWindow}.
 * <p>
 * Runs either in global mode (one window shared by every scope) or per-scope mode
 * (one window per host; a {@code null} host maps to {@value #DEFAULT_SCOPE}).
 * Each window is guarded by its own lock. Timestamps at or before {@code now - timeWindow}
 * are evicted lazily before every read.
 * </p>
 */
public class SlidingWindowRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    public static final String DEFAULT_SCOPE = "default";

    private final Duration timeWindow;
    private final long windowNanos;
    private final boolean global;
    private final Ticker ticker;
    private final Sleeper sleeper;

    private volatile int maxRequests;

    private final RateWindow globalWindow = new RateWindow();
    private final Map<String, RateWindow> windows = new ConcurrentHashMap<>();

    private final Timer waitTimer;
    private final Counter throttled;

    public SlidingWindowRateLimiter(int maxRequests,
                                    Duration timeWindow,
                                    boolean global,
                                    Ticker ticker,
                                    Sleeper sleeper,
                                    MeterRegistry meterRegistry) {
        Preconditions.checkArgument(maxRequests >= 1, "maxRequests must be >= 1, got %s", maxRequests);
        Preconditions.checkArgument(timeWindow.toNanos() > 0, "timeWindow must be positive, got %s", timeWindow);
        this.maxRequests = maxRequests;
        this.timeWindow = timeWindow;
        this.windowNanos = timeWindow.toNanos();
        this.global = global;
        this.ticker = ticker;
        this.sleeper = sleeper;

        String mode = global ? "global" : "per_host";
        waitTimer = Timer.builder(MetricsNames.RATELIMIT_WAIT)
                .tag(MetricsTags.MODE, mode)
                .description("Time callers spent blocked waiting for rate limiter capacity")
                .register(meterRegistry);
        throttled = Counter.builder(MetricsNames.RATELIMIT_THROTTLED_TOTAL)
                .tag(MetricsTags.MODE, mode)
                .register(meterRegistry);
    }

    /**
     * Checks for free capacity without consuming it.
     * <p>
     * Never blocks. If the scope lock is held (for example by a {@link #waitIfNeeded(String)}
     * caller sleeping on a full window), the answer comes from the size recorded at the last
     * update of the window, without evicting.
     * </p>
     *
     * @param scope Host key; ignored in global mode
     * @return true if fewer than {@code maxRequests} requests are in the window
     */
    public boolean canMakeRequest(String scope) {
        RateWindow window = windowFor(scope);
        if (!window.lock.tryLock()) {
            return window.size < maxRequests;
        }
        try {
            window.evict(ticker.read(), windowNanos);
            return window.timestamps.size() < maxRequests;
        } finally {
            window.lock.unlock();
        }
    }

    /**
     * Records a request at the current time, regardless of capacity.
     */
    public void recordRequest(String scope) {
        RateWindow window = windowFor(scope);
        window.lock.lock();
        try {
            long now = ticker.read();
            window.evict(now, windowNanos);
            window.add(now);
        } finally {
            window.lock.unlock();
        }
    }

    /**
     * Takes a slot in the scope's window, blocking until one frees up.
     * <p>
     * The check and the record happen under the scope lock, so concurrent callers of the
     * same scope are serialized and never both take the last slot. A caller that has to wait
     * holds the scope lock while sleeping.
     * </p>
     *
     * @param scope Host key; ignored in global mode
     * @return How long the caller was blocked ({@link Duration#ZERO} if capacity was free)
     * @throws InterruptedException if interrupted while waiting; no slot is taken
     */
    public Duration waitIfNeeded(String scope) throws InterruptedException {
        RateWindow window = windowFor(scope);
        window.lock.lock();
        try {
            long now = ticker.read();
            window.evict(now, windowNanos);
            int limit = maxRequests;
            int inWindow = window.timestamps.size();
            if (inWindow < limit) {
                window.add(now);
                return Duration.ZERO;
            }

            // The entry whose expiry brings the window back under the limit
            long freeingTimestamp = window.nth(inWindow - limit);
            long waitNanos = Math.max(0L, freeingTimestamp + windowNanos - now);
            Duration wait = Duration.ofNanos(waitNanos);

            throttled.increment();
            log.debug("Rate limit reached for scope {} ({} in window, limit {}), waiting {}ms",
                    keyOf(scope), inWindow, limit, wait.toMillis());
            sleeper.sleep(wait);

            window.evict(now + waitNanos, windowNanos);
            window.add(now + waitNanos);
            waitTimer.record(wait);
            return wait;
        } finally {
            window.lock.unlock();
        }
    }

    /**
     * @return Requests currently in the scope's window (after eviction)
     */
    public int requestCount(String scope) {
        RateWindow window = windowFor(scope);
        window.lock.lock();
        try {
            window.evict(ticker.read(), windowNanos);
            return window.timestamps.size();
        } finally {
            window.lock.unlock();
        }
    }

    /**
     * Copy of the scope's retained timestamps (ticker nanos), oldest first, without evicting.
     */
    List<Long> retainedTimestamps(String scope) {
        RateWindow window = windowFor(scope);
        window.lock.lock();
        try {
            return new ArrayList<>(window.timestamps);
        } finally {
            window.lock.unlock();
        }
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    /**
     * Changes the allowed requests per window; takes effect on the next check.
     */
    public void setMaxRequests(int maxRequests) {
        Preconditions.checkArgument(maxRequests >= 1, "maxRequests must be >= 1, got %s", maxRequests);
        this.maxRequests = maxRequests;
    }

    public Duration getTimeWindow() {
        return timeWindow;
    }

    public boolean isGlobal() {
        return global;
    }

    private RateWindow windowFor(String scope) {
        if (global) {
            return globalWindow;
        }
        return windows.computeIfAbsent(keyOf(scope), key -> new RateWindow());
    }

    private static String keyOf(String scope) {
        return scope != null ? scope : DEFAULT_SCOPE;
    }

    /**
     * Request timestamps of one scope, oldest first.
     */
    private static final class RateWindow {
        final ReentrantLock lock = new ReentrantLock();
        final ArrayDeque<Long> timestamps = new ArrayDeque<>();
        // Size as of the last update, readable without the lock
        volatile int size;

        // Caller holds lock
        void evict(long now, long windowNanos) {
            long cutoff = now - windowNanos;
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
                timestamps.pollFirst();
            }
            size = timestamps.size();
        }

        // Caller holds lock
        void add(long timestamp) {
            timestamps.addLast(timestamp);
            size = timestamps.size();
        }

        // Caller holds lock
        long nth(int index) {
            Iterator<Long> it = timestamps.iterator();
            for (int i = 0; i < index; i++) {
                it.next();
            }
            return it.next();
        }
    }
}
