package com.qqsuccubus.pacer.core.util;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Backoff and jitter calculations shared by the retry scheduler and the delay injector.
 * <p>
 * <b>Retry formula:</b> {@code t = factor * 2^attempt}, attempt 0-based.
 * </p>
 * <p>
 * <b>Jitter formula:</b> {@code t = max(0, base + uniform(-jitter, +jitter))}.
 * </p>
 */
public final class Backoff {
    private static final int MAX_EXPONENT = 20;

    private Backoff() {
    }

    /**
     * Computes the pause before the next retry.
     *
     * @param attempt Attempt that just failed (0-based)
     * @param factor  Backoff factor (pause after the first failure)
     * @return {@code factor * 2^attempt}
     */
    public static Duration exponential(int attempt, Duration factor) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got " + attempt);
        }
        // Cap exponent to avoid overflow
        long multiplier = 1L << Math.min(attempt, MAX_EXPONENT);
        return factor.multipliedBy(multiplier);
    }

    /**
     * Adds symmetric jitter to a base delay.
     *
     * @param base   Base delay
     * @param jitter Maximum deviation in either direction
     * @param random Source of uniform samples in {@code [0, 1)}
     * @return Jittered delay, never negative
     */
    public static Duration jittered(Duration base, Duration jitter, DoubleSupplier random) {
        long jitterNanos = jitter.toNanos();
        if (jitterNanos == 0) {
            return base.isNegative() ? Duration.ZERO : base;
        }
        double offset = (random.getAsDouble() * 2.0 - 1.0) * jitterNanos;
        long nanos = base.toNanos() + Math.round(offset);
        return Duration.ofNanos(Math.max(0L, nanos));
    }
}
