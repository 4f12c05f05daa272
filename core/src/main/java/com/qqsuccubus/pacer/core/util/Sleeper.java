package com.qqsuccubus.pacer.core.util;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the calling thread for a computed duration.
 * <p>
 * Components sleep through this seam so tests can substitute a sleeper that only
 * advances a fake clock.
 * </p>
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps on the calling thread via {@link TimeUnit#sleep(long)}.
     */
    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            TimeUnit.NANOSECONDS.sleep(duration.toNanos());
        }
    };

    /**
     * Sleeps for the given duration; zero or negative durations return immediately.
     *
     * @param duration How long to block
     * @throws InterruptedException if the calling thread is interrupted while sleeping
     */
    void sleep(Duration duration) throws InterruptedException;
}
