package com.qqsuccubus.pacer.throttle.config;

import com.google.common.base.Preconditions;
import com.qqsuccubus.pacer.core.settings.ISettingsStore;
import com.qqsuccubus.pacer.core.settings.InMemorySettingsStore;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for adaptive rate control and pre-request delay injection.
 */
@Value
@Builder(toBuilder = true)
public class ThrottleConfig {

    // Adaptive rate (requests per limiter window, shared by every host)
    @Builder.Default
    int initialRate = 10;
    @Builder.Default
    int minRate = 1;
    @Builder.Default
    int maxRate = 50;
    @Builder.Default
    Duration rateWindow = Duration.ofSeconds(10);     // success/failure rollover window
    @Builder.Default
    Duration limiterWindow = Duration.ofSeconds(1);   // per-host sliding window

    // Delay injection
    @Builder.Default
    Duration baseDelay = Duration.ofMillis(100);
    @Builder.Default
    Duration delayJitter = Duration.ofMillis(50);

    public static ThrottleConfig fromEnv() {
        return from(InMemorySettingsStore.fromEnv());
    }

    public static ThrottleConfig from(ISettingsStore settings) {
        return ThrottleConfig.builder()
                .initialRate(settings.getInt("RATE_INITIAL", 10))
                .minRate(settings.getInt("RATE_MIN", 1))
                .maxRate(settings.getInt("RATE_MAX", 50))
                .rateWindow(Duration.ofSeconds(settings.getLong("RATE_WINDOW_SEC", 10)))
                .limiterWindow(Duration.ofMillis(settings.getLong("RATE_LIMIT_WINDOW_MS", 1000)))
                .baseDelay(Duration.ofMillis(settings.getLong("DELAY_BASE_MS", 100)))
                .delayJitter(Duration.ofMillis(settings.getLong("DELAY_JITTER_MS", 50)))
                .build();
    }

    /**
     * Rejects settings under which {@code minRate <= currentRate <= maxRate} cannot hold.
     *
     * @return this config
     * @throws IllegalArgumentException on invalid settings
     */
    public ThrottleConfig validate() {
        Preconditions.checkArgument(minRate >= 1, "minRate must be >= 1, got %s", minRate);
        Preconditions.checkArgument(maxRate >= minRate, "maxRate (%s) must be >= minRate (%s)", maxRate, minRate);
        Preconditions.checkArgument(initialRate >= minRate && initialRate <= maxRate,
                "initialRate (%s) must be within [%s, %s]", initialRate, minRate, maxRate);
        Preconditions.checkArgument(rateWindow.toNanos() > 0, "rateWindow must be positive");
        Preconditions.checkArgument(limiterWindow.toNanos() > 0, "limiterWindow must be positive");
        Preconditions.checkArgument(!baseDelay.isNegative(), "baseDelay must not be negative");
        Preconditions.checkArgument(!delayJitter.isNegative(), "delayJitter must not be negative");
        return this;
    }
}
