package com.qqsuccubus.pacer.throttle.config;

import com.qqsuccubus.pacer.core.settings.InMemorySettingsStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ThrottleConfigTest {

    @Test
    void testDefaults() {
        ThrottleConfig config = ThrottleConfig.from(new InMemorySettingsStore()).validate();

        assertEquals(10, config.getInitialRate());
        assertEquals(1, config.getMinRate());
        assertEquals(50, config.getMaxRate());
        assertEquals(Duration.ofSeconds(10), config.getRateWindow());
        assertEquals(Duration.ofSeconds(1), config.getLimiterWindow());
        assertEquals(Duration.ofMillis(100), config.getBaseDelay());
        assertEquals(Duration.ofMillis(50), config.getDelayJitter());
    }

    @Test
    void testFromSettings_ReadsKeys() {
        ThrottleConfig config = ThrottleConfig.from(new InMemorySettingsStore(Map.of(
                "RATE_INITIAL", "5",
                "RATE_MAX", 20,
                "RATE_WINDOW_SEC", "30",
                "DELAY_BASE_MS", "0")));

        assertEquals(5, config.getInitialRate());
        assertEquals(20, config.getMaxRate());
        assertEquals(Duration.ofSeconds(30), config.getRateWindow());
        assertEquals(Duration.ZERO, config.getBaseDelay());
    }

    @Test
    void testValidate_RejectsInconsistentBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> ThrottleConfig.builder().minRate(0).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> ThrottleConfig.builder().minRate(10).maxRate(5).initialRate(7).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> ThrottleConfig.builder().rateWindow(Duration.ZERO).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> ThrottleConfig.builder().delayJitter(Duration.ofMillis(-5)).build().validate());
    }
}
