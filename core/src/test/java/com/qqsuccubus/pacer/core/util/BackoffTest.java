package com.qqsuccubus.pacer.core.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackoffTest {

    @Test
    void testExponential_DoublesPerAttempt() {
        Duration factor = Duration.ofSeconds(1);

        assertEquals(Duration.ofSeconds(1), Backoff.exponential(0, factor));
        assertEquals(Duration.ofSeconds(2), Backoff.exponential(1, factor));
        assertEquals(Duration.ofSeconds(4), Backoff.exponential(2, factor));
        assertEquals(Duration.ofSeconds(8), Backoff.exponential(3, factor));
    }

    @Test
    void testExponential_HugeAttemptDoesNotOverflow() {
        Duration pause = Backoff.exponential(500, Duration.ofMillis(1));

        assertEquals(Duration.ofMillis(1L << 20), pause);
    }

    @Test
    void testExponential_NegativeAttemptRejected() {
        assertThrows(IllegalArgumentException.class, () -> Backoff.exponential(-1, Duration.ofSeconds(1)));
    }

    @Test
    void testJittered_ExtremesOfRandomRange() {
        Duration base = Duration.ofMillis(100);
        Duration jitter = Duration.ofMillis(50);

        assertEquals(Duration.ofMillis(50), Backoff.jittered(base, jitter, () -> 0.0));
        assertEquals(Duration.ofMillis(100), Backoff.jittered(base, jitter, () -> 0.5));
        assertEquals(Duration.ofMillis(150), Backoff.jittered(base, jitter, () -> 1.0));
    }

    @Test
    void testJittered_NeverNegative() {
        Duration delay = Backoff.jittered(Duration.ofMillis(10), Duration.ofMillis(50), () -> 0.0);

        assertEquals(Duration.ZERO, delay);
    }

    @Test
    void testJittered_ZeroJitterReturnsBase() {
        assertEquals(Duration.ofMillis(100), Backoff.jittered(Duration.ofMillis(100), Duration.ZERO, () -> 0.3));
        assertEquals(Duration.ZERO, Backoff.jittered(Duration.ofMillis(-5), Duration.ZERO, () -> 0.3));
    }

    @Test
    void testJittered_StaysWithinBounds() {
        Duration base = Duration.ofMillis(100);
        Duration jitter = Duration.ofMillis(50);
        for (int i = 0; i <= 100; i++) {
            double r = i / 100.0;
            Duration delay = Backoff.jittered(base, jitter, () -> r);
            assertTrue(delay.compareTo(Duration.ofMillis(50)) >= 0, "below lower bound: " + delay);
            assertTrue(delay.compareTo(Duration.ofMillis(150)) <= 0, "above upper bound: " + delay);
        }
    }
}
