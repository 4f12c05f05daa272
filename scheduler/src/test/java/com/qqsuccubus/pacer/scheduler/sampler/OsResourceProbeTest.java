package com.qqsuccubus.pacer.scheduler.sampler;

import com.qqsuccubus.pacer.core.util.Sleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Smoke tests against the running JVM's management beans.
 */
class OsResourceProbeTest {

    @Test
    void testImmediateReadings_WithinPercentRange() throws Exception {
        OsResourceProbe probe = new OsResourceProbe(Sleeper.SYSTEM);

        double cpu = probe.cpuPercent(Duration.ZERO);
        double memory = probe.memoryPercent();

        assertTrue(cpu >= 0.0 && cpu <= 100.0, "cpu=" + cpu);
        assertTrue(memory >= 0.0 && memory <= 100.0, "memory=" + memory);
        assertTrue(probe.liveThreadCount() >= 1);
    }

    @Test
    void testObservationWindow_SleepsThroughSleeper() throws Exception {
        List<Duration> slept = new ArrayList<>();
        OsResourceProbe probe = new OsResourceProbe(slept::add);

        try {
            double cpu = probe.cpuPercent(Duration.ofMillis(250));
            assertTrue(cpu >= 0.0 && cpu <= 100.0, "cpu=" + cpu);
        } catch (IllegalStateException e) {
            // Platform without a system CPU reading
        }

        assertEquals(List.of(Duration.ofMillis(250)), slept);
    }
}
