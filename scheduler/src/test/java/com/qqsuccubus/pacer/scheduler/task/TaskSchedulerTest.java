package com.qqsuccubus.pacer.scheduler.task;

import com.qqsuccubus.pacer.core.metrics.MetricsNames;
import com.qqsuccubus.pacer.core.metrics.MetricsTags;
import com.qqsuccubus.pacer.core.util.Sleeper;
import com.qqsuccubus.pacer.scheduler.config.SchedulerConfig;
import com.qqsuccubus.pacer.scheduler.pool.DynamicWorkerPool;
import com.qqsuccubus.pacer.scheduler.sampler.IResourceProbe;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskSchedulerTest {

    private SimpleMeterRegistry registry;
    private RecordingSleeper sleeper;
    private DynamicWorkerPool pool;
    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        sleeper = new RecordingSleeper();
        SchedulerConfig config = SchedulerConfig.builder()
                .minWorkers(2)
                .maxWorkers(8)
                .initialWorkers(4)
                .maxRetries(3)
                .backoffFactor(Duration.ofSeconds(1))
                .shutdownTimeout(Duration.ofSeconds(5))
                .build();
        pool = new DynamicWorkerPool(config, new StubProbe(), registry);
        scheduler = new TaskScheduler(pool, config, sleeper, registry);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown(true);
    }

    @Test
    void testAlwaysFailing_BacksOffThenRethrowsLastFailure() {
        AtomicInteger attempts = new AtomicInteger();
        IOException failure = new IOException("connection refused");

        IOException thrown = assertThrows(IOException.class, () -> scheduler.scheduleWithBackoff(() -> {
            attempts.incrementAndGet();
            throw failure;
        }));

        assertSame(failure, thrown);
        assertEquals(4, attempts.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeper.sleeps);
        assertEquals(3.0, registry.get(MetricsNames.SCHEDULER_RETRIES_TOTAL).counter().count());
        assertEquals(1.0, registry.get(MetricsNames.SCHEDULER_RETRY_EXHAUSTED_TOTAL).counter().count());
    }

    @Test
    void testCallerInterrupted_CancelsRunningAttempt() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch workInterrupted = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AtomicBoolean flagAfterThrow = new AtomicBoolean(false);

        Thread caller = new Thread(() -> {
            try {
                scheduler.scheduleWithBackoff(() -> {
                    started.countDown();
                    try {
                        never.await();
                    } catch (InterruptedException e) {
                        workInterrupted.countDown();
                        throw e;
                    }
                    return "unreachable";
                });
            } catch (Exception e) {
                thrown.set(e);
                flagAfterThrow.set(Thread.currentThread().isInterrupted());
            }
        }, "backoff-caller");
        caller.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        caller.interrupt();
        caller.join(5000);

        assertFalse(caller.isAlive());
        assertTrue(thrown.get() instanceof InterruptedException);
        assertTrue(flagAfterThrow.get());
        assertTrue(workInterrupted.await(5, TimeUnit.SECONDS));
        assertTrue(sleeper.sleeps.isEmpty());
    }

    @Test
    void testEventualSuccess_StopsRetrying() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        String result = scheduler.scheduleWithBackoff(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("transient");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, attempts.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.sleeps);
    }

    @Test
    void testZeroRetries_SingleAttempt() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> scheduler.scheduleWithBackoff(() -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("fail");
        }, 0, Duration.ofMillis(100)));

        assertEquals(1, attempts.get());
        assertTrue(sleeper.sleeps.isEmpty());
    }

    @Test
    void testScheduleBatch_WavesBoundConcurrencyAndKeepOrder() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<Callable<Integer>> tasks = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            int index = i;
            tasks.add(() -> {
                int now = running.incrementAndGet();
                maxRunning.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(20);
                    if (index == 4) {
                        throw new IllegalStateException("task " + index + " failed");
                    }
                    return index;
                } finally {
                    running.decrementAndGet();
                }
            });
        }

        List<Integer> results = scheduler.scheduleBatch(tasks, 2);

        assertEquals(Arrays.asList(0, 1, 2, 3, null, 5, 6), results);
        assertTrue(maxRunning.get() <= 2, "wave size exceeded: " + maxRunning.get());
        assertEquals(1.0, registry.get(MetricsNames.POOL_TASK_FAILURES_TOTAL)
                .tag(MetricsTags.PATH, "batch").counter().count());
    }

    @Test
    void testScheduleBatch_DefaultWaveIsWorkerCount() throws Exception {
        List<Callable<String>> tasks = List.of(() -> "a", () -> "b", () -> "c");

        assertEquals(List.of("a", "b", "c"), scheduler.scheduleBatch(tasks));
    }

    @Test
    void testScheduleBatch_EmptyInput() throws Exception {
        assertTrue(scheduler.scheduleBatch(List.<Callable<String>>of(), 3).isEmpty());
    }

    @Test
    void testScheduleBatch_NonPositiveWaveRejected() {
        List<Callable<String>> tasks = List.of(() -> "a");

        assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleBatch(tasks, 0));
    }

    /**
     * Records requested pauses without sleeping.
     */
    private static class RecordingSleeper implements Sleeper {
        final List<Duration> sleeps = new CopyOnWriteArrayList<>();

        @Override
        public void sleep(Duration duration) {
            sleeps.add(duration);
        }
    }

    /**
     * Test stub for host resource readings.
     */
    private static class StubProbe implements IResourceProbe {
        @Override
        public double cpuPercent(Duration observationWindow) {
            return 10.0;
        }

        @Override
        public double memoryPercent() {
            return 10.0;
        }

        @Override
        public int liveThreadCount() {
            return 1;
        }
    }
}
