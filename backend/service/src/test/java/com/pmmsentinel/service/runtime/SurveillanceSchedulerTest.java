package com.pmmsentinel.service.runtime;

import com.pmmsentinel.core.bus.EventBus;
import com.pmmsentinel.core.events.TaskFailed;
import com.pmmsentinel.engine.api.PassResult;
import com.pmmsentinel.engine.api.SurveillanceTask;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SurveillanceSchedulerTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-12T20:00:00Z"), ZoneOffset.UTC);

    @Test
    void runOnceRunsEnabledTasksOnly() {
        AtomicInteger runsA = new AtomicInteger();
        AtomicInteger runsB = new AtomicInteger();
        SurveillanceScheduler scheduler = new SurveillanceScheduler(
                List.of(
                        new SurveillanceScheduler.ScheduledTask(task("a", () -> {
                            runsA.incrementAndGet();
                            return PassResult.success("a", "ok", Map.of());
                        }), true),
                        new SurveillanceScheduler.ScheduledTask(task("b", () -> {
                            runsB.incrementAndGet();
                            return PassResult.success("b", "ok", Map.of());
                        }), false)
                ),
                new EventBus(),
                CLOCK
        );
        try {
            List<PassResult> results = scheduler.runOnce();

            assertEquals(1, results.size());
            assertEquals("a", results.get(0).task());
            assertEquals(1, runsA.get());
            assertEquals(0, runsB.get());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void failureInOneTaskDoesNotBlockOthersAndPublishesTaskFailed() {
        EventBus bus = new EventBus();
        List<TaskFailed> failures = new CopyOnWriteArrayList<>();
        bus.subscribe(TaskFailed.class, failures::add);
        AtomicInteger goodRuns = new AtomicInteger();

        SurveillanceScheduler scheduler = new SurveillanceScheduler(
                List.of(
                        new SurveillanceScheduler.ScheduledTask(task("bad", () -> {
                            throw new IllegalStateException("boom");
                        }), true),
                        new SurveillanceScheduler.ScheduledTask(task("good", () -> {
                            goodRuns.incrementAndGet();
                            return PassResult.success("good", "ok", Map.of());
                        }), true)
                ),
                bus,
                CLOCK
        );
        try {
            List<PassResult> results = scheduler.runOnce();

            assertEquals(2, results.size());
            assertFalse(results.get(0).success());
            assertTrue(results.get(0).message().contains("boom"));
            assertTrue(results.get(1).success());
            assertEquals(1, goodRuns.get());
            assertEquals(1, failures.size());
            assertEquals("bad", failures.get(0).taskName());
            assertEquals(CLOCK.instant(), failures.get(0).timestamp());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void startedSchedulerKeepsRunningAfterFailures() throws Exception {
        CountDownLatch runs = new CountDownLatch(3);
        SurveillanceScheduler scheduler = new SurveillanceScheduler(
                List.of(new SurveillanceScheduler.ScheduledTask(task("flaky", () -> {
                    runs.countDown();
                    throw new IllegalStateException("flaky");
                }), true)),
                new EventBus(),
                CLOCK,
                10
        );
        try {
            scheduler.start();
            assertTrue(runs.await(5, TimeUnit.SECONDS));
        } finally {
            scheduler.shutdown();
        }
    }

    private static SurveillanceTask task(String name, Supplier<PassResult> body) {
        return new SurveillanceTask() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Duration interval() {
                return Duration.ofMillis(10);
            }

            @Override
            public PassResult run() {
                return body.get();
            }
        };
    }
}
