package com.pmmsentinel.service.runtime;

import com.pmmsentinel.core.bus.EventBus;
import com.pmmsentinel.core.events.TaskFailed;
import com.pmmsentinel.engine.api.PassResult;
import com.pmmsentinel.engine.api.SurveillanceTask;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs each enabled {@link SurveillanceTask} at its own fixed rate. A failing run is logged,
 * published as {@link TaskFailed} and does not affect other tasks or later runs.
 */
public class SurveillanceScheduler {
    private static final Logger LOGGER = Logger.getLogger(SurveillanceScheduler.class.getName());

    private final List<ScheduledTask> tasks;
    private final EventBus eventBus;
    private final Clock clock;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService taskExecutor;

    public SurveillanceScheduler(List<ScheduledTask> tasks, EventBus eventBus, Clock clock) {
        this(tasks, eventBus, clock, 100);
    }

    SurveillanceScheduler(List<ScheduledTask> tasks, EventBus eventBus, Clock clock, long minIntervalMillis) {
        this.tasks = List.copyOf(tasks);
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.minIntervalMillis = minIntervalMillis;
        this.taskExecutor = Executors.newFixedThreadPool(Math.max(1, this.tasks.size()));
    }

    public void start() {
        for (ScheduledTask scheduled : tasks) {
            if (!scheduled.enabled()) {
                LOGGER.info(() -> "Task " + scheduled.task().name() + " is disabled");
                continue;
            }
            long intervalMillis = Math.max(minIntervalMillis, scheduled.task().interval().toMillis());
            timerExecutor.scheduleAtFixedRate(
                    () -> taskExecutor.submit(() -> runSafely(scheduled.task())),
                    0,
                    intervalMillis,
                    TimeUnit.MILLISECONDS
            );
        }
    }

    /**
     * Runs every enabled task once, concurrently, and returns their results in registration order.
     */
    public List<PassResult> runOnce() {
        List<CompletableFuture<PassResult>> runs = new ArrayList<>();
        for (ScheduledTask scheduled : tasks) {
            if (scheduled.enabled()) {
                runs.add(CompletableFuture.supplyAsync(() -> runSafely(scheduled.task()), taskExecutor));
            }
        }
        List<PassResult> results = new ArrayList<>(runs.size());
        for (CompletableFuture<PassResult> run : runs) {
            results.add(run.join());
        }
        return results;
    }

    public void shutdown() {
        timerExecutor.shutdown();
        taskExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            taskExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public List<ScheduledTask> scheduledTasks() {
        return tasks;
    }

    private PassResult runSafely(SurveillanceTask task) {
        try {
            return task.run();
        } catch (Exception ex) {
            LOGGER.log(Level.WARNING, "Task run failed: " + task.name(), ex);
            eventBus.publish(new TaskFailed(clock.instant(), task.name(), String.valueOf(ex.getMessage())));
            return PassResult.failure(
                    task.name(),
                    "Task run failed: " + task.name() + " - " + ex.getMessage(),
                    Map.of("task", task.name())
            );
        }
    }

    public record ScheduledTask(SurveillanceTask task, boolean enabled) {
        public ScheduledTask {
            Objects.requireNonNull(task, "task is required");
        }
    }
}
