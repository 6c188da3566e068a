package com.pmmsentinel.service;

import com.pmmsentinel.core.bus.EventBus;
import com.pmmsentinel.engine.api.EngineContext;
import com.pmmsentinel.engine.complaint.ComplaintTracker;
import com.pmmsentinel.engine.dashboard.DashboardCore;
import com.pmmsentinel.engine.detect.SignalDetector;
import com.pmmsentinel.engine.metrics.InMemoryMetricSeries;
import com.pmmsentinel.engine.performance.PerformanceMonitor;
import com.pmmsentinel.engine.report.RegulatoryReporter;
import com.pmmsentinel.service.config.ConfigLoader;
import com.pmmsentinel.service.config.EngineConfig;
import com.pmmsentinel.service.runtime.DetectionTask;
import com.pmmsentinel.service.runtime.ReportTask;
import com.pmmsentinel.service.runtime.SnapshotTask;
import com.pmmsentinel.service.runtime.SurveillanceScheduler;
import com.pmmsentinel.service.store.IdSequences;
import com.pmmsentinel.service.store.JsonFileMonitoringStore;
import com.pmmsentinel.service.store.JsonlEventStore;
import com.pmmsentinel.service.telemetry.SimulatedTelemetrySource;
import com.pmmsentinel.service.telemetry.SnapshotMetricRecorder;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        Path configDir = Path.of(args.length > 0 ? args[0] : "config");
        EngineConfig config = ConfigLoader.loadEngine(configDir);
        Clock clock = Clock.systemUTC();

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(config.eventLogPath());
        eventStore.attachTo(eventBus);
        JsonFileMonitoringStore store = new JsonFileMonitoringStore(config.stateFilePath());

        InMemoryMetricSeries series = new InMemoryMetricSeries();
        new SnapshotMetricRecorder(series).attachTo(eventBus);

        long seed = config.telemetrySeed() == null ? System.nanoTime() : config.telemetrySeed();
        ExecutorService detectionExecutor = Executors.newFixedThreadPool(config.workerThreads());
        EngineContext context = new EngineContext(series, store, eventBus, clock);
        IdSequences ids = IdSequences.resumeFrom(store.exportState());
        DashboardCore dashboard = new DashboardCore(
                context,
                detectionExecutor,
                config.dashboardSettings(),
                new SignalDetector(clock, ids.signals()),
                new PerformanceMonitor(context, new SimulatedTelemetrySource(seed)),
                new RegulatoryReporter(context, ids.reports()),
                new ComplaintTracker(context, ids.complaints())
        );

        SurveillanceScheduler scheduler = new SurveillanceScheduler(List.of(
                new SurveillanceScheduler.ScheduledTask(
                        new SnapshotTask(dashboard.performanceMonitor(), config.snapshot().interval()),
                        config.snapshot().enabled()
                ),
                new SurveillanceScheduler.ScheduledTask(
                        new DetectionTask(dashboard, config.detection().interval()),
                        config.detection().enabled()
                ),
                new SurveillanceScheduler.ScheduledTask(
                        new ReportTask(
                                dashboard.regulatoryReporter(),
                                config.report().interval(),
                                config.report().type(),
                                config.report().periodDays()
                        ),
                        config.report().enabled()
                )
        ), eventBus, clock);

        LOGGER.info(() -> "Starting surveillance with state in " + store.file() + " and audit trail in "
                + config.eventLogPath());
        scheduler.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            detectionExecutor.shutdown();
            try {
                detectionExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }
}
