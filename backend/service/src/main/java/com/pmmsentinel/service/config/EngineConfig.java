package com.pmmsentinel.service.config;

import com.pmmsentinel.core.model.ReportType;
import com.pmmsentinel.engine.dashboard.DashboardSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Contents of {@code config/engine.json}. Missing sections fall back to the defaults below.
 */
public record EngineConfig(
        TaskSchedule detection,
        TaskSchedule snapshot,
        ReportSchedule report,
        int detectionWindow,
        int minSamples,
        List<String> kpiMetrics,
        String stateFile,
        String eventLogFile,
        Long telemetrySeed,
        int workerThreads
) {
    public static final TaskSchedule DEFAULT_DETECTION = new TaskSchedule(Duration.ofMinutes(5), true);
    public static final TaskSchedule DEFAULT_SNAPSHOT = new TaskSchedule(Duration.ofMinutes(1), true);
    public static final ReportSchedule DEFAULT_REPORT =
            new ReportSchedule(Duration.ofDays(30), true, ReportType.PERIODIC, 30);

    public EngineConfig {
        detection = detection == null ? DEFAULT_DETECTION : detection;
        snapshot = snapshot == null ? DEFAULT_SNAPSHOT : snapshot;
        report = report == null ? DEFAULT_REPORT : report;
        detectionWindow = detectionWindow <= 0 ? DashboardSettings.DEFAULT.detectionWindow() : detectionWindow;
        minSamples = minSamples <= 0 ? DashboardSettings.DEFAULT.minSamples() : minSamples;
        kpiMetrics = kpiMetrics == null ? DashboardSettings.DEFAULT.kpiMetrics() : List.copyOf(kpiMetrics);
        stateFile = stateFile == null ? "state/monitoring.json" : stateFile;
        eventLogFile = eventLogFile == null ? "logs/events.jsonl" : eventLogFile;
        workerThreads = workerThreads <= 0 ? 4 : workerThreads;
    }

    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, 0, 0, null, null, null, null, 0);
    }

    public DashboardSettings dashboardSettings() {
        return new DashboardSettings(detectionWindow, minSamples, kpiMetrics);
    }

    public Path stateFilePath() {
        return Path.of(stateFile);
    }

    public Path eventLogPath() {
        return Path.of(eventLogFile);
    }

    public record TaskSchedule(Duration interval, Boolean enabled) {
        public TaskSchedule {
            requirePositive(interval);
            enabled = enabled == null ? Boolean.TRUE : enabled;
        }
    }

    public record ReportSchedule(Duration interval, Boolean enabled, ReportType type, int periodDays) {
        public static final int DEFAULT_PERIOD_DAYS = 30;

        public ReportSchedule {
            requirePositive(interval);
            enabled = enabled == null ? Boolean.TRUE : enabled;
            type = type == null ? ReportType.PERIODIC : type;
            periodDays = periodDays <= 0 ? DEFAULT_PERIOD_DAYS : periodDays;
        }
    }

    private static void requirePositive(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
    }
}
