package com.pmmsentinel.service.runtime;

import com.pmmsentinel.core.model.PerformanceSnapshot;
import com.pmmsentinel.engine.api.PassResult;
import com.pmmsentinel.engine.api.SurveillanceTask;
import com.pmmsentinel.engine.performance.PerformanceMonitor;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public class SnapshotTask implements SurveillanceTask {
    public static final String NAME = "performanceSnapshot";

    private final PerformanceMonitor monitor;
    private final Duration interval;

    public SnapshotTask(PerformanceMonitor monitor, Duration interval) {
        this.monitor = Objects.requireNonNull(monitor, "monitor is required");
        this.interval = Objects.requireNonNull(interval, "interval is required");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public PassResult run() {
        PerformanceSnapshot snapshot = monitor.captureSnapshot();
        return PassResult.success(NAME, "Captured snapshot at " + snapshot.timestamp(), Map.of(
                "responseTimeAvgMs", snapshot.responseTimeAvgMs(),
                "errorRatePercent", snapshot.errorRatePercent()
        ));
    }
}
