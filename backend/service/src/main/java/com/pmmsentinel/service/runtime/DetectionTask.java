package com.pmmsentinel.service.runtime;

import com.pmmsentinel.engine.api.PassResult;
import com.pmmsentinel.engine.api.SurveillanceTask;
import com.pmmsentinel.engine.dashboard.DashboardCore;
import com.pmmsentinel.engine.dashboard.SignalSummary;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class DetectionTask implements SurveillanceTask {
    public static final String NAME = "signalDetection";

    private final DashboardCore dashboard;
    private final Duration interval;

    public DetectionTask(DashboardCore dashboard, Duration interval) {
        this.dashboard = Objects.requireNonNull(dashboard, "dashboard is required");
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
        List<SignalSummary> signals = dashboard.runSignalDetection();
        return PassResult.success(NAME, "Detected " + signals.size() + " signals", Map.of("signals", signals.size()));
    }
}
