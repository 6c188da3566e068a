package com.pmmsentinel.service.telemetry;

import com.pmmsentinel.core.bus.EventBus;
import com.pmmsentinel.core.events.SnapshotCaptured;
import com.pmmsentinel.core.model.PerformanceSnapshot;
import com.pmmsentinel.engine.metrics.InMemoryMetricSeries;

import java.time.Instant;
import java.util.Objects;

/**
 * Feeds every captured performance snapshot into the metric series so detection and trend
 * analysis see the service's own runtime figures.
 */
public class SnapshotMetricRecorder {
    public static final String RESPONSE_TIME_AVG = "response_time_avg";
    public static final String RESPONSE_TIME_P95 = "response_time_p95";
    public static final String THROUGHPUT = "throughput";
    public static final String ERROR_RATE = "error_rate";
    public static final String AVAILABILITY = "availability";

    private final InMemoryMetricSeries series;

    public SnapshotMetricRecorder(InMemoryMetricSeries series) {
        this.series = Objects.requireNonNull(series, "series is required");
    }

    public Runnable attachTo(EventBus bus) {
        return bus.subscribe(SnapshotCaptured.class, event -> record(event.snapshot()));
    }

    public void record(PerformanceSnapshot snapshot) {
        Instant at = snapshot.timestamp();
        series.record(RESPONSE_TIME_AVG, at, snapshot.responseTimeAvgMs());
        series.record(RESPONSE_TIME_P95, at, snapshot.responseTimeP95Ms());
        series.record(THROUGHPUT, at, snapshot.throughput());
        series.record(ERROR_RATE, at, snapshot.errorRatePercent());
        series.record(AVAILABILITY, at, snapshot.availabilityPercent());
        snapshot.subMetrics().forEach((name, value) -> series.record(name, at, value));
    }
}
