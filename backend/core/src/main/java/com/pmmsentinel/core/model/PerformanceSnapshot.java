package com.pmmsentinel.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One reading of the monitored service's runtime performance. Response times are in
 * milliseconds, throughput in requests per second, error rate and availability in percent.
 */
public record PerformanceSnapshot(
        Instant timestamp,
        double responseTimeAvgMs,
        double responseTimeP95Ms,
        double throughput,
        double errorRatePercent,
        double availabilityPercent,
        int activeUsers,
        Map<String, Double> subMetrics
) {
    public PerformanceSnapshot {
        Objects.requireNonNull(timestamp, "timestamp is required");
        subMetrics = subMetrics == null ? Map.of() : Map.copyOf(subMetrics);
    }
}
