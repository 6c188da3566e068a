package com.pmmsentinel.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record MetricPoint(
        String metricName,
        Instant timestamp,
        double value,
        Map<String, String> tags
) {
    public MetricPoint {
        Objects.requireNonNull(metricName, "metricName is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value of " + metricName + " must be finite: " + value);
        }
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static MetricPoint of(String metricName, Instant timestamp, double value) {
        return new MetricPoint(metricName, timestamp, value, Map.of());
    }
}
