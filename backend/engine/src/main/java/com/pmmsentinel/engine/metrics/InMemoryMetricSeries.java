package com.pmmsentinel.engine.metrics;

import com.pmmsentinel.core.model.MetricPoint;
import com.pmmsentinel.engine.api.MetricSource;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only metric series keyed by metric name. Points are kept in arrival order without
 * deduplication; readers always get a stable copy.
 */
public class InMemoryMetricSeries implements MetricSource {
    private final Map<String, CopyOnWriteArrayList<MetricPoint>> series = new ConcurrentHashMap<>();

    public void append(MetricPoint point) {
        Objects.requireNonNull(point, "point is required");
        series.computeIfAbsent(point.metricName(), ignored -> new CopyOnWriteArrayList<>()).add(point);
    }

    public void record(String metricName, Instant timestamp, double value) {
        append(MetricPoint.of(metricName, timestamp, value));
    }

    @Override
    public Set<String> metricNames() {
        return Set.copyOf(series.keySet());
    }

    @Override
    public List<MetricPoint> points(String metricName, Instant from, Instant to) {
        List<MetricPoint> points = series.get(metricName);
        if (points == null) {
            return List.of();
        }
        return points.stream()
                .filter(point -> !point.timestamp().isBefore(from) && !point.timestamp().isAfter(to))
                .toList();
    }

    @Override
    public List<MetricPoint> latest(String metricName, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
        List<MetricPoint> points = series.get(metricName);
        if (points == null) {
            return List.of();
        }
        Object[] view = points.toArray();
        int from = Math.max(0, view.length - count);
        return Arrays.stream(view, from, view.length).map(MetricPoint.class::cast).toList();
    }

    @Override
    public int size(String metricName) {
        List<MetricPoint> points = series.get(metricName);
        return points == null ? 0 : points.size();
    }
}
