package com.pmmsentinel.engine.api;

import com.pmmsentinel.core.model.MetricPoint;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Named metric time series, each in insertion order.
 */
public interface MetricSource {
    Set<String> metricNames();

    /**
     * Points of one metric with {@code from <= timestamp <= to}; empty for an unknown metric.
     */
    List<MetricPoint> points(String metricName, Instant from, Instant to);

    /**
     * The most recent {@code count} points of one metric, oldest first.
     */
    List<MetricPoint> latest(String metricName, int count);

    int size(String metricName);
}
