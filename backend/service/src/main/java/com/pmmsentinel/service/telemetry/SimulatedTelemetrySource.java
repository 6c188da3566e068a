package com.pmmsentinel.service.telemetry;

import com.pmmsentinel.core.model.PerformanceSnapshot;
import com.pmmsentinel.engine.api.TelemetrySource;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Stand-in telemetry feed drawing uniformly from ranges typical of a healthy deployment.
 * The same seed yields the same sequence of snapshots.
 */
public class SimulatedTelemetrySource implements TelemetrySource {
    private final Random random;

    public SimulatedTelemetrySource(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public synchronized PerformanceSnapshot sample(Instant at) {
        double avg = uniform(150, 250);
        double p95 = uniform(400, 600);
        double throughput = uniform(80, 120);
        double errorRate = uniform(0.1, 1.5);
        double availability = uniform(99.5, 99.99);
        int activeUsers = 50 + random.nextInt(151);

        Map<String, Double> subMetrics = new LinkedHashMap<>();
        subMetrics.put("cpu_usage", uniform(30, 70));
        subMetrics.put("memory_usage", uniform(40, 80));
        subMetrics.put("request_queue", (double) random.nextInt(51));
        return new PerformanceSnapshot(at, avg, p95, throughput, errorRate, availability, activeUsers, subMetrics);
    }

    private double uniform(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }
}
