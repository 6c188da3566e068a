package com.pmmsentinel.engine.performance;

import java.time.Instant;
import java.util.Map;

public record RealtimeMetrics(
        Instant timestamp,
        SlaReading responseTimeAvgMs,
        SlaReading responseTimeP95Ms,
        SlaReading throughput,
        SlaReading availabilityPercent,
        SlaReading errorRatePercent,
        int activeUsers,
        Map<String, Double> system
) {
    public RealtimeMetrics {
        system = system == null ? Map.of() : Map.copyOf(system);
    }
}
