package com.pmmsentinel.core.events;

import java.time.Instant;

public record DetectionPassCompleted(
        Instant timestamp,
        int metricsScanned,
        int signalsDetected,
        int persistenceFailures,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "DetectionPassCompleted";
    }
}
