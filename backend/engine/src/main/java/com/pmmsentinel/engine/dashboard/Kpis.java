package com.pmmsentinel.engine.dashboard;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Kpis(
        Instant timestamp,
        Map<String, Double> metrics,
        AlertCounts alerts,
        SignalCounts signals,
        ComplaintCounts complaints
) {
    public Kpis {
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    /**
     * An alert counts as active for 24 hours, so both figures cover the same window.
     */
    public record AlertCounts(int active, int last24h) {
    }

    public record SignalCounts(int active, int detected7d) {
    }

    public record ComplaintCounts(int open, int created7d) {
    }
}
