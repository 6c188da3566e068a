package com.pmmsentinel.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record Alert(
        String id,
        Instant timestamp,
        String type,
        Severity severity,
        String metricName,
        double currentValue,
        double threshold,
        Map<String, Object> details
) {
    public Alert {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(severity, "severity is required");
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
