package com.pmmsentinel.core.model;

import java.util.Map;

public record IncidentsSummary(
        int totalAlerts,
        Map<String, Integer> bySeverity,
        Map<String, Integer> byType,
        int criticalCount,
        int highCount
) {
    public IncidentsSummary {
        bySeverity = bySeverity == null ? Map.of() : Map.copyOf(bySeverity);
        byType = byType == null ? Map.of() : Map.copyOf(byType);
    }
}
