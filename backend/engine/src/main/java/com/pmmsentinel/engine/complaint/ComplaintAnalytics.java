package com.pmmsentinel.engine.complaint;

import java.util.Map;

public record ComplaintAnalytics(
        int total,
        int periodDays,
        Map<String, Integer> byStatus,
        Map<String, Integer> byPriority,
        Map<String, Integer> byCategory,
        ResolutionStats resolutionStats,
        int openCount
) {
    public ComplaintAnalytics {
        byStatus = byStatus == null ? Map.of() : Map.copyOf(byStatus);
        byPriority = byPriority == null ? Map.of() : Map.copyOf(byPriority);
        byCategory = byCategory == null ? Map.of() : Map.copyOf(byCategory);
        resolutionStats = resolutionStats == null ? ResolutionStats.none() : resolutionStats;
    }
}
