package com.pmmsentinel.engine.dashboard;

import java.time.Instant;
import java.util.Map;

public record Overview(
        Instant timestamp,
        int healthScore,
        HealthStatus healthStatus,
        int activeSignals,
        int activeAlerts,
        int openComplaints,
        int metricsTracked,
        Map<String, TrendSummary> trendsSummary,
        String complianceStatus,
        String lastReportId
) {
    public Overview {
        trendsSummary = trendsSummary == null ? Map.of() : Map.copyOf(trendsSummary);
    }
}
