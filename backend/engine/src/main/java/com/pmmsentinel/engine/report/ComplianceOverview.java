package com.pmmsentinel.engine.report;

import com.pmmsentinel.core.model.ComplianceStatus;

import java.time.Instant;
import java.util.List;

public record ComplianceOverview(
        String framework,
        List<String> articlesCovered,
        ComplianceStatus status,
        Instant lastUpdated,
        String systemClassification,
        String monitoringStatus
) {
    public ComplianceOverview {
        articlesCovered = articlesCovered == null ? List.of() : List.copyOf(articlesCovered);
    }
}
