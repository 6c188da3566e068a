package com.pmmsentinel.core.model;

import java.time.Instant;
import java.util.Map;

public record ComplianceStatus(
        String overallStatus,
        Map<String, RequirementCheck> articles,
        Instant nextAuditDue
) {
    public ComplianceStatus {
        articles = articles == null ? Map.of() : Map.copyOf(articles);
    }
}
