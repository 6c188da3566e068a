package com.pmmsentinel.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record RegulatoryReport(
        String id,
        Instant createdAt,
        ReportType type,
        Instant periodStart,
        Instant periodEnd,
        ReportStatus status,
        String title,
        String summary,
        Map<String, MetricSummary> metricsSummary,
        IncidentsSummary incidentsSummary,
        ComplianceStatus complianceStatus,
        List<String> recommendations,
        Instant submittedAt,
        String submittedTo
) {
    public RegulatoryReport {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(type, "type is required");
        status = status == null ? ReportStatus.DRAFT : status;
        metricsSummary = metricsSummary == null ? Map.of() : Map.copyOf(metricsSummary);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public RegulatoryReport apply(ReportPatch patch, Instant at) {
        Objects.requireNonNull(patch, "patch is required");
        ReportStatus next = patch.status();
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateException(
                    "Report " + id + " cannot move from " + status.wire() + " to " + next.wire());
        }
        if (next == ReportStatus.SUBMITTED) {
            if (patch.submittedTo() == null || patch.submittedTo().isBlank()) {
                throw new IllegalArgumentException("submittedTo is required to submit report " + id);
            }
            return new RegulatoryReport(id, createdAt, type, periodStart, periodEnd, next, title, summary,
                    metricsSummary, incidentsSummary, complianceStatus, recommendations, at, patch.submittedTo());
        }
        return new RegulatoryReport(id, createdAt, type, periodStart, periodEnd, next, title, summary,
                metricsSummary, incidentsSummary, complianceStatus, recommendations, submittedAt, submittedTo);
    }
}
