package com.pmmsentinel.engine.report;

import com.pmmsentinel.core.events.PersistenceFailed;
import com.pmmsentinel.core.events.ReportGenerated;
import com.pmmsentinel.core.model.Alert;
import com.pmmsentinel.core.model.ComplianceStatus;
import com.pmmsentinel.core.model.IncidentsSummary;
import com.pmmsentinel.core.model.MetricPoint;
import com.pmmsentinel.core.model.MetricSummary;
import com.pmmsentinel.core.model.RegulatoryReport;
import com.pmmsentinel.core.model.ReportPatch;
import com.pmmsentinel.core.model.ReportStatus;
import com.pmmsentinel.core.model.ReportType;
import com.pmmsentinel.core.model.RequirementCheck;
import com.pmmsentinel.core.model.Severity;
import com.pmmsentinel.core.util.SequenceGenerator;
import com.pmmsentinel.core.util.Stats;
import com.pmmsentinel.engine.api.EngineContext;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Aggregates metric statistics and alert counts over a reporting period into an EU AI Act
 * Article 72 post-market monitoring report.
 */
public class RegulatoryReporter {
    private static final Logger LOGGER = Logger.getLogger(RegulatoryReporter.class.getName());

    public static final Duration AUDIT_INTERVAL = Duration.ofDays(90);
    public static final int ALERT_FATIGUE_THRESHOLD = 10;

    public static final String ROOT_CAUSE_RECOMMENDATION =
            "Review and address root causes of critical incidents";
    public static final String THRESHOLD_RECOMMENDATION =
            "Consider adjusting alert thresholds to reduce alert fatigue";
    public static final String MONITORING_RECOMMENDATION =
            "Continue regular monitoring and documentation updates";

    private static final Map<String, String> REQUIREMENTS = requirements();
    private static final DateTimeFormatter TITLE_MONTH =
            DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    private final EngineContext context;
    private final SequenceGenerator sequence;

    public RegulatoryReporter(EngineContext context) {
        this(context, new SequenceGenerator());
    }

    public RegulatoryReporter(EngineContext context, SequenceGenerator sequence) {
        this.context = Objects.requireNonNull(context, "context is required");
        this.sequence = Objects.requireNonNull(sequence, "sequence is required");
    }

    public RegulatoryReport generateReport(ReportType type, int periodDays) {
        Objects.requireNonNull(type, "type is required");
        if (periodDays <= 0) {
            throw new IllegalArgumentException("periodDays must be positive: " + periodDays);
        }
        Instant end = context.clock().instant();
        Instant start = end.minus(Duration.ofDays(periodDays));

        Map<String, MetricSummary> metrics = summarizeMetrics(start, end);
        IncidentsSummary incidents = summarizeIncidents(start, end);

        RegulatoryReport report = new RegulatoryReport(
                sequence.nextId("REG", SequenceGenerator.DAY_STAMP, end),
                end,
                type,
                start,
                end,
                ReportStatus.DRAFT,
                "EU AI Act Article 72 Compliance Report - " + TITLE_MONTH.format(end),
                summaryText(metrics, incidents),
                metrics,
                incidents,
                checkCompliance(end),
                recommendations(incidents),
                null,
                null
        );

        try {
            context.store().appendReport(report);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed storing regulatory report " + report.id(), e);
            context.eventBus().publish(new PersistenceFailed(end, "report", report.id(), e.getMessage()));
        }
        context.eventBus().publish(new ReportGenerated(end, report.id(), type, periodDays));
        LOGGER.info(() -> "Generated " + type.wire() + " report " + report.id() + " covering "
                + metrics.size() + " metrics and " + incidents.totalAlerts() + " alerts");
        return report;
    }

    public ComplianceOverview getComplianceStatus() {
        Instant now = context.clock().instant();
        return new ComplianceOverview(
                "EU AI Act",
                List.of("Article 72"),
                checkCompliance(now),
                now,
                "High-Risk AI System",
                "Active"
        );
    }

    public List<RegulatoryReport> listReports(String type, String status) {
        Optional<ReportType> typeFilter = Optional.ofNullable(type).map(ReportType::fromWire);
        Optional<ReportStatus> statusFilter = Optional.ofNullable(status).map(ReportStatus::fromWire);
        return context.store().reports(typeFilter, statusFilter);
    }

    public RegulatoryReport getReport(String reportId) {
        return context.store().findReport(reportId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown report id: " + reportId));
    }

    public RegulatoryReport advanceReport(String reportId, ReportPatch patch) {
        Instant now = context.clock().instant();
        return context.store().updateReport(reportId, report -> report.apply(patch, now))
                .orElseThrow(() -> new IllegalArgumentException("Unknown report id: " + reportId));
    }

    private Map<String, MetricSummary> summarizeMetrics(Instant start, Instant end) {
        Map<String, MetricSummary> summary = new TreeMap<>();
        for (String metricName : context.metricSource().metricNames()) {
            List<Double> values = context.metricSource().points(metricName, start, end).stream()
                    .map(MetricPoint::value)
                    .toList();
            if (values.isEmpty()) {
                continue;
            }
            summary.put(metricName, new MetricSummary(
                    values.size(),
                    Stats.round(Stats.mean(values), 4),
                    Stats.round(Stats.min(values), 4),
                    Stats.round(Stats.max(values), 4),
                    Stats.round(Stats.sampleStdDev(values), 4)
            ));
        }
        return summary;
    }

    private IncidentsSummary summarizeIncidents(Instant start, Instant end) {
        List<Alert> alerts = context.store().alerts(start, end);
        Map<String, Integer> bySeverity = new TreeMap<>();
        Map<String, Integer> byType = new TreeMap<>();
        for (Alert alert : alerts) {
            bySeverity.merge(alert.severity().wire(), 1, Integer::sum);
            byType.merge(alert.type(), 1, Integer::sum);
        }
        return new IncidentsSummary(
                alerts.size(),
                bySeverity,
                byType,
                bySeverity.getOrDefault(Severity.CRITICAL.wire(), 0),
                bySeverity.getOrDefault(Severity.HIGH.wire(), 0)
        );
    }

    // Placeholder policy: every requirement is reported compliant until evidence checks exist.
    private ComplianceStatus checkCompliance(Instant now) {
        Map<String, RequirementCheck> articles = new LinkedHashMap<>();
        REQUIREMENTS.forEach((article, requirement) ->
                articles.put(article, new RequirementCheck(requirement, "compliant", now)));
        return new ComplianceStatus("compliant", articles, now.plus(AUDIT_INTERVAL));
    }

    private static String summaryText(Map<String, MetricSummary> metrics, IncidentsSummary incidents) {
        return String.join("\n",
                "This report summarizes post-market monitoring activities "
                        + "in accordance with EU AI Act Article 72 requirements.",
                "",
                "Metrics tracked: " + metrics.size(),
                "Total alerts: " + incidents.totalAlerts(),
                "Critical incidents: " + incidents.criticalCount(),
                "",
                "The AI system continues to operate within defined safety parameters."
        );
    }

    private static List<String> recommendations(IncidentsSummary incidents) {
        List<String> recommendations = new ArrayList<>();
        if (incidents.criticalCount() > 0) {
            recommendations.add(ROOT_CAUSE_RECOMMENDATION);
        }
        if (incidents.totalAlerts() > ALERT_FATIGUE_THRESHOLD) {
            recommendations.add(THRESHOLD_RECOMMENDATION);
        }
        recommendations.add(MONITORING_RECOMMENDATION);
        return recommendations;
    }

    private static Map<String, String> requirements() {
        Map<String, String> requirements = new LinkedHashMap<>();
        requirements.put("article_72_1", "Post-market monitoring system established");
        requirements.put("article_72_2", "Data collection and analysis procedures defined");
        requirements.put("article_72_3", "Serious incident reporting mechanism in place");
        requirements.put("article_72_4", "Corrective action procedures established");
        requirements.put("article_72_5", "Documentation maintained and updated");
        return requirements;
    }
}
