package com.pmmsentinel.service.runtime;

import com.pmmsentinel.core.model.RegulatoryReport;
import com.pmmsentinel.core.model.ReportType;
import com.pmmsentinel.engine.api.PassResult;
import com.pmmsentinel.engine.api.SurveillanceTask;
import com.pmmsentinel.engine.report.RegulatoryReporter;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public class ReportTask implements SurveillanceTask {
    public static final String NAME = "regulatoryReport";

    private final RegulatoryReporter reporter;
    private final Duration interval;
    private final ReportType type;
    private final int periodDays;

    public ReportTask(RegulatoryReporter reporter, Duration interval, ReportType type, int periodDays) {
        this.reporter = Objects.requireNonNull(reporter, "reporter is required");
        this.interval = Objects.requireNonNull(interval, "interval is required");
        this.type = Objects.requireNonNull(type, "type is required");
        this.periodDays = periodDays;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public PassResult run() {
        RegulatoryReport report = reporter.generateReport(type, periodDays);
        return PassResult.success(NAME, "Generated report " + report.id(), Map.of(
                "reportId", report.id(),
                "totalAlerts", report.incidentsSummary().totalAlerts()
        ));
    }
}
