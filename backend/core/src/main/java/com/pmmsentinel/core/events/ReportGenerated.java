package com.pmmsentinel.core.events;

import com.pmmsentinel.core.model.ReportType;

import java.time.Instant;

public record ReportGenerated(
        Instant timestamp,
        String reportId,
        ReportType reportType,
        int periodDays
) implements Event {
    @Override
    public String type() {
        return "ReportGenerated";
    }
}
