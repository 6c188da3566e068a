package com.pmmsentinel.engine.dashboard;

import com.pmmsentinel.core.model.Severity;
import com.pmmsentinel.core.model.Signal;
import com.pmmsentinel.core.model.SignalCategory;

public record SignalSummary(
        String id,
        SignalCategory category,
        Severity severity,
        String metric,
        String description
) {
    public static SignalSummary of(Signal signal) {
        return new SignalSummary(
                signal.id(),
                signal.category(),
                signal.severity(),
                signal.metricName(),
                signal.description()
        );
    }
}
