package com.pmmsentinel.core.events;

import com.pmmsentinel.core.model.SignalStatus;

import java.time.Instant;

public record SignalStatusChanged(
        Instant timestamp,
        String signalId,
        String metricName,
        SignalStatus previousStatus,
        SignalStatus status,
        String actor
) implements Event {
    @Override
    public String type() {
        return "SignalStatusChanged";
    }
}
