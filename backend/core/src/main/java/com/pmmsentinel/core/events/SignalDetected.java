package com.pmmsentinel.core.events;

import com.pmmsentinel.core.model.Signal;

import java.time.Instant;

public record SignalDetected(Instant timestamp, Signal signal) implements Event {
    @Override
    public String type() {
        return "SignalDetected";
    }
}
