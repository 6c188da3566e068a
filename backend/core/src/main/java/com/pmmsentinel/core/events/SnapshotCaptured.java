package com.pmmsentinel.core.events;

import com.pmmsentinel.core.model.PerformanceSnapshot;

import java.time.Instant;

public record SnapshotCaptured(Instant timestamp, PerformanceSnapshot snapshot) implements Event {
    @Override
    public String type() {
        return "SnapshotCaptured";
    }
}
