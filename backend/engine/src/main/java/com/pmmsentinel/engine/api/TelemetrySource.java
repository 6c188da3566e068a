package com.pmmsentinel.engine.api;

import com.pmmsentinel.core.model.PerformanceSnapshot;

import java.time.Instant;

public interface TelemetrySource {
    PerformanceSnapshot sample(Instant at);
}
