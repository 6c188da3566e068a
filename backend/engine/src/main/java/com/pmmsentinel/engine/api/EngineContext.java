package com.pmmsentinel.engine.api;

import com.pmmsentinel.core.bus.EventBus;

import java.time.Clock;
import java.util.Objects;

public record EngineContext(
        MetricSource metricSource,
        MonitoringStore store,
        EventBus eventBus,
        Clock clock
) {
    public EngineContext {
        Objects.requireNonNull(metricSource, "metricSource is required");
        Objects.requireNonNull(store, "store is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
    }
}
