package com.pmmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SignalCategory {
    ANOMALY("anomaly"),
    TREND_CHANGE("trend_change"),
    THRESHOLD_BREACH("threshold_breach"),
    PATTERN_DETECTED("pattern_detected"),
    DRIFT_DETECTED("drift_detected");

    private final String wire;

    SignalCategory(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static SignalCategory fromWire(String value) {
        return WireNames.parse(values(), SignalCategory::wire, value, "signal category");
    }
}
