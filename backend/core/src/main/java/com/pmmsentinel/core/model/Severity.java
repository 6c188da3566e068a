package com.pmmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3),
    CRITICAL("critical", 4);

    private final String wire;
    private final int level;

    Severity(String wire, int level) {
        this.wire = wire;
        this.level = level;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public int level() {
        return level;
    }

    public boolean isHigherThan(Severity other) {
        return level > other.level;
    }

    @JsonCreator
    public static Severity fromWire(String value) {
        return WireNames.parse(values(), Severity::wire, value, "severity");
    }
}
