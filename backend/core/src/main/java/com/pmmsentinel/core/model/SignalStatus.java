package com.pmmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review state of a detected signal. Transitions only happen through an explicit
 * {@link SignalPatch}: active to acknowledged to resolved, or active to false positive.
 */
public enum SignalStatus {
    ACTIVE("active"),
    ACKNOWLEDGED("acknowledged"),
    RESOLVED("resolved"),
    FALSE_POSITIVE("false_positive");

    private final String wire;

    SignalStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean canTransitionTo(SignalStatus next) {
        return switch (this) {
            case ACTIVE -> next == ACKNOWLEDGED || next == FALSE_POSITIVE;
            case ACKNOWLEDGED -> next == RESOLVED;
            case RESOLVED, FALSE_POSITIVE -> false;
        };
    }

    @JsonCreator
    public static SignalStatus fromWire(String value) {
        return WireNames.parse(values(), SignalStatus::wire, value, "signal status");
    }
}
