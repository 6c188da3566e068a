package com.pmmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ComplaintStatus {
    OPEN("open"),
    IN_PROGRESS("in_progress"),
    UNDER_REVIEW("under_review"),
    RESOLVED("resolved"),
    CLOSED("closed");

    private final String wire;

    ComplaintStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean isOpen() {
        return this == OPEN || this == IN_PROGRESS;
    }

    @JsonCreator
    public static ComplaintStatus fromWire(String value) {
        return WireNames.parse(values(), ComplaintStatus::wire, value, "complaint status");
    }
}
