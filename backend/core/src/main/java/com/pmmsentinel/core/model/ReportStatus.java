package com.pmmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReportStatus {
    DRAFT("draft"),
    PENDING_REVIEW("pending_review"),
    APPROVED("approved"),
    SUBMITTED("submitted");

    private final String wire;

    ReportStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    // Reports advance one review step at a time; submitted is final.
    public boolean canAdvanceTo(ReportStatus next) {
        return next.ordinal() == ordinal() + 1;
    }

    @JsonCreator
    public static ReportStatus fromWire(String value) {
        return WireNames.parse(values(), ReportStatus::wire, value, "report status");
    }
}
