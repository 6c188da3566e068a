package com.pmmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReportType {
    PERIODIC("periodic"),
    INCIDENT("incident"),
    COMPLIANCE("compliance"),
    AUDIT("audit");

    private final String wire;

    ReportType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static ReportType fromWire(String value) {
        return WireNames.parse(values(), ReportType::wire, value, "report type");
    }
}
