package com.pmmsentinel.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

public record SignalPatch(SignalStatus status, String acknowledgedBy) {
    private static final Set<String> FIELDS = Set.of("status", "acknowledgedBy");

    public SignalPatch {
        Objects.requireNonNull(status, "status is required");
    }

    public static SignalPatch acknowledge(String actor) {
        return new SignalPatch(SignalStatus.ACKNOWLEDGED, actor);
    }

    public static SignalPatch resolve() {
        return new SignalPatch(SignalStatus.RESOLVED, null);
    }

    public static SignalPatch falsePositive() {
        return new SignalPatch(SignalStatus.FALSE_POSITIVE, null);
    }

    public static SignalPatch fromFields(Map<String, Object> fields) {
        PatchFields.rejectUnknown(fields, FIELDS, "signal");
        return new SignalPatch(
                SignalStatus.fromWire(PatchFields.string(fields, "status")),
                PatchFields.string(fields, "acknowledgedBy")
        );
    }
}
