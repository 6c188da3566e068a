package com.pmmsentinel.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

public record ReportPatch(ReportStatus status, String submittedTo) {
    private static final Set<String> FIELDS = Set.of("status", "submittedTo");

    public ReportPatch {
        Objects.requireNonNull(status, "status is required");
    }

    public static ReportPatch fromFields(Map<String, Object> fields) {
        PatchFields.rejectUnknown(fields, FIELDS, "report");
        return new ReportPatch(
                ReportStatus.fromWire(PatchFields.string(fields, "status")),
                PatchFields.string(fields, "submittedTo")
        );
    }
}
