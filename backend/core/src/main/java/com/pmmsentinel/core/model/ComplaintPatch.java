package com.pmmsentinel.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Mutable fields of a {@link Complaint}. Null components are left unchanged.
 */
public record ComplaintPatch(
        ComplaintStatus status,
        ComplaintPriority priority,
        String assignedTo,
        String resolution
) {
    private static final Set<String> FIELDS = Set.of("status", "priority", "assignedTo", "resolution");

    public static ComplaintPatch fromFields(Map<String, Object> fields) {
        PatchFields.rejectUnknown(fields, FIELDS, "complaint");
        String status = PatchFields.string(fields, "status");
        String priority = PatchFields.string(fields, "priority");
        return new ComplaintPatch(
                status == null ? null : ComplaintStatus.fromWire(status),
                priority == null ? null : ComplaintPriority.fromWire(priority),
                PatchFields.string(fields, "assignedTo"),
                PatchFields.string(fields, "resolution")
        );
    }

    public boolean isEmpty() {
        return status == null && priority == null && assignedTo == null && resolution == null;
    }

    public Map<String, String> changes() {
        Map<String, String> changes = new LinkedHashMap<>();
        if (status != null) {
            changes.put("status", status.wire());
        }
        if (priority != null) {
            changes.put("priority", priority.wire());
        }
        if (assignedTo != null) {
            changes.put("assignedTo", assignedTo);
        }
        if (resolution != null) {
            changes.put("resolution", resolution);
        }
        return changes;
    }
}
