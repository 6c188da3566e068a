package com.pmmsentinel.engine.api;

import com.pmmsentinel.core.model.Complaint;
import com.pmmsentinel.core.model.ComplaintPriority;
import com.pmmsentinel.core.model.ComplaintStatus;

import java.time.Instant;

public record ComplaintFilter(ComplaintStatus status, ComplaintPriority priority, Instant since) {
    public static ComplaintFilter all() {
        return new ComplaintFilter(null, null, null);
    }

    public static ComplaintFilter withStatus(ComplaintStatus status) {
        return new ComplaintFilter(status, null, null);
    }

    public static ComplaintFilter since(Instant since) {
        return new ComplaintFilter(null, null, since);
    }

    public boolean matches(Complaint complaint) {
        if (status != null && complaint.status() != status) {
            return false;
        }
        if (priority != null && complaint.priority() != priority) {
            return false;
        }
        return since == null || !complaint.createdAt().isBefore(since);
    }
}
