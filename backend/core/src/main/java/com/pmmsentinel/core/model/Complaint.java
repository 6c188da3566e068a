package com.pmmsentinel.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record Complaint(
        String id,
        Instant createdAt,
        String userId,
        String category,
        String subject,
        String description,
        ComplaintPriority priority,
        ComplaintStatus status,
        String assignedTo,
        String relatedInteractionId,
        String resolution,
        Instant resolvedAt,
        List<String> tags,
        List<ComplaintUpdate> updates
) {
    public Complaint {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(category, "category is required");
        priority = priority == null ? ComplaintPriority.MEDIUM : priority;
        status = status == null ? ComplaintStatus.OPEN : status;
        tags = tags == null ? List.of() : List.copyOf(tags);
        updates = updates == null ? List.of() : List.copyOf(updates);
    }

    public Complaint apply(ComplaintPatch patch, Instant at) {
        Objects.requireNonNull(patch, "patch is required");
        if (patch.isEmpty()) {
            throw new IllegalArgumentException("Complaint update for " + id + " has no changes");
        }
        List<ComplaintUpdate> history = new ArrayList<>(updates);
        history.add(new ComplaintUpdate(at, patch.changes()));

        boolean resolving = patch.resolution() != null && !patch.resolution().isBlank();
        return new Complaint(
                id,
                createdAt,
                userId,
                category,
                subject,
                description,
                patch.priority() == null ? priority : patch.priority(),
                patch.status() == null ? status : patch.status(),
                patch.assignedTo() == null ? assignedTo : patch.assignedTo(),
                relatedInteractionId,
                resolving ? patch.resolution() : resolution,
                resolving ? at : resolvedAt,
                tags,
                history
        );
    }
}
