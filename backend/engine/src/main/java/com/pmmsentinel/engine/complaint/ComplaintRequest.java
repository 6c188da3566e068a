package com.pmmsentinel.engine.complaint;

import com.pmmsentinel.core.model.ComplaintPriority;

import java.util.List;
import java.util.Objects;

public record ComplaintRequest(
        String userId,
        String category,
        String subject,
        String description,
        ComplaintPriority priority,
        String relatedInteractionId,
        List<String> tags
) {
    public ComplaintRequest {
        Objects.requireNonNull(category, "category is required");
        if (category.isBlank()) {
            throw new IllegalArgumentException("category must not be blank");
        }
        priority = priority == null ? ComplaintPriority.MEDIUM : priority;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
