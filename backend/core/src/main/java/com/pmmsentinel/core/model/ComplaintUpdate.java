package com.pmmsentinel.core.model;

import java.time.Instant;
import java.util.Map;

public record ComplaintUpdate(Instant timestamp, Map<String, String> changes) {
    public ComplaintUpdate {
        changes = changes == null ? Map.of() : Map.copyOf(changes);
    }
}
