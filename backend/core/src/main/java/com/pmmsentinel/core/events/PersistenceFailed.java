package com.pmmsentinel.core.events;

import java.time.Instant;

public record PersistenceFailed(
        Instant timestamp,
        String recordKind,
        String recordId,
        String message
) implements Event {
    @Override
    public String type() {
        return "PersistenceFailed";
    }
}
