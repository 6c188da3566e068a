package com.pmmsentinel.core.events;

import java.time.Instant;

public record TaskFailed(Instant timestamp, String taskName, String message) implements Event {
    @Override
    public String type() {
        return "TaskFailed";
    }
}
