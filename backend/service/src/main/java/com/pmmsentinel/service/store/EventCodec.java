package com.pmmsentinel.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pmmsentinel.core.events.DetectionPassCompleted;
import com.pmmsentinel.core.events.Event;
import com.pmmsentinel.core.events.PersistenceFailed;
import com.pmmsentinel.core.events.ReportGenerated;
import com.pmmsentinel.core.events.SignalDetected;
import com.pmmsentinel.core.events.SignalStatusChanged;
import com.pmmsentinel.core.events.SnapshotCaptured;
import com.pmmsentinel.core.events.TaskFailed;
import com.pmmsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One-line JSON envelope ({@code type}, {@code timestamp}, {@code event}) for every event the
 * engine publishes.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "SignalDetected", SignalDetected.class,
            "SignalStatusChanged", SignalStatusChanged.class,
            "DetectionPassCompleted", DetectionPassCompleted.class,
            "SnapshotCaptured", SnapshotCaptured.class,
            "ReportGenerated", ReportGenerated.class,
            "PersistenceFailed", PersistenceFailed.class,
            "TaskFailed", TaskFailed.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
