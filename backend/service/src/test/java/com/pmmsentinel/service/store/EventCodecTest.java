package com.pmmsentinel.service.store;

import com.pmmsentinel.core.events.DetectionPassCompleted;
import com.pmmsentinel.core.events.Event;
import com.pmmsentinel.core.events.PersistenceFailed;
import com.pmmsentinel.core.events.ReportGenerated;
import com.pmmsentinel.core.events.SignalDetected;
import com.pmmsentinel.core.events.SignalStatusChanged;
import com.pmmsentinel.core.events.SnapshotCaptured;
import com.pmmsentinel.core.events.TaskFailed;
import com.pmmsentinel.core.model.PerformanceSnapshot;
import com.pmmsentinel.core.model.ReportType;
import com.pmmsentinel.core.model.Severity;
import com.pmmsentinel.core.model.Signal;
import com.pmmsentinel.core.model.SignalCategory;
import com.pmmsentinel.core.model.SignalStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventCodecTest {
    private static final Instant NOW = Instant.parse("2026-02-12T20:00:00Z");

    @Test
    void everyPublishedEventTypeSurvivesTheJsonLine() {
        Signal signal = Signal.detected("SIG-20260212200000-0001", NOW, SignalCategory.ANOMALY, Severity.HIGH,
                "response_accuracy", 0.42, 0.91, -53.8, 0.82, "Anomaly detected");
        List<Event> events = List.of(
                new SignalDetected(NOW, signal),
                new SignalStatusChanged(NOW, signal.id(), "response_accuracy", SignalStatus.ACTIVE,
                        SignalStatus.ACKNOWLEDGED, "analyst"),
                new DetectionPassCompleted(NOW, 3, 1, 0, 12),
                new SnapshotCaptured(NOW, new PerformanceSnapshot(NOW, 180, 450, 110, 0.5, 99.95, 120,
                        Map.of("cpu_usage", 42.0))),
                new ReportGenerated(NOW, "REG-20260212-0001", ReportType.PERIODIC, 30),
                new PersistenceFailed(NOW, "report", "REG-20260212-0001", "disk full"),
                new TaskFailed(NOW, "regulatoryReport", "boom")
        );
        assertEquals(events.size(), EventCodec.allEventTypes().size());

        for (Event event : events) {
            assertEquals(event, EventCodec.fromJsonLine(EventCodec.toJsonLine(event)));
        }
    }

    @Test
    void envelopeCarriesTypeAndTimestamp() {
        String line = EventCodec.toJsonLine(new TaskFailed(NOW, "signalDetection", "boom"));

        assertTrue(line.contains("\"type\":\"TaskFailed\""));
        assertTrue(line.contains("\"timestamp\":\"2026-02-12T20:00:00Z\""));
    }

    @Test
    void unknownTypeIsRejected() {
        assertThrows(IllegalArgumentException.class, () ->
                EventCodec.fromJsonLine("{\"type\":\"AlertRaised\",\"timestamp\":\"2026-02-12T20:00:00Z\",\"event\":{}}"));
    }
}
