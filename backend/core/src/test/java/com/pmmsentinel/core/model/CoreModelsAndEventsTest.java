package com.pmmsentinel.core.model;

import com.pmmsentinel.core.events.DetectionPassCompleted;
import com.pmmsentinel.core.events.PersistenceFailed;
import com.pmmsentinel.core.events.ReportGenerated;
import com.pmmsentinel.core.events.SignalDetected;
import com.pmmsentinel.core.events.SignalStatusChanged;
import com.pmmsentinel.core.events.SnapshotCaptured;
import com.pmmsentinel.core.events.TaskFailed;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreModelsAndEventsTest {
    private static final Instant NOW = Instant.parse("2026-02-12T20:00:00Z");
    private static final Instant LATER = Instant.parse("2026-02-12T21:30:00Z");

    @Test
    void eventTypesMatchSimpleClassNames() {
        Signal signal = signal();
        PerformanceSnapshot snapshot = new PerformanceSnapshot(NOW, 180, 450, 100, 0.5, 99.95, 120, Map.of());

        assertEquals("SignalDetected", new SignalDetected(NOW, signal).type());
        assertEquals("SignalStatusChanged", new SignalStatusChanged(
                NOW, signal.id(), "m", SignalStatus.ACTIVE, SignalStatus.RESOLVED, null).type());
        assertEquals("DetectionPassCompleted", new DetectionPassCompleted(NOW, 3, 1, 0, 12).type());
        assertEquals("SnapshotCaptured", new SnapshotCaptured(NOW, snapshot).type());
        assertEquals("ReportGenerated", new ReportGenerated(NOW, "REG-1", ReportType.PERIODIC, 30).type());
        assertEquals("PersistenceFailed", new PersistenceFailed(NOW, "signal", "SIG-1", "disk").type());
        assertEquals("TaskFailed", new TaskFailed(NOW, "t", "boom").type());
    }

    @Test
    void wireNamesParseCaseInsensitivelyAndRejectUnknownValues() {
        assertEquals(SignalStatus.FALSE_POSITIVE, SignalStatus.fromWire("FALSE_POSITIVE"));
        assertEquals(ReportStatus.PENDING_REVIEW, ReportStatus.fromWire(" pending_review "));
        assertEquals(ComplaintStatus.IN_PROGRESS, ComplaintStatus.fromWire("in_progress"));

        IllegalArgumentException unknown =
                assertThrows(IllegalArgumentException.class, () -> Severity.fromWire("urgent"));
        assertTrue(unknown.getMessage().contains("urgent"));
        assertThrows(IllegalArgumentException.class, () -> ReportType.fromWire(""));
    }

    @Test
    void severityOrderingFollowsLevel() {
        assertTrue(Severity.CRITICAL.isHigherThan(Severity.HIGH));
        assertFalse(Severity.LOW.isHigherThan(Severity.MEDIUM));
    }

    @Test
    void signalAcknowledgeThenResolve() {
        Signal acknowledged = signal().apply(SignalPatch.acknowledge("analyst"), LATER);

        assertEquals(SignalStatus.ACKNOWLEDGED, acknowledged.status());
        assertEquals("analyst", acknowledged.acknowledgedBy());
        assertEquals(LATER, acknowledged.acknowledgedAt());
        assertFalse(acknowledged.isActive());

        Signal resolved = acknowledged.apply(SignalPatch.resolve(), LATER.plusSeconds(60));
        assertEquals(SignalStatus.RESOLVED, resolved.status());
        assertEquals("analyst", resolved.acknowledgedBy());
        assertEquals(LATER, resolved.acknowledgedAt());
    }

    @Test
    void signalRejectsIllegalTransitions() {
        Signal active = signal();

        assertThrows(IllegalStateException.class, () -> active.apply(SignalPatch.resolve(), LATER));
        assertThrows(IllegalArgumentException.class, () -> active.apply(SignalPatch.acknowledge(" "), LATER));

        Signal dismissed = active.apply(SignalPatch.falsePositive(), LATER);
        assertEquals(SignalStatus.FALSE_POSITIVE, dismissed.status());
        assertThrows(IllegalStateException.class, () -> dismissed.apply(SignalPatch.acknowledge("analyst"), LATER));
    }

    @Test
    void signalConfidenceMustBeAProbability() {
        assertThrows(IllegalArgumentException.class, () -> Signal.detected(
                "SIG-1", NOW, SignalCategory.ANOMALY, Severity.HIGH, "m", 1, 1, 0, 1.2, "d"));
        assertThrows(IllegalArgumentException.class, () -> Signal.detected(
                "SIG-1", NOW, SignalCategory.ANOMALY, Severity.HIGH, "m", 1, 1, 0, Double.NaN, "d"));
    }

    @Test
    void nonFiniteReadingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> MetricPoint.of("latency", NOW, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> MetricPoint.of("latency", NOW, Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> Signal.detected(
                "SIG-1", NOW, SignalCategory.ANOMALY, Severity.HIGH, "m", Double.NaN, 1, 0, 0.9, "d"));
        assertThrows(IllegalArgumentException.class, () -> Signal.detected(
                "SIG-1", NOW, SignalCategory.ANOMALY, Severity.HIGH, "m", 1, 1, Double.NEGATIVE_INFINITY, 0.9, "d"));
    }

    @Test
    void patchesRejectUnknownFields() {
        IllegalArgumentException signalError = assertThrows(IllegalArgumentException.class,
                () -> SignalPatch.fromFields(Map.of("status", "resolved", "severity", "low")));
        assertTrue(signalError.getMessage().contains("severity"));

        assertThrows(IllegalArgumentException.class,
                () -> ReportPatch.fromFields(Map.of("status", "approved", "title", "x")));
        assertThrows(IllegalArgumentException.class,
                () -> ComplaintPatch.fromFields(Map.of("subject", "x")));
        assertThrows(IllegalArgumentException.class,
                () -> ComplaintPatch.fromFields(Map.of("status", 3)));

        SignalPatch patch = SignalPatch.fromFields(Map.of("status", "acknowledged", "acknowledgedBy", "qa"));
        assertEquals(SignalPatch.acknowledge("qa"), patch);
    }

    @Test
    void reportAdvancesOneStepAtATimeAndSubmissionNeedsRecipient() {
        RegulatoryReport draft = report();

        assertThrows(IllegalStateException.class,
                () -> draft.apply(new ReportPatch(ReportStatus.APPROVED, null), LATER));

        RegulatoryReport pending = draft.apply(new ReportPatch(ReportStatus.PENDING_REVIEW, null), LATER);
        RegulatoryReport approved = pending.apply(new ReportPatch(ReportStatus.APPROVED, null), LATER);
        assertThrows(IllegalArgumentException.class,
                () -> approved.apply(new ReportPatch(ReportStatus.SUBMITTED, null), LATER));

        RegulatoryReport submitted = approved.apply(new ReportPatch(ReportStatus.SUBMITTED, "national-authority"), LATER);
        assertEquals(ReportStatus.SUBMITTED, submitted.status());
        assertEquals(LATER, submitted.submittedAt());
        assertEquals("national-authority", submitted.submittedTo());
        assertThrows(IllegalStateException.class,
                () -> submitted.apply(new ReportPatch(ReportStatus.DRAFT, null), LATER));
    }

    @Test
    void complaintUpdatesAppendHistoryAndResolutionStampsTime() {
        Complaint complaint = new Complaint("CMP-20260212-0001", NOW, "u-1", "accuracy", "Wrong answer",
                "The assistant cited a repealed article", null, null, null, null, null, null, List.of("legal"), null);
        assertEquals(ComplaintPriority.MEDIUM, complaint.priority());
        assertEquals(ComplaintStatus.OPEN, complaint.status());

        Complaint assigned = complaint.apply(new ComplaintPatch(ComplaintStatus.IN_PROGRESS, null, "ops", null), NOW);
        Complaint resolved = assigned.apply(
                new ComplaintPatch(ComplaintStatus.RESOLVED, null, null, "Knowledge base updated"), LATER);

        assertEquals(2, resolved.updates().size());
        assertEquals(Map.of("status", "in_progress", "assignedTo", "ops"), resolved.updates().get(0).changes());
        assertEquals("ops", resolved.assignedTo());
        assertEquals(LATER, resolved.resolvedAt());
        assertNull(assigned.resolvedAt());
        assertFalse(resolved.status().isOpen());

        assertThrows(IllegalArgumentException.class,
                () -> complaint.apply(new ComplaintPatch(null, null, null, null), LATER));
    }

    private static Signal signal() {
        return Signal.detected("SIG-20260212200000-0001", NOW, SignalCategory.ANOMALY, Severity.CRITICAL,
                "response_accuracy", 0.2, 0.9, -77.7, 0.99, "Anomaly detected");
    }

    private static RegulatoryReport report() {
        return new RegulatoryReport("REG-20260212-0001", NOW, ReportType.PERIODIC, NOW.minusSeconds(86400), NOW,
                ReportStatus.DRAFT, "title", "summary", Map.of(), null, null, List.of(), null, null);
    }
}
