package com.pmmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Objects;

/**
 * A finding produced by signal detection over one metric window.
 *
 * <p>Everything except the review fields ({@code status}, {@code acknowledgedBy},
 * {@code acknowledgedAt}) is fixed at detection time. Review changes go through
 * {@link #apply(SignalPatch, Instant)}, which returns a new record.
 */
public record Signal(
        String id,
        Instant timestamp,
        SignalCategory category,
        Severity severity,
        String metricName,
        double detectedValue,
        double expectedValue,
        double deviationPercent,
        double confidence,
        String description,
        SignalStatus status,
        String acknowledgedBy,
        Instant acknowledgedAt
) {
    public Signal {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(metricName, "metricName is required");
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        if (!Double.isFinite(detectedValue) || !Double.isFinite(expectedValue) || !Double.isFinite(deviationPercent)) {
            throw new IllegalArgumentException("Signal " + id + " has a non-finite reading");
        }
        status = status == null ? SignalStatus.ACTIVE : status;
    }

    public static Signal detected(
            String id,
            Instant timestamp,
            SignalCategory category,
            Severity severity,
            String metricName,
            double detectedValue,
            double expectedValue,
            double deviationPercent,
            double confidence,
            String description
    ) {
        return new Signal(id, timestamp, category, severity, metricName, detectedValue, expectedValue,
                deviationPercent, confidence, description, SignalStatus.ACTIVE, null, null);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == SignalStatus.ACTIVE;
    }

    public Signal apply(SignalPatch patch, Instant at) {
        Objects.requireNonNull(patch, "patch is required");
        SignalStatus next = patch.status();
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Signal " + id + " cannot move from " + status.wire() + " to " + next.wire());
        }
        if (next == SignalStatus.ACKNOWLEDGED) {
            if (patch.acknowledgedBy() == null || patch.acknowledgedBy().isBlank()) {
                throw new IllegalArgumentException("acknowledgedBy is required to acknowledge signal " + id);
            }
            return new Signal(id, timestamp, category, severity, metricName, detectedValue, expectedValue,
                    deviationPercent, confidence, description, next, patch.acknowledgedBy(), at);
        }
        return new Signal(id, timestamp, category, severity, metricName, detectedValue, expectedValue,
                deviationPercent, confidence, description, next, acknowledgedBy, acknowledgedAt);
    }
}
