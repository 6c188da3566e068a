package com.pmmsentinel.engine.dashboard;

import com.pmmsentinel.core.model.Alert;
import com.pmmsentinel.core.model.Severity;
import com.pmmsentinel.core.model.Signal;

import java.util.List;

/**
 * 0 to 100 score: every active signal and recent alert deducts points by severity.
 */
public final class HealthScore {
    public static final int MAX = 100;

    private HealthScore() {
    }

    public static int calculate(List<Signal> activeSignals, List<Alert> activeAlerts) {
        int score = MAX;
        for (Signal signal : activeSignals) {
            score -= signalPenalty(signal.severity());
        }
        for (Alert alert : activeAlerts) {
            score -= alertPenalty(alert.severity());
        }
        return Math.max(0, Math.min(MAX, score));
    }

    static int signalPenalty(Severity severity) {
        return switch (severity) {
            case CRITICAL -> 15;
            case HIGH -> 10;
            case MEDIUM -> 5;
            case LOW -> 0;
        };
    }

    static int alertPenalty(Severity severity) {
        return switch (severity) {
            case CRITICAL -> 20;
            case HIGH -> 10;
            case MEDIUM, LOW -> 0;
        };
    }
}
