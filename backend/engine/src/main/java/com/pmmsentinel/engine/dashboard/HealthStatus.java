package com.pmmsentinel.engine.dashboard;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {
    HEALTHY("healthy", 90),
    WARNING("warning", 70),
    DEGRADED("degraded", 50),
    CRITICAL("critical", 0);

    private final String wire;
    private final int minScore;

    HealthStatus(String wire, int minScore) {
        this.wire = wire;
        this.minScore = minScore;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public int minScore() {
        return minScore;
    }

    public static HealthStatus forScore(int score) {
        for (HealthStatus status : values()) {
            if (score >= status.minScore) {
                return status;
            }
        }
        return CRITICAL;
    }
}
