package com.pmmsentinel.engine.dashboard;

import java.util.List;

/**
 * @param detectionWindow most recent values handed to the detector per metric
 * @param minSamples      metrics with fewer samples are skipped by a detection pass
 * @param kpiMetrics      metrics averaged by {@link DashboardCore#getKpis()}
 */
public record DashboardSettings(int detectionWindow, int minSamples, List<String> kpiMetrics) {
    public static final DashboardSettings DEFAULT = new DashboardSettings(
            50,
            5,
            List.of("response_accuracy", "hallucination_rate", "user_satisfaction")
    );

    public DashboardSettings {
        if (detectionWindow <= 0) {
            throw new IllegalArgumentException("detectionWindow must be positive: " + detectionWindow);
        }
        if (minSamples <= 0) {
            throw new IllegalArgumentException("minSamples must be positive: " + minSamples);
        }
        kpiMetrics = kpiMetrics == null ? List.of() : List.copyOf(kpiMetrics);
    }
}
