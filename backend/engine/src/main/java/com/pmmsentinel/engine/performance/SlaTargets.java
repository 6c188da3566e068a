package com.pmmsentinel.engine.performance;

public record SlaTargets(
        double responseTimeAvgMs,
        double responseTimeP95Ms,
        double availabilityPercent,
        double errorRatePercent,
        double throughput
) {
    public static final SlaTargets DEFAULT = new SlaTargets(200, 500, 99.9, 1.0, 100);

    public boolean responseTimeAvgMet(double value) {
        return value <= responseTimeAvgMs;
    }

    public boolean responseTimeP95Met(double value) {
        return value <= responseTimeP95Ms;
    }

    public boolean availabilityMet(double value) {
        return value >= availabilityPercent;
    }

    public boolean errorRateMet(double value) {
        return value <= errorRatePercent;
    }

    public boolean throughputMet(double value) {
        return value >= throughput;
    }
}
