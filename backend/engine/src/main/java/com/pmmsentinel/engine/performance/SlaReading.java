package com.pmmsentinel.engine.performance;

public record SlaReading(double value, double target, String slaStatus) {
    public static final String OK = "ok";
    public static final String BREACH = "breach";

    static SlaReading of(double value, double target, boolean met) {
        return new SlaReading(value, target, met ? OK : BREACH);
    }
}
