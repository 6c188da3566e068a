package com.pmmsentinel.engine.performance;

public record SlaCheck(double value, double target, boolean compliant) {
}
