package com.pmmsentinel.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Descriptive statistics over metric windows. Empty inputs yield 0 rather than NaN.
 */
public final class Stats {
    private Stats() {
    }

    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    /**
     * Sample standard deviation (n - 1 denominator); 0 for fewer than two values.
     */
    public static double sampleStdDev(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0.0;
        for (double value : values) {
            double delta = value - mean;
            squares += delta * delta;
        }
        return Math.sqrt(squares / (values.size() - 1));
    }

    public static double min(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
    }

    public static double max(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }

    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }
}
