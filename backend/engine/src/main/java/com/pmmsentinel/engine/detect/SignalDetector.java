package com.pmmsentinel.engine.detect;

import com.pmmsentinel.core.model.Severity;
import com.pmmsentinel.core.model.Signal;
import com.pmmsentinel.core.model.SignalCategory;
import com.pmmsentinel.core.util.SequenceGenerator;
import com.pmmsentinel.core.util.Stats;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Scans one metric window and reports anomalies, trend changes and decline patterns.
 *
 * <p>Each of the three sub-detectors contributes at most one signal per call. Non-finite
 * readings are dropped from the window first. Apart from drawing identifiers from its
 * {@link SequenceGenerator} the detector has no side effects: it neither stores nor publishes
 * what it finds.
 */
public class SignalDetector {
    public static final int MIN_POINTS = 3;

    public static final int ANOMALY_MIN_POINTS = 5;
    public static final double ANOMALY_Z_THRESHOLD = 2.0;
    public static final double CRITICAL_Z_THRESHOLD = 3.0;
    public static final double SINGLE_POINT_FALLBACK_STD = 0.1;
    public static final double ANOMALY_BASE_CONFIDENCE = 0.7;
    public static final double ANOMALY_CONFIDENCE_PER_SIGMA = 0.1;
    public static final double ANOMALY_MAX_CONFIDENCE = 0.99;

    public static final int TREND_WINDOW = 10;
    public static final double TREND_CHANGE_PERCENT = 15.0;
    public static final double TREND_HIGH_PERCENT = 25.0;
    public static final double TREND_BASE_CONFIDENCE = 0.6;
    public static final double TREND_MAX_CONFIDENCE = 0.95;

    public static final int DECLINE_WINDOW = 5;
    public static final int DECLINE_MIN_DROPS = 4;
    public static final double DECLINE_CONFIDENCE = 0.8;

    private final Clock clock;
    private final SequenceGenerator sequence;

    public SignalDetector(Clock clock) {
        this(clock, new SequenceGenerator());
    }

    public SignalDetector(Clock clock, SequenceGenerator sequence) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.sequence = Objects.requireNonNull(sequence, "sequence is required");
    }

    public List<Signal> detectSignals(String metricName, List<Double> values) {
        Objects.requireNonNull(metricName, "metricName is required");
        List<Double> window = values.stream().filter(Double::isFinite).toList();
        if (window.size() < MIN_POINTS) {
            return List.of();
        }

        List<Signal> signals = new ArrayList<>(3);
        detectAnomaly(metricName, window).ifPresent(signals::add);
        detectTrendChange(metricName, window).ifPresent(signals::add);
        detectDecline(metricName, window).ifPresent(signals::add);
        return List.copyOf(signals);
    }

    Optional<Signal> detectAnomaly(String metricName, List<Double> window) {
        if (window.size() < ANOMALY_MIN_POINTS) {
            return Optional.empty();
        }
        double current = window.get(window.size() - 1);
        List<Double> historical = window.subList(0, window.size() - 1);

        double mean = Stats.mean(historical);
        double std = historical.size() > 1 ? Stats.sampleStdDev(historical) : SINGLE_POINT_FALLBACK_STD;
        if (std == 0.0) {
            return Optional.empty();
        }

        double zScore = Math.abs(current - mean) / std;
        if (!Double.isFinite(zScore) || zScore <= ANOMALY_Z_THRESHOLD) {
            return Optional.empty();
        }

        Severity severity = zScore > CRITICAL_Z_THRESHOLD ? Severity.CRITICAL : Severity.HIGH;
        double confidence = Math.min(
                ANOMALY_MAX_CONFIDENCE,
                ANOMALY_BASE_CONFIDENCE + (zScore - ANOMALY_Z_THRESHOLD) * ANOMALY_CONFIDENCE_PER_SIGMA
        );
        return Optional.of(emit(
                SignalCategory.ANOMALY,
                severity,
                metricName,
                current,
                mean,
                percentChange(mean, current),
                confidence,
                String.format(Locale.ROOT, "Anomaly detected: %s = %.4f (expected ~%.4f, z-score: %.2f)",
                        metricName, current, mean, zScore)
        ));
    }

    Optional<Signal> detectTrendChange(String metricName, List<Double> window) {
        if (window.size() < TREND_WINDOW) {
            return Optional.empty();
        }
        int half = TREND_WINDOW / 2;
        List<Double> recent = window.subList(window.size() - half, window.size());
        List<Double> earlier = window.subList(window.size() - TREND_WINDOW, window.size() - half);

        double recentMean = Stats.mean(recent);
        double earlierMean = Stats.mean(earlier);
        if (earlierMean == 0.0) {
            return Optional.empty();
        }

        double changePercent = (recentMean - earlierMean) / earlierMean * 100.0;
        double magnitude = Math.abs(changePercent);
        if (!Double.isFinite(magnitude) || magnitude <= TREND_CHANGE_PERCENT) {
            return Optional.empty();
        }

        Severity severity = magnitude > TREND_HIGH_PERCENT ? Severity.HIGH : Severity.MEDIUM;
        double confidence = Math.min(TREND_MAX_CONFIDENCE, TREND_BASE_CONFIDENCE + magnitude / 100.0);
        String direction = changePercent > 0 ? "increasing" : "decreasing";
        return Optional.of(emit(
                SignalCategory.TREND_CHANGE,
                severity,
                metricName,
                recentMean,
                earlierMean,
                changePercent,
                confidence,
                String.format(Locale.ROOT, "Trend change detected: %s is %s (%+.1f%% change)",
                        metricName, direction, changePercent)
        ));
    }

    Optional<Signal> detectDecline(String metricName, List<Double> window) {
        if (window.size() < DECLINE_WINDOW) {
            return Optional.empty();
        }
        List<Double> recent = window.subList(window.size() - DECLINE_WINDOW, window.size());
        int drops = 0;
        for (int i = 1; i < recent.size(); i++) {
            if (recent.get(i) < recent.get(i - 1)) {
                drops++;
            }
        }
        if (drops < DECLINE_MIN_DROPS) {
            return Optional.empty();
        }

        double first = recent.get(0);
        double last = recent.get(recent.size() - 1);
        return Optional.of(emit(
                SignalCategory.PATTERN_DETECTED,
                Severity.MEDIUM,
                metricName,
                last,
                first,
                percentChange(first, last),
                DECLINE_CONFIDENCE,
                String.format(Locale.ROOT, "Pattern detected: %s showing consecutive decline (%d drops in last %d readings)",
                        metricName, drops, DECLINE_WINDOW)
        ));
    }

    private Signal emit(
            SignalCategory category,
            Severity severity,
            String metricName,
            double detected,
            double expected,
            double deviationPercent,
            double confidence,
            String description
    ) {
        Instant now = clock.instant();
        return Signal.detected(
                sequence.nextId("SIG", SequenceGenerator.SECOND_STAMP, now),
                now,
                category,
                severity,
                metricName,
                detected,
                expected,
                deviationPercent,
                confidence,
                description
        );
    }

    private static double percentChange(double base, double value) {
        double change = base == 0.0 ? 0.0 : (value - base) / base * 100.0;
        return Double.isFinite(change) ? change : 0.0;
    }
}
