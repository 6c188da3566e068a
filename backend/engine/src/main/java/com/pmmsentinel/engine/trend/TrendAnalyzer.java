package com.pmmsentinel.engine.trend;

import com.pmmsentinel.core.model.MetricPoint;
import com.pmmsentinel.core.util.Stats;
import com.pmmsentinel.engine.api.MetricSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Direction, strength and short-horizon forecast for metric windows.
 */
public class TrendAnalyzer {
    public static final int DIRECTION_MIN_POINTS = 5;
    public static final int FORECAST_MIN_POINTS = 3;
    public static final double DIRECTION_BAND = 0.05;
    public static final double STEADY_FORECAST_CONFIDENCE = 0.7;
    public static final double VOLATILE_FORECAST_CONFIDENCE = 0.5;

    private final MetricSource metricSource;
    private final Clock clock;

    public TrendAnalyzer(MetricSource metricSource, Clock clock) {
        this.metricSource = Objects.requireNonNull(metricSource, "metricSource is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public TrendAnalysis analyzeTrends(String metricName, List<Double> values, List<Instant> timestamps) {
        Objects.requireNonNull(values, "values are required");
        if (timestamps != null && timestamps.size() != values.size()) {
            throw new IllegalArgumentException("Got " + timestamps.size() + " timestamps for "
                    + values.size() + " values of " + metricName);
        }
        List<Double> window = values.stream().filter(Double::isFinite).toList();
        if (window.size() < 2) {
            return TrendAnalysis.insufficientData(metricName, window.size());
        }

        double current = window.get(window.size() - 1);
        double std = Stats.sampleStdDev(window);

        TrendDirection direction = TrendDirection.STABLE;
        double strength = 0.0;
        if (window.size() >= DIRECTION_MIN_POINTS) {
            int split = window.size() / 2;
            double firstHalf = Stats.mean(window.subList(0, split));
            double secondHalf = Stats.mean(window.subList(split, window.size()));
            // A zero baseline has no relative change to measure.
            if (firstHalf != 0.0) {
                if (secondHalf > firstHalf * (1 + DIRECTION_BAND)) {
                    direction = TrendDirection.INCREASING;
                    strength = Math.min(1.0, Math.abs((secondHalf - firstHalf) / firstHalf));
                } else if (secondHalf < firstHalf * (1 - DIRECTION_BAND)) {
                    direction = TrendDirection.DECREASING;
                    strength = Math.min(1.0, Math.abs((firstHalf - secondHalf) / firstHalf));
                }
            }
        }

        return new TrendAnalysis(
                metricName,
                TrendAnalysis.ANALYZED,
                window.size(),
                current,
                Stats.mean(window),
                std,
                Stats.min(window),
                Stats.max(window),
                direction,
                strength,
                forecast(window, current, std)
        );
    }

    public Map<String, TrendAnalysis> getAllTrends(int hours) {
        Instant now = clock.instant();
        Instant start = now.minus(lookback(hours));
        Map<String, TrendAnalysis> trends = new TreeMap<>();
        for (String metricName : metricSource.metricNames()) {
            List<MetricPoint> points = metricSource.points(metricName, start, now);
            if (!points.isEmpty()) {
                trends.put(metricName, analyze(metricName, points));
            }
        }
        return trends;
    }

    public TrendAnalysis forecast(String metricName, int hours) {
        if (!metricSource.metricNames().contains(metricName)) {
            throw new IllegalArgumentException("Unknown metric: " + metricName);
        }
        Instant now = clock.instant();
        List<MetricPoint> points = metricSource.points(metricName, now.minus(lookback(hours)), now);
        if (points.isEmpty()) {
            throw new IllegalArgumentException("No data for metric " + metricName + " in the last " + hours + "h");
        }
        return analyze(metricName, points);
    }

    private TrendAnalysis analyze(String metricName, List<MetricPoint> points) {
        return analyzeTrends(
                metricName,
                points.stream().map(MetricPoint::value).toList(),
                points.stream().map(MetricPoint::timestamp).toList()
        );
    }

    private static Forecast forecast(List<Double> window, double current, double std) {
        if (window.size() < FORECAST_MIN_POINTS) {
            return null;
        }
        double totalChange = 0.0;
        for (int i = 1; i < window.size(); i++) {
            totalChange += window.get(i) - window.get(i - 1);
        }
        double avgChange = totalChange / (window.size() - 1);
        return new Forecast(
                current + avgChange,
                current + avgChange * 3,
                Math.abs(avgChange) < std ? STEADY_FORECAST_CONFIDENCE : VOLATILE_FORECAST_CONFIDENCE
        );
    }

    static Duration lookback(int hours) {
        if (hours <= 0) {
            throw new IllegalArgumentException("hours must be positive: " + hours);
        }
        return Duration.ofHours(hours);
    }
}
