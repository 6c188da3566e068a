package com.pmmsentinel.engine.performance;

import com.pmmsentinel.core.bus.EventBus;
import com.pmmsentinel.core.events.PersistenceFailed;
import com.pmmsentinel.core.events.SnapshotCaptured;
import com.pmmsentinel.core.model.PerformanceSnapshot;
import com.pmmsentinel.core.util.Stats;
import com.pmmsentinel.engine.api.EngineContext;
import com.pmmsentinel.engine.api.TelemetrySource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Captures performance snapshots from the telemetry feed and checks them against
 * {@link SlaTargets}.
 */
public class PerformanceMonitor {
    private static final Logger LOGGER = Logger.getLogger(PerformanceMonitor.class.getName());
    private static final Duration SLA_WINDOW = Duration.ofHours(24);
    private static final String SLA_PERIOD = "24h";

    private final EngineContext context;
    private final TelemetrySource telemetry;
    private final SlaTargets targets;

    public PerformanceMonitor(EngineContext context, TelemetrySource telemetry) {
        this(context, telemetry, SlaTargets.DEFAULT);
    }

    public PerformanceMonitor(EngineContext context, TelemetrySource telemetry, SlaTargets targets) {
        this.context = Objects.requireNonNull(context, "context is required");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry is required");
        this.targets = Objects.requireNonNull(targets, "targets are required");
    }

    public SlaTargets targets() {
        return targets;
    }

    public PerformanceSnapshot captureSnapshot() {
        PerformanceSnapshot snapshot = telemetry.sample(context.clock().instant());
        EventBus bus = context.eventBus();
        try {
            context.store().appendSnapshot(snapshot);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed storing performance snapshot taken at " + snapshot.timestamp(), e);
            bus.publish(new PersistenceFailed(
                    context.clock().instant(),
                    "snapshot",
                    snapshot.timestamp().toString(),
                    e.getMessage()
            ));
        }
        bus.publish(new SnapshotCaptured(context.clock().instant(), snapshot));
        return snapshot;
    }

    public RealtimeMetrics getRealtimeMetrics() {
        PerformanceSnapshot snapshot = captureSnapshot();
        return new RealtimeMetrics(
                snapshot.timestamp(),
                SlaReading.of(Stats.round(snapshot.responseTimeAvgMs(), 2), targets.responseTimeAvgMs(),
                        targets.responseTimeAvgMet(snapshot.responseTimeAvgMs())),
                SlaReading.of(Stats.round(snapshot.responseTimeP95Ms(), 2), targets.responseTimeP95Ms(),
                        targets.responseTimeP95Met(snapshot.responseTimeP95Ms())),
                SlaReading.of(Stats.round(snapshot.throughput(), 2), targets.throughput(),
                        targets.throughputMet(snapshot.throughput())),
                SlaReading.of(Stats.round(snapshot.availabilityPercent(), 3), targets.availabilityPercent(),
                        targets.availabilityMet(snapshot.availabilityPercent())),
                SlaReading.of(Stats.round(snapshot.errorRatePercent(), 3), targets.errorRatePercent(),
                        targets.errorRateMet(snapshot.errorRatePercent())),
                snapshot.activeUsers(),
                snapshot.subMetrics()
        );
    }

    public SlaStatus getSlaStatus() {
        Instant now = context.clock().instant();
        List<PerformanceSnapshot> snapshots = context.store().snapshots(now.minus(SLA_WINDOW), now);
        if (snapshots.isEmpty()) {
            return SlaStatus.noData(SLA_PERIOD);
        }

        double avgResponse = average(snapshots, PerformanceSnapshot::responseTimeAvgMs);
        double avgAvailability = average(snapshots, PerformanceSnapshot::availabilityPercent);
        double avgErrorRate = average(snapshots, PerformanceSnapshot::errorRatePercent);

        Map<String, SlaCheck> checks = new LinkedHashMap<>();
        checks.put("response_time_avg", new SlaCheck(Stats.round(avgResponse, 2), targets.responseTimeAvgMs(),
                targets.responseTimeAvgMet(avgResponse)));
        checks.put(SlaStatus.AVAILABILITY, new SlaCheck(Stats.round(avgAvailability, 3),
                targets.availabilityPercent(), targets.availabilityMet(avgAvailability)));
        checks.put(SlaStatus.ERROR_RATE, new SlaCheck(Stats.round(avgErrorRate, 3), targets.errorRatePercent(),
                targets.errorRateMet(avgErrorRate)));

        List<String> breaches = new ArrayList<>();
        if (!targets.responseTimeAvgMet(avgResponse)) {
            breaches.add(SlaStatus.RESPONSE_TIME);
        }
        if (!targets.availabilityMet(avgAvailability)) {
            breaches.add(SlaStatus.AVAILABILITY);
        }
        if (!targets.errorRateMet(avgErrorRate)) {
            breaches.add(SlaStatus.ERROR_RATE);
        }

        return new SlaStatus(
                breaches.isEmpty() ? SlaStatus.COMPLIANT : SlaStatus.BREACH,
                SLA_PERIOD,
                checks,
                List.copyOf(breaches),
                snapshots.size()
        );
    }

    public List<PerformanceSnapshot> getHistory(int hours) {
        if (hours <= 0) {
            throw new IllegalArgumentException("hours must be positive: " + hours);
        }
        Instant now = context.clock().instant();
        return context.store().snapshots(now.minus(Duration.ofHours(hours)), now);
    }

    private static double average(List<PerformanceSnapshot> snapshots, ToDoubleFunction<PerformanceSnapshot> field) {
        return snapshots.stream().mapToDouble(field).average().orElse(0.0);
    }
}
