package com.pmmsentinel.engine.dashboard;

import com.pmmsentinel.core.events.DetectionPassCompleted;
import com.pmmsentinel.core.events.PersistenceFailed;
import com.pmmsentinel.core.events.SignalDetected;
import com.pmmsentinel.core.events.SignalStatusChanged;
import com.pmmsentinel.core.model.Alert;
import com.pmmsentinel.core.model.ComplaintStatus;
import com.pmmsentinel.core.model.MetricPoint;
import com.pmmsentinel.core.model.RegulatoryReport;
import com.pmmsentinel.core.model.Signal;
import com.pmmsentinel.core.model.SignalPatch;
import com.pmmsentinel.core.model.SignalStatus;
import com.pmmsentinel.core.util.Stats;
import com.pmmsentinel.engine.api.ComplaintFilter;
import com.pmmsentinel.engine.api.EngineContext;
import com.pmmsentinel.engine.api.MonitoringStore;
import com.pmmsentinel.engine.api.SignalFilter;
import com.pmmsentinel.engine.api.TelemetrySource;
import com.pmmsentinel.engine.complaint.ComplaintTracker;
import com.pmmsentinel.engine.detect.SignalDetector;
import com.pmmsentinel.engine.performance.PerformanceMonitor;
import com.pmmsentinel.engine.report.RegulatoryReporter;
import com.pmmsentinel.engine.trend.TrendAnalyzer;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point that wires the detector, analyzers and trackers to one {@link EngineContext} and
 * serves the aggregated views built from them.
 *
 * <p>Detection passes fan out one task per metric on the injected executor. Two passes never
 * scan the same metric at the same time.
 */
public class DashboardCore {
    private static final Logger LOGGER = Logger.getLogger(DashboardCore.class.getName());
    private static final Duration DAY = Duration.ofHours(24);
    private static final Duration WEEK = Duration.ofDays(7);
    private static final int TREND_HOURS = 24;

    private final EngineContext context;
    private final Executor executor;
    private final DashboardSettings settings;
    private final SignalDetector signalDetector;
    private final TrendAnalyzer trendAnalyzer;
    private final PerformanceMonitor performanceMonitor;
    private final RegulatoryReporter regulatoryReporter;
    private final ComplaintTracker complaintTracker;
    private final Map<String, ReentrantLock> metricLocks = new ConcurrentHashMap<>();

    public DashboardCore(EngineContext context, TelemetrySource telemetry, Executor executor) {
        this(context, telemetry, executor, DashboardSettings.DEFAULT);
    }

    public DashboardCore(
            EngineContext context,
            TelemetrySource telemetry,
            Executor executor,
            DashboardSettings settings
    ) {
        this(
                context,
                executor,
                settings,
                new SignalDetector(context.clock()),
                new PerformanceMonitor(context, telemetry),
                new RegulatoryReporter(context),
                new ComplaintTracker(context)
        );
    }

    public DashboardCore(
            EngineContext context,
            Executor executor,
            DashboardSettings settings,
            SignalDetector signalDetector,
            PerformanceMonitor performanceMonitor,
            RegulatoryReporter regulatoryReporter,
            ComplaintTracker complaintTracker
    ) {
        this.context = Objects.requireNonNull(context, "context is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.settings = Objects.requireNonNull(settings, "settings are required");
        this.signalDetector = Objects.requireNonNull(signalDetector, "signalDetector is required");
        this.trendAnalyzer = new TrendAnalyzer(context.metricSource(), context.clock());
        this.performanceMonitor = Objects.requireNonNull(performanceMonitor, "performanceMonitor is required");
        this.regulatoryReporter = Objects.requireNonNull(regulatoryReporter, "regulatoryReporter is required");
        this.complaintTracker = Objects.requireNonNull(complaintTracker, "complaintTracker is required");
    }

    public SignalDetector signalDetector() {
        return signalDetector;
    }

    public TrendAnalyzer trendAnalyzer() {
        return trendAnalyzer;
    }

    public PerformanceMonitor performanceMonitor() {
        return performanceMonitor;
    }

    public RegulatoryReporter regulatoryReporter() {
        return regulatoryReporter;
    }

    public ComplaintTracker complaintTracker() {
        return complaintTracker;
    }

    public Overview getOverview() {
        Instant now = context.clock().instant();
        MonitoringStore store = context.store();
        List<Signal> activeSignals = store.signals(SignalFilter.active());
        List<Alert> activeAlerts = activeAlerts(now);
        int openComplaints = store.complaints(ComplaintFilter.withStatus(ComplaintStatus.OPEN)).size();

        Map<String, TrendSummary> trendsSummary = new TreeMap<>();
        trendAnalyzer.getAllTrends(TREND_HOURS).forEach((metricName, analysis) ->
                trendsSummary.put(metricName, new TrendSummary(analysis.direction(), analysis.currentValue())));

        int score = HealthScore.calculate(activeSignals, activeAlerts);
        return new Overview(
                now,
                score,
                HealthStatus.forScore(score),
                activeSignals.size(),
                activeAlerts.size(),
                openComplaints,
                context.metricSource().metricNames().size(),
                trendsSummary,
                "compliant",
                store.latestReport().map(RegulatoryReport::id).orElse(null)
        );
    }

    public List<SignalSummary> runSignalDetection() {
        Instant started = context.clock().instant();
        List<String> eligible = new ArrayList<>();
        for (String metricName : new TreeSet<>(context.metricSource().metricNames())) {
            if (context.metricSource().size(metricName) >= settings.minSamples()) {
                eligible.add(metricName);
            }
        }

        List<CompletableFuture<MetricPass>> passes = new ArrayList<>(eligible.size());
        for (String metricName : eligible) {
            passes.add(CompletableFuture
                    .supplyAsync(() -> scanMetric(metricName), executor)
                    .exceptionally(ex -> {
                        LOGGER.log(Level.WARNING, "Signal detection failed for metric " + metricName, ex);
                        return MetricPass.EMPTY;
                    }));
        }

        List<SignalSummary> summaries = new ArrayList<>();
        int persistenceFailures = 0;
        for (CompletableFuture<MetricPass> pass : passes) {
            MetricPass result = pass.join();
            result.signals().forEach(signal -> summaries.add(SignalSummary.of(signal)));
            persistenceFailures += result.persistenceFailures();
        }

        Instant finished = context.clock().instant();
        long durationMillis = Duration.between(started, finished).toMillis();
        context.eventBus().publish(new DetectionPassCompleted(
                finished, eligible.size(), summaries.size(), persistenceFailures, durationMillis));
        int failures = persistenceFailures;
        LOGGER.info(() -> "Detection pass scanned " + eligible.size() + " metrics, detected "
                + summaries.size() + " signals, " + failures + " persistence failures");
        return List.copyOf(summaries);
    }

    public Kpis getKpis() {
        Instant now = context.clock().instant();
        Instant dayAgo = now.minus(DAY);
        Instant weekAgo = now.minus(WEEK);
        MonitoringStore store = context.store();
        List<Alert> activeAlerts = activeAlerts(now);

        Map<String, Double> metrics = new LinkedHashMap<>();
        for (String metricName : settings.kpiMetrics()) {
            List<Double> values = context.metricSource().points(metricName, dayAgo, now).stream()
                    .map(MetricPoint::value)
                    .toList();
            if (!values.isEmpty()) {
                metrics.put(metricName, Stats.round(Stats.mean(values), 4));
            }
        }

        return new Kpis(
                now,
                metrics,
                new Kpis.AlertCounts(activeAlerts.size(), store.alerts(dayAgo, now).size()),
                new Kpis.SignalCounts(
                        store.signals(SignalFilter.active()).size(),
                        store.signals(SignalFilter.since(weekAgo)).size()
                ),
                new Kpis.ComplaintCounts(
                        store.complaints(ComplaintFilter.withStatus(ComplaintStatus.OPEN)).size(),
                        store.complaints(ComplaintFilter.since(weekAgo)).size()
                )
        );
    }

    /**
     * Signals detected in the last {@code hours} hours, optionally limited to one wire-name status.
     */
    public List<Signal> getSignalHistory(String status, int hours) {
        if (hours <= 0) {
            throw new IllegalArgumentException("hours must be positive: " + hours);
        }
        SignalStatus statusFilter = status == null ? null : SignalStatus.fromWire(status);
        Instant now = context.clock().instant();
        return context.store().signals(new SignalFilter(statusFilter, now.minus(Duration.ofHours(hours)), now));
    }

    public Signal acknowledgeSignal(String signalId, String actor) {
        return updateSignal(signalId, SignalPatch.acknowledge(actor));
    }

    public Signal resolveSignal(String signalId) {
        return updateSignal(signalId, SignalPatch.resolve());
    }

    public Signal markFalsePositive(String signalId) {
        return updateSignal(signalId, SignalPatch.falsePositive());
    }

    public Signal updateSignal(String signalId, SignalPatch patch) {
        Objects.requireNonNull(patch, "patch is required");
        Instant now = context.clock().instant();
        SignalStatus previous = context.store().findSignal(signalId)
                .map(Signal::status)
                .orElseThrow(() -> new IllegalArgumentException("Unknown signal id: " + signalId));
        Signal updated = context.store().updateSignal(signalId, signal -> signal.apply(patch, now))
                .orElseThrow(() -> new IllegalArgumentException("Unknown signal id: " + signalId));
        context.eventBus().publish(new SignalStatusChanged(
                now, updated.id(), updated.metricName(), previous, updated.status(), patch.acknowledgedBy()));
        return updated;
    }

    private List<Alert> activeAlerts(Instant now) {
        return context.store().alerts(now.minus(DAY), now);
    }

    private MetricPass scanMetric(String metricName) {
        ReentrantLock lock = metricLocks.computeIfAbsent(metricName, ignored -> new ReentrantLock());
        lock.lock();
        try {
            List<Double> window = context.metricSource().latest(metricName, settings.detectionWindow()).stream()
                    .map(MetricPoint::value)
                    .toList();
            List<Signal> signals = signalDetector.detectSignals(metricName, window);
            int failures = 0;
            for (Signal signal : signals) {
                if (!commit(signal)) {
                    failures++;
                }
            }
            return new MetricPass(signals, failures);
        } finally {
            lock.unlock();
        }
    }

    private boolean commit(Signal signal) {
        boolean stored = true;
        try {
            context.store().appendSignal(signal);
        } catch (RuntimeException e) {
            stored = false;
            LOGGER.log(Level.WARNING, "Failed storing signal " + signal.id(), e);
            context.eventBus().publish(new PersistenceFailed(
                    context.clock().instant(), "signal", signal.id(), e.getMessage()));
        }
        context.eventBus().publish(new SignalDetected(signal.timestamp(), signal));
        return stored;
    }

    private record MetricPass(List<Signal> signals, int persistenceFailures) {
        static final MetricPass EMPTY = new MetricPass(List.of(), 0);
    }
}
