package com.pmmsentinel.engine.dashboard;

import com.pmmsentinel.core.events.DetectionPassCompleted;
import com.pmmsentinel.core.events.PersistenceFailed;
import com.pmmsentinel.core.events.SignalDetected;
import com.pmmsentinel.core.events.SignalStatusChanged;
import com.pmmsentinel.core.model.Alert;
import com.pmmsentinel.core.model.ComplaintPatch;
import com.pmmsentinel.core.model.ComplaintStatus;
import com.pmmsentinel.core.model.ReportType;
import com.pmmsentinel.core.model.Severity;
import com.pmmsentinel.core.model.Signal;
import com.pmmsentinel.core.model.SignalCategory;
import com.pmmsentinel.core.model.SignalPatch;
import com.pmmsentinel.core.model.SignalStatus;
import com.pmmsentinel.core.util.SequenceGenerator;
import com.pmmsentinel.engine.api.EngineContext;
import com.pmmsentinel.engine.api.MonitoringStore;
import com.pmmsentinel.engine.api.SignalFilter;
import com.pmmsentinel.engine.complaint.ComplaintRequest;
import com.pmmsentinel.engine.complaint.ComplaintTracker;
import com.pmmsentinel.engine.detect.SignalDetector;
import com.pmmsentinel.engine.metrics.InMemoryMetricSeries;
import com.pmmsentinel.engine.performance.PerformanceMonitor;
import com.pmmsentinel.engine.report.RegulatoryReporter;
import com.pmmsentinel.engine.support.Engines;
import com.pmmsentinel.engine.support.EventCapture;
import com.pmmsentinel.engine.support.FailingMonitoringStore;
import com.pmmsentinel.engine.support.FixedTelemetrySource;
import com.pmmsentinel.engine.support.MutableClock;
import com.pmmsentinel.engine.trend.TrendDirection;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DashboardCoreTest {
    private final MutableClock clock = new MutableClock(Engines.NOW);
    private final InMemoryMetricSeries series = new InMemoryMetricSeries();

    @Test
    void quietSystemIsHealthy() {
        DashboardCore dashboard = dashboard(Engines.context(series, clock));

        Overview overview = dashboard.getOverview();

        assertEquals(100, overview.healthScore());
        assertEquals(HealthStatus.HEALTHY, overview.healthStatus());
        assertEquals(0, overview.activeSignals());
        assertEquals("compliant", overview.complianceStatus());
        assertNull(overview.lastReportId());
    }

    @Test
    void overviewCombinesSignalsAlertsComplaintsTrendsAndReports() {
        recordSeries("response_accuracy", 0.90, 0.91, 0.92, 0.99, 1.00, 1.01);
        EngineContext context = Engines.context(series, clock);
        MonitoringStore store = context.store();
        store.appendSignal(signal("SIG-1", Severity.CRITICAL));
        store.appendSignal(signal("SIG-2", Severity.HIGH));
        store.updateSignal("SIG-2", signal -> signal.apply(SignalPatch.falsePositive(), Engines.NOW));
        store.appendAlert(alert("ALT-1", Severity.CRITICAL, Engines.NOW.minus(Duration.ofHours(1))));
        store.appendAlert(alert("ALT-2", Severity.CRITICAL, Engines.NOW.minus(Duration.ofHours(30))));
        DashboardCore dashboard = dashboard(context);
        ComplaintTracker complaints = dashboard.complaintTracker();
        complaints.createComplaint(complaint());
        String inProgress = complaints.createComplaint(complaint()).id();
        complaints.updateComplaint(inProgress, new ComplaintPatch(ComplaintStatus.IN_PROGRESS, null, null, null));
        String reportId = dashboard.regulatoryReporter().generateReport(ReportType.PERIODIC, 30).id();

        Overview overview = dashboard.getOverview();

        assertEquals(65, overview.healthScore());
        assertEquals(HealthStatus.DEGRADED, overview.healthStatus());
        assertEquals(1, overview.activeSignals());
        assertEquals(1, overview.activeAlerts());
        assertEquals(1, overview.openComplaints());
        assertEquals(1, overview.metricsTracked());
        assertEquals(TrendDirection.INCREASING, overview.trendsSummary().get("response_accuracy").direction());
        assertEquals(1.01, overview.trendsSummary().get("response_accuracy").current());
        assertEquals(reportId, overview.lastReportId());
    }

    @Test
    void detectionScansEligibleMetricsAndCommitsSignals() {
        recordSeries("user_satisfaction", 5.0, 4.0, 3.0, 2.0, 1.0);
        recordSeries("sparse", 5.0, 4.0, 3.0, 2.0);
        EngineContext context = Engines.context(series, clock);
        EventCapture events = new EventCapture(context.eventBus());

        List<SignalSummary> detected = dashboard(context).runSignalDetection();

        assertEquals(1, detected.size());
        SignalSummary summary = detected.get(0);
        assertEquals(SignalCategory.PATTERN_DETECTED, summary.category());
        assertEquals(Severity.MEDIUM, summary.severity());
        assertEquals("user_satisfaction", summary.metric());
        assertEquals(summary.id(), context.store().signals(SignalFilter.active()).get(0).id());
        assertEquals(1, events.byType(SignalDetected.class).size());

        DetectionPassCompleted pass = events.byType(DetectionPassCompleted.class).get(0);
        assertEquals(1, pass.metricsScanned());
        assertEquals(1, pass.signalsDetected());
        assertEquals(0, pass.persistenceFailures());
    }

    @Test
    void detectionWindowIsCappedAtFiftyMostRecentValues() {
        for (int i = 0; i < 80; i++) {
            series.record("latency", Engines.NOW.minusSeconds(80 - i), i);
        }
        List<List<Double>> windows = new CopyOnWriteArrayList<>();
        SignalDetector recording = new SignalDetector(clock) {
            @Override
            public List<Signal> detectSignals(String metricName, List<Double> values) {
                windows.add(List.copyOf(values));
                return super.detectSignals(metricName, values);
            }
        };
        EngineContext context = Engines.context(series, clock);

        dashboard(context, recording, Runnable::run).runSignalDetection();

        assertEquals(1, windows.size());
        assertEquals(50, windows.get(0).size());
        assertEquals(30.0, windows.get(0).get(0));
        assertEquals(79.0, windows.get(0).get(49));
    }

    @Test
    void storeFailureStillReturnsDetectedSignals() {
        recordSeries("user_satisfaction", 5.0, 4.0, 3.0, 2.0, 1.0);
        EngineContext context = Engines.context(series, new FailingMonitoringStore(), clock);
        EventCapture events = new EventCapture(context.eventBus());

        List<SignalSummary> detected = dashboard(context).runSignalDetection();

        assertEquals(1, detected.size());
        assertEquals(1, events.byType(PersistenceFailed.class).size());
        assertEquals(1, events.byType(SignalDetected.class).size());
        assertEquals(1, events.byType(DetectionPassCompleted.class).get(0).persistenceFailures());
    }

    @Test
    void parallelPassesOverManyMetricsNeverShareIds() {
        for (int m = 0; m < 20; m++) {
            recordSeries("metric_" + m, 5.0, 4.0, 3.0, 2.0, 1.0);
        }
        EngineContext context = Engines.context(series, clock);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            DashboardCore dashboard = dashboard(context, new SignalDetector(clock, new SequenceGenerator()), pool);

            List<SignalSummary> first = dashboard.runSignalDetection();
            List<SignalSummary> second = dashboard.runSignalDetection();

            Set<String> ids = new HashSet<>();
            first.forEach(summary -> ids.add(summary.id()));
            second.forEach(summary -> ids.add(summary.id()));
            assertEquals(20, first.size());
            assertEquals(40, ids.size());
            assertEquals(40, context.store().signals(SignalFilter.all()).size());
            assertEquals("metric_0", first.get(0).metric());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void kpisAverageConfiguredMetricsOverTheLastDay() {
        series.record("response_accuracy", Engines.NOW.minus(Duration.ofHours(2)), 0.9);
        series.record("response_accuracy", Engines.NOW.minus(Duration.ofHours(1)), 0.8);
        series.record("response_accuracy", Engines.NOW.minus(Duration.ofDays(3)), 0.1);
        series.record("hallucination_rate", Engines.NOW.minus(Duration.ofDays(3)), 0.2);
        series.record("user_satisfaction", Engines.NOW.minus(Duration.ofHours(1)), 4.5);
        series.record("hallucination_rate", Engines.NOW.minus(Duration.ofHours(1)), 0.05);
        EngineContext context = Engines.context(series, clock);
        context.store().appendAlert(alert("ALT-1", Severity.HIGH, Engines.NOW.minus(Duration.ofHours(3))));
        context.store().appendAlert(alert("ALT-2", Severity.HIGH, Engines.NOW.minus(Duration.ofDays(3))));
        context.store().appendSignal(signal("SIG-1", Severity.MEDIUM));
        DashboardCore dashboard = dashboard(context);
        dashboard.complaintTracker().createComplaint(complaint());

        Kpis kpis = dashboard.getKpis();

        assertEquals(Map.of("response_accuracy", 0.85, "hallucination_rate", 0.05, "user_satisfaction", 4.5),
                kpis.metrics());
        assertEquals(List.of("response_accuracy", "hallucination_rate", "user_satisfaction"),
                List.copyOf(kpis.metrics().keySet()));
        assertEquals(new Kpis.AlertCounts(1, 1), kpis.alerts());
        assertEquals(new Kpis.SignalCounts(1, 1), kpis.signals());
        assertEquals(new Kpis.ComplaintCounts(1, 1), kpis.complaints());
    }

    @Test
    void signalHistoryFiltersByStatusAndHours() {
        EngineContext context = Engines.context(series, clock);
        context.store().appendSignal(signal("SIG-1", Severity.HIGH));
        clock.advance(Duration.ofHours(5));
        context.store().appendSignal(Signal.detected("SIG-2", clock.instant(), SignalCategory.ANOMALY,
                Severity.LOW, "m", 1, 1, 0, 0.9, "d"));
        DashboardCore dashboard = dashboard(context);
        dashboard.markFalsePositive("SIG-2");

        assertEquals(2, dashboard.getSignalHistory(null, 24).size());
        assertEquals(1, dashboard.getSignalHistory(null, 2).size());
        assertEquals("SIG-1", dashboard.getSignalHistory("active", 24).get(0).id());
        assertThrows(IllegalArgumentException.class, () -> dashboard.getSignalHistory("open", 24));
        assertThrows(IllegalArgumentException.class, () -> dashboard.getSignalHistory(null, 0));
    }

    @Test
    void reviewTransitionsPublishStatusChanges() {
        EngineContext context = Engines.context(series, clock);
        context.store().appendSignal(signal("SIG-1", Severity.HIGH));
        EventCapture events = new EventCapture(context.eventBus());
        DashboardCore dashboard = dashboard(context);

        Signal acknowledged = dashboard.acknowledgeSignal("SIG-1", "analyst");
        Signal resolved = dashboard.resolveSignal("SIG-1");

        assertEquals(SignalStatus.ACKNOWLEDGED, acknowledged.status());
        assertEquals(SignalStatus.RESOLVED, resolved.status());
        List<SignalStatusChanged> changes = events.byType(SignalStatusChanged.class);
        assertEquals(2, changes.size());
        assertEquals(SignalStatus.ACTIVE, changes.get(0).previousStatus());
        assertEquals("analyst", changes.get(0).actor());
        assertEquals(SignalStatus.ACKNOWLEDGED, changes.get(1).previousStatus());

        assertThrows(IllegalStateException.class, () -> dashboard.markFalsePositive("SIG-1"));
        assertThrows(IllegalArgumentException.class, () -> dashboard.resolveSignal("SIG-404"));
        assertThrows(IllegalArgumentException.class,
                () -> dashboard.updateSignal("SIG-1", SignalPatch.fromFields(Map.of("status", "closed"))));
        assertEquals(2, events.byType(SignalStatusChanged.class).size());
    }

    private DashboardCore dashboard(EngineContext context) {
        return new DashboardCore(context, FixedTelemetrySource.healthy(), Runnable::run);
    }

    private DashboardCore dashboard(EngineContext context, SignalDetector detector, Executor executor) {
        return new DashboardCore(
                context,
                executor,
                DashboardSettings.DEFAULT,
                detector,
                new PerformanceMonitor(context, FixedTelemetrySource.healthy()),
                new RegulatoryReporter(context),
                new ComplaintTracker(context)
        );
    }

    private void recordSeries(String metricName, double... values) {
        for (int i = 0; i < values.length; i++) {
            series.record(metricName, Engines.NOW.minusSeconds((values.length - i) * 60L), values[i]);
        }
    }

    private static Signal signal(String id, Severity severity) {
        return Signal.detected(id, Engines.NOW, SignalCategory.ANOMALY, severity, "response_accuracy",
                0.2, 0.9, -77.7, 0.9, "Anomaly detected");
    }

    private static Alert alert(String id, Severity severity, Instant at) {
        return new Alert(id, at, "threshold", severity, "response_accuracy", 0.5, 0.8, Map.of());
    }

    private static ComplaintRequest complaint() {
        return new ComplaintRequest("user-1", "accuracy", "Wrong answer", "Details", null, null, List.of());
    }
}
