package com.pmmsentinel.engine.store;

import com.pmmsentinel.core.model.Alert;
import com.pmmsentinel.core.model.Complaint;
import com.pmmsentinel.core.model.PerformanceSnapshot;
import com.pmmsentinel.core.model.RegulatoryReport;
import com.pmmsentinel.core.model.ReportStatus;
import com.pmmsentinel.core.model.ReportType;
import com.pmmsentinel.core.model.Signal;
import com.pmmsentinel.engine.api.ComplaintFilter;
import com.pmmsentinel.engine.api.MonitoringStore;
import com.pmmsentinel.engine.api.SignalFilter;
import com.pmmsentinel.engine.performance.SnapshotLog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Reference {@link MonitoringStore} holding everything in memory. Subclasses add durability by
 * overriding {@link #afterWrite(String)}, which runs under the store lock after every mutation.
 */
public class InMemoryMonitoringStore implements MonitoringStore {
    protected final ReentrantLock lock = new ReentrantLock();

    private final Map<String, Signal> signals = new LinkedHashMap<>();
    private final List<Alert> alerts = new ArrayList<>();
    private final SnapshotLog snapshots;
    private final Map<String, RegulatoryReport> reports = new LinkedHashMap<>();
    private final Map<String, Complaint> complaints = new LinkedHashMap<>();

    public InMemoryMonitoringStore() {
        this(new SnapshotLog());
    }

    public InMemoryMonitoringStore(SnapshotLog snapshots) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots is required");
    }

    @Override
    public void appendSignal(Signal signal) {
        write("signals", () -> putNew("signal", signals, signal.id(), signal));
    }

    @Override
    public List<Signal> signals(SignalFilter filter) {
        return read(() -> signals.values().stream().filter(filter::matches).toList());
    }

    @Override
    public Optional<Signal> findSignal(String signalId) {
        return read(() -> Optional.ofNullable(signals.get(signalId)));
    }

    @Override
    public Optional<Signal> updateSignal(String signalId, UnaryOperator<Signal> update) {
        return replace("signals", signals, signalId, update);
    }

    @Override
    public void appendAlert(Alert alert) {
        write("alerts", () -> alerts.add(alert));
    }

    @Override
    public List<Alert> alerts(Instant from, Instant to) {
        return read(() -> alerts.stream()
                .filter(alert -> !alert.timestamp().isBefore(from) && !alert.timestamp().isAfter(to))
                .toList());
    }

    @Override
    public void appendSnapshot(PerformanceSnapshot snapshot) {
        write("snapshots", () -> snapshots.append(snapshot));
    }

    @Override
    public List<PerformanceSnapshot> snapshots(Instant from, Instant to) {
        return snapshots.between(from, to);
    }

    @Override
    public void appendReport(RegulatoryReport report) {
        write("reports", () -> putNew("report", reports, report.id(), report));
    }

    @Override
    public List<RegulatoryReport> reports(Optional<ReportType> type, Optional<ReportStatus> status) {
        return read(() -> reports.values().stream()
                .filter(report -> type.isEmpty() || report.type() == type.get())
                .filter(report -> status.isEmpty() || report.status() == status.get())
                .toList());
    }

    @Override
    public Optional<RegulatoryReport> findReport(String reportId) {
        return read(() -> Optional.ofNullable(reports.get(reportId)));
    }

    @Override
    public Optional<RegulatoryReport> updateReport(String reportId, UnaryOperator<RegulatoryReport> update) {
        return replace("reports", reports, reportId, update);
    }

    @Override
    public Optional<RegulatoryReport> latestReport() {
        return read(() -> reports.values().stream().reduce((first, second) -> second));
    }

    @Override
    public void appendComplaint(Complaint complaint) {
        write("complaints", () -> putNew("complaint", complaints, complaint.id(), complaint));
    }

    @Override
    public List<Complaint> complaints(ComplaintFilter filter) {
        return read(() -> complaints.values().stream().filter(filter::matches).toList());
    }

    @Override
    public Optional<Complaint> findComplaint(String complaintId) {
        return read(() -> Optional.ofNullable(complaints.get(complaintId)));
    }

    @Override
    public Optional<Complaint> updateComplaint(String complaintId, UnaryOperator<Complaint> update) {
        return replace("complaints", complaints, complaintId, update);
    }

    public StoreState exportState() {
        return read(() -> new StoreState(
                List.copyOf(signals.values()),
                List.copyOf(alerts),
                snapshots.all(),
                List.copyOf(reports.values()),
                List.copyOf(complaints.values())
        ));
    }

    protected void importState(StoreState state) {
        lock.lock();
        try {
            state.signals().forEach(signal -> signals.put(signal.id(), signal));
            alerts.addAll(state.alerts());
            state.snapshots().forEach(snapshots::append);
            state.reports().forEach(report -> reports.put(report.id(), report));
            state.complaints().forEach(complaint -> complaints.put(complaint.id(), complaint));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hook invoked while holding {@link #lock} after {@code recordKind} changed.
     */
    protected void afterWrite(String recordKind) {
    }

    private void write(String recordKind, Runnable mutation) {
        lock.lock();
        try {
            mutation.run();
            afterWrite(recordKind);
        } finally {
            lock.unlock();
        }
    }

    private static <T> void putNew(String recordKind, Map<String, T> records, String id, T record) {
        if (records.putIfAbsent(id, record) != null) {
            throw new IllegalArgumentException("Duplicate " + recordKind + " id: " + id);
        }
    }

    private <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    private <T> Optional<T> replace(String recordKind, Map<String, T> records, String id, UnaryOperator<T> update) {
        lock.lock();
        try {
            T current = records.get(id);
            if (current == null) {
                return Optional.empty();
            }
            T updated = Objects.requireNonNull(update.apply(current), "update must not return null");
            records.put(id, updated);
            afterWrite(recordKind);
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }
}
