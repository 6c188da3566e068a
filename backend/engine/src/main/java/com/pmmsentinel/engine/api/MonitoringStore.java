package com.pmmsentinel.engine.api;

import com.pmmsentinel.core.model.Alert;
import com.pmmsentinel.core.model.Complaint;
import com.pmmsentinel.core.model.PerformanceSnapshot;
import com.pmmsentinel.core.model.RegulatoryReport;
import com.pmmsentinel.core.model.ReportStatus;
import com.pmmsentinel.core.model.ReportType;
import com.pmmsentinel.core.model.Signal;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Append and filtered read-back for every record the engine produces or consumes.
 *
 * <p>Reads return point-in-time copies in insertion order. {@code update*} methods apply the
 * change atomically and return the stored result, or empty when the id is unknown. Appending a
 * signal, report or complaint whose id is already stored throws {@link IllegalArgumentException}
 * and leaves the stored record untouched. Any write may throw {@link IllegalStateException} when
 * the backing storage is unavailable; the in-memory view has been updated by then.
 */
public interface MonitoringStore {
    void appendSignal(Signal signal);

    List<Signal> signals(SignalFilter filter);

    Optional<Signal> findSignal(String signalId);

    Optional<Signal> updateSignal(String signalId, UnaryOperator<Signal> update);

    void appendAlert(Alert alert);

    List<Alert> alerts(Instant from, Instant to);

    void appendSnapshot(PerformanceSnapshot snapshot);

    List<PerformanceSnapshot> snapshots(Instant from, Instant to);

    void appendReport(RegulatoryReport report);

    List<RegulatoryReport> reports(Optional<ReportType> type, Optional<ReportStatus> status);

    Optional<RegulatoryReport> findReport(String reportId);

    Optional<RegulatoryReport> updateReport(String reportId, UnaryOperator<RegulatoryReport> update);

    Optional<RegulatoryReport> latestReport();

    void appendComplaint(Complaint complaint);

    List<Complaint> complaints(ComplaintFilter filter);

    Optional<Complaint> findComplaint(String complaintId);

    Optional<Complaint> updateComplaint(String complaintId, UnaryOperator<Complaint> update);
}
