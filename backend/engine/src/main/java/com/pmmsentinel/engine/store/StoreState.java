package com.pmmsentinel.engine.store;

import com.pmmsentinel.core.model.Alert;
import com.pmmsentinel.core.model.Complaint;
import com.pmmsentinel.core.model.PerformanceSnapshot;
import com.pmmsentinel.core.model.RegulatoryReport;
import com.pmmsentinel.core.model.Signal;

import java.util.List;

public record StoreState(
        List<Signal> signals,
        List<Alert> alerts,
        List<PerformanceSnapshot> snapshots,
        List<RegulatoryReport> reports,
        List<Complaint> complaints
) {
    public StoreState {
        signals = signals == null ? List.of() : List.copyOf(signals);
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
        snapshots = snapshots == null ? List.of() : List.copyOf(snapshots);
        reports = reports == null ? List.of() : List.copyOf(reports);
        complaints = complaints == null ? List.of() : List.copyOf(complaints);
    }

    public static StoreState empty() {
        return new StoreState(List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
