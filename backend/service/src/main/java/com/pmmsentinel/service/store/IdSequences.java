package com.pmmsentinel.service.store;

import com.pmmsentinel.core.model.Complaint;
import com.pmmsentinel.core.model.RegulatoryReport;
import com.pmmsentinel.core.model.Signal;
import com.pmmsentinel.core.util.SequenceGenerator;
import com.pmmsentinel.engine.store.StoreState;

/**
 * Identifier counters that continue after the records already held in a restored store.
 */
public record IdSequences(SequenceGenerator signals, SequenceGenerator reports, SequenceGenerator complaints) {
    public static IdSequences resumeFrom(StoreState state) {
        return new IdSequences(
                SequenceGenerator.continuing(state.signals().stream().map(Signal::id).toList()),
                SequenceGenerator.continuing(state.reports().stream().map(RegulatoryReport::id).toList()),
                SequenceGenerator.continuing(state.complaints().stream().map(Complaint::id).toList())
        );
    }
}
