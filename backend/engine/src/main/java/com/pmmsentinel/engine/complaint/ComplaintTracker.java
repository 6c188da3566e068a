package com.pmmsentinel.engine.complaint;

import com.pmmsentinel.core.events.PersistenceFailed;
import com.pmmsentinel.core.model.Complaint;
import com.pmmsentinel.core.model.ComplaintPatch;
import com.pmmsentinel.core.model.ComplaintPriority;
import com.pmmsentinel.core.model.ComplaintStatus;
import com.pmmsentinel.core.util.SequenceGenerator;
import com.pmmsentinel.core.util.Stats;
import com.pmmsentinel.engine.api.ComplaintFilter;
import com.pmmsentinel.engine.api.EngineContext;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ComplaintTracker {
    private static final Logger LOGGER = Logger.getLogger(ComplaintTracker.class.getName());
    private static final double SECONDS_PER_HOUR = 3600.0;

    private final EngineContext context;
    private final SequenceGenerator sequence;

    public ComplaintTracker(EngineContext context) {
        this(context, new SequenceGenerator());
    }

    public ComplaintTracker(EngineContext context, SequenceGenerator sequence) {
        this.context = Objects.requireNonNull(context, "context is required");
        this.sequence = Objects.requireNonNull(sequence, "sequence is required");
    }

    public Complaint createComplaint(ComplaintRequest request) {
        Objects.requireNonNull(request, "request is required");
        Instant now = context.clock().instant();
        Complaint complaint = new Complaint(
                sequence.nextId("CMP", SequenceGenerator.DAY_STAMP, now),
                now,
                request.userId(),
                request.category(),
                request.subject(),
                request.description(),
                request.priority(),
                ComplaintStatus.OPEN,
                null,
                request.relatedInteractionId(),
                null,
                null,
                request.tags(),
                List.of()
        );
        try {
            context.store().appendComplaint(complaint);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed storing complaint " + complaint.id(), e);
            context.eventBus().publish(new PersistenceFailed(now, "complaint", complaint.id(), e.getMessage()));
        }
        return complaint;
    }

    public Complaint updateComplaint(String complaintId, ComplaintPatch patch) {
        Objects.requireNonNull(patch, "patch is required");
        Instant now = context.clock().instant();
        return context.store().updateComplaint(complaintId, complaint -> complaint.apply(patch, now))
                .orElseThrow(() -> new IllegalArgumentException("Unknown complaint id: " + complaintId));
    }

    public Complaint getComplaint(String complaintId) {
        return context.store().findComplaint(complaintId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown complaint id: " + complaintId));
    }

    /**
     * Complaints created in the last {@code days} days, optionally narrowed by wire-name status and
     * priority.
     */
    public List<Complaint> listComplaints(String status, String priority, int days) {
        Instant since = windowStart(days);
        return context.store().complaints(new ComplaintFilter(
                status == null ? null : ComplaintStatus.fromWire(status),
                priority == null ? null : ComplaintPriority.fromWire(priority),
                since
        ));
    }

    public ComplaintAnalytics getAnalytics(int days) {
        List<Complaint> complaints = context.store().complaints(ComplaintFilter.since(windowStart(days)));
        if (complaints.isEmpty()) {
            return new ComplaintAnalytics(0, days, Map.of(), Map.of(), Map.of(), ResolutionStats.none(), 0);
        }

        Map<String, Integer> byStatus = new TreeMap<>();
        Map<String, Integer> byPriority = new TreeMap<>();
        Map<String, Integer> byCategory = new TreeMap<>();
        List<Double> resolutionHours = new ArrayList<>();
        int open = 0;
        for (Complaint complaint : complaints) {
            byStatus.merge(complaint.status().wire(), 1, Integer::sum);
            byPriority.merge(complaint.priority().wire(), 1, Integer::sum);
            byCategory.merge(complaint.category(), 1, Integer::sum);
            if (complaint.status().isOpen()) {
                open++;
            }
            if (complaint.resolvedAt() != null) {
                long seconds = Duration.between(complaint.createdAt(), complaint.resolvedAt()).getSeconds();
                resolutionHours.add(seconds / SECONDS_PER_HOUR);
            }
        }

        ResolutionStats resolution = resolutionHours.isEmpty()
                ? ResolutionStats.none()
                : new ResolutionStats(
                        resolutionHours.size(),
                        Stats.mean(resolutionHours),
                        Stats.min(resolutionHours),
                        Stats.max(resolutionHours)
                );
        return new ComplaintAnalytics(complaints.size(), days, byStatus, byPriority, byCategory, resolution, open);
    }

    private Instant windowStart(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive: " + days);
        }
        return context.clock().instant().minus(Duration.ofDays(days));
    }
}
