package com.pmmsentinel.engine.performance;

import com.pmmsentinel.core.model.PerformanceSnapshot;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded performance history. Appending beyond capacity evicts the oldest snapshot; reads copy
 * under the lock so a reader never observes a half-applied append.
 */
public final class SnapshotLog {
    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final ArrayDeque<PerformanceSnapshot> snapshots = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public SnapshotLog() {
        this(DEFAULT_CAPACITY);
    }

    public SnapshotLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void append(PerformanceSnapshot snapshot) {
        lock.lock();
        try {
            snapshots.addLast(snapshot);
            while (snapshots.size() > capacity) {
                snapshots.removeFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    public List<PerformanceSnapshot> between(Instant from, Instant to) {
        return all().stream()
                .filter(snapshot -> !snapshot.timestamp().isBefore(from) && !snapshot.timestamp().isAfter(to))
                .toList();
    }

    public List<PerformanceSnapshot> all() {
        lock.lock();
        try {
            return List.copyOf(snapshots);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return snapshots.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
