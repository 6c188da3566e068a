package com.pmmsentinel.core.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic counter behind record identifiers such as {@code SIG-20260212200000-0007}.
 * Safe to share between threads; two ids from one generator never collide, even within the
 * same second.
 */
public final class SequenceGenerator {
    public static final DateTimeFormatter SECOND_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss", Locale.ROOT).withZone(ZoneOffset.UTC);
    public static final DateTimeFormatter DAY_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd", Locale.ROOT).withZone(ZoneOffset.UTC);

    private final AtomicLong counter;

    public SequenceGenerator() {
        this(0);
    }

    public SequenceGenerator(long lastIssued) {
        this.counter = new AtomicLong(lastIssued);
    }

    /**
     * Continues after the highest counter found at the end of {@code issuedIds}; ids without a
     * numeric suffix are ignored.
     */
    public static SequenceGenerator continuing(Collection<String> issuedIds) {
        long lastIssued = 0;
        for (String id : issuedIds) {
            String suffix = id.substring(id.lastIndexOf('-') + 1);
            if (!suffix.isEmpty() && suffix.length() < 19 && suffix.chars().allMatch(Character::isDigit)) {
                lastIssued = Math.max(lastIssued, Long.parseLong(suffix));
            }
        }
        return new SequenceGenerator(lastIssued);
    }

    public long next() {
        return counter.incrementAndGet();
    }

    public long lastIssued() {
        return counter.get();
    }

    public String nextId(String prefix, DateTimeFormatter stamp, Instant at) {
        return prefix + "-" + stamp.format(at) + "-" + String.format(Locale.ROOT, "%04d", next());
    }
}
