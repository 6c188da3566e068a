package com.pmmsentinel.core.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequenceGeneratorTest {
    private static final Instant AT = Instant.parse("2026-02-12T20:00:05Z");

    @Test
    void formatsPrefixStampAndPaddedCounter() {
        SequenceGenerator sequence = new SequenceGenerator();

        assertEquals("SIG-20260212200005-0001", sequence.nextId("SIG", SequenceGenerator.SECOND_STAMP, AT));
        assertEquals("REG-20260212-0002", sequence.nextId("REG", SequenceGenerator.DAY_STAMP, AT));
        assertEquals(2, sequence.lastIssued());
    }

    @Test
    void resumesAfterGivenCounter() {
        SequenceGenerator sequence = new SequenceGenerator(41);

        assertEquals("CMP-20260212-0042", sequence.nextId("CMP", SequenceGenerator.DAY_STAMP, AT));
    }

    @Test
    void continuesAfterHighestIssuedSuffix() {
        SequenceGenerator sequence = SequenceGenerator.continuing(
                List.of("REG-20260211-0007", "REG-20260212-0012", "REG-20260212-0003", "legacy-id"));

        assertEquals(12, sequence.lastIssued());
        assertEquals("REG-20260212-0013", sequence.nextId("REG", SequenceGenerator.DAY_STAMP, AT));
        assertEquals(0, SequenceGenerator.continuing(List.of()).lastIssued());
    }

    @Test
    void concurrentCallersNeverShareAnId() throws Exception {
        SequenceGenerator sequence = new SequenceGenerator();
        Set<String> ids = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 800; i++) {
            pool.submit(() -> ids.add(sequence.nextId("SIG", SequenceGenerator.SECOND_STAMP, AT)));
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(800, ids.size());
        assertEquals(800, sequence.lastIssued());
    }
}
