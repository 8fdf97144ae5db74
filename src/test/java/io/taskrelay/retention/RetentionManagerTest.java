package io.taskrelay.retention;

import io.taskrelay.core.model.EventType;
import io.taskrelay.ledger.log.SegmentedEventLog;
import io.taskrelay.ledger.segment.LedgerSegment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

final class RetentionManagerTest {

    private static final byte[] PAYLOAD = new byte[32];

    // Two events per segment.
    private static final int CAPACITY = LedgerSegment.HEADER_SIZE + 2 * (LedgerSegment.RECORD_OVERHEAD + 9 + PAYLOAD.length);

    @TempDir
    Path dir;

    @Test
    void sweepTrimsEachPartitionToItsBudget() throws Exception {
        try (final SegmentedEventLog log = new SegmentedEventLog(dir, CAPACITY, false)) {
            for (int i = 0; i < 6; i++) log.append("a", EventType.UPDATED, PAYLOAD);
            for (int i = 0; i < 2; i++) log.append("b", EventType.UPDATED, PAYLOAD);

            // Budget fits one segment: "a" loses its two sealed segments, "b" has only its active one.
            try (final RetentionManager retention = new RetentionManager(log, Duration.ofDays(7), CAPACITY, Duration.ofHours(1))) {
                assertEquals(2, retention.sweep());
                assertEquals(0, retention.sweep());
            }

            assertEquals(5L, log.retainedFloor("a"));
            assertEquals(6L, log.head("a"));
            assertEquals(1L, log.retainedFloor("b"));
        }
    }

    @Test
    void youngSegmentsWithinBudgetAreKept() throws Exception {
        try (final SegmentedEventLog log = new SegmentedEventLog(dir, CAPACITY, false)) {
            for (int i = 0; i < 6; i++) log.append("a", EventType.UPDATED, PAYLOAD);

            try (final RetentionManager retention = new RetentionManager(log, Duration.ofDays(7), Long.MAX_VALUE, Duration.ofHours(1))) {
                assertEquals(0, retention.sweep());
            }
            assertEquals(1L, log.retainedFloor("a"));
        }
    }
}
