package io.taskrelay.ledger.log;

import io.taskrelay.core.model.EventType;
import io.taskrelay.core.model.TaskEvent;
import io.taskrelay.ledger.segment.LedgerSegment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class SegmentedEventLogTest {

    // Four 7-byte payloads per segment.
    private static final int CAPACITY = LedgerSegment.HEADER_SIZE + 4 * (LedgerSegment.RECORD_OVERHEAD + EventRecordCodec.HEADER_BYTES + 7);

    private static final byte[] PAYLOAD = "payload".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path dir;

    private static List<Long> sequences(final List<TaskEvent> events) {
        return events.stream().map(TaskEvent::sequence).collect(Collectors.toList());
    }

    @Test
    void partitionsAreSequencedIndependentlyFromOne() throws Exception {
        try (final SegmentedEventLog log = new SegmentedEventLog(dir, CAPACITY, false)) {
            assertEquals(1L, log.append("task-a", EventType.CREATED, PAYLOAD));
            assertEquals(1L, log.append("task-b", EventType.CREATED, PAYLOAD));
            assertEquals(2L, log.append("task-a", EventType.UPDATED, PAYLOAD));

            assertEquals(2L, log.head("task-a"));
            assertEquals(1L, log.head("task-b"));
            assertEquals(0L, log.head("task-c"));
            assertEquals(Set.of("task-a", "task-b"), log.partitions());
        }
    }

    @Test
    void readReturnsEventsAfterCursorInOrder() throws Exception {
        final Instant now = Instant.parse("2024-05-01T10:15:30Z");
        try (final SegmentedEventLog log = new SegmentedEventLog(dir, CAPACITY, false, Clock.fixed(now, ZoneOffset.UTC))) {
            for (int i = 0; i < 10; i++) log.append("t", i == 0 ? EventType.CREATED : EventType.UPDATED, PAYLOAD);

            final List<TaskEvent> page = log.read("t", 2L, 5);
            assertEquals(List.of(3L, 4L, 5L, 6L, 7L), sequences(page));

            final TaskEvent first = log.read("t", 0L, 1).get(0);
            assertEquals(EventType.CREATED, first.type());
            assertArrayEquals(PAYLOAD, first.payload());
            assertEquals(now, first.producedAt());
            assertEquals("t#1", first.idempotencyKey());
        }
    }

    @Test
    void readAtHeadOrOnUnknownPartitionIsEmpty() throws Exception {
        try (final SegmentedEventLog log = new SegmentedEventLog(dir, CAPACITY, false)) {
            log.append("t", EventType.CREATED, PAYLOAD);
            assertTrue(log.read("t", 1L, 10).isEmpty());
            assertTrue(log.read("t", 5L, 10).isEmpty());
            assertTrue(log.read("missing", 0L, 10).isEmpty());
        }
    }

    @Test
    void readBelowRetentionFloorFailsWithGap() throws Exception {
        try (final SegmentedEventLog log = new SegmentedEventLog(dir, CAPACITY, false)) {
            for (int i = 0; i < 10; i++) log.append("t", EventType.UPDATED, PAYLOAD);

            assertEquals(2, log.enforceRetention(Duration.ofDays(1), 0L));
            assertEquals(9L, log.retainedFloor("t"));

            final RetentionGapException gap = assertThrows(RetentionGapException.class, () -> log.read("t", 3L, 10));
            assertEquals("t", gap.getTaskId());
            assertEquals(3L, gap.getRequestedFrom());
            assertEquals(9L, gap.getLowestRetained());

            // Right below the floor is still readable.
            assertEquals(List.of(9L, 10L), sequences(log.read("t", 8L, 10)));
        }
    }

    @Test
    void listenersSeeEveryAppendAfterItIsStored() throws Exception {
        try (final SegmentedEventLog log = new SegmentedEventLog(dir, CAPACITY, false)) {
            final List<String> seen = new ArrayList<>();
            log.addAppendListener((taskId, seq) -> {
                assertEquals(seq, log.head(taskId));
                seen.add(taskId + "#" + seq);
            });
            log.addAppendListener((taskId, seq) -> {
                throw new IllegalStateException("broken listener");
            });

            log.append("a", EventType.CREATED, PAYLOAD);
            log.append("a", EventType.UPDATED, PAYLOAD);
            log.append("b", EventType.CREATED, PAYLOAD);

            assertEquals(List.of("a#1", "a#2", "b#1"), seen);
        }
    }

    @Test
    void reopenDiscoversPartitionsAndContinuesSequences() throws Exception {
        try (final SegmentedEventLog log = new SegmentedEventLog(dir, CAPACITY, true)) {
            for (int i = 0; i < 6; i++) log.append("task/with spaces", EventType.UPDATED, PAYLOAD);
            log.append("other", EventType.CREATED, PAYLOAD);
        }

        try (final SegmentedEventLog log = new SegmentedEventLog(dir, CAPACITY, true)) {
            assertEquals(Set.of("task/with spaces", "other"), log.partitions());
            assertEquals(6L, log.head("task/with spaces"));
            assertEquals(7L, log.append("task/with spaces", EventType.DELETED, PAYLOAD));
            assertEquals(List.of(5L, 6L, 7L), sequences(log.read("task/with spaces", 4L, 10)));
        }
    }

    @Test
    void appendAfterCloseIsUnavailable() throws Exception {
        final SegmentedEventLog log = new SegmentedEventLog(dir, CAPACITY, false);
        log.close();
        final PartitionUnavailableException e = assertThrows(PartitionUnavailableException.class,
                () -> log.append("t", EventType.CREATED, PAYLOAD));
        assertEquals("t", e.getTaskId());
    }

    @Test
    void oversizedEventIsRejectedWithoutConsumingASequence() throws Exception {
        try (final SegmentedEventLog log = new SegmentedEventLog(dir, CAPACITY, false)) {
            assertThrows(PartitionUnavailableException.class,
                    () -> log.append("t", EventType.UPDATED, new byte[CAPACITY]));
            assertEquals(1L, log.append("t", EventType.UPDATED, PAYLOAD));
        }
    }
}
