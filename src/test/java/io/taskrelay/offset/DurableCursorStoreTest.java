package io.taskrelay.offset;

import io.taskrelay.ledger.constant.LedgerConstant;
import io.taskrelay.ledger.segment.LedgerSegment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

final class DurableCursorStoreTest {

    @TempDir
    Path dir;

    @Test
    void cursorsArePersistedAndRecovered() throws Exception {
        final Path storage = dir.resolve("cursors");

        try (final DurableCursorStore store = new DurableCursorStore(storage)) {
            assertTrue(store.advance("s1", "task-a", 5L));
            assertTrue(store.advance("s1", "task-b", 7L));
            assertTrue(store.advance("s2", "task-a", 9L));

            assertEquals(5L, store.fetch("s1", "task-a"));
            assertEquals(Map.of("task-a", 5L, "task-b", 7L), store.cursors("s1"));
        }

        try (final DurableCursorStore recovered = new DurableCursorStore(storage)) {
            assertEquals(5L, recovered.fetch("s1", "task-a"));
            assertEquals(7L, recovered.fetch("s1", "task-b"));
            assertEquals(9L, recovered.fetch("s2", "task-a"));
        }
    }

    @Test
    void advanceIsMonotonic() throws Exception {
        try (final DurableCursorStore store = new DurableCursorStore(dir.resolve("cursors"))) {
            assertEquals(0L, store.fetch("s", "t"));
            assertTrue(store.advance("s", "t", 4L));
            assertFalse(store.advance("s", "t", 4L));
            assertFalse(store.advance("s", "t", 2L));
            assertEquals(4L, store.fetch("s", "t"));
        }
    }

    @Test
    void concurrentAdvancesKeepTheMaximum() throws Exception {
        final Path storage = dir.resolve("cursors");
        try (final DurableCursorStore store = new DurableCursorStore(storage)) {
            final ExecutorService pool = Executors.newFixedThreadPool(4);
            IntStream.rangeClosed(1, 500).forEach(i -> pool.submit(() -> store.advance("s", "t", i)));
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
            assertEquals(500L, store.fetch("s", "t"));
        }

        try (final DurableCursorStore recovered = new DurableCursorStore(storage)) {
            assertEquals(500L, recovered.fetch("s", "t"));
        }
    }

    @Test
    void forgetSurvivesRestart() throws Exception {
        final Path storage = dir.resolve("cursors");

        try (final DurableCursorStore store = new DurableCursorStore(storage)) {
            store.advance("gone", "t", 3L);
            store.advance("kept", "t", 4L);
            store.forget("gone");
            assertEquals(0L, store.fetch("gone", "t"));
            assertTrue(store.cursors("gone").isEmpty());
        }

        try (final DurableCursorStore recovered = new DurableCursorStore(storage)) {
            assertEquals(0L, recovered.fetch("gone", "t"));
            assertEquals(4L, recovered.fetch("kept", "t"));
        }
    }

    @Test
    void recoveryIgnoresTrailingGarbage() throws Exception {
        final Path storage = dir.resolve("cursors");

        try (final DurableCursorStore store = new DurableCursorStore(storage)) {
            store.advance("s", "t", 1L);
            store.advance("s", "u", 2L);
        }

        final Path segment;
        try (final Stream<Path> stream = Files.list(storage)) {
            segment = stream.filter(p -> p.toString().endsWith(LedgerConstant.SEGMENT_EXT)).findFirst().orElseThrow();
        }

        try (final FileChannel ch = FileChannel.open(segment, StandardOpenOption.APPEND)) {
            final ByteBuffer garbage = ByteBuffer.allocate(2);
            garbage.putShort((short) 9999);
            garbage.flip();
            ch.write(garbage);
        }

        try (final DurableCursorStore recovered = new DurableCursorStore(storage)) {
            assertEquals(1L, recovered.fetch("s", "t"));
            assertEquals(2L, recovered.fetch("s", "u"));
        }
    }

    @Test
    void walStaysBoundedUnderSteadyAcks() throws Exception {
        final Path storage = dir.resolve("cursors");
        // Room for 64 records of ("S", "T") per segment.
        final int capacity = LedgerSegment.HEADER_SIZE + 64 * (LedgerSegment.RECORD_OVERHEAD + 19);

        long sequence = 0;
        for (int round = 0; round < 3; round++) {
            try (final DurableCursorStore store = new DurableCursorStore(storage, capacity)) {
                store.advance("gone", "T", 1L);
                store.forget("gone");
                for (int i = 0; i < 20_000; i++) {
                    store.advance("S", "T", ++sequence);
                    if ((i & 1) == 0) store.advance("S", "U", sequence);
                }
            }

            assertTrue(segmentFiles(storage) <= 3, "round " + round + " left " + segmentFiles(storage) + " segments");

            try (final DurableCursorStore recovered = new DurableCursorStore(storage, capacity)) {
                assertEquals(sequence, recovered.fetch("S", "T"));
                assertEquals(sequence - 1, recovered.fetch("S", "U"));
                assertEquals(0L, recovered.fetch("gone", "T"));
            }
        }
    }

    private static long segmentFiles(final Path storage) throws Exception {
        try (final Stream<Path> stream = Files.list(storage)) {
            return stream.filter(p -> p.toString().endsWith(LedgerConstant.SEGMENT_EXT)).count();
        }
    }
}
