package io.taskrelay.offset;

import io.taskrelay.ledger.orchestrator.LedgerOrchestrator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/*
 * Cursor store with in-memory reads and a write-ahead ledger for durability.
 *
 *  - advance(): atomic max in memory, then queued for the background flusher
 *  - fetch(): plain map lookup
 *  - startup: replays the ledger, last record per key wins
 *
 * A crash may lose the most recent unflushed advances; the subscriber then sees those events again,
 * which at-least-once delivery already allows.
 */
@Slf4j
public final class DurableCursorStore implements CursorStore {

    private static final int CURSOR_SEGMENT_CAPACITY = 4 * 1024 * 1024;

    private static final int BATCH_SIZE = 1024;

    private static final long IDLE_POLL_MILLIS = 50L;

    private static final int REPLAY_PAGE = 4096;

    // Compaction starts once the WAL spans more segments than this.
    private static final int COMPACT_AFTER_SEGMENTS = 3;

    private static final byte KIND_ADVANCE = 1;
    private static final byte KIND_FORGET = 2;

    private final Path storageDir;

    /* subscriber -> (task -> cursor) */
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Long>> cursors = new ConcurrentHashMap<>();

    private final LedgerOrchestrator wal;

    private final BlockingQueue<byte[]> commitQueue = new LinkedBlockingQueue<>();

    private final ExecutorService flusherExecutor = Executors.newSingleThreadExecutor(r -> {
        final Thread t = new Thread(r, "cursor-flusher");
        t.setDaemon(true);
        return t;
    });

    private final AtomicBoolean running = new AtomicBoolean(true);

    // flusher thread only
    private long recordsSinceSnapshot;
    private long lastSnapshotSize;

    public DurableCursorStore(final Path storageDir) throws IOException {
        this(storageDir, CURSOR_SEGMENT_CAPACITY);
    }

    DurableCursorStore(final Path storageDir, final int segmentCapacity) throws IOException {
        this.storageDir = Objects.requireNonNull(storageDir, "storageDir");
        Files.createDirectories(storageDir);

        this.wal = LedgerOrchestrator.bootstrap(storageDir, segmentCapacity, true);
        recordsSinceSnapshot = recoverStateFromWal();

        flusherExecutor.submit(this::flusherLoop);
    }

    @Override
    public boolean advance(final String subscriberId, final String taskId, final long sequence) {
        Objects.requireNonNull(subscriberId, "subscriberId");
        Objects.requireNonNull(taskId, "taskId");

        final ConcurrentHashMap<String, Long> perTask = cursors.computeIfAbsent(subscriberId, __ -> new ConcurrentHashMap<>());
        final boolean[] moved = new boolean[1];
        perTask.compute(taskId, (k, current) -> {
            if (current != null && current >= sequence) return current;
            moved[0] = true;
            return sequence;
        });

        if (moved[0]) {
            commitQueue.offer(serializeAdvance(subscriberId, taskId, sequence));
        }
        return moved[0];
    }

    @Override
    public long fetch(final String subscriberId, final String taskId) {
        final Map<String, Long> perTask = cursors.get(subscriberId);
        if (perTask == null) return 0L;
        return perTask.getOrDefault(taskId, 0L);
    }

    @Override
    public Map<String, Long> cursors(final String subscriberId) {
        final Map<String, Long> perTask = cursors.get(subscriberId);
        return perTask == null ? Collections.emptyMap() : Map.copyOf(perTask);
    }

    @Override
    public void forget(final String subscriberId) {
        if (cursors.remove(subscriberId) != null) {
            commitQueue.offer(serializeForget(subscriberId));
        }
    }

    /*
     * Background flush loop: drain queue, batch, append to WAL.
     */
    private void flusherLoop() {
        final List<byte[]> batchBuffer = new ArrayList<>(BATCH_SIZE);

        while (running.get()) {
            try {
                final byte[] element = commitQueue.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (element == null) continue;

                batchBuffer.add(element);
                commitQueue.drainTo(batchBuffer, BATCH_SIZE - 1);
                flushBatch(batchBuffer);
            } catch (final InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            } catch (final RuntimeException e) {
                log.error("Cursor flusher loop encountered error", e);
            }
        }

        // Final drain once the running flag is cleared.
        try {
            while (!commitQueue.isEmpty()) {
                commitQueue.drainTo(batchBuffer, BATCH_SIZE);
                flushBatch(batchBuffer);
            }
        } catch (final RuntimeException e) {
            log.error("Error while flushing remaining cursors on flusher shutdown", e);
        }
    }

    private void flushBatch(final List<byte[]> batch) {
        if (batch.isEmpty()) return;

        try {
            wal.appendAll(batch);
            recordsSinceSnapshot += batch.size();
        } catch (final IOException e) {
            log.error("Failed to persist {} cursor update(s)", batch.size(), e);
        } finally {
            batch.clear();
        }
        compactIfNeeded();
    }

    /*
     * Rewrites the live cursors as one snapshot at the tail, then drops every segment that ends before it.
     * The in-memory map is never behind a record already written, so the snapshot supersedes everything older.
     * Runs only once more records were written since the last snapshot than it contained.
     */
    private void compactIfNeeded() {
        if (wal.segmentCount() <= COMPACT_AFTER_SEGMENTS || recordsSinceSnapshot <= lastSnapshotSize) return;

        final List<byte[]> snapshot = new ArrayList<>();
        cursors.forEach((subscriberId, perTask) ->
                perTask.forEach((taskId, sequence) -> snapshot.add(serializeAdvance(subscriberId, taskId, sequence))));

        try {
            final long snapshotStart = wal.getHighWaterMark() + 1L;
            wal.appendAll(snapshot);
            final int dropped = wal.deleteSegmentsBefore(snapshotStart);
            recordsSinceSnapshot = 0;
            lastSnapshotSize = snapshot.size();
            log.debug("Compacted cursor WAL: {} live cursor(s), {} segment(s) dropped", snapshot.size(), dropped);
        } catch (final IOException e) {
            log.error("Cursor WAL compaction failed; older segments kept", e);
        }
    }

    @Override
    public void close() {
        running.set(false);
        flusherExecutor.shutdown();
        try {
            if (!flusherExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Cursor flusher did not terminate within 30s");
            }
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
        }

        wal.close();
    }

    private long recoverStateFromWal() {
        log.info("Recovering cursors from: {}", storageDir);

        long next = wal.firstRetainedSequence();
        final long head = wal.getHighWaterMark();
        long replayed = 0;

        while (next <= head) {
            final int n = wal.fetch(next, REPLAY_PAGE, (seq, record) -> apply(record));
            if (n == 0) break;
            replayed += n;
            next += n;
        }
        log.info("Cursor recovery complete. Replayed {} record(s) for {} subscriber(s).", replayed, cursors.size());
        return replayed;
    }

    int walSegmentCount() {
        return wal.segmentCount();
    }

    /*
     * Record format (LE):
     * ADVANCE: [kind:byte=1][sLen:int][sBytes][tLen:int][tBytes][sequence:long]
     * FORGET:  [kind:byte=2][sLen:int][sBytes]
     */
    private void apply(final byte[] record) {
        final ByteBuffer buf = ByteBuffer.wrap(record).order(ByteOrder.LITTLE_ENDIAN);
        final byte kind = buf.get();
        final String subscriberId = readString(buf);

        switch (kind) {
            case KIND_ADVANCE -> {
                final String taskId = readString(buf);
                final long sequence = buf.getLong();
                cursors.computeIfAbsent(subscriberId, __ -> new ConcurrentHashMap<>())
                        .merge(taskId, sequence, Math::max);
            }
            case KIND_FORGET -> cursors.remove(subscriberId);
            default -> log.warn("Skipping cursor record of unknown kind {}", kind);
        }
    }

    private static String readString(final ByteBuffer buf) {
        final int len = buf.getInt();
        final byte[] bytes = new byte[len];
        buf.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static byte[] serializeAdvance(final String subscriberId, final String taskId, final long sequence) {
        final byte[] s = subscriberId.getBytes(StandardCharsets.UTF_8);
        final byte[] t = taskId.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(1 + 4 + s.length + 4 + t.length + 8)
                .order(ByteOrder.LITTLE_ENDIAN)
                .put(KIND_ADVANCE)
                .putInt(s.length).put(s)
                .putInt(t.length).put(t)
                .putLong(sequence)
                .array();
    }

    private static byte[] serializeForget(final String subscriberId) {
        final byte[] s = subscriberId.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(1 + 4 + s.length)
                .order(ByteOrder.LITTLE_ENDIAN)
                .put(KIND_FORGET)
                .putInt(s.length).put(s)
                .array();
    }
}
