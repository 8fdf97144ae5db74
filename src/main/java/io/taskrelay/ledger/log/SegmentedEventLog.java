package io.taskrelay.ledger.log;

import io.taskrelay.core.model.EventType;
import io.taskrelay.core.model.TaskEvent;
import io.taskrelay.ledger.constant.LedgerConstant;
import io.taskrelay.ledger.orchestrator.LedgerOrchestrator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * {@link EventLog} keeping one {@link LedgerOrchestrator} per task under {@code baseDir/p-<hex task id>}.
 * <p>
 * Each orchestrator serializes its own appends, so partitions never contend with each other.
 * Partitions found on disk are opened eagerly at startup.
 * </p>
 */
@Slf4j
public final class SegmentedEventLog implements EventLog {
    @Getter private final Path baseDir;
    private final int segmentCapacity;
    private final boolean fsync;
    private final Clock clock;

    private final ConcurrentMap<String, LedgerOrchestrator> partitions = new ConcurrentHashMap<>();
    private final List<AppendListener> listeners = new CopyOnWriteArrayList<>();

    private volatile boolean closed;

    public SegmentedEventLog(final Path baseDir, final int segmentCapacity, final boolean fsync) throws IOException {
        this(baseDir, segmentCapacity, fsync, Clock.systemUTC());
    }

    public SegmentedEventLog(final Path baseDir,
                             final int segmentCapacity,
                             final boolean fsync,
                             final Clock clock) throws IOException {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
        this.segmentCapacity = segmentCapacity;
        this.fsync = fsync;
        this.clock = Objects.requireNonNull(clock, "clock");

        Files.createDirectories(baseDir);
        discoverOnDisk();
    }

    private void discoverOnDisk() throws IOException {
        try (final Stream<Path> dirs = Files.list(baseDir)) {
            for (final Path dir : dirs.filter(Files::isDirectory).toList()) {
                final var taskId = PartitionNames.taskIdOf(dir.getFileName().toString());
                if (taskId.isEmpty()) {
                    log.warn("Ignoring unexpected directory {}", dir);
                    continue;
                }
                partitions.put(taskId.get(), LedgerOrchestrator.bootstrap(dir, segmentCapacity, fsync));
            }
        }
        log.info("Event log at {} opened with {} partition(s)", baseDir, partitions.size());
    }

    private LedgerOrchestrator partitionForWrite(final String taskId) throws PartitionUnavailableException {
        try {
            return partitions.computeIfAbsent(taskId, id -> {
                try {
                    return LedgerOrchestrator.bootstrap(baseDir.resolve(PartitionNames.directoryName(id)), segmentCapacity, fsync);
                } catch (final IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (final UncheckedIOException e) {
            throw new PartitionUnavailableException(taskId, "cannot open partition storage", e.getCause());
        }
    }

    @Override
    public long append(final String taskId, final EventType type, final byte[] payload) throws PartitionUnavailableException {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        if (taskId.isEmpty()) throw new IllegalArgumentException("taskId must not be empty");

        if (closed) throw new PartitionUnavailableException(taskId, "event log closed", null);

        final LedgerOrchestrator ledger = partitionForWrite(taskId);
        final byte[] record = EventRecordCodec.encode(type, Instant.now(clock), payload);

        final long sequence;
        try {
            sequence = ledger.append(record);
        } catch (final IOException e) {
            log.error("Append to partition {} failed", taskId, e);
            throw new PartitionUnavailableException(taskId, e.getMessage(), e);
        }

        for (final AppendListener listener : listeners) {
            try {
                listener.onAppend(taskId, sequence);
            } catch (final RuntimeException e) {
                // The event is durable; a listener failure must not turn it into a failed append.
                log.error("Append listener failed for {}#{}", taskId, sequence, e);
            }
        }
        return sequence;
    }

    @Override
    public List<TaskEvent> read(final String taskId,
                                final long fromSequenceExclusive,
                                final int maxCount) throws RetentionGapException {
        Objects.requireNonNull(taskId, "taskId");
        if (fromSequenceExclusive < 0) throw new IllegalArgumentException("fromSequenceExclusive must be >= 0");
        if (maxCount <= 0) throw new IllegalArgumentException("maxCount must be > 0");

        final LedgerOrchestrator ledger = partitions.get(taskId);
        if (ledger == null) return Collections.emptyList();

        final long head = ledger.getHighWaterMark();
        if (fromSequenceExclusive >= head) return Collections.emptyList();

        final long floor = ledger.firstRetainedSequence();
        if (fromSequenceExclusive + 1 < floor) {
            throw new RetentionGapException(taskId, fromSequenceExclusive, floor);
        }

        final int want = (int) Math.min(maxCount, head - fromSequenceExclusive);
        final List<TaskEvent> out = new ArrayList<>(want);
        ledger.fetch(fromSequenceExclusive + 1, want, (seq, record) ->
                out.add(EventRecordCodec.decode(taskId, seq, record)));

        // Retention may have removed the start of the range after the floor check.
        if (!out.isEmpty() && out.get(0).sequence() != fromSequenceExclusive + 1) {
            throw new RetentionGapException(taskId, fromSequenceExclusive, out.get(0).sequence());
        }
        if (out.isEmpty()) {
            final long newFloor = ledger.firstRetainedSequence();
            if (fromSequenceExclusive + 1 < newFloor) {
                throw new RetentionGapException(taskId, fromSequenceExclusive, newFloor);
            }
        }
        return out;
    }

    @Override
    public long head(final String taskId) {
        final LedgerOrchestrator ledger = partitions.get(taskId);
        return ledger == null ? LedgerConstant.NO_SEQUENCE : ledger.getHighWaterMark();
    }

    @Override
    public long retainedFloor(final String taskId) {
        final LedgerOrchestrator ledger = partitions.get(taskId);
        return ledger == null ? LedgerConstant.NO_SEQUENCE + 1 : ledger.firstRetainedSequence();
    }

    @Override
    public Set<String> partitions() {
        return Collections.unmodifiableSet(partitions.keySet());
    }

    @Override
    public void addAppendListener(final AppendListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public int enforceRetention(final Duration maxAge, final long maxBytesPerPartition) {
        final Instant cutoff = Instant.now(clock).minus(maxAge);
        int deleted = 0;
        for (final var e : partitions.entrySet()) {
            try {
                deleted += e.getValue().enforceRetention(cutoff, maxBytesPerPartition);
            } catch (final RuntimeException ex) {
                log.error("Retention failed for partition {}", e.getKey(), ex);
            }
        }
        return deleted;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        for (final LedgerOrchestrator ledger : partitions.values()) {
            ledger.close();
        }
        log.info("Event log at {} closed", baseDir);
    }
}
