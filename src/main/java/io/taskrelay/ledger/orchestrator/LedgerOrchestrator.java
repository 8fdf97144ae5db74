package io.taskrelay.ledger.orchestrator;

import io.taskrelay.ledger.constant.LedgerConstant;
import io.taskrelay.ledger.segment.LedgerSegment;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;
import java.util.zip.CRC32C;

import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Chain of {@link LedgerSegment}s in one directory forming a single gap-free sequence.
 * <p>
 * Appends are serialized by an internal lock (single writer per ledger). Fetches read an immutable
 * snapshot of the chain and never block appends. Retention removes sealed segments from the old end
 * only, so the retained range is always contiguous.
 * </p>
 */
@Slf4j
public final class LedgerOrchestrator implements AutoCloseable {

    private final Path directory;
    @Getter
    private final int segmentCapacity;
    private final boolean fsync;
    private final SegmentSync sync;

    private final ReentrantLock writeLock = new ReentrantLock();
    private LedgerSegment activeSegment;

    @Getter
    private volatile long highWaterMark;

    // Copy-on-write snapshot, ordered by sequence, for lock-free fetch.
    private volatile LedgerSegment[] segmentSnapshot = new LedgerSegment[0];

    private volatile boolean closed;

    /**
     * Flushes a segment to storage. Replaceable so tests can fail the flush.
     */
    @FunctionalInterface
    interface SegmentSync {
        void force(LedgerSegment segment) throws IOException;
    }

    private LedgerOrchestrator(final Path directory,
                               final int segmentCapacity,
                               final boolean fsync,
                               final SegmentSync sync,
                               final long initialHwm) {
        this.directory = directory;
        this.segmentCapacity = segmentCapacity;
        this.fsync = fsync;
        this.sync = sync;
        this.highWaterMark = initialHwm;
    }

    public static LedgerOrchestrator bootstrap(@NonNull final Path directory, final int segmentCapacity) throws IOException {
        return bootstrap(directory, segmentCapacity, true);
    }

    public static LedgerOrchestrator bootstrap(@NonNull final Path directory,
                                               final int segmentCapacity,
                                               final boolean fsync) throws IOException {
        return bootstrap(directory, segmentCapacity, fsync, LedgerSegment::force);
    }

    static LedgerOrchestrator bootstrap(@NonNull final Path directory,
                                        final int segmentCapacity,
                                        final boolean fsync,
                                        @NonNull final SegmentSync sync) throws IOException {
        Files.createDirectories(directory);

        final List<Path> files;
        try (final Stream<Path> s = Files.list(directory)) {
            files = s.filter(p -> p.getFileName().toString().endsWith(LedgerConstant.SEGMENT_EXT))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        }

        final List<LedgerSegment> recovered = new ArrayList<>();
        long hwm = LedgerConstant.NO_SEQUENCE;

        for (final Path path : files) {
            final LedgerSegment seg = recoverAndOpenSegment(path, directory);
            if (seg == null) continue;

            // Empty segments still carry the base sequence; it must survive even when retention emptied the ledger.
            hwm = Math.max(hwm, seg.getLastSequence());

            if (seg.isLogicallyEmpty()) {
                seg.delete();
                continue;
            }
            recovered.add(seg);
        }

        recovered.sort(Comparator.comparingLong(LedgerSegment::getFirstSequence)
                .thenComparingLong(LedgerSegment::getLastSequence));

        final LedgerOrchestrator orchestrator = new LedgerOrchestrator(directory, segmentCapacity, fsync, sync, hwm);

        final LedgerSegment tail = recovered.isEmpty() ? null : recovered.get(recovered.size() - 1);
        final LedgerSegment active;
        if (tail == null || tail.isFull() || tail.getLastSequence() < hwm) {
            active = orchestrator.createNewSegment(hwm);
            recovered.add(active);
        } else {
            active = tail;
        }

        orchestrator.activeSegment = active;
        orchestrator.segmentSnapshot = recovered.toArray(new LedgerSegment[0]);

        log.debug("Ledger {} bootstrapped with {} segment(s), high-water mark {}", directory, recovered.size(), hwm);
        return orchestrator;
    }

    private static LedgerSegment recoverAndOpenSegment(final Path segmentPath, final Path baseDir) {
        Path tempRecoveryPath = null;
        try {
            tempRecoveryPath = baseDir.resolve(segmentPath.getFileName().toString() + ".recovery_tmp");
            Files.copy(segmentPath, tempRecoveryPath, StandardCopyOption.REPLACE_EXISTING);

            if (recoverSegmentFile(tempRecoveryPath)) {
                Files.move(tempRecoveryPath, segmentPath, StandardCopyOption.REPLACE_EXISTING);
                return LedgerSegment.openExisting(segmentPath);
            }
            return null;
        } catch (final IOException e) {
            log.error("Recovery I/O error: {}", segmentPath, e);
            return null;
        } finally {
            if (tempRecoveryPath != null) {
                try {
                    Files.deleteIfExists(tempRecoveryPath);
                } catch (final IOException e) {
                    log.warn("Could not remove recovery temp file {}", tempRecoveryPath, e);
                }
            }
        }
    }

    /**
     * Zeroes everything after the last intact record so the segment can be reopened and appended to.
     */
    private static boolean recoverSegmentFile(final Path segmentPath) {
        try (final FileChannel ch = FileChannel.open(segmentPath, READ, WRITE)) {

            final long size = ch.size();
            if (size < LedgerSegment.HEADER_SIZE) {
                log.warn("Segment {} shorter than its header; discarding", segmentPath);
                return false;
            }

            long currentFilePosition = LedgerSegment.HEADER_SIZE;
            final ByteBuffer recordHeaderBuffer = ByteBuffer.allocate(LedgerSegment.RECORD_OVERHEAD)
                    .order(ByteOrder.LITTLE_ENDIAN);
            ch.position(LedgerSegment.HEADER_SIZE);

            final CRC32C crcValidator = new CRC32C();
            final ByteBuffer payloadChunk = ByteBuffer.allocate(64 * 1024);

            while (currentFilePosition + LedgerSegment.RECORD_OVERHEAD <= size) {
                recordHeaderBuffer.clear();
                final int bytesRead = ch.read(recordHeaderBuffer);

                if (bytesRead <= 0) break;

                if (bytesRead < recordHeaderBuffer.capacity()) {
                    log.warn("Partial record header at pos {} in {}. Truncating.", currentFilePosition, segmentPath);
                    zeroTail(ch, currentFilePosition);
                    return true;
                }

                recordHeaderBuffer.flip();
                final int payloadLength = recordHeaderBuffer.getInt();
                final int storedCrc = recordHeaderBuffer.getInt();

                // Zero-filled space: clean end of data.
                if (payloadLength == 0) break;

                if (payloadLength < 0 || payloadLength > (size - currentFilePosition - LedgerSegment.RECORD_OVERHEAD)) {
                    log.warn("Invalid record length {} at {} in {}. Truncating.", payloadLength, currentFilePosition, segmentPath);
                    zeroTail(ch, currentFilePosition);
                    return true;
                }

                crcValidator.reset();
                long remaining = payloadLength;

                while (remaining > 0) {
                    payloadChunk.clear();
                    if (remaining < payloadChunk.capacity()) {
                        payloadChunk.limit((int) remaining);
                    }

                    final int chunkRead = ch.read(payloadChunk);
                    if (chunkRead < 0) break;

                    payloadChunk.flip();
                    crcValidator.update(payloadChunk);
                    remaining -= chunkRead;
                }

                if (remaining > 0) {
                    log.warn("Torn record at {} in {}. Truncating.", currentFilePosition, segmentPath);
                    zeroTail(ch, currentFilePosition);
                    return true;
                }

                if ((int) crcValidator.getValue() != storedCrc) {
                    log.warn("CRC32C mismatch at {} in {}. Stored: {}, Calc: {}. Truncating.",
                            currentFilePosition, segmentPath, storedCrc, (int) crcValidator.getValue());
                    zeroTail(ch, currentFilePosition);
                    return true;
                }

                currentFilePosition += (LedgerSegment.RECORD_OVERHEAD + payloadLength);
            }
            return true;
        } catch (final IOException e) {
            log.error("Critical recovery error: {}", segmentPath, e);
            return false;
        }
    }

    // Keeps the file size (the segment stays mapped at full capacity) but clears the damaged tail.
    private static void zeroTail(final FileChannel ch, final long position) throws IOException {
        final long size = ch.size();
        ch.truncate(position);
        ch.position(position);
        final ByteBuffer zeros = ByteBuffer.allocate((int) Math.min(64 * 1024, Math.max(1, size - position)));
        long remaining = size - position;
        while (remaining > 0) {
            zeros.clear();
            if (remaining < zeros.capacity()) zeros.limit((int) remaining);
            remaining -= ch.write(zeros);
        }
        ch.force(true);
    }

    /**
     * Appends one record at {@code highWaterMark + 1}, rolling to a new segment when needed.
     * Durable on return when the ledger was bootstrapped with fsync. If the write cannot be forced the
     * record is taken back and the next append reuses its sequence.
     */
    public long append(final byte[] record) throws IOException {
        return appendAll(List.of(record));
    }

    /**
     * Appends records in order with a single force at the end. Returns the last assigned sequence.
     * All or nothing: on failure none of the records is visible or kept.
     */
    public long appendAll(final List<byte[]> records) throws IOException {
        if (records.isEmpty()) return highWaterMark;

        writeLock.lock();
        try {
            if (closed) throw new IOException("Ledger closed: " + directory);

            final long before = highWaterMark;
            final List<LedgerSegment> touched = new ArrayList<>(2);
            long seq = before;
            try {
                for (final byte[] record : records) {
                    final LedgerSegment seg = writable(record.length, seq);
                    if (touched.isEmpty() || touched.get(touched.size() - 1) != seg) touched.add(seg);
                    seq = seg.append(record);
                }
                if (fsync) {
                    for (final LedgerSegment seg : touched) sync.force(seg);
                }
            } catch (final IOException | RuntimeException e) {
                if (seq > before) {
                    for (final LedgerSegment seg : touched) seg.discardAfter(before);
                    log.error("Append to {} failed, discarded {} unflushed record(s)", directory, seq - before, e);
                }
                throw e;
            }
            highWaterMark = seq;
            return seq;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Returns the active segment, rolling after {@code lastSequence} if it cannot fit {@code recordBytes}.
     * Caller holds the write lock.
     */
    private LedgerSegment writable(final int recordBytes, final long lastSequence) throws IOException {
        if (LedgerSegment.HEADER_SIZE + LedgerSegment.RECORD_OVERHEAD + recordBytes > segmentCapacity) {
            throw new IOException("Record of " + recordBytes + " bytes exceeds segment capacity " + segmentCapacity);
        }

        LedgerSegment current = activeSegment;
        if (current == null || !current.hasSpaceFor(recordBytes)) {
            log.debug("Rolling segment in {} (no room for {} bytes)", directory, recordBytes);
            current = createNewSegment(lastSequence);
            activeSegment = current;
            addToSnapshot(current);
        }
        return current;
    }

    private void addToSnapshot(final LedgerSegment seg) {
        final LedgerSegment[] snap = segmentSnapshot;
        final LedgerSegment[] next = new LedgerSegment[snap.length + 1];
        System.arraycopy(snap, 0, next, 0, snap.length);
        next[next.length - 1] = seg;
        segmentSnapshot = next;
    }

    private LedgerSegment createNewSegment(final long previousLastSequence) throws IOException {
        Path segmentPath;
        do {
            // Zero-padded base sequence keeps lexical order equal to sequence order.
            final String fileName = String.format("%020d-%06d%s", previousLastSequence + 1,
                    ThreadLocalRandom.current().nextInt(1_000_000), LedgerConstant.SEGMENT_EXT);
            segmentPath = directory.resolve(fileName);
        } while (Files.exists(segmentPath));

        log.debug("Creating segment: {}", segmentPath);
        return LedgerSegment.create(segmentPath, segmentCapacity, previousLastSequence);
    }

    @FunctionalInterface
    public interface RecordVisitor {
        void accept(long sequence, byte[] record);
    }

    /**
     * Visits up to {@code maxRecords} records starting at {@code fromSequence} (inclusive), across
     * segment boundaries. Returns the number visited; records below the retained floor are skipped.
     */
    public int fetch(final long fromSequence, final int maxRecords, final RecordVisitor visitor) {
        if (maxRecords <= 0) return 0;

        long start = Math.max(fromSequence, 1L);
        int remaining = maxRecords;
        int visited = 0;

        final LedgerSegment[] snap = segmentSnapshot;
        int idx = segmentIndexFor(snap, start);
        if (idx < 0) {
            final long floor = firstRetainedIn(snap);
            if (start >= floor) return 0;
            // Below the floor: begin at the oldest retained record.
            start = floor;
            idx = segmentIndexFor(snap, start);
            if (idx < 0) return 0;
        }

        // The chain is gap-free, so each segment continues where the previous one ended.
        while (remaining > 0 && idx < snap.length) {
            final int n = snap[idx].visitFrom(start, remaining, (seq, buf, pos, len) ->
                    visitor.accept(seq, LedgerSegment.copyRecord(buf, pos, len)));
            visited += n;
            remaining -= n;
            start += n;
            idx++;
        }

        return visited;
    }

    private static int segmentIndexFor(final LedgerSegment[] snap, final long sequence) {
        int lo = 0, hi = snap.length - 1;

        while (lo <= hi) {
            final int mid = (lo + hi) >>> 1;
            final LedgerSegment s = snap[mid];

            if (s.count() == 0) {
                // Empty (freshly rolled) segment: it only covers sequences past the high-water mark.
                hi = mid - 1;
                continue;
            }

            final long fs = s.getFirstSequence();
            final long ls = s.getLastSequence();

            if (sequence < fs) {
                hi = mid - 1;
            } else if (sequence > ls) {
                lo = mid + 1;
            } else {
                return mid;
            }
        }
        return -1;
    }

    private long firstRetainedIn(final LedgerSegment[] snap) {
        for (final LedgerSegment s : snap) {
            if (s.count() > 0) return s.getFirstSequence();
        }
        return highWaterMark + 1L;
    }

    /**
     * Lowest sequence still stored, or {@code highWaterMark + 1} when nothing is retained.
     */
    public long firstRetainedSequence() {
        return firstRetainedIn(segmentSnapshot);
    }

    /**
     * Bytes on disk across all segments.
     */
    public long sizeOnDisk() {
        long total = 0;
        for (final LedgerSegment s : segmentSnapshot) total += s.getCapacity();
        return total;
    }

    /**
     * Deletes sealed segments, oldest first, whose file is older than {@code cutoff} or while the
     * ledger exceeds {@code maxBytes}. The active segment is never removed. Returns the number deleted.
     */
    public int enforceRetention(final Instant cutoff, final long maxBytes) {
        writeLock.lock();
        try {
            if (closed) return 0;

            final LedgerSegment[] snap = segmentSnapshot;
            long total = sizeOnDisk();
            int drop = 0;

            for (final LedgerSegment seg : snap) {
                if (seg == activeSegment) break;

                final boolean expired = lastModified(seg).isBefore(cutoff);
                final boolean oversized = total > maxBytes;
                if (!expired && !oversized) break;

                total -= seg.getCapacity();
                drop++;
            }

            return dropOldest(snap, drop);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Deletes sealed segments whose records all lie below {@code sequence}. The active segment is never
     * removed. Returns the number deleted.
     */
    public int deleteSegmentsBefore(final long sequence) {
        writeLock.lock();
        try {
            if (closed) return 0;

            final LedgerSegment[] snap = segmentSnapshot;
            int drop = 0;
            for (final LedgerSegment seg : snap) {
                if (seg == activeSegment || seg.getLastSequence() >= sequence) break;
                drop++;
            }
            return dropOldest(snap, drop);
        } finally {
            writeLock.unlock();
        }
    }

    // Caller holds the write lock.
    private int dropOldest(final LedgerSegment[] snap, final int drop) {
        if (drop == 0) return 0;

        final LedgerSegment[] next = new LedgerSegment[snap.length - drop];
        System.arraycopy(snap, drop, next, 0, next.length);
        segmentSnapshot = next;

        for (int i = 0; i < drop; i++) {
            try {
                snap[i].delete();
                log.info("Deleted segment {} (sequences {}..{})",
                        snap[i].getFile(), snap[i].getFirstSequence(), snap[i].getLastSequence());
            } catch (final IOException e) {
                log.error("Failed to delete segment {}", snap[i].getFile(), e);
            }
        }
        return drop;
    }

    private static Instant lastModified(final LedgerSegment seg) {
        try {
            return Files.getLastModifiedTime(seg.getFile()).toInstant();
        } catch (final IOException e) {
            // Unknown age: keep it.
            return Instant.MAX;
        }
    }

    /**
     * Number of segments currently in the chain.
     */
    public int segmentCount() {
        return segmentSnapshot.length;
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void close() {
        writeLock.lock();
        try {
            if (closed) return;
            closed = true;
            for (final LedgerSegment s : segmentSnapshot) {
                s.close();
            }
            activeSegment = null;
        } finally {
            writeLock.unlock();
        }
    }
}
