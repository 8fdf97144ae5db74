package io.taskrelay.ledger.segment;

import io.taskrelay.ledger.constant.LedgerConstant;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.zip.CRC32C;

/**
 * One memory-mapped, append-only file of length-prefixed, CRC32C-checked records.
 * <p>
 * Layout: {@code [magic:int][version:short][headerCrc:int][firstSequence:long][lastSequence:long]}
 * followed by records {@code [len:int][crc:int][bytes]}. A zero length marks the end of data.
 * Sequences are implicit: the i-th record has {@code firstSequence + i}.
 * </p>
 * Single writer; readers may visit concurrently through absolute reads only.
 */
@Slf4j
public final class LedgerSegment implements AutoCloseable {
    private static final int MAGIC_POS = 0;
    private static final int VERSION_POS = MAGIC_POS + Integer.BYTES;
    private static final int CRC_POS = VERSION_POS + Short.BYTES;
    private static final int FIRST_SEQ_POS = CRC_POS + Integer.BYTES;
    private static final int LAST_SEQ_POS = FIRST_SEQ_POS + Long.BYTES;
    public static final int HEADER_SIZE = LAST_SEQ_POS + Long.BYTES;

    public static final int RECORD_OVERHEAD = Integer.BYTES + Integer.BYTES; // Len + CRC
    private static final int MIN_RECORD_SIZE = RECORD_OVERHEAD + 1;

    /**
     * Sentinel meaning "no first sequence yet" (empty segment).
     */
    private static final long FIRST_SEQ_UNSET = Long.MIN_VALUE;

    // Hint stride: 1 hint per 256 records.
    private static final int HINT_SHIFT = 8;
    private static final int HINT_STRIDE = 1 << HINT_SHIFT;
    private static final int HINT_MASK = HINT_STRIDE - 1;

    @Getter private final Path file;
    @Getter private final int capacity;
    private final MappedByteBuffer buf;

    private final int[] hintPositions;

    private final CRC32C recordCrc = new CRC32C();
    private final CRC32C headerCrc = new CRC32C();
    private final ByteBuffer headerScratch = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);

    // Written after the record bytes; readers never look past it.
    private volatile int publishedCount;

    @Getter private volatile long firstSequence;
    @Getter private volatile long lastSequence;

    private LedgerSegment(final Path file,
                          final int capacity,
                          final MappedByteBuffer buf,
                          final int[] hintPositions) throws IOException {
        this.file = file;
        this.capacity = capacity;
        this.buf = buf;
        this.hintPositions = hintPositions;

        readAndVerifyHeader();
        rebuildHintsAndCount();
    }

    /**
     * Creates an empty segment whose next record gets {@code baseLastSequence + 1}.
     */
    public static LedgerSegment create(final Path file,
                                       final int capacity,
                                       final long baseLastSequence) throws IOException {
        if (capacity < HEADER_SIZE + MIN_RECORD_SIZE) throw new IllegalArgumentException("Capacity too small");

        try (final FileChannel ch = FileChannel.open(file,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            ch.truncate(capacity);
            final MappedByteBuffer map = ch.map(FileChannel.MapMode.READ_WRITE, 0, capacity);
            map.order(ByteOrder.LITTLE_ENDIAN);

            map.putInt(MAGIC_POS, LedgerConstant.MAGIC);
            map.putShort(VERSION_POS, LedgerConstant.VERSION);
            map.putInt(CRC_POS, 0);
            map.putLong(FIRST_SEQ_POS, FIRST_SEQ_UNSET);
            map.putLong(LAST_SEQ_POS, baseLastSequence);
            map.putInt(CRC_POS, headerCrcOf(FIRST_SEQ_UNSET, baseLastSequence));
            map.force();

            map.position(HEADER_SIZE);
            return new LedgerSegment(file, capacity, map, new int[hintCount(capacity)]);
        }
    }

    public static LedgerSegment openExisting(final Path file) throws IOException {
        try (final FileChannel ch = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            final long size = ch.size();
            if (size < HEADER_SIZE) throw new IOException("Segment too small: " + file);
            final MappedByteBuffer map = ch.map(FileChannel.MapMode.READ_WRITE, 0, size);
            map.order(ByteOrder.LITTLE_ENDIAN);

            final int cap = (int) size;
            return new LedgerSegment(file, cap, map, new int[hintCount(cap)]);
        }
    }

    private static int hintCount(final int capacity) {
        final int maxRecords = Math.max(1, (capacity - HEADER_SIZE) / MIN_RECORD_SIZE);
        return Math.max(1, (maxRecords + HINT_STRIDE - 1) >>> HINT_SHIFT);
    }

    private static int headerCrcOf(final long first, final long last) {
        final ByteBuffer hb = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        hb.putInt(LedgerConstant.MAGIC).putShort(LedgerConstant.VERSION).putInt(0).putLong(first).putLong(last).flip();
        final CRC32C crc = new CRC32C();
        crc.update(hb);
        return (int) crc.getValue();
    }

    private void readAndVerifyHeader() throws IOException {
        final int magic = buf.getInt(MAGIC_POS);
        final short ver = buf.getShort(VERSION_POS);
        if (magic != LedgerConstant.MAGIC || ver != LedgerConstant.VERSION)
            throw new IOException("Bad magic/version in " + file);

        final int storedCrc = buf.getInt(CRC_POS);
        final long fs = buf.getLong(FIRST_SEQ_POS);
        final long ls = buf.getLong(LAST_SEQ_POS);

        if (headerCrcOf(fs, ls) != storedCrc)
            throw new IOException("Header CRC mismatch in " + file);

        this.firstSequence = fs;
        this.lastSequence = ls;
    }

    public boolean isLogicallyEmpty() {
        return firstSequence == FIRST_SEQ_UNSET && publishedCount == 0;
    }

    /**
     * Number of records in this segment.
     */
    public int count() {
        return publishedCount;
    }

    private void rebuildHintsAndCount() {
        int pos = HEADER_SIZE;
        final int maxPos = capacity - RECORD_OVERHEAD;

        int count = 0;

        while (pos <= maxPos) {
            final int len = buf.getInt(pos);
            if (len == 0) break;

            if (len < 0) {
                log.warn("Corrupt negative length {} at {} in {}", len, pos, file);
                break;
            }

            final int next = pos + RECORD_OVERHEAD + len;
            if (next > capacity) {
                log.warn("Record length {} exceeds capacity at {} in {}", len, pos, file);
                break;
            }

            if ((count & HINT_MASK) == 0) {
                final int hi = count >>> HINT_SHIFT;
                if (hi < hintPositions.length) hintPositions[hi] = pos;
            }

            count++;
            pos = next;
        }

        buf.position(pos);
        publishedCount = count;

        // Header claims records that recovery truncated away: fall back to an empty segment on the same base.
        if (count == 0 && firstSequence != FIRST_SEQ_UNSET) {
            this.lastSequence = firstSequence - 1L;
            this.firstSequence = FIRST_SEQ_UNSET;
            updateHeaderOnDisk();
        }

        // Repair header if a crash left it behind the records.
        if (count > 0) {
            long fs = this.firstSequence;
            long ls = this.lastSequence;

            if (fs == FIRST_SEQ_UNSET) {
                fs = ls + 1L;
                this.firstSequence = fs;
            }

            final long actualLast = fs + (count - 1L);
            if (actualLast != ls) {
                this.lastSequence = actualLast;
            }

            updateHeaderOnDisk();
        }
    }

    public boolean hasSpaceFor(final int recordBytes) {
        return (capacity - buf.position()) >= (recordBytes + RECORD_OVERHEAD);
    }

    public boolean isFull() {
        return capacity - buf.position() < MIN_RECORD_SIZE;
    }

    /**
     * Bytes occupied by the header and the records written so far.
     */
    public int usedBytes() {
        return buf.position();
    }

    @FunctionalInterface
    public interface RecordVisitor {
        void accept(long sequence, ByteBuffer segmentBuffer, int recordPos, int recordLen);
    }

    private int positionForRecordIndex(final int recordIndex) {
        final int chunk = recordIndex >>> HINT_SHIFT;
        int pos = hintPositions[chunk];
        final int base = chunk << HINT_SHIFT;

        for (int i = base; i < recordIndex; i++) {
            final int len = buf.getInt(pos);
            pos += (RECORD_OVERHEAD + len);
        }

        return pos;
    }

    /**
     * Visits up to {@code maxRecords} records starting at {@code sequence} (inclusive).
     * Returns the number visited.
     */
    public int visitFrom(final long sequence, final int maxRecords, final RecordVisitor visitor) {
        if (maxRecords <= 0) return 0;

        final int available = publishedCount;
        if (available <= 0) return 0;

        final long fs = this.firstSequence;
        if (fs == FIRST_SEQ_UNSET) return 0;

        long start = sequence;
        if (start < fs) start = fs;

        final long lastByCount = fs + (available - 1L);
        if (start > lastByCount) return 0;

        final int startIdx = (int) (start - fs);
        int endIdx = startIdx + maxRecords;
        if (endIdx > available) endIdx = available;

        int p = positionForRecordIndex(startIdx);

        for (int i = startIdx; i < endIdx; i++) {
            final int len = buf.getInt(p);
            visitor.accept(fs + i, buf, p + RECORD_OVERHEAD, len);
            p += (RECORD_OVERHEAD + len);
        }

        return endIdx - startIdx;
    }

    /**
     * Appends one record and returns its sequence. Caller guarantees {@link #hasSpaceFor(int)}.
     */
    public long append(final byte[] record) throws IOException {
        final int len = record.length;
        if (len == 0) throw new IllegalArgumentException("empty record");
        if (!hasSpaceFor(len)) throw new IOException("Segment full: " + file);

        final int ridx = publishedCount;
        if ((ridx & HINT_MASK) == 0) {
            hintPositions[ridx >>> HINT_SHIFT] = buf.position();
        }

        final int start = buf.position();
        recordCrc.reset();
        recordCrc.update(record, 0, len);

        // Length goes in last so a torn write never exposes a half-written record.
        buf.position(start + Integer.BYTES);
        buf.putInt((int) recordCrc.getValue());
        buf.put(record);
        final int end = buf.position();
        buf.putInt(start, len);
        buf.position(end);

        final long seq = lastSequence + 1L;
        if (firstSequence == FIRST_SEQ_UNSET) {
            firstSequence = seq;
        }
        lastSequence = seq;
        publishedCount = ridx + 1;

        updateHeaderOnDisk();
        return seq;
    }

    /**
     * Drops every record after {@code lastKeptSequence}, as if they had never been appended. Used to take back
     * writes whose force failed; the dropped records must not have been published past the ledger's
     * high-water mark. A segment emptied this way keeps {@code lastKeptSequence} as its base.
     */
    public void discardAfter(final long lastKeptSequence) {
        if (lastKeptSequence >= lastSequence) return;

        final int keep = firstSequence == FIRST_SEQ_UNSET || lastKeptSequence < firstSequence
                ? 0
                : (int) (lastKeptSequence - firstSequence + 1L);
        final int from = keep == 0 ? HEADER_SIZE : positionForRecordIndex(keep);
        final int to = buf.position();

        // The first dropped length word is cleared first; recovery stops there even if the rest never lands.
        for (int pos = from; pos < to; pos++) {
            buf.put(pos, (byte) 0);
        }
        buf.position(from);

        publishedCount = keep;
        lastSequence = lastKeptSequence;
        if (keep == 0) firstSequence = FIRST_SEQ_UNSET;
        updateHeaderOnDisk();
        log.warn("Discarded records after {} in {}", lastKeptSequence, file);
    }

    public void force() throws IOException {
        try {
            buf.force();
        } catch (final RuntimeException e) {
            throw new IOException("Failed to force " + file, e);
        }
    }

    /**
     * Copies the record bytes at {@code recordPos} out of a visited buffer.
     */
    public static byte[] copyRecord(final ByteBuffer segmentBuffer, final int recordPos, final int recordLen) {
        final byte[] dst = new byte[recordLen];
        segmentBuffer.get(recordPos, dst, 0, recordLen);
        return dst;
    }

    private void updateHeaderOnDisk() {
        buf.putLong(FIRST_SEQ_POS, firstSequence);
        buf.putLong(LAST_SEQ_POS, lastSequence);
        headerScratch.clear();
        headerScratch.putInt(LedgerConstant.MAGIC).putShort(LedgerConstant.VERSION).putInt(0)
                .putLong(firstSequence).putLong(lastSequence).flip();
        headerCrc.reset();
        headerCrc.update(headerScratch);
        buf.putInt(CRC_POS, (int) headerCrc.getValue());
    }

    /**
     * Closes and removes the file. Readers holding this segment keep a valid mapping.
     */
    public void delete() throws IOException {
        close();
        Files.deleteIfExists(file);
    }

    @Override
    public void close() {
        try {
            buf.force();
        } catch (final RuntimeException e) {
            log.warn("Failed to force {} on close: {}", file, e.toString());
        }
    }

    @Override
    public String toString() {
        return "LedgerSegment{" +
                "file=" + file +
                ", capacity=" + capacity +
                ", firstSequence=" + firstSequence +
                ", lastSequence=" + lastSequence +
                ", position=" + buf.position() +
                '}';
    }
}
