package io.taskrelay.ledger.log;

import io.taskrelay.core.model.EventType;
import io.taskrelay.core.model.TaskEvent;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;

/*
 * Ledger record format (LE):
 * [type:byte][producedAtMillis:long][payload bytes...]
 * The sequence is implied by the record's position in the partition.
 */
final class EventRecordCodec {
    static final int HEADER_BYTES = 1 + Long.BYTES;

    private EventRecordCodec() {
    }

    static byte[] encode(final EventType type, final Instant producedAt, final byte[] payload) {
        final ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.put(type.code());
        out.putLong(producedAt.toEpochMilli());
        out.put(payload);
        return out.array();
    }

    static TaskEvent decode(final String taskId, final long sequence, final byte[] record) {
        if (record.length < HEADER_BYTES) {
            throw new IllegalStateException("Truncated record " + sequence + " in partition " + taskId);
        }
        final ByteBuffer in = ByteBuffer.wrap(record).order(ByteOrder.LITTLE_ENDIAN);
        final EventType type = EventType.fromCode(in.get());
        final Instant producedAt = Instant.ofEpochMilli(in.getLong());
        final byte[] payload = new byte[in.remaining()];
        in.get(payload);
        return new TaskEvent(taskId, sequence, type, payload, producedAt);
    }
}
