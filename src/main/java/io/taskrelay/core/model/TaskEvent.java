package io.taskrelay.core.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable task-domain event as stored in its task's partition.
 * <p>
 * {@code sequence} starts at 1 and is unique and gap-free within a partition; nothing is
 * promised about ordering across partitions. The payload is opaque to the relay.
 * </p>
 */
public record TaskEvent(String taskId, long sequence, EventType type, byte[] payload, Instant producedAt) {

    public TaskEvent {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(producedAt, "producedAt");
        if (sequence <= 0) throw new IllegalArgumentException("sequence must be > 0: " + sequence);
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * Key consumers use to drop redeliveries: delivery is at-least-once.
     */
    public String idempotencyKey() {
        return taskId + '#' + sequence;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskEvent other)) return false;
        return sequence == other.sequence
                && taskId.equals(other.taskId)
                && type == other.type
                && Arrays.equals(payload, other.payload)
                && producedAt.equals(other.producedAt);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(taskId, sequence, type, producedAt);
        return 31 * h + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "TaskEvent{" +
                "taskId=" + taskId +
                ", sequence=" + sequence +
                ", type=" + type +
                ", payloadBytes=" + payload.length +
                ", producedAt=" + producedAt +
                '}';
    }
}
