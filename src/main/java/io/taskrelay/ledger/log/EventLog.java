package io.taskrelay.ledger.log;

import io.taskrelay.core.model.EventType;
import io.taskrelay.core.model.TaskEvent;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Append-only event log partitioned by task id; the source of truth for ordering and replay.
 */
public interface EventLog extends AutoCloseable {

    /**
     * Appends an event to the task's partition and returns its sequence once it is durable.
     *
     * @throws PartitionUnavailableException if the append could not be persisted
     */
    long append(String taskId, EventType type, byte[] payload) throws PartitionUnavailableException;

    /**
     * Reads up to {@code maxCount} events with sequence greater than {@code fromSequenceExclusive}, in order.
     * Returns an empty list once {@code fromSequenceExclusive} reaches the head.
     *
     * @throws RetentionGapException if events right after {@code fromSequenceExclusive} are no longer retained
     */
    List<TaskEvent> read(String taskId, long fromSequenceExclusive, int maxCount) throws RetentionGapException;

    /** Last appended sequence of the partition, 0 if it has none. */
    long head(String taskId);

    /** Lowest retained sequence, {@code head + 1} when nothing is retained. */
    long retainedFloor(String taskId);

    Set<String> partitions();

    void addAppendListener(AppendListener listener);

    /**
     * Drops sealed storage older than {@code maxAge} or beyond {@code maxBytesPerPartition}, oldest first.
     * Returns the number of segments removed.
     */
    int enforceRetention(Duration maxAge, long maxBytesPerPartition);

    @Override
    void close();
}
