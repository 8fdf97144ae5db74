package io.taskrelay.publisher;

import io.taskrelay.core.model.EventType;
import io.taskrelay.ledger.log.EventLog;
import io.taskrelay.ledger.log.PartitionUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Entry point for the task-mutation path.
 * <p>
 * A task mutation is complete only once {@link #publish} returns; a {@link PartitionUnavailableException}
 * means the mutation must be retried or aborted by the caller. The publisher never retries on its own,
 * so one call can never produce two events.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class Publisher {
    private final EventLog eventLog;

    public PublishAck publish(final String taskId, final EventType type, final byte[] payload)
            throws PartitionUnavailableException {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");

        final long sequence = eventLog.append(taskId, type, payload);
        log.debug("Published {} for task {} at sequence {}", type, taskId, sequence);
        return new PublishAck(taskId, sequence);
    }
}
