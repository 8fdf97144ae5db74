package io.taskrelay.broker.delivery;

import io.taskrelay.core.model.TaskEvent;

import java.time.Instant;

/**
 * An event that exhausted its delivery attempts for one subscriber. The event stays in the log and the
 * subscriber's cursor stays before it, so it is delivered again after reconnect.
 * <p>
 * {@code event} is null when the stored record itself could not be read; {@code taskId} and {@code sequence}
 * still name the position the lane was stuck at.
 * </p>
 */
public record UndeliverableEvent(String subscriberId,
                                 String taskId,
                                 long sequence,
                                 TaskEvent event,
                                 int attempts,
                                 String lastError,
                                 Instant reportedAt) {

    public UndeliverableEvent(final String subscriberId,
                              final TaskEvent event,
                              final int attempts,
                              final String lastError,
                              final Instant reportedAt) {
        this(subscriberId, event.taskId(), event.sequence(), event, attempts, lastError, reportedAt);
    }

    public String idempotencyKey() {
        return taskId + "#" + sequence;
    }
}
