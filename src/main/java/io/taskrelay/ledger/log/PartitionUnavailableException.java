package io.taskrelay.ledger.log;

import lombok.Getter;

import java.io.IOException;

/**
 * The partition could not durably persist an append. The event must be assumed not to exist.
 */
@Getter
public final class PartitionUnavailableException extends IOException {
    private final String taskId;

    public PartitionUnavailableException(final String taskId, final String message, final Throwable cause) {
        super("Partition " + taskId + " unavailable: " + message, cause);
        this.taskId = taskId;
    }
}
