package io.taskrelay.ledger.log;

import lombok.Getter;

/**
 * A read started below the retention floor: events after {@code requestedFrom} and before
 * {@code lowestRetained} are gone and cannot be replayed.
 */
@Getter
public final class RetentionGapException extends Exception {
    private final String taskId;
    private final long requestedFrom;
    private final long lowestRetained;

    public RetentionGapException(final String taskId, final long requestedFrom, final long lowestRetained) {
        super("Partition " + taskId + ": read after " + requestedFrom
                + " is below the retention floor " + lowestRetained);
        this.taskId = taskId;
        this.requestedFrom = requestedFrom;
        this.lowestRetained = lowestRetained;
    }
}
