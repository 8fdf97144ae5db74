package io.taskrelay.broker.delivery;

import io.taskrelay.ledger.log.RetentionGapException;

/**
 * Decides where a lane resumes when its next event has been removed by retention.
 */
@FunctionalInterface
public interface RetentionGapHandler {
    /**
     * @param previousCursor the lane's position when the gap was found
     * @return the position to resume from; events after it are delivered next
     */
    long onRetentionGap(SubscriberSession session, RetentionGapException gap, long previousCursor);
}
