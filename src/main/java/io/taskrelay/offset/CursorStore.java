package io.taskrelay.offset;

import java.util.Map;

/** Last-acknowledged sequence per (subscriber, task partition). */
public interface CursorStore extends AutoCloseable {

    /**
     * Raises the cursor to {@code sequence}. Lower or equal values leave it unchanged.
     *
     * @return true if the cursor moved
     */
    boolean advance(String subscriberId, String taskId, long sequence);

    /** Cursor for the partition, 0 when nothing was acknowledged. */
    long fetch(String subscriberId, String taskId);

    /** Snapshot of every cursor the subscriber holds. */
    Map<String, Long> cursors(String subscriberId);

    /** Drops all cursors of the subscriber. */
    void forget(String subscriberId);

    @Override
    void close();
}
