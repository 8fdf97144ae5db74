package io.taskrelay.ledger.log;

/**
 * Notified after an event is durably appended. Called on the appending thread; must not block.
 */
@FunctionalInterface
public interface AppendListener {
    void onAppend(String taskId, long sequence);
}
