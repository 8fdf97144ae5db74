package io.taskrelay.publisher;

/**
 * Proof that an event is durably logged. The mutation path may commit only after receiving it.
 */
public record PublishAck(String taskId, long sequence) {
}
