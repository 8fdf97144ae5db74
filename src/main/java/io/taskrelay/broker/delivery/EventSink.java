package io.taskrelay.broker.delivery;

import io.taskrelay.core.model.MissedEvents;
import io.taskrelay.core.model.TaskEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound half of a subscriber connection.
 * <p>
 * Implementations must not block: {@link #send} is invoked while the delivery lane holds its lock.
 * The returned future completes when the event has been handed to the transport; the subscriber's
 * acknowledgement arrives separately through the registry.
 * </p>
 */
public interface EventSink {

    /**
     * Hands one event to the subscriber. A future completed exceptionally (or a thrown
     * {@link RuntimeException}) counts as a failed attempt.
     */
    CompletableFuture<Void> send(TaskEvent event);

    /**
     * Tells the subscriber that events it never received were removed by retention.
     */
    void missedEvents(MissedEvents notice);

    /**
     * The relay ended this session on its own, e.g. after an undeliverable event.
     */
    default void closed(final String reason) {
    }
}
