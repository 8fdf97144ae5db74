package io.taskrelay.broker.delivery;

import io.taskrelay.core.model.TaskEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * The single in-flight event of a lane and how often it has been tried.
 *
 * @param nextRetryAt when the next attempt is due, or the send time of the current attempt
 */
public record DeliveryAttempt(TaskEvent event, String subscriberId, int attemptCount, Instant nextRetryAt) {
    public DeliveryAttempt {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(subscriberId, "subscriberId");
        Objects.requireNonNull(nextRetryAt, "nextRetryAt");
        if (attemptCount < 1) throw new IllegalArgumentException("attemptCount must be >= 1");
    }

    public static DeliveryAttempt first(final TaskEvent event, final String subscriberId, final Instant now) {
        return new DeliveryAttempt(event, subscriberId, 1, now);
    }

    public DeliveryAttempt next(final Instant retryAt) {
        return new DeliveryAttempt(event, subscriberId, attemptCount + 1, retryAt);
    }
}
