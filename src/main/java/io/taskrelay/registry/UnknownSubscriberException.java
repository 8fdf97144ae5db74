package io.taskrelay.registry;

import lombok.Getter;

/**
 * The subscriber id was never subscribed or has been unsubscribed.
 */
@Getter
public final class UnknownSubscriberException extends RuntimeException {
    private final String subscriberId;

    public UnknownSubscriberException(final String subscriberId) {
        super("Unknown subscriber: " + subscriberId);
        this.subscriberId = subscriberId;
    }
}
