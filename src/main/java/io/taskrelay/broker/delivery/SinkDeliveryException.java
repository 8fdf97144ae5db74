package io.taskrelay.broker.delivery;

/**
 * A sink rejected an event or did not acknowledge it in time.
 */
public final class SinkDeliveryException extends RuntimeException {
    public SinkDeliveryException(final String message) {
        super(message);
    }

    public SinkDeliveryException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
