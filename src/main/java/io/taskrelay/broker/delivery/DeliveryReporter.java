package io.taskrelay.broker.delivery;

import io.taskrelay.core.model.MissedEvents;

/**
 * Operator-facing sink for delivery anomalies.
 */
public interface DeliveryReporter {
    void undeliverable(UndeliverableEvent report);

    void missedEvents(MissedEvents notice);
}
