package io.taskrelay.registry;

import io.taskrelay.broker.delivery.SubscriberSession;
import io.taskrelay.core.model.Interest;

import java.util.concurrent.locks.ReentrantLock;

/*
 * Mutable registry entry; every field is guarded by lock.
 */
final class SubscriberRecord {
    final String subscriberId;
    final ReentrantLock lock = new ReentrantLock();

    Interest interest;
    ConnectionState state = ConnectionState.DISCONNECTED;
    SubscriberSession session;
    boolean removed;

    SubscriberRecord(final String subscriberId, final Interest interest) {
        this.subscriberId = subscriberId;
        this.interest = interest;
    }
}
