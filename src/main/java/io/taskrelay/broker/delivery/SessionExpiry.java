package io.taskrelay.broker.delivery;

/**
 * Callback for sessions the dispatcher gives up on. Invoked at most once per session, never under a lane lock.
 */
@FunctionalInterface
public interface SessionExpiry {
    void expire(SubscriberSession session, String reason);
}
