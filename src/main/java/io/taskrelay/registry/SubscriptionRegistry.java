package io.taskrelay.registry;

import io.taskrelay.broker.delivery.Dispatcher;
import io.taskrelay.broker.delivery.EventSink;
import io.taskrelay.broker.delivery.SubscriberSession;
import io.taskrelay.broker.reconcile.Reconciler;
import io.taskrelay.core.model.Interest;
import io.taskrelay.offset.CursorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Subscriber lifecycle: subscribe, connect, ack, disconnect, unsubscribe.
 * <p>
 * Operations on one subscriber id are serialized by that subscriber's record lock; different subscribers
 * never contend. The record lock is always taken before any lane lock. Only cursors are persisted; interests
 * and connection state live in memory.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class SubscriptionRegistry {
    private final CursorStore cursors;
    private final Dispatcher dispatcher;
    private final Reconciler reconciler;

    private final ConcurrentMap<String, SubscriberRecord> records = new ConcurrentHashMap<>();

    /**
     * Registers a subscriber or replaces its interest. Never touches its cursors. If the subscriber is
     * connected, delivery is re-scoped to the new interest.
     */
    public void subscribe(final String subscriberId, final Interest interest) {
        requireId(subscriberId);
        Objects.requireNonNull(interest, "interest");

        for (; ; ) {
            final SubscriberRecord record = records.computeIfAbsent(subscriberId, id -> new SubscriberRecord(id, interest));
            record.lock.lock();
            try {
                // lost a race with unsubscribe; start over with a fresh record
                if (record.removed) continue;

                final boolean changed = !record.interest.equals(interest);
                record.interest = interest;
                if (changed && record.session != null) {
                    reconciler.rescope(record.session, interest);
                }
                log.info("Subscriber {} subscribed to {}", subscriberId, interest);
                return;
            } finally {
                record.lock.unlock();
            }
        }
    }

    /**
     * Attaches a live sink. Any previous session of the subscriber is closed first; replay from the persisted
     * cursors starts before any live event is pushed.
     *
     * @throws UnknownSubscriberException if the subscriber is not subscribed
     */
    public void connect(final String subscriberId, final EventSink sink) {
        Objects.requireNonNull(sink, "sink");
        final SubscriberRecord record = existing(subscriberId);

        SubscriberSession replaced = null;
        record.lock.lock();
        try {
            if (record.removed) throw new UnknownSubscriberException(subscriberId);
            replaced = record.session;
            record.session = reconciler.reconcile(subscriberId, sink, record.interest,
                    (session, reason) -> expired(session, reason));
            record.state = ConnectionState.CONNECTED;
        } finally {
            record.lock.unlock();
        }

        if (replaced != null) {
            replaced.getSink().closed("replaced by a new connection");
        }
    }

    /**
     * Detaches the sink. Cursors are kept; in-flight deliveries are abandoned and redelivered on reconnect.
     *
     * @throws UnknownSubscriberException if the subscriber is not subscribed
     */
    public void disconnect(final String subscriberId) {
        final SubscriberRecord record = existing(subscriberId);
        record.lock.lock();
        try {
            if (record.removed) throw new UnknownSubscriberException(subscriberId);
            if (record.session != null) {
                dispatcher.unregister(record.session);
                record.session = null;
            }
            if (record.state == ConnectionState.CONNECTED) {
                log.info("Subscriber {} disconnected", subscriberId);
            }
            record.state = ConnectionState.DISCONNECTED;
        } finally {
            record.lock.unlock();
        }
    }

    /**
     * Disconnects only if the current session still delivers to {@code sink}; a connection that was already
     * replaced by a newer one leaves the subscriber alone.
     *
     * @return true if the subscriber was disconnected
     */
    public boolean disconnect(final String subscriberId, final EventSink sink) {
        final SubscriberRecord record = records.get(subscriberId);
        if (record == null) return false;

        record.lock.lock();
        try {
            if (record.removed || record.session == null || record.session.getSink() != sink) return false;
            dispatcher.unregister(record.session);
            record.session = null;
            record.state = ConnectionState.DISCONNECTED;
            log.info("Subscriber {} disconnected (connection closed)", subscriberId);
            return true;
        } finally {
            record.lock.unlock();
        }
    }

    /**
     * Records that the subscriber processed every event of the task up to {@code sequence}. Lower or equal
     * sequences and unknown subscribers are ignored.
     */
    public void ack(final String subscriberId, final String taskId, final long sequence) {
        Objects.requireNonNull(taskId, "taskId");
        if (subscriberId == null || sequence <= 0) return;

        final SubscriberRecord record = records.get(subscriberId);
        if (record == null) return;

        record.lock.lock();
        try {
            if (record.removed) return;
            cursors.advance(subscriberId, taskId, sequence);
            // a duplicate ack may still be the one releasing a redelivered event
            dispatcher.acked(subscriberId, taskId, sequence);
        } finally {
            record.lock.unlock();
        }
    }

    /**
     * Removes the subscriber and its cursors. No event is sent to it once this returns.
     *
     * @throws UnknownSubscriberException if the subscriber is not subscribed
     */
    public void unsubscribe(final String subscriberId) {
        final SubscriberRecord record = existing(subscriberId);
        record.lock.lock();
        try {
            if (record.removed) throw new UnknownSubscriberException(subscriberId);
            if (record.session != null) {
                dispatcher.unregister(record.session);
                record.session = null;
            }
            record.state = ConnectionState.DISCONNECTED;
            record.removed = true;
            records.remove(subscriberId, record);
            cursors.forget(subscriberId);
            log.info("Subscriber {} unsubscribed", subscriberId);
        } finally {
            record.lock.unlock();
        }
    }

    public ConnectionState state(final String subscriberId) {
        final SubscriberRecord record = existing(subscriberId);
        record.lock.lock();
        try {
            return record.state;
        } finally {
            record.lock.unlock();
        }
    }

    public Interest interest(final String subscriberId) {
        final SubscriberRecord record = existing(subscriberId);
        record.lock.lock();
        try {
            return record.interest;
        } finally {
            record.lock.unlock();
        }
    }

    public long cursor(final String subscriberId, final String taskId) {
        return cursors.fetch(subscriberId, taskId);
    }

    public Set<String> subscribers() {
        return Set.copyOf(records.keySet());
    }

    /*
     * Called by the dispatcher when a session gave up (e.g. undeliverable event). Stale sessions are ignored.
     */
    private void expired(final SubscriberSession session, final String reason) {
        final SubscriberRecord record = records.get(session.getSubscriberId());
        if (record == null) return;

        record.lock.lock();
        try {
            if (record.removed || record.session != session) return;
            dispatcher.unregister(session);
            record.session = null;
            record.state = ConnectionState.DISCONNECTED;
        } finally {
            record.lock.unlock();
        }
        log.warn("Subscriber {} force-disconnected: {}", session.getSubscriberId(), reason);
        session.getSink().closed(reason);
    }

    private SubscriberRecord existing(final String subscriberId) {
        requireId(subscriberId);
        final SubscriberRecord record = records.get(subscriberId);
        if (record == null) throw new UnknownSubscriberException(subscriberId);
        return record;
    }

    private static void requireId(final String subscriberId) {
        Objects.requireNonNull(subscriberId, "subscriberId");
        if (subscriberId.isEmpty()) throw new IllegalArgumentException("subscriberId must not be empty");
    }
}
