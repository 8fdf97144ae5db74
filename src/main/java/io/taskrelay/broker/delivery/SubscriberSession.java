package io.taskrelay.broker.delivery;

import io.taskrelay.core.model.Interest;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One connection of a subscriber: its sink, its current interest and one {@link DeliveryLane} per partition.
 * A reconnect creates a new session; the old one is closed and never sends again.
 */
@Slf4j
public final class SubscriberSession {
    @Getter private final String subscriberId;
    @Getter private final EventSink sink;
    @Getter private volatile Interest interest;

    private final RetentionGapHandler gapHandler;
    private final SessionExpiry onExpire;
    private final ConcurrentMap<String, DeliveryLane> lanes = new ConcurrentHashMap<>();
    private final AtomicBoolean expired = new AtomicBoolean();

    private volatile boolean closed;

    SubscriberSession(final String subscriberId,
                      final EventSink sink,
                      final Interest interest,
                      final RetentionGapHandler gapHandler,
                      final SessionExpiry onExpire) {
        this.subscriberId = Objects.requireNonNull(subscriberId, "subscriberId");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.interest = Objects.requireNonNull(interest, "interest");
        this.gapHandler = Objects.requireNonNull(gapHandler, "gapHandler");
        this.onExpire = Objects.requireNonNull(onExpire, "onExpire");
    }

    public boolean isClosed() {
        return closed;
    }

    public void setInterest(final Interest interest) {
        this.interest = Objects.requireNonNull(interest, "interest");
    }

    /** Lane for a partition, or null if none is open. */
    public DeliveryLane lane(final String taskId) {
        return lanes.get(taskId);
    }

    public Map<String, DeliveryLane> lanes() {
        return Map.copyOf(lanes);
    }

    RetentionGapHandler gapHandler() {
        return gapHandler;
    }

    ConcurrentMap<String, DeliveryLane> laneMap() {
        return lanes;
    }

    void expire(final String reason) {
        if (!expired.compareAndSet(false, true)) return;
        log.warn("Session of subscriber {} expired: {}", subscriberId, reason);
        try {
            onExpire.expire(this, reason);
        } catch (final RuntimeException e) {
            log.error("Expiry handler failed for subscriber {}", subscriberId, e);
        }
    }

    /**
     * Closes every lane. No event is sent through this session once this returns.
     */
    void close() {
        closed = true;
        for (final DeliveryLane lane : lanes.values()) {
            lane.close();
        }
    }
}
