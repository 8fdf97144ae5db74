package io.taskrelay.broker.delivery;

import io.taskrelay.core.model.MissedEvents;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Logs delivery anomalies and keeps the most recent ones in memory for inspection.
 */
@Slf4j
public final class LoggingDeliveryReporter implements DeliveryReporter {
    private final int capacity;
    private final Deque<UndeliverableEvent> undeliverable = new ArrayDeque<>();
    private final Deque<MissedEvents> missed = new ArrayDeque<>();

    public LoggingDeliveryReporter() {
        this(256);
    }

    public LoggingDeliveryReporter(final int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
    }

    @Override
    public void undeliverable(final UndeliverableEvent report) {
        log.error("Undeliverable event {} for subscriber {} after {} attempt(s): {}",
                report.idempotencyKey(), report.subscriberId(), report.attempts(), report.lastError());
        synchronized (undeliverable) {
            if (undeliverable.size() == capacity) undeliverable.removeFirst();
            undeliverable.addLast(report);
        }
    }

    @Override
    public void missedEvents(final MissedEvents notice) {
        log.warn("Subscriber {} missed {} event(s) of task {} (cursor {}, lowest retained {})",
                notice.subscriberId(), notice.missedCount(), notice.taskId(),
                notice.previousCursor(), notice.lowestRetained());
        synchronized (missed) {
            if (missed.size() == capacity) missed.removeFirst();
            missed.addLast(notice);
        }
    }

    public List<UndeliverableEvent> recentUndeliverable() {
        synchronized (undeliverable) {
            return List.copyOf(undeliverable);
        }
    }

    public List<MissedEvents> recentMissedEvents() {
        synchronized (missed) {
            return List.copyOf(missed);
        }
    }
}
