package io.taskrelay.test;

import io.taskrelay.broker.delivery.EventSink;
import io.taskrelay.broker.delivery.SinkDeliveryException;
import io.taskrelay.core.model.MissedEvents;
import io.taskrelay.core.model.TaskEvent;
import io.taskrelay.registry.SubscriptionRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Sink that records everything it is given. Optionally acks each event back through the registry
 * (asynchronously, as a real client would) or fails every send.
 */
public final class RecordingSink implements EventSink {
    private final BlockingQueue<TaskEvent> events = new LinkedBlockingQueue<>();
    private final BlockingQueue<MissedEvents> missed = new LinkedBlockingQueue<>();
    private final BlockingQueue<String> closed = new LinkedBlockingQueue<>();

    private final SubscriptionRegistry ackTo;
    private final String subscriberId;
    private volatile boolean failing;

    private RecordingSink(final SubscriptionRegistry ackTo, final String subscriberId) {
        this.ackTo = ackTo;
        this.subscriberId = subscriberId;
    }

    /** Records events; the test acks by hand. */
    public static RecordingSink manual() {
        return new RecordingSink(null, null);
    }

    /** Acks every received event. */
    public static RecordingSink autoAck(final SubscriptionRegistry registry, final String subscriberId) {
        return new RecordingSink(registry, subscriberId);
    }

    public RecordingSink failing() {
        this.failing = true;
        return this;
    }

    @Override
    public CompletableFuture<Void> send(final TaskEvent event) {
        if (failing) {
            return CompletableFuture.failedFuture(new SinkDeliveryException("sink down"));
        }
        events.add(event);
        if (ackTo != null) {
            CompletableFuture.runAsync(() -> ackTo.ack(subscriberId, event.taskId(), event.sequence()));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void missedEvents(final MissedEvents notice) {
        missed.add(notice);
    }

    @Override
    public void closed(final String reason) {
        closed.add(reason);
    }

    public TaskEvent next() throws InterruptedException {
        final TaskEvent e = events.poll(5, TimeUnit.SECONDS);
        if (e == null) throw new AssertionError("no event delivered within 5s");
        return e;
    }

    /** Next {@code n} delivered sequences, in delivery order. */
    public List<Long> nextSequences(final int n) throws InterruptedException {
        final List<Long> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) out.add(next().sequence());
        return out;
    }

    /** Null if nothing arrives within {@code millis}. */
    public TaskEvent poll(final long millis) throws InterruptedException {
        return events.poll(millis, TimeUnit.MILLISECONDS);
    }

    public MissedEvents nextMissed() throws InterruptedException {
        final MissedEvents m = missed.poll(5, TimeUnit.SECONDS);
        if (m == null) throw new AssertionError("no missed-events notice within 5s");
        return m;
    }

    public String awaitClosed() throws InterruptedException {
        final String reason = closed.poll(5, TimeUnit.SECONDS);
        if (reason == null) throw new AssertionError("session not closed within 5s");
        return reason;
    }
}
