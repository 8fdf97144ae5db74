package io.taskrelay.broker.delivery;

import io.taskrelay.core.model.TaskEvent;
import io.taskrelay.ledger.log.RetentionGapException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ack-gated delivery of one partition to one subscriber session.
 * <p>
 * The lane keeps at most one event in flight. The next event is sent only after the subscriber acknowledged
 * the previous one, so a partition is always delivered in sequence order. Waiting for an ack or a backoff
 * never occupies a thread: sends, timeouts and retries are tasks on the dispatcher's scheduler, and every
 * callback carries a generation number so stale timers and futures are ignored.
 * </p>
 * <p>
 * A lane starts in replay mode at the subscriber's cursor and becomes caught up once its position reaches
 * the head observed when it was opened. Only caught-up lanes are woken by append notifications; a replaying
 * lane keeps paging on its own after each ack.
 * </p>
 */
@Slf4j
public final class DeliveryLane {
    private final Dispatcher dispatcher;
    private final SubscriberSession session;
    @Getter private final String taskId;
    @Getter private final long replayTarget;

    private final AtomicBoolean pumpScheduled = new AtomicBoolean();
    private volatile boolean caughtUp;

    // guarded by this
    private long position;
    private final ArrayDeque<TaskEvent> pending = new ArrayDeque<>();
    private DeliveryAttempt inFlight;
    private ScheduledFuture<?> timer;
    private long generation;
    private boolean closed;
    private int readFailures;
    private boolean readBackoff;

    DeliveryLane(final Dispatcher dispatcher,
                 final SubscriberSession session,
                 final String taskId,
                 final long position,
                 final long replayTarget) {
        this.dispatcher = dispatcher;
        this.session = session;
        this.taskId = taskId;
        this.position = position;
        this.replayTarget = replayTarget;
    }

    public boolean isCaughtUp() {
        return caughtUp;
    }

    /** Highest sequence acknowledged (or skipped over a retention gap) through this lane. */
    public synchronized long position() {
        return position;
    }

    public synchronized DeliveryAttempt inFlight() {
        return inFlight;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    void start() {
        schedulePump();
    }

    /** New events were appended to the partition. */
    void signal() {
        if (caughtUp) schedulePump();
    }

    void acked(final long sequence) {
        synchronized (this) {
            if (closed || sequence <= position) return;
            position = sequence;
            while (!pending.isEmpty() && pending.peekFirst().sequence() <= sequence) {
                pending.removeFirst();
            }
            if (inFlight != null && inFlight.event().sequence() <= sequence) {
                cancelTimer();
                inFlight = null;
                generation++;
            }
        }
        schedulePump();
    }

    synchronized void close() {
        if (closed) return;
        closed = true;
        cancelTimer();
        inFlight = null;
        pending.clear();
        generation++;
    }

    private void schedulePump() {
        if (!pumpScheduled.compareAndSet(false, true)) return;
        try {
            dispatcher.scheduler().execute(this::pump);
        } catch (final RejectedExecutionException e) {
            pumpScheduled.set(false);
            log.debug("Dispatcher stopped, lane {}/{} not pumped", session.getSubscriberId(), taskId);
        }
    }

    private void pump() {
        pumpScheduled.set(false);
        synchronized (this) {
            if (closed || inFlight != null || readBackoff) return;
            try {
                fill();
                readFailures = 0;
            } catch (final RuntimeException e) {
                readFailed(e);
                return;
            }
            if (pending.isEmpty()) return;

            inFlight = DeliveryAttempt.first(pending.peekFirst(), session.getSubscriberId(), dispatcher.clock().instant());
            send();
        }
    }

    private void fill() {
        if (!pending.isEmpty()) return;
        if (!caughtUp && position >= replayTarget) {
            caughtUp = true;
            log.debug("Subscriber {} caught up on task {} at {}", session.getSubscriberId(), taskId, position);
        }

        List<TaskEvent> page;
        for (; ; ) {
            try {
                // One record at a time after a failed read, so the unreadable one is isolated.
                page = dispatcher.eventLog().read(taskId, position, readFailures > 0 ? 1 : dispatcher.pageSize());
                break;
            } catch (final RetentionGapException gap) {
                final long resumeAt = session.gapHandler().onRetentionGap(session, gap, position);
                if (resumeAt <= position) {
                    throw new IllegalStateException("Gap handler did not move lane " + taskId + " past " + position);
                }
                position = resumeAt;
            }
        }
        for (final TaskEvent e : page) {
            if (e.sequence() > position) pending.addLast(e);
        }
    }

    // caller holds the lock
    private void send() {
        final long gen = ++generation;
        final DeliveryAttempt attempt = inFlight;

        CompletableFuture<Void> sent;
        try {
            sent = session.getSink().send(attempt.event());
            if (sent == null) sent = CompletableFuture.completedFuture(null);
        } catch (final RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }

        final Duration ackTimeout = dispatcher.ackTimeout();
        timer = schedule(() -> failed(gen, new SinkDeliveryException(
                "no ack for " + attempt.event().idempotencyKey() + " within " + ackTimeout.toMillis() + " ms")), ackTimeout);

        sent.whenComplete((v, ex) -> {
            if (ex != null) failed(gen, ex);
        });
    }

    private synchronized void retry(final long gen) {
        if (closed || gen != generation || inFlight == null) return;
        send();
    }

    private synchronized void failed(final long gen, final Throwable cause) {
        if (closed || gen != generation || inFlight == null) return;
        cancelTimer();

        final DeliveryAttempt attempt = inFlight;
        final Throwable root = cause instanceof CompletionException && cause.getCause() != null ? cause.getCause() : cause;
        final RetryPolicy policy = dispatcher.retryPolicy();

        if (!policy.shouldRetry(attempt.attemptCount())) {
            giveUp(new UndeliverableEvent(session.getSubscriberId(), attempt.event(), attempt.attemptCount(),
                    String.valueOf(root.getMessage()), dispatcher.clock().instant()));
            return;
        }

        final Duration delay = policy.delayAfter(attempt.attemptCount());
        log.warn("Delivery of {} to {} failed (attempt {}/{}), retrying in {} ms: {}",
                attempt.event().idempotencyKey(), session.getSubscriberId(),
                attempt.attemptCount(), policy.getMaxAttempts(), delay.toMillis(), root.getMessage());

        inFlight = attempt.next(dispatcher.clock().instant().plus(delay));
        final long retryGen = ++generation;
        timer = schedule(() -> retry(retryGen), delay);
    }

    // caller holds the lock
    private void readFailed(final RuntimeException cause) {
        readFailures++;
        final long stuckAt = position + 1L;
        final RetryPolicy policy = dispatcher.retryPolicy();

        if (!policy.shouldRetry(readFailures)) {
            log.error("Giving up reading {}#{} for subscriber {}", taskId, stuckAt, session.getSubscriberId(), cause);
            giveUp(new UndeliverableEvent(session.getSubscriberId(), taskId, stuckAt, null, readFailures,
                    String.valueOf(cause.getMessage()), dispatcher.clock().instant()));
            return;
        }

        final Duration delay = policy.delayAfter(readFailures);
        log.error("Reading {}#{} for subscriber {} failed (attempt {}/{}), retrying in {} ms",
                taskId, stuckAt, session.getSubscriberId(), readFailures, policy.getMaxAttempts(), delay.toMillis(), cause);
        readBackoff = true;
        timer = schedule(this::endReadBackoff, delay);
    }

    private void endReadBackoff() {
        synchronized (this) {
            if (closed) return;
            readBackoff = false;
            timer = null;
        }
        schedulePump();
    }

    // caller holds the lock
    private void giveUp(final UndeliverableEvent report) {
        closed = true;
        cancelTimer();
        inFlight = null;
        pending.clear();
        generation++;

        dispatcher.reporter().undeliverable(report);

        final String reason = "event " + report.idempotencyKey() + " undeliverable after " + report.attempts() + " attempt(s)";
        try {
            dispatcher.scheduler().execute(() -> session.expire(reason));
        } catch (final RejectedExecutionException e) {
            log.debug("Dispatcher stopped before session {} could expire", session.getSubscriberId());
        }
    }

    private ScheduledFuture<?> schedule(final Runnable task, final Duration delay) {
        try {
            return dispatcher.scheduler().schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final RejectedExecutionException e) {
            log.debug("Dispatcher stopped, dropping timer for lane {}/{}", session.getSubscriberId(), taskId);
            return null;
        }
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }
}
