package io.taskrelay.broker.delivery;

import io.taskrelay.config.impl.DispatchSettings;
import io.taskrelay.core.model.Interest;
import io.taskrelay.ledger.log.AppendListener;
import io.taskrelay.ledger.log.EventLog;
import io.taskrelay.offset.CursorStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pushes events from the log to connected subscribers.
 * <p>
 * Holds the live {@link SubscriberSession} of every connected subscriber and drives their lanes on a shared
 * scheduled pool. Appends wake caught-up lanes; a partition seen for the first time gets a lane in every
 * session whose interest covers it.
 * </p>
 */
@Slf4j
public final class Dispatcher implements AppendListener, AutoCloseable {
    private final EventLog eventLog;
    private final CursorStore cursors;
    private final DeliveryReporter reporter;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final int pageSize;
    private final Duration ackTimeout;

    private final ScheduledThreadPoolExecutor scheduler;
    private final ConcurrentMap<String, SubscriberSession> sessions = new ConcurrentHashMap<>();

    public Dispatcher(final EventLog eventLog,
                      final CursorStore cursors,
                      final DispatchSettings settings,
                      final DeliveryReporter reporter) {
        this(eventLog, cursors, settings, reporter, RetryPolicy.from(settings), Clock.systemUTC());
    }

    public Dispatcher(final EventLog eventLog,
                      final CursorStore cursors,
                      final DispatchSettings settings,
                      final DeliveryReporter reporter,
                      final RetryPolicy retryPolicy,
                      final Clock clock) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.cursors = Objects.requireNonNull(cursors, "cursors");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (settings.getPageSize() <= 0) throw new IllegalArgumentException("pageSize must be > 0");
        this.pageSize = settings.getPageSize();
        this.ackTimeout = settings.getAckTimeout();

        final AtomicInteger threadIds = new AtomicInteger();
        this.scheduler = new ScheduledThreadPoolExecutor(Math.max(1, settings.getWorkerThreads()), r -> {
            final Thread t = new Thread(r, "relay-dispatch-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.scheduler.setRemoveOnCancelPolicy(true);
    }

    /**
     * Installs a new session for the subscriber, closing the one it replaces. No lanes are opened yet.
     */
    public SubscriberSession register(final String subscriberId,
                                      final EventSink sink,
                                      final Interest interest,
                                      final RetentionGapHandler gapHandler,
                                      final SessionExpiry onExpire) {
        final SubscriberSession session = new SubscriberSession(subscriberId, sink, interest, gapHandler, onExpire);
        final SubscriberSession previous = sessions.put(subscriberId, session);
        if (previous != null) {
            previous.close();
            log.info("Replaced session of subscriber {}", subscriberId);
        }
        return session;
    }

    /**
     * Opens (or returns the existing) lane for a partition, positioned at the persisted cursor and replaying
     * up to the current head. Returns a closed lane if the session is already closed.
     */
    public DeliveryLane openLane(final SubscriberSession session, final String taskId) {
        final boolean[] created = new boolean[1];
        final DeliveryLane lane = session.laneMap().computeIfAbsent(taskId, id -> {
            created[0] = true;
            return new DeliveryLane(this, session, id,
                    cursors.fetch(session.getSubscriberId(), id), eventLog.head(id));
        });

        if (session.isClosed()) {
            lane.close();
            return lane;
        }
        if (created[0]) {
            log.debug("Opened lane {}/{} at {} (replay to {})",
                    session.getSubscriberId(), taskId, lane.position(), lane.getReplayTarget());
            lane.start();
        }
        return lane;
    }

    /**
     * Stops delivery of one partition to the session. No send happens on that lane once this returns.
     */
    public void closeLane(final SubscriberSession session, final String taskId) {
        final DeliveryLane lane = session.laneMap().remove(taskId);
        if (lane != null) lane.close();
    }

    /**
     * Removes the session if it is still the subscriber's current one and closes it.
     */
    public void unregister(final SubscriberSession session) {
        sessions.remove(session.getSubscriberId(), session);
        session.close();
    }

    public Optional<SubscriberSession> session(final String subscriberId) {
        return Optional.ofNullable(sessions.get(subscriberId));
    }

    /**
     * Releases the in-flight delivery of the subscriber's lane for the task, if any.
     */
    public void acked(final String subscriberId, final String taskId, final long sequence) {
        final SubscriberSession session = sessions.get(subscriberId);
        if (session == null) return;
        final DeliveryLane lane = session.lane(taskId);
        if (lane != null) lane.acked(sequence);
    }

    @Override
    public void onAppend(final String taskId, final long sequence) {
        for (final SubscriberSession session : sessions.values()) {
            if (session.isClosed() || !session.getInterest().includes(taskId)) continue;

            final DeliveryLane lane = session.lane(taskId);
            if (lane == null) {
                openLane(session, taskId);
            } else {
                lane.signal();
            }
        }
    }

    EventLog eventLog() {
        return eventLog;
    }

    DeliveryReporter reporter() {
        return reporter;
    }

    RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    Clock clock() {
        return clock;
    }

    int pageSize() {
        return pageSize;
    }

    Duration ackTimeout() {
        return ackTimeout;
    }

    ScheduledExecutorService scheduler() {
        return scheduler;
    }

    @Override
    public void close() {
        for (final SubscriberSession session : sessions.values()) {
            session.close();
        }
        sessions.clear();
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Dispatch workers did not terminate within 5s");
            }
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
