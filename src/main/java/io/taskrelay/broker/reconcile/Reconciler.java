package io.taskrelay.broker.reconcile;

import io.taskrelay.broker.delivery.DeliveryLane;
import io.taskrelay.broker.delivery.DeliveryReporter;
import io.taskrelay.broker.delivery.Dispatcher;
import io.taskrelay.broker.delivery.EventSink;
import io.taskrelay.broker.delivery.RetentionGapHandler;
import io.taskrelay.broker.delivery.SessionExpiry;
import io.taskrelay.broker.delivery.SubscriberSession;
import io.taskrelay.core.model.Interest;
import io.taskrelay.core.model.MissedEvents;
import io.taskrelay.ledger.log.EventLog;
import io.taskrelay.ledger.log.RetentionGapException;
import io.taskrelay.offset.CursorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;

/**
 * Brings a (re)connecting subscriber from its persisted cursors up to the live head.
 * <p>
 * The session is registered with the {@link Dispatcher} before partitions are enumerated, so a partition
 * created in between still gets a lane through the dispatcher's append path. Each lane replays up to the head
 * seen when it opened and only then accepts live wake-ups.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class Reconciler implements RetentionGapHandler {
    private final EventLog eventLog;
    private final Dispatcher dispatcher;
    private final CursorStore cursors;
    private final DeliveryReporter reporter;

    public SubscriberSession reconcile(final String subscriberId,
                                       final EventSink sink,
                                       final Interest interest,
                                       final SessionExpiry onExpire) {
        final SubscriberSession session = dispatcher.register(subscriberId, sink, interest, this, onExpire);

        int behind = 0;
        final Set<String> partitions = partitionsOf(interest);
        for (final String taskId : partitions) {
            final DeliveryLane lane = dispatcher.openLane(session, taskId);
            if (!lane.isCaughtUp() && lane.position() < lane.getReplayTarget()) behind++;
        }
        log.info("Subscriber {} connected: {} partition(s), {} with events to replay", subscriberId, partitions.size(), behind);
        return session;
    }

    /**
     * Applies a changed interest to a live session: dropped partitions stop, new ones start replaying.
     */
    public void rescope(final SubscriberSession session, final Interest interest) {
        session.setInterest(interest);
        for (final String taskId : session.lanes().keySet()) {
            if (!interest.includes(taskId)) dispatcher.closeLane(session, taskId);
        }
        for (final String taskId : partitionsOf(interest)) {
            dispatcher.openLane(session, taskId);
        }
    }

    /**
     * Signals the loss, moves the cursor just below the lowest retained event and resumes from there.
     */
    @Override
    public long onRetentionGap(final SubscriberSession session, final RetentionGapException gap, final long previousCursor) {
        final long resumeAt = gap.getLowestRetained() - 1;
        final MissedEvents notice = new MissedEvents(session.getSubscriberId(), gap.getTaskId(), previousCursor, gap.getLowestRetained());

        reporter.missedEvents(notice);
        try {
            session.getSink().missedEvents(notice);
        } catch (final RuntimeException e) {
            log.warn("Could not notify subscriber {} of missed events on {}", session.getSubscriberId(), gap.getTaskId(), e);
        }
        cursors.advance(session.getSubscriberId(), gap.getTaskId(), resumeAt);
        return resumeAt;
    }

    private Set<String> partitionsOf(final Interest interest) {
        return interest.isAllTasks() ? Set.copyOf(eventLog.partitions()) : interest.taskIds();
    }
}
