package io.taskrelay.broker.delivery;

import io.taskrelay.config.impl.DispatchSettings;
import io.taskrelay.core.model.EventType;
import io.taskrelay.core.model.Interest;
import io.taskrelay.core.model.TaskEvent;
import io.taskrelay.ledger.log.AppendListener;
import io.taskrelay.ledger.log.EventLog;
import io.taskrelay.ledger.log.PartitionUnavailableException;
import io.taskrelay.ledger.log.RetentionGapException;
import io.taskrelay.ledger.log.SegmentedEventLog;
import io.taskrelay.offset.DurableCursorStore;
import io.taskrelay.test.RecordingSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static io.taskrelay.test.Fixtures.bytes;
import static org.junit.jupiter.api.Assertions.*;

final class DispatcherTest {

    @TempDir
    Path dir;

    private SegmentedEventLog eventLog;
    private DurableCursorStore cursors;
    private LoggingDeliveryReporter reporter;
    private Dispatcher dispatcher;

    private final List<String> expired = new ArrayList<>();

    private final RetentionGapHandler noGaps = (session, gap, previous) -> {
        throw new AssertionError("unexpected gap " + gap.getMessage());
    };

    @BeforeEach
    void setUp() throws Exception {
        eventLog = new SegmentedEventLog(dir.resolve("ledger"), 64 * 1024, false);
        cursors = new DurableCursorStore(dir.resolve("cursors"));
        reporter = new LoggingDeliveryReporter(4);
        final DispatchSettings settings = new DispatchSettings(2, 2, Duration.ofMillis(200), Duration.ofMillis(5), Duration.ofMillis(20), 2);
        dispatcher = new Dispatcher(eventLog, cursors, settings, reporter,
                new RetryPolicy(Duration.ofMillis(5), Duration.ofMillis(20), 2), Clock.systemUTC());
        eventLog.addAppendListener(dispatcher);
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
        cursors.close();
        eventLog.close();
    }

    private SubscriberSession register(final String id, final EventSink sink, final Interest interest) {
        return dispatcher.register(id, sink, interest, noGaps, (session, reason) -> {
            synchronized (expired) {
                expired.add(session.getSubscriberId() + ": " + reason);
            }
        });
    }

    @Test
    void replayPagesThroughTheBacklogOneAckAtATime() throws Exception {
        for (int i = 0; i < 5; i++) eventLog.append("T", EventType.UPDATED, bytes("u"));
        cursors.advance("S", "T", 1L);

        final RecordingSink sink = RecordingSink.manual();
        final SubscriberSession session = register("S", sink, Interest.of("T"));
        final DeliveryLane lane = dispatcher.openLane(session, "T");

        assertEquals(1L, lane.position());
        assertEquals(5L, lane.getReplayTarget());

        // Page size is 2, so the lane has to read three times.
        for (long seq = 2; seq <= 5; seq++) {
            assertEquals(seq, sink.next().sequence());
            assertEquals(seq, lane.inFlight().event().sequence());
            dispatcher.acked("S", "T", seq);
        }
        assertNull(sink.poll(200));
    }

    @Test
    void openLaneIsIdempotent() {
        final SubscriberSession session = register("S", RecordingSink.manual(), Interest.of("T"));
        assertSame(dispatcher.openLane(session, "T"), dispatcher.openLane(session, "T"));
        assertEquals(1, session.lanes().size());
    }

    @Test
    void closedLaneNeverSendsAgain() throws Exception {
        eventLog.append("T", EventType.CREATED, bytes("c"));
        final RecordingSink sink = RecordingSink.manual();
        final SubscriberSession session = register("S", sink, Interest.of("T"));
        final DeliveryLane lane = dispatcher.openLane(session, "T");
        assertEquals(1L, sink.next().sequence());

        dispatcher.closeLane(session, "T");
        assertTrue(lane.isClosed());
        assertNull(lane.inFlight());

        eventLog.append("T", EventType.UPDATED, bytes("u"));
        // the append opens a fresh lane at the stored cursor, which never moved
        final DeliveryLane reopened = session.lane("T");
        assertNotSame(lane, reopened);
        assertEquals(1L, sink.next().sequence());
        assertTrue(lane.isClosed());
    }

    @Test
    void unregisteredSessionGetsNothing() throws Exception {
        final RecordingSink sink = RecordingSink.manual();
        final SubscriberSession session = register("S", sink, Interest.all());
        dispatcher.unregister(session);

        eventLog.append("T", EventType.CREATED, bytes("c"));
        assertNull(sink.poll(300));
        assertTrue(session.isClosed());
        assertTrue(dispatcher.session("S").isEmpty());
    }

    @Test
    void sendFailuresExhaustAttemptsAndExpireTheSession() throws Exception {
        eventLog.append("T", EventType.CREATED, bytes("c"));
        final CountDownLatch reported = new CountDownLatch(1);
        final RecordingSink broken = RecordingSink.manual().failing();

        dispatcher.register("S", broken, Interest.of("T"), noGaps, (session, reason) -> reported.countDown());
        dispatcher.openLane(dispatcher.session("S").orElseThrow(), "T");

        assertTrue(reported.await(5, TimeUnit.SECONDS));
        final UndeliverableEvent report = reporter.recentUndeliverable().get(0);
        assertEquals("T#1", report.event().idempotencyKey());
        assertEquals(2, report.attempts());
        assertEquals("sink down", report.lastError());
        assertEquals(0L, cursors.fetch("S", "T"));
        assertEquals(1L, eventLog.head("T"));
    }

    @Test
    void sinkThatThrowsCountsAsFailedAttempt() throws Exception {
        eventLog.append("T", EventType.CREATED, bytes("c"));
        final CountDownLatch reported = new CountDownLatch(1);
        final EventSink throwing = new EventSink() {
            @Override
            public java.util.concurrent.CompletableFuture<Void> send(final io.taskrelay.core.model.TaskEvent event) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void missedEvents(final io.taskrelay.core.model.MissedEvents notice) {
            }
        };

        final SubscriberSession session = dispatcher.register("S", throwing, Interest.of("T"), noGaps,
                (s, reason) -> reported.countDown());
        dispatcher.openLane(session, "T");

        assertTrue(reported.await(5, TimeUnit.SECONDS));
        assertEquals("boom", reporter.recentUndeliverable().get(0).lastError());
    }

    @Test
    void ackForUnknownSubscriberOrTaskIsIgnored() {
        register("S", RecordingSink.manual(), Interest.of("T"));
        dispatcher.acked("nobody", "T", 3L);
        dispatcher.acked("S", "other", 3L);
        assertTrue(dispatcher.session("S").orElseThrow().lanes().isEmpty());
    }

    @Test
    void unreadableRecordIsReportedAfterTheGoodOnesAheadOfIt() throws Exception {
        for (int i = 0; i < 5; i++) eventLog.append("T", EventType.UPDATED, bytes("u"));

        final DispatchSettings settings = new DispatchSettings(1, 2, Duration.ofSeconds(5), Duration.ofMillis(5), Duration.ofMillis(20), 2);
        final CountDownLatch expiredSession = new CountDownLatch(1);
        final RecordingSink sink = RecordingSink.manual();

        try (final Dispatcher corrupt = new Dispatcher(new CorruptRecordLog(eventLog, 4L), cursors, settings, reporter)) {
            final SubscriberSession session = corrupt.register("S", sink, Interest.of("T"), noGaps,
                    (s, reason) -> expiredSession.countDown());
            corrupt.openLane(session, "T");

            for (long seq = 1; seq <= 3; seq++) {
                assertEquals(seq, sink.next().sequence());
                corrupt.acked("S", "T", seq);
            }

            assertTrue(expiredSession.await(5, TimeUnit.SECONDS));
            assertNull(sink.poll(100));

            final UndeliverableEvent report = reporter.recentUndeliverable().get(0);
            assertEquals("T#4", report.idempotencyKey());
            assertNull(report.event());
            assertEquals(2, report.attempts());
            assertEquals("corrupt record 4", report.lastError());
        }
    }

    /**
     * Fails every read whose range covers one sequence, as a record with a broken body would.
     */
    private static final class CorruptRecordLog implements EventLog {
        private final EventLog delegate;
        private final long corrupt;

        CorruptRecordLog(final EventLog delegate, final long corrupt) {
            this.delegate = delegate;
            this.corrupt = corrupt;
        }

        @Override
        public long append(final String taskId, final EventType type, final byte[] payload) throws PartitionUnavailableException {
            return delegate.append(taskId, type, payload);
        }

        @Override
        public List<TaskEvent> read(final String taskId, final long fromSequenceExclusive, final int maxCount) throws RetentionGapException {
            if (fromSequenceExclusive < corrupt && corrupt <= fromSequenceExclusive + maxCount) {
                throw new IllegalStateException("corrupt record " + corrupt);
            }
            return delegate.read(taskId, fromSequenceExclusive, maxCount);
        }

        @Override
        public long head(final String taskId) {
            return delegate.head(taskId);
        }

        @Override
        public long retainedFloor(final String taskId) {
            return delegate.retainedFloor(taskId);
        }

        @Override
        public Set<String> partitions() {
            return delegate.partitions();
        }

        @Override
        public void addAppendListener(final AppendListener listener) {
            delegate.addAppendListener(listener);
        }

        @Override
        public int enforceRetention(final Duration maxAge, final long maxBytesPerPartition) {
            return delegate.enforceRetention(maxAge, maxBytesPerPartition);
        }

        @Override
        public void close() {
        }
    }
}
