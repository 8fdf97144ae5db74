package io.taskrelay;

import io.taskrelay.broker.delivery.Dispatcher;
import io.taskrelay.broker.delivery.LoggingDeliveryReporter;
import io.taskrelay.broker.reconcile.Reconciler;
import io.taskrelay.config.impl.RelayConfig;
import io.taskrelay.ledger.log.SegmentedEventLog;
import io.taskrelay.offset.DurableCursorStore;
import io.taskrelay.publisher.Publisher;
import io.taskrelay.registry.SubscriptionRegistry;
import io.taskrelay.retention.RetentionManager;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Wires the relay components for one data directory. Closing it stops delivery first and the log last.
 */
@Slf4j
@Getter
public final class TaskRelay implements AutoCloseable {
    private final SegmentedEventLog eventLog;
    private final DurableCursorStore cursors;
    private final LoggingDeliveryReporter reporter;
    private final Dispatcher dispatcher;
    private final Reconciler reconciler;
    private final SubscriptionRegistry registry;
    private final Publisher publisher;
    private final RetentionManager retention;

    private TaskRelay(final RelayConfig cfg, final SegmentedEventLog eventLog, final DurableCursorStore cursors) {
        this.eventLog = eventLog;
        this.cursors = cursors;
        this.reporter = new LoggingDeliveryReporter();
        this.dispatcher = new Dispatcher(eventLog, cursors, cfg.getDispatch(), reporter);
        this.reconciler = new Reconciler(eventLog, dispatcher, cursors, reporter);
        this.registry = new SubscriptionRegistry(cursors, dispatcher, reconciler);
        this.publisher = new Publisher(eventLog);
        this.retention = new RetentionManager(eventLog,
                cfg.getRetention().getMaxAge(),
                cfg.getRetention().getMaxBytesPerPartition(),
                cfg.getRetention().getSweepInterval());

        eventLog.addAppendListener(dispatcher);
    }

    public static TaskRelay open(final RelayConfig cfg) throws IOException {
        final SegmentedEventLog eventLog = new SegmentedEventLog(
                cfg.getLedger().getPath(), cfg.getLedger().getSegmentBytes(), cfg.getLedger().isFsync());
        final DurableCursorStore cursors;
        try {
            cursors = new DurableCursorStore(cfg.getCursorsPath());
        } catch (final IOException | RuntimeException e) {
            eventLog.close();
            throw e;
        }

        final TaskRelay relay = new TaskRelay(cfg, eventLog, cursors);
        relay.retention.start();
        log.info("Task relay opened (ledger {}, cursors {})", cfg.getLedger().getPath(), cfg.getCursorsPath());
        return relay;
    }

    @Override
    public void close() {
        retention.close();
        dispatcher.close();
        cursors.close();
        eventLog.close();
        log.info("Task relay closed");
    }
}
