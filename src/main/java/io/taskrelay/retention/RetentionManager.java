package io.taskrelay.retention;

import io.taskrelay.ledger.log.EventLog;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background job that periodically:
 * - Deletes sealed partition segments older than `maxAge`
 * - Keeps each partition within `maxBytesPerPartition` by oldest-first deletion
 * <p>
 * Readers that later ask for the deleted range get a retention gap, never silently shifted data.
 * </p>
 */
@Slf4j
public final class RetentionManager implements AutoCloseable {
    private final EventLog eventLog;
    private final Duration maxAge;
    private final long maxBytesPerPartition;
    private final Duration sweepInterval;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "retention-sweeper");
        t.setDaemon(true);
        return t;
    });

    public RetentionManager(final EventLog eventLog,
                            final Duration maxAge,
                            final long maxBytesPerPartition,
                            final Duration sweepInterval) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.maxAge = Objects.requireNonNull(maxAge, "maxAge");
        this.maxBytesPerPartition = maxBytesPerPartition;
        this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval");
    }

    public void start() {
        final long periodMillis = sweepInterval.toMillis();
        scheduler.scheduleAtFixedRate(this::sweep, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info("Retention sweeper started (maxAge={}, maxBytesPerPartition={}, every {})",
                maxAge, maxBytesPerPartition, sweepInterval);
    }

    /**
     * Runs one pass immediately. Returns the number of segments deleted.
     */
    public int sweep() {
        try {
            final int deleted = eventLog.enforceRetention(maxAge, maxBytesPerPartition);
            if (deleted > 0) {
                log.info("Retention sweep deleted {} segment(s)", deleted);
            }
            return deleted;
        } catch (final RuntimeException e) {
            log.error("Retention sweep failed", e);
            return 0;
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
