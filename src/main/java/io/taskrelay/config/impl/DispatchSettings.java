package io.taskrelay.config.impl;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.util.Map;

/**
 * Delivery tuning: worker pool, replay page size, ack timeout and retry backoff.
 */
@Getter
@AllArgsConstructor
public final class DispatchSettings {
    private final int workerThreads;
    private final int pageSize;
    private final Duration ackTimeout;
    private final Duration retryBase;
    private final Duration retryCap;
    private final int maxAttempts;

    public static DispatchSettings defaults() {
        return new DispatchSettings(4, 256, Duration.ofSeconds(10), Duration.ofMillis(200), Duration.ofSeconds(30), 8);
    }

    static DispatchSettings from(final Map<String, Object> m) {
        final DispatchSettings d = defaults();
        if (m == null) return d;
        return new DispatchSettings(
                ConfigValues.intValue(m, "workerThreads", d.workerThreads),
                ConfigValues.intValue(m, "pageSize", d.pageSize),
                Duration.ofMillis(ConfigValues.longValue(m, "ackTimeoutMillis", d.ackTimeout.toMillis())),
                Duration.ofMillis(ConfigValues.longValue(m, "retryBaseMillis", d.retryBase.toMillis())),
                Duration.ofMillis(ConfigValues.longValue(m, "retryCapMillis", d.retryCap.toMillis())),
                ConfigValues.intValue(m, "maxAttempts", d.maxAttempts));
    }
}
