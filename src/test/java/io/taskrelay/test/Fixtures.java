package io.taskrelay.test;

import io.taskrelay.config.impl.DispatchSettings;
import io.taskrelay.config.impl.LedgerSettings;
import io.taskrelay.config.impl.RelayConfig;
import io.taskrelay.config.impl.RetentionSettings;
import io.taskrelay.config.impl.TransportSettings;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

public final class Fixtures {
    private Fixtures() {
    }

    public static RelayConfig config(final Path dir) {
        return config(dir, DispatchSettings.defaults(), 64 * 1024);
    }

    public static RelayConfig config(final Path dir, final DispatchSettings dispatch, final int segmentBytes) {
        return new RelayConfig(
                new LedgerSettings(dir.resolve("ledger"), segmentBytes, false),
                dir.resolve("cursors"),
                dispatch,
                new RetentionSettings(Duration.ofDays(7), Long.MAX_VALUE, Duration.ofHours(1)),
                new TransportSettings(0));
    }

    /** Fast timeouts and a low attempt ceiling for failure-path tests. */
    public static DispatchSettings impatient(final int maxAttempts) {
        return new DispatchSettings(2, 16, Duration.ofMillis(150), Duration.ofMillis(10), Duration.ofMillis(40), maxAttempts);
    }

    public static byte[] bytes(final String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
