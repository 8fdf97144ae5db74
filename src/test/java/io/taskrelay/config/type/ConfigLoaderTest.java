package io.taskrelay.config.type;

import io.taskrelay.config.impl.RelayConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class ConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    void loadsEveryKey() throws Exception {
        final Path file = dir.resolve("relay.yaml");
        Files.writeString(file, String.join("\n",
                "ledger:",
                "  path: /var/lib/relay/ledger",
                "  segmentBytes: 4096",
                "  fsync: false",
                "cursors:",
                "  path: /var/lib/relay/cursors",
                "dispatch:",
                "  workerThreads: 2",
                "  pageSize: 32",
                "  ackTimeoutMillis: 1500",
                "  retryBaseMillis: 50",
                "  retryCapMillis: 5000",
                "  maxAttempts: 3",
                "retention:",
                "  maxAgeHours: 24",
                "  maxBytesPerPartition: 1048576",
                "  sweepIntervalMinutes: 5",
                "transport:",
                "  port: 9000",
                ""));

        final RelayConfig cfg = ConfigLoader.load(file);

        assertEquals(Path.of("/var/lib/relay/ledger"), cfg.getLedger().getPath());
        assertEquals(4096, cfg.getLedger().getSegmentBytes());
        assertFalse(cfg.getLedger().isFsync());
        assertEquals(Path.of("/var/lib/relay/cursors"), cfg.getCursorsPath());

        assertEquals(2, cfg.getDispatch().getWorkerThreads());
        assertEquals(32, cfg.getDispatch().getPageSize());
        assertEquals(Duration.ofMillis(1500), cfg.getDispatch().getAckTimeout());
        assertEquals(Duration.ofMillis(50), cfg.getDispatch().getRetryBase());
        assertEquals(Duration.ofSeconds(5), cfg.getDispatch().getRetryCap());
        assertEquals(3, cfg.getDispatch().getMaxAttempts());

        assertEquals(Duration.ofHours(24), cfg.getRetention().getMaxAge());
        assertEquals(1_048_576L, cfg.getRetention().getMaxBytesPerPartition());
        assertEquals(Duration.ofMinutes(5), cfg.getRetention().getSweepInterval());

        assertEquals(9000, cfg.getTransport().getPort());
    }

    @Test
    void missingKeysFallBackToDefaults() throws Exception {
        final Path file = dir.resolve("partial.yaml");
        Files.writeString(file, "dispatch:\n  maxAttempts: 5\n");

        final RelayConfig cfg = ConfigLoader.load(file);

        assertEquals(5, cfg.getDispatch().getMaxAttempts());
        assertEquals(256, cfg.getDispatch().getPageSize());
        assertEquals(Duration.ofSeconds(10), cfg.getDispatch().getAckTimeout());
        assertEquals(Path.of("data", "ledger"), cfg.getLedger().getPath());
        assertTrue(cfg.getLedger().isFsync());
        assertEquals(7420, cfg.getTransport().getPort());
        assertEquals(Duration.ofHours(168), cfg.getRetention().getMaxAge());
    }

    @Test
    void bundledDefaultsLoadFromTheClasspath() throws Exception {
        final RelayConfig cfg = ConfigLoader.loadResource("relay.yaml");
        assertEquals(8, cfg.getDispatch().getMaxAttempts());
        assertEquals(Duration.ofMillis(200), cfg.getDispatch().getRetryBase());
        assertEquals(7420, cfg.getTransport().getPort());
    }

    @Test
    void wrongTypeIsRejected() throws Exception {
        final Path file = dir.resolve("bad.yaml");
        Files.writeString(file, "transport:\n  port: seven\n");
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(file));
    }
}
