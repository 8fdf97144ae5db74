package io.taskrelay.config.impl;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;
import java.util.Map;

/**
 * Event log storage: location, segment size and whether appends are forced to disk.
 */
@Getter
@AllArgsConstructor
public final class LedgerSettings {
    private final Path path;
    private final int segmentBytes;
    private final boolean fsync;

    static LedgerSettings from(final Map<String, Object> m) {
        if (m == null) return new LedgerSettings(Path.of("data", "ledger"), 1 << 20, true);
        return new LedgerSettings(
                Path.of(ConfigValues.stringValue(m, "path", "data/ledger")),
                ConfigValues.intValue(m, "segmentBytes", 1 << 20),
                ConfigValues.boolValue(m, "fsync", true));
    }
}
