package io.taskrelay.config.impl;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;
import java.util.Map;

/**
 * Immutable config holder loaded from relay.yaml. Every key has a default, so an empty document is valid.
 */
@Getter
@AllArgsConstructor
public final class RelayConfig {

    private final LedgerSettings ledger;
    private final Path cursorsPath;
    private final DispatchSettings dispatch;
    private final RetentionSettings retention;
    private final TransportSettings transport;

    public static RelayConfig fromMap(final Map<String, Object> root) {
        final Map<String, Object> m = root == null ? Map.of() : root;
        final Map<String, Object> cursors = ConfigValues.section(m, "cursors");

        return new RelayConfig(
                LedgerSettings.from(ConfigValues.section(m, "ledger")),
                Path.of(cursors == null ? "data/cursors" : ConfigValues.stringValue(cursors, "path", "data/cursors")),
                DispatchSettings.from(ConfigValues.section(m, "dispatch")),
                RetentionSettings.from(ConfigValues.section(m, "retention")),
                TransportSettings.from(ConfigValues.section(m, "transport")));
    }
}
