package io.taskrelay.config.impl;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

@Getter
@AllArgsConstructor
public final class TransportSettings {
    /* 0 binds an ephemeral port */
    private final int port;

    static TransportSettings from(final Map<String, Object> m) {
        return new TransportSettings(m == null ? 7420 : ConfigValues.intValue(m, "port", 7420));
    }
}
