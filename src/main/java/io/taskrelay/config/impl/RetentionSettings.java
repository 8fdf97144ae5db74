package io.taskrelay.config.impl;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.util.Map;

@Getter
@AllArgsConstructor
public final class RetentionSettings {
    private final Duration maxAge;
    private final long maxBytesPerPartition;
    private final Duration sweepInterval;

    static RetentionSettings from(final Map<String, Object> m) {
        final Map<String, Object> src = m == null ? Map.of() : m;
        return new RetentionSettings(
                Duration.ofHours(ConfigValues.longValue(src, "maxAgeHours", 168L)),
                ConfigValues.longValue(src, "maxBytesPerPartition", 64L << 20),
                Duration.ofMinutes(ConfigValues.longValue(src, "sweepIntervalMinutes", 60L)));
    }
}
