package io.taskrelay.config.impl;

import java.util.Map;

/**
 * Typed reads from SnakeYAML maps with defaults for absent keys.
 */
final class ConfigValues {
    private ConfigValues() {
    }

    static int intValue(final Map<String, Object> m, final String key, final int def) {
        final Object v = m.get(key);
        if (v == null) return def;
        if (v instanceof Number n) return n.intValue();
        throw new IllegalArgumentException("Config key '" + key + "' must be a number, got: " + v);
    }

    static long longValue(final Map<String, Object> m, final String key, final long def) {
        final Object v = m.get(key);
        if (v == null) return def;
        if (v instanceof Number n) return n.longValue();
        throw new IllegalArgumentException("Config key '" + key + "' must be a number, got: " + v);
    }

    static boolean boolValue(final Map<String, Object> m, final String key, final boolean def) {
        final Object v = m.get(key);
        if (v == null) return def;
        if (v instanceof Boolean b) return b;
        throw new IllegalArgumentException("Config key '" + key + "' must be true/false, got: " + v);
    }

    static String stringValue(final Map<String, Object> m, final String key, final String def) {
        final Object v = m.get(key);
        return v == null ? def : String.valueOf(v);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> section(final Map<String, Object> root, final String key) {
        final Object v = root.get(key);
        if (v == null) return null;
        if (v instanceof Map<?, ?>) return (Map<String, Object>) v;
        throw new IllegalArgumentException("Config section '" + key + "' must be a mapping");
    }
}
