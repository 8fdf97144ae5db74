package io.taskrelay.core.model;

/**
 * Closed set of task-domain event kinds. The {@code code} is the stable byte written to the ledger.
 */
public enum EventType {
    CREATED((byte) 1),
    UPDATED((byte) 2),
    ASSIGNED((byte) 3),
    STATUS_CHANGED((byte) 4),
    DELETED((byte) 5);

    private final byte code;

    EventType(final byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    public static EventType fromCode(final byte code) {
        for (final EventType t : values()) {
            if (t.code == code) return t;
        }
        throw new IllegalArgumentException("Unknown event type code: " + code);
    }
}
