package io.taskrelay.core.model;

/**
 * Signal that a subscriber's replay range for one task fell below the retention floor.
 * Events in {@code (previousCursor, lowestRetained)} are gone; delivery resumes at {@code lowestRetained}.
 */
public record MissedEvents(String subscriberId, String taskId, long previousCursor, long lowestRetained) {

    public long missedCount() {
        return Math.max(0L, lowestRetained - previousCursor - 1L);
    }
}
