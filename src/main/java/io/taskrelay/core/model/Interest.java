package io.taskrelay.core.model;

import java.util.Objects;
import java.util.Set;

/**
 * Which task partitions a subscriber wants: every task, or an explicit set of task ids.
 */
public final class Interest {
    private static final Interest ALL = new Interest(true, Set.of());

    private final boolean allTasks;
    private final Set<String> taskIds;

    private Interest(final boolean allTasks, final Set<String> taskIds) {
        this.allTasks = allTasks;
        this.taskIds = taskIds;
    }

    public static Interest all() {
        return ALL;
    }

    public static Interest of(final Set<String> taskIds) {
        Objects.requireNonNull(taskIds, "taskIds");
        if (taskIds.isEmpty()) throw new IllegalArgumentException("interest needs at least one task id");
        return new Interest(false, Set.copyOf(taskIds));
    }

    public static Interest of(final String... taskIds) {
        return of(Set.of(taskIds));
    }

    public boolean isAllTasks() {
        return allTasks;
    }

    /** Explicit task ids; empty when {@link #isAllTasks()}. */
    public Set<String> taskIds() {
        return taskIds;
    }

    public boolean includes(final String taskId) {
        return allTasks || taskIds.contains(taskId);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Interest other)) return false;
        return allTasks == other.allTasks && taskIds.equals(other.taskIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(allTasks, taskIds);
    }

    @Override
    public String toString() {
        return allTasks ? "Interest{all}" : "Interest" + taskIds;
    }
}
