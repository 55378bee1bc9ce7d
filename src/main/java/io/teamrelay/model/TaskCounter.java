package io.teamrelay.model;

/**
 * Highest task id ever issued for a team. Ids above it are free; ids at or below it are never reused.
 */
public record TaskCounter(long lastId) {
    public static TaskCounter empty() {
        return new TaskCounter(0L);
    }

    public TaskCounter next() {
        return new TaskCounter(lastId + 1L);
    }
}
