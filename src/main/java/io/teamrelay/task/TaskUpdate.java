package io.teamrelay.task;

import io.teamrelay.model.TaskStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Requested change to one task. Null fields are left alone. An empty {@code owner} clears the owner;
 * a metadata entry with a null value removes that key.
 */
public record TaskUpdate(
        TaskStatus status,
        String owner,
        String title,
        String description,
        List<Long> addBlocks,
        List<Long> addBlockedBy,
        Map<String, Object> metadata
) {
    public TaskUpdate {
        addBlocks = addBlocks == null ? List.of() : List.copyOf(addBlocks);
        addBlockedBy = addBlockedBy == null ? List.of() : List.copyOf(addBlockedBy);
        metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static TaskUpdate empty() {
        return new TaskUpdate(null, null, null, null, null, null, null);
    }

    public static TaskUpdate status(TaskStatus status) {
        return empty().withStatus(status);
    }

    public TaskUpdate withStatus(TaskStatus next) {
        return new TaskUpdate(next, owner, title, description, addBlocks, addBlockedBy, metadata);
    }

    public TaskUpdate withOwner(String next) {
        return new TaskUpdate(status, next, title, description, addBlocks, addBlockedBy, metadata);
    }

    public TaskUpdate withTitle(String next) {
        return new TaskUpdate(status, owner, next, description, addBlocks, addBlockedBy, metadata);
    }

    public TaskUpdate withDescription(String next) {
        return new TaskUpdate(status, owner, title, next, addBlocks, addBlockedBy, metadata);
    }

    public TaskUpdate withAddBlocks(List<Long> next) {
        return new TaskUpdate(status, owner, title, description, next, addBlockedBy, metadata);
    }

    public TaskUpdate withAddBlockedBy(List<Long> next) {
        return new TaskUpdate(status, owner, title, description, addBlocks, next, metadata);
    }

    public TaskUpdate withMetadata(Map<String, Object> next) {
        return new TaskUpdate(status, owner, title, description, addBlocks, addBlockedBy, next);
    }

    public boolean changesOwner() {
        return owner != null;
    }
}
