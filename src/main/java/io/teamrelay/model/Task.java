package io.teamrelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * One task document. {@code blocks} and {@code blockedBy} are kept sorted and duplicate-free.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Task(
        long id,
        String title,
        String description,
        TaskStatus status,
        String owner,
        List<Long> blocks,
        List<Long> blockedBy,
        Map<String, Object> metadata
) {
    public Task {
        description = description == null ? "" : description;
        status = status == null ? TaskStatus.PENDING : status;
        blocks = sortedIds(blocks);
        blockedBy = sortedIds(blockedBy);
        metadata = metadata == null || metadata.isEmpty()
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Task withStatus(TaskStatus next) {
        return new Task(id, title, description, next, owner, blocks, blockedBy, metadata);
    }

    public Task withOwner(String next) {
        return new Task(id, title, description, status, next, blocks, blockedBy, metadata);
    }

    public Task withTitle(String next) {
        return new Task(id, next, description, status, owner, blocks, blockedBy, metadata);
    }

    public Task withDescription(String next) {
        return new Task(id, title, next, status, owner, blocks, blockedBy, metadata);
    }

    public Task withBlocks(Collection<Long> next) {
        return new Task(id, title, description, status, owner, List.copyOf(next), blockedBy, metadata);
    }

    public Task withBlockedBy(Collection<Long> next) {
        return new Task(id, title, description, status, owner, blocks, List.copyOf(next), metadata);
    }

    public Task withMetadata(Map<String, Object> next) {
        return new Task(id, title, description, status, owner, blocks, blockedBy, next);
    }

    private static List<Long> sortedIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return List.copyOf(new TreeSet<>(ids));
    }
}
