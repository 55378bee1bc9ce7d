package io.teamrelay.task;

import io.teamrelay.model.Task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated outcome of a graph edit: the documents to write (the edited task first) and the ids to remove.
 */
public record TaskGraphChange(Task result, Map<Long, Task> writes, List<Long> deletions) {
    public TaskGraphChange {
        writes = Collections.unmodifiableMap(new LinkedHashMap<>(writes));
        deletions = List.copyOf(deletions);
    }
}
