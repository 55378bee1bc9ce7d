package io.teamrelay.task;

import io.teamrelay.model.Task;
import io.teamrelay.model.TaskStatus;
import io.teamrelay.storage.StoreException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable snapshot of a team's tasks that plans edits without touching storage.
 *
 * <p>An edge {@code a -> b} means task {@code a} blocks task {@code b}. Every plan either throws
 * before producing anything or returns a change that keeps {@code blocks}/{@code blockedBy} mutual
 * inverses and the graph acyclic.
 */
public final class TaskGraph {
    private final Map<Long, Task> tasks;

    public TaskGraph(Collection<Task> snapshot) {
        this.tasks = new TreeMap<>();
        for (Task task : snapshot) {
            tasks.put(task.id(), task);
        }
    }

    public Optional<Task> find(long id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public Task require(long id) {
        Task task = tasks.get(id);
        if (task == null) {
            throw StoreException.notFound("Task " + id + " not found");
        }
        return task;
    }

    public List<Task> tasks() {
        return List.copyOf(tasks.values());
    }

    /**
     * Plans insertion of {@code draft}, whose {@code blockedBy} ids must already exist.
     */
    public TaskGraphChange planCreate(Task draft) {
        if (tasks.containsKey(draft.id())) {
            throw StoreException.alreadyExists("Task " + draft.id() + " already exists");
        }
        List<Edge> edges = new ArrayList<>();
        for (Long blocker : draft.blockedBy()) {
            requireDependency(draft.id(), blocker);
            edges.add(new Edge(blocker, draft.id()));
        }
        for (Long blocked : draft.blocks()) {
            requireDependency(draft.id(), blocked);
            edges.add(new Edge(draft.id(), blocked));
        }
        requireAcyclic(draft, edges);

        Map<Long, Task> writes = new LinkedHashMap<>();
        writes.put(draft.id(), draft);
        linkInverse(writes, edges, draft.id());
        return new TaskGraphChange(draft, writes, List.of());
    }

    public TaskGraphChange planUpdate(long id, TaskUpdate update) {
        Task current = require(id);
        if (update.status() == TaskStatus.DELETED) {
            return planDelete(id);
        }
        if (update.title() != null && update.title().isBlank()) {
            throw StoreException.invalidArgument("Task title must not be empty");
        }

        List<Edge> edges = new ArrayList<>();
        for (Long blocked : update.addBlocks()) {
            requireDependency(id, blocked);
            edges.add(new Edge(id, blocked));
        }
        for (Long blocker : update.addBlockedBy()) {
            requireDependency(id, blocker);
            edges.add(new Edge(blocker, id));
        }
        requireAcyclic(null, edges);

        Set<Long> blocks = new TreeSet<>(current.blocks());
        Set<Long> blockedBy = new TreeSet<>(current.blockedBy());
        for (Edge edge : edges) {
            if (edge.from() == id) {
                blocks.add(edge.to());
            } else {
                blockedBy.add(edge.from());
            }
        }

        Task next = current.withBlocks(blocks).withBlockedBy(blockedBy);
        if (update.status() != null && update.status() != current.status()) {
            TaskTransitions.requireAllowed(id, current.status(), update.status());
            requireBlockersCompleted(next, update.status());
            next = next.withStatus(update.status());
        }
        if (update.title() != null) {
            next = next.withTitle(update.title());
        }
        if (update.description() != null) {
            next = next.withDescription(update.description());
        }
        if (update.changesOwner()) {
            next = next.withOwner(update.owner().isBlank() ? null : update.owner());
        }
        if (update.metadata() != null) {
            next = next.withMetadata(mergeMetadata(current.metadata(), update.metadata()));
        }

        Map<Long, Task> writes = new LinkedHashMap<>();
        writes.put(id, next);
        linkInverse(writes, edges, id);
        return new TaskGraphChange(next, writes, List.of());
    }

    /**
     * Plans removal of a task and scrubs its id from every task that references it.
     */
    public TaskGraphChange planDelete(long id) {
        Task current = require(id);
        Map<Long, Task> writes = new LinkedHashMap<>();
        for (Task other : tasks.values()) {
            if (other.id() == id) {
                continue;
            }
            boolean referenced = other.blocks().contains(id) || other.blockedBy().contains(id);
            if (!referenced) {
                continue;
            }
            Set<Long> blocks = new TreeSet<>(other.blocks());
            Set<Long> blockedBy = new TreeSet<>(other.blockedBy());
            blocks.remove(id);
            blockedBy.remove(id);
            writes.put(other.id(), other.withBlocks(blocks).withBlockedBy(blockedBy));
        }
        return new TaskGraphChange(current.withStatus(TaskStatus.DELETED), writes, List.of(id));
    }

    /**
     * Returns unfinished work of a departed member to the pool: back to pending, no owner.
     */
    public TaskGraphChange planOwnerReset(String owner) {
        Map<Long, Task> writes = new LinkedHashMap<>();
        for (Task task : tasks.values()) {
            if (owner.equals(task.owner()) && task.status() != TaskStatus.COMPLETED) {
                writes.put(task.id(), task.withOwner(null).withStatus(TaskStatus.PENDING));
            }
        }
        return new TaskGraphChange(null, writes, List.of());
    }

    public static Map<String, Object> mergeMetadata(Map<String, Object> current, Map<String, Object> patch) {
        Map<String, Object> merged = current == null ? new LinkedHashMap<>() : new LinkedHashMap<>(current);
        for (Map.Entry<String, Object> entry : patch.entrySet()) {
            if (entry.getValue() == null) {
                merged.remove(entry.getKey());
            } else {
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        return merged;
    }

    private void requireDependency(long taskId, Long otherId) {
        if (otherId == null) {
            throw StoreException.invalidArgument("Task " + taskId + ": dependency id must not be null");
        }
        if (otherId == taskId) {
            throw StoreException.cycleDetected("Task " + taskId + " cannot depend on itself");
        }
        if (!tasks.containsKey(otherId)) {
            throw StoreException.unknownTask("Referenced task " + otherId + " does not exist");
        }
    }

    private void requireBlockersCompleted(Task task, TaskStatus target) {
        if (target != TaskStatus.IN_PROGRESS && target != TaskStatus.COMPLETED) {
            return;
        }
        for (Long blockerId : task.blockedBy()) {
            Task blocker = tasks.get(blockerId);
            if (blocker != null && blocker.status() != TaskStatus.COMPLETED) {
                throw StoreException.invalidTransition(
                        "Cannot set task " + task.id() + " to '" + target.wire() + "': blocked by task "
                                + blockerId + " (status: '" + blocker.status().wire() + "')");
            }
        }
    }

    private void requireAcyclic(Task added, List<Edge> extra) {
        Map<Long, Set<Long>> graph = new HashMap<>();
        for (Task task : tasks.values()) {
            graph.computeIfAbsent(task.id(), ignored -> new HashSet<>()).addAll(task.blocks());
            for (Long blocker : task.blockedBy()) {
                graph.computeIfAbsent(blocker, ignored -> new HashSet<>()).add(task.id());
            }
        }
        if (added != null) {
            graph.computeIfAbsent(added.id(), ignored -> new HashSet<>());
        }
        for (Edge edge : extra) {
            graph.computeIfAbsent(edge.from(), ignored -> new HashSet<>()).add(edge.to());
        }
        Set<Long> visiting = new HashSet<>();
        Set<Long> visited = new HashSet<>();
        for (Long id : graph.keySet()) {
            dfsCycleCheck(id, graph, visiting, visited);
        }
    }

    private void dfsCycleCheck(Long id, Map<Long, Set<Long>> graph, Set<Long> visiting, Set<Long> visited) {
        if (visited.contains(id)) {
            return;
        }
        if (!visiting.add(id)) {
            throw StoreException.cycleDetected("Dependency change would create a cycle through task " + id);
        }
        for (Long next : graph.getOrDefault(id, Set.of())) {
            dfsCycleCheck(next, graph, visiting, visited);
        }
        visiting.remove(id);
        visited.add(id);
    }

    private void linkInverse(Map<Long, Task> writes, List<Edge> edges, long editedId) {
        for (Edge edge : edges) {
            long otherId = edge.from() == editedId ? edge.to() : edge.from();
            Task other = writes.containsKey(otherId) ? writes.get(otherId) : tasks.get(otherId);
            if (edge.from() == editedId) {
                Set<Long> blockedBy = new TreeSet<>(other.blockedBy());
                blockedBy.add(editedId);
                writes.put(otherId, other.withBlockedBy(blockedBy));
            } else {
                Set<Long> blocks = new TreeSet<>(other.blocks());
                blocks.add(editedId);
                writes.put(otherId, other.withBlocks(blocks));
            }
        }
    }

    private record Edge(long from, long to) {
    }
}
