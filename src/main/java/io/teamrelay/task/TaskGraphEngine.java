package io.teamrelay.task;

import io.teamrelay.config.TeamRelayConfig;
import io.teamrelay.config.TeamRelayContext;
import io.teamrelay.model.Task;
import io.teamrelay.model.TaskCounter;
import io.teamrelay.model.TaskStatus;
import io.teamrelay.model.TeamConfig;
import io.teamrelay.storage.DocumentStore;
import io.teamrelay.storage.StoreException;
import io.teamrelay.team.TeamRegistry;
import io.teamrelay.util.Names;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Task documents of one coordination root.
 *
 * <p>Every mutation runs under the team's graph lock ({@code tasks/.lock}), reads a full snapshot,
 * plans the edit with {@link TaskGraph} and only then writes. A rejected edit writes nothing.
 */
public final class TaskGraphEngine {
    private static final String TASK_SUFFIX = ".json";

    private final TeamRelayContext context;
    private final TeamRegistry teams;

    public TaskGraphEngine(TeamRelayContext context, TeamRegistry teams) {
        this.context = context;
        this.teams = teams;
    }

    /**
     * Issues the next task id. The counter starts above the highest task already on disk, so ids are
     * never reissued even when the counter document was lost.
     */
    public long allocateId(String team) {
        TeamRelayConfig layout = context.config();
        TaskCounter counter = store().modify(layout.taskCounterFile(team), TaskCounter.class, current -> {
            TaskCounter base = current.orElseGet(() -> new TaskCounter(highestStoredId(team)));
            return base.next();
        }, timeout());
        return counter.lastId();
    }

    public Task create(String team, String title, String owner, Collection<Long> blockedBy) {
        return create(team, title, "", owner, blockedBy, null);
    }

    public Task create(
            String team,
            String title,
            String description,
            String owner,
            Collection<Long> blockedBy,
            Map<String, Object> metadata
    ) {
        Names.requireValid(team, "Team");
        if (title == null || title.isBlank()) {
            throw StoreException.invalidArgument("Task title must not be empty");
        }
        requireTeam(team);
        List<Long> dependencies = blockedBy == null ? List.of() : new ArrayList<>(blockedBy);
        return store().withLock(context.config().taskGraphLock(team), timeout(), () -> {
            TeamConfig config = teams.readConfig(team);
            String resolvedOwner = resolveOwner(config, owner);
            TaskGraph graph = snapshot(team);
            for (Long dependency : dependencies) {
                if (dependency == null || graph.find(dependency).isEmpty()) {
                    throw StoreException.unknownTask("Referenced task " + dependency + " does not exist");
                }
            }
            long id = allocateId(team);
            Task draft = new Task(id, title, description, TaskStatus.PENDING, resolvedOwner,
                    List.of(), dependencies, metadata);
            TaskGraphChange change = graph.planCreate(draft);
            commit(team, change);
            return change.result();
        });
    }

    public Task update(String team, long id, TaskUpdate update) {
        requireTeam(team);
        return store().withLock(context.config().taskGraphLock(team), timeout(), () -> {
            requireTeam(team);
            TaskGraph graph = snapshot(team);
            TaskUpdate resolved = update;
            if (update.changesOwner() && !update.owner().isBlank()) {
                TeamConfig config = teams.readConfig(team);
                resolved = update.withOwner(resolveOwner(config, update.owner()));
            }
            TaskGraphChange change = graph.planUpdate(id, resolved);
            commit(team, change);
            return change.result();
        });
    }

    public Task delete(String team, long id) {
        return update(team, id, TaskUpdate.status(TaskStatus.DELETED));
    }

    /**
     * Puts every unfinished task of {@code owner} back to pending without an owner.
     *
     * @return the tasks that were reset
     */
    public List<Task> resetOwnerTasks(String team, String owner) {
        requireTeam(team);
        return store().withLock(context.config().taskGraphLock(team), timeout(), () -> {
            requireTeam(team);
            TaskGraphChange change = snapshot(team).planOwnerReset(owner);
            commit(team, change);
            return List.copyOf(change.writes().values());
        });
    }

    public List<Task> list(String team) {
        requireTeam(team);
        return loadAll(team);
    }

    public Task get(String team, long id) {
        return find(team, id).orElseThrow(() -> StoreException.notFound("Task " + id + " not found"));
    }

    public Optional<Task> find(String team, long id) {
        Names.requireValid(team, "Team");
        return store().read(context.config().taskFile(team, id), Task.class);
    }

    /**
     * Checked once before taking the graph lock and again under it, since a team delete holds that
     * lock while it removes the task directory.
     */
    private void requireTeam(String team) {
        Names.requireValid(team, "Team");
        if (!teams.exists(team)) {
            throw StoreException.notFound("Team '" + team + "' not found");
        }
    }

    private String resolveOwner(TeamConfig config, String owner) {
        if (owner == null || owner.isBlank()) {
            return null;
        }
        if (!config.hasMember(owner)) {
            throw StoreException.invalidArgument(
                    "Owner '" + owner + "' is not a member of team '" + config.name() + "'");
        }
        return owner;
    }

    private void commit(String team, TaskGraphChange change) {
        for (Map.Entry<Long, Task> write : change.writes().entrySet()) {
            Task next = write.getValue();
            store().modify(taskFile(team, write.getKey()), Task.class, current -> next, timeout());
        }
        for (Long deleted : change.deletions()) {
            store().modify(taskFile(team, deleted), Task.class, current -> null, timeout());
        }
    }

    private TaskGraph snapshot(String team) {
        return new TaskGraph(loadAll(team));
    }

    private List<Task> loadAll(String team) {
        List<Task> tasks = new ArrayList<>();
        for (Path file : store().list(context.config().tasksDir(team), TASK_SUFFIX)) {
            if (parseId(file) < 0L) {
                continue;
            }
            // A concurrent delete may remove the file between listing and reading.
            store().read(file, Task.class).ifPresent(tasks::add);
        }
        tasks.sort(Comparator.comparingLong(Task::id));
        return tasks;
    }

    private long highestStoredId(String team) {
        long highest = 0L;
        for (Path file : store().list(context.config().tasksDir(team), TASK_SUFFIX)) {
            highest = Math.max(highest, parseId(file));
        }
        return highest;
    }

    private static long parseId(Path file) {
        String name = file.getFileName().toString();
        String stem = name.substring(0, name.length() - TASK_SUFFIX.length());
        if (stem.isEmpty() || !stem.chars().allMatch(Character::isDigit)) {
            return -1L;
        }
        try {
            return Long.parseLong(stem);
        } catch (NumberFormatException overflow) {
            return -1L;
        }
    }

    private Path taskFile(String team, long id) {
        return context.config().taskFile(team, id);
    }

    private Duration timeout() {
        return context.settings().lockTimeout();
    }

    private DocumentStore store() {
        return context.store();
    }
}
