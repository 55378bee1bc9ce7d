package io.teamrelay.task;

import io.teamrelay.config.RuntimeSettings;
import io.teamrelay.config.TeamRelayConfig;
import io.teamrelay.config.TeamRelayContext;
import io.teamrelay.model.Member;
import io.teamrelay.model.MemberStatus;
import io.teamrelay.model.Task;
import io.teamrelay.model.TaskStatus;
import io.teamrelay.storage.ErrorKind;
import io.teamrelay.storage.FileDocumentStore;
import io.teamrelay.storage.StoreException;
import io.teamrelay.team.TeamRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class TaskGraphEngineTest {

    @Test
    void idsFromManyProcessesAreUnique() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-task-ids-");
        ExecutorService pool = Executors.newFixedThreadPool(10);
        try {
            TeamRelayConfig config = new TeamRelayConfig(root);
            newEngine(config).teams().create("alpha", "");

            List<Callable<List<Long>>> processes = new ArrayList<>();
            for (int p = 0; p < 10; p++) {
                Fixture process = newEngine(config);
                processes.add(() -> {
                    List<Long> ids = new ArrayList<>();
                    for (int i = 0; i < 10; i++) {
                        ids.add(process.tasks().allocateId("alpha"));
                    }
                    return ids;
                });
            }
            Set<Long> seen = new HashSet<>();
            for (Future<List<Long>> future : pool.invokeAll(processes)) {
                seen.addAll(future.get(60, TimeUnit.SECONDS));
            }
            Assertions.assertEquals(100, seen.size());
            Assertions.assertTrue(seen.stream().allMatch(id -> id >= 1L && id <= 100L));
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentCreatesKeepGraphConsistent() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-task-concurrent-");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            TeamRelayConfig config = new TeamRelayConfig(root);
            Fixture seed = newEngine(config);
            seed.teams().create("alpha", "");
            Task base = seed.tasks().create("alpha", "base", null, List.of());

            List<Callable<Task>> jobs = new ArrayList<>();
            for (int p = 0; p < 4; p++) {
                Fixture process = newEngine(config);
                int n = p;
                jobs.add(() -> process.tasks().create("alpha", "child " + n, null, List.of(base.id())));
            }
            for (Future<Task> future : pool.invokeAll(jobs)) {
                future.get(60, TimeUnit.SECONDS);
            }

            Task reloaded = seed.tasks().get("alpha", base.id());
            Assertions.assertEquals(4, reloaded.blocks().size());
            for (Long child : reloaded.blocks()) {
                Assertions.assertEquals(List.of(base.id()), seed.tasks().get("alpha", child).blockedBy());
            }
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void unknownDependencyCreatesNoFile() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-task-unknown-");
        try {
            TeamRelayConfig config = new TeamRelayConfig(root);
            Fixture fx = newEngine(config);
            fx.teams().create("alpha", "");

            StoreException error = Assertions.assertThrows(StoreException.class,
                    () -> fx.tasks().create("alpha", "orphan", null, List.of(42L)));
            Assertions.assertEquals(ErrorKind.UNKNOWN_TASK, error.kind());
            Assertions.assertEquals(List.of(), fx.tasks().list("alpha"));
            Assertions.assertFalse(Files.exists(config.taskFile("alpha", 1L)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rejectedCycleLeavesDocumentsUntouched() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-task-cycle-");
        try {
            TeamRelayConfig config = new TeamRelayConfig(root);
            Fixture fx = newEngine(config);
            fx.teams().create("alpha", "");
            Task a = fx.tasks().create("alpha", "A", null, List.of());
            Task b = fx.tasks().create("alpha", "B", null, List.of(a.id()));
            byte[] aBefore = Files.readAllBytes(config.taskFile("alpha", a.id()));
            byte[] bBefore = Files.readAllBytes(config.taskFile("alpha", b.id()));

            StoreException error = Assertions.assertThrows(StoreException.class,
                    () -> fx.tasks().update("alpha", b.id(), TaskUpdate.empty().withAddBlocks(List.of(a.id()))));
            Assertions.assertEquals(ErrorKind.CYCLE_DETECTED, error.kind());
            Assertions.assertArrayEquals(aBefore, Files.readAllBytes(config.taskFile("alpha", a.id())));
            Assertions.assertArrayEquals(bBefore, Files.readAllBytes(config.taskFile("alpha", b.id())));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lifecycleAndDeletion() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-task-life-");
        try {
            TeamRelayConfig config = new TeamRelayConfig(root);
            Fixture fx = newEngine(config);
            fx.teams().create("alpha", "");
            fx.teams().addMember("alpha", member("worker"));

            Task first = fx.tasks().create("alpha", "first", "do it", "worker", List.of(), Map.of("priority", "high"));
            Task second = fx.tasks().create("alpha", "second", null, List.of(first.id()));
            Assertions.assertEquals(List.of(second.id()), fx.tasks().get("alpha", first.id()).blocks());
            Assertions.assertEquals("worker", first.owner());

            fx.tasks().update("alpha", first.id(), TaskUpdate.status(TaskStatus.IN_PROGRESS));
            fx.tasks().update("alpha", first.id(), TaskUpdate.status(TaskStatus.COMPLETED));
            StoreException backwards = Assertions.assertThrows(StoreException.class,
                    () -> fx.tasks().update("alpha", first.id(), TaskUpdate.status(TaskStatus.PENDING)));
            Assertions.assertEquals(ErrorKind.INVALID_TRANSITION, backwards.kind());
            Assertions.assertEquals(TaskStatus.COMPLETED, fx.tasks().get("alpha", first.id()).status());

            Task started = fx.tasks().update("alpha", second.id(), TaskUpdate.status(TaskStatus.IN_PROGRESS));
            Assertions.assertEquals(TaskStatus.IN_PROGRESS, started.status());

            fx.tasks().delete("alpha", first.id());
            Assertions.assertFalse(Files.exists(config.taskFile("alpha", first.id())));
            Assertions.assertEquals(List.of(), fx.tasks().get("alpha", second.id()).blockedBy());

            Task third = fx.tasks().create("alpha", "third", null, List.of());
            Assertions.assertEquals(3L, third.id());
            Assertions.assertEquals(List.of(second.id(), third.id()),
                    fx.tasks().list("alpha").stream().map(Task::id).toList());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void ownerMustBeMember() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-task-owner-");
        try {
            Fixture fx = newEngine(new TeamRelayConfig(root));
            fx.teams().create("alpha", "");
            StoreException error = Assertions.assertThrows(StoreException.class,
                    () -> fx.tasks().create("alpha", "x", "stranger", List.of()));
            Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, error.kind());

            StoreException missingTeam = Assertions.assertThrows(StoreException.class,
                    () -> fx.tasks().create("beta", "x", null, List.of()));
            Assertions.assertEquals(ErrorKind.NOT_FOUND, missingTeam.kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resetOwnerTasksReturnsWorkToPool() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-task-reset-");
        try {
            Fixture fx = newEngine(new TeamRelayConfig(root));
            fx.teams().create("alpha", "");
            fx.teams().addMember("alpha", member("bob"));
            Task open = fx.tasks().create("alpha", "open", "bob", List.of());
            Task done = fx.tasks().create("alpha", "done", "bob", List.of());
            fx.tasks().update("alpha", open.id(), TaskUpdate.status(TaskStatus.IN_PROGRESS));
            fx.tasks().update("alpha", done.id(), TaskUpdate.status(TaskStatus.IN_PROGRESS));
            fx.tasks().update("alpha", done.id(), TaskUpdate.status(TaskStatus.COMPLETED));

            List<Task> reset = fx.tasks().resetOwnerTasks("alpha", "bob");

            Assertions.assertEquals(List.of(open.id()), reset.stream().map(Task::id).toList());
            Task reopened = fx.tasks().get("alpha", open.id());
            Assertions.assertEquals(TaskStatus.PENDING, reopened.status());
            Assertions.assertNull(reopened.owner());
            Assertions.assertEquals("bob", fx.tasks().get("alpha", done.id()).owner());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void counterSurvivesLossOfHighWatermark() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-task-hwm-");
        try {
            TeamRelayConfig config = new TeamRelayConfig(root);
            Fixture fx = newEngine(config);
            fx.teams().create("alpha", "");
            fx.tasks().create("alpha", "one", null, List.of());
            fx.tasks().create("alpha", "two", null, List.of());
            Files.delete(config.taskCounterFile("alpha"));

            Assertions.assertEquals(3L, fx.tasks().create("alpha", "three", null, List.of()).id());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Member member(String name) {
        return new Member(name, "general-purpose", "", "", null, "", false, 0L, "", MemberStatus.UNKNOWN);
    }

    private static Fixture newEngine(TeamRelayConfig config) {
        TeamRelayContext context = new TeamRelayContext(config, new FileDocumentStore(), RuntimeSettings.defaults());
        TeamRegistry teams = new TeamRegistry(context);
        return new Fixture(teams, new TaskGraphEngine(context, teams));
    }

    private record Fixture(TeamRegistry teams, TaskGraphEngine tasks) {
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
