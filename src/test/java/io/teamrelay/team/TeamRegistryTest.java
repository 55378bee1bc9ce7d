package io.teamrelay.team;

import io.teamrelay.config.RuntimeSettings;
import io.teamrelay.config.TeamRelayConfig;
import io.teamrelay.config.TeamRelayContext;
import io.teamrelay.mailbox.MailboxEngine;
import io.teamrelay.mailbox.MessageDraft;
import io.teamrelay.model.Member;
import io.teamrelay.model.MemberStatus;
import io.teamrelay.model.Task;
import io.teamrelay.model.TeamConfig;
import io.teamrelay.storage.ErrorKind;
import io.teamrelay.storage.FileDocumentStore;
import io.teamrelay.storage.FileLockManager;
import io.teamrelay.storage.LockHandle;
import io.teamrelay.storage.StoreException;
import io.teamrelay.task.TaskGraphEngine;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class TeamRegistryTest {
    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneOffset.UTC);

    @Test
    void createWritesConfigWithLead() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-team-create-");
        try {
            TeamRelayConfig config = new TeamRelayConfig(root);
            TeamRegistry teams = registry(config);

            TeamConfig created = teams.create("alpha", "first team");

            Assertions.assertTrue(Files.exists(config.configFile("alpha")));
            Assertions.assertEquals(FIXED.millis(), created.createdAt());
            Assertions.assertEquals(TeamRelayConfig.LEAD_NAME, created.leadName());
            Assertions.assertEquals(1, created.members().size());
            Assertions.assertTrue(created.members().get(0).isLead());
            Assertions.assertEquals(created, teams.readConfig("alpha"));

            StoreException duplicate = Assertions.assertThrows(StoreException.class,
                    () -> teams.create("alpha", "again"));
            Assertions.assertEquals(ErrorKind.ALREADY_EXISTS, duplicate.kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void namesAreValidated() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-team-names-");
        try {
            TeamRegistry teams = registry(new TeamRelayConfig(root));
            for (String bad : List.of("", "has space", "../escape", "dots.not.ok", "x".repeat(65))) {
                StoreException error = Assertions.assertThrows(StoreException.class, () -> teams.create(bad, ""));
                Assertions.assertEquals(ErrorKind.INVALID_NAME, error.kind(), bad);
            }
            Assertions.assertEquals("x".repeat(64), teams.create("x".repeat(64), "").name());
            Assertions.assertEquals("team_1-b", teams.create("team_1-b", "").name());

            StoreException missing = Assertions.assertThrows(StoreException.class, () -> teams.readConfig("nobody"));
            Assertions.assertEquals(ErrorKind.NOT_FOUND, missing.kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void membersGetPaletteColoursInJoinOrder() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-team-members-");
        try {
            TeamRegistry teams = registry(new TeamRelayConfig(root));
            teams.create("alpha", "");

            Member first = teams.addMember("alpha", member("first"));
            Member second = teams.addMember("alpha", member("second"));

            Assertions.assertEquals("blue", first.color());
            Assertions.assertEquals("green", second.color());
            Assertions.assertEquals(FIXED.millis(), first.joinedAt());
            Assertions.assertEquals(List.of("team-lead", "first", "second"),
                    teams.readConfig("alpha").members().stream().map(Member::name).toList());

            StoreException duplicate = Assertions.assertThrows(StoreException.class,
                    () -> teams.addMember("alpha", member("first")));
            Assertions.assertEquals(ErrorKind.ALREADY_EXISTS, duplicate.kind());

            StoreException reserved = Assertions.assertThrows(StoreException.class,
                    () -> teams.addMember("alpha", member("team-lead")));
            Assertions.assertEquals(ErrorKind.INVALID_NAME, reserved.kind());

            StoreException noTeam = Assertions.assertThrows(StoreException.class,
                    () -> teams.addMember("beta", member("first")));
            Assertions.assertEquals(ErrorKind.NOT_FOUND, noTeam.kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void removeAndUpdateMember() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-team-remove-");
        try {
            TeamRegistry teams = registry(new TeamRelayConfig(root));
            teams.create("alpha", "");
            teams.addMember("alpha", member("worker"));

            Member updated = teams.updateMember("alpha", "worker",
                    m -> m.withProcessHandle("pid:42").withStatus(MemberStatus.ALIVE));
            Assertions.assertEquals("pid:42", updated.processHandle());
            Assertions.assertEquals(MemberStatus.ALIVE,
                    teams.readConfig("alpha").findMember("worker").orElseThrow().status());

            StoreException lead = Assertions.assertThrows(StoreException.class,
                    () -> teams.removeMember("alpha", "team-lead"));
            Assertions.assertEquals(ErrorKind.INVALID_NAME, lead.kind());

            Assertions.assertEquals("worker", teams.removeMember("alpha", "worker").name());
            StoreException gone = Assertions.assertThrows(StoreException.class,
                    () -> teams.removeMember("alpha", "worker"));
            Assertions.assertEquals(ErrorKind.NOT_FOUND, gone.kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deleteRefusedWhileTeammateAlive() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-team-delete-");
        try {
            TeamRelayConfig config = new TeamRelayConfig(root);
            TeamRegistry teams = registry(config);
            teams.create("alpha", "");
            teams.addMember("alpha", member("busy"));
            Files.createDirectories(config.tasksDir("alpha"));
            Files.writeString(config.taskFile("alpha", 1L), "{}");

            StoreException active = Assertions.assertThrows(StoreException.class,
                    () -> teams.delete("alpha", m -> MemberStatus.ALIVE));
            Assertions.assertEquals(ErrorKind.TEAMMATES_ACTIVE, active.kind());
            Assertions.assertTrue(Files.exists(config.configFile("alpha")));
            Assertions.assertTrue(Files.exists(config.taskFile("alpha", 1L)));

            TeamConfig deleted = teams.delete("alpha", m -> MemberStatus.DEAD);
            Assertions.assertEquals("alpha", deleted.name());
            Assertions.assertFalse(Files.exists(config.configFile("alpha")));
            Assertions.assertFalse(Files.exists(config.tasksDir("alpha")));
            Assertions.assertFalse(Files.exists(config.teamDir("alpha")));
            Assertions.assertFalse(teams.exists("alpha"));

            StoreException missing = Assertions.assertThrows(StoreException.class,
                    () -> teams.delete("alpha", HealthProbe.recorded()));
            Assertions.assertEquals(ErrorKind.NOT_FOUND, missing.kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deleteWaitsForTaskGraphLock() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-team-delete-graph-");
        try {
            TeamRelayConfig config = new TeamRelayConfig(root);
            TeamRelayContext context = context(config, 300L);
            TeamRegistry teams = new TeamRegistry(context, FIXED);
            TaskGraphEngine tasks = new TaskGraphEngine(context, teams);
            teams.create("alpha", "");
            Task task = tasks.create("alpha", "keep me", null, List.of());

            try (LockHandle ignored = new FileLockManager().acquire(config.taskGraphLock("alpha"), Duration.ofSeconds(5))) {
                StoreException busy = Assertions.assertThrows(StoreException.class,
                        () -> teams.delete("alpha", HealthProbe.recorded()));
                Assertions.assertEquals(ErrorKind.LOCK_TIMEOUT, busy.kind());
                Assertions.assertTrue(Files.exists(config.configFile("alpha")));
                Assertions.assertTrue(Files.exists(config.taskFile("alpha", task.id())));
            }

            teams.delete("alpha", HealthProbe.recorded());
            Assertions.assertFalse(Files.exists(config.teamDir("alpha")));
            StoreException gone = Assertions.assertThrows(StoreException.class,
                    () -> tasks.create("alpha", "orphan", null, List.of()));
            Assertions.assertEquals(ErrorKind.NOT_FOUND, gone.kind());
            Assertions.assertFalse(Files.exists(config.tasksDir("alpha")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deleteProceedsOnceInboxLockIsReleased() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-team-delete-inbox-");
        ExecutorService holder = Executors.newSingleThreadExecutor();
        try {
            TeamRelayConfig config = new TeamRelayConfig(root);
            TeamRelayContext context = context(config, 5_000L);
            TeamRegistry teams = new TeamRegistry(context, FIXED);
            MailboxEngine mailboxes = new MailboxEngine(context, FIXED);
            teams.create("alpha", "");
            mailboxes.ensureMailbox("alpha", TeamRelayConfig.LEAD_NAME);

            CountDownLatch locked = new CountDownLatch(1);
            Future<?> release = holder.submit(() -> {
                try (LockHandle ignored = new FileLockManager().acquire(config.inboxLock("alpha"), Duration.ofSeconds(5))) {
                    locked.countDown();
                    Thread.sleep(300L);
                }
                return null;
            });
            Assertions.assertTrue(locked.await(5, TimeUnit.SECONDS));

            long started = System.nanoTime();
            teams.delete("alpha", HealthProbe.recorded());
            long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            release.get(5, TimeUnit.SECONDS);

            Assertions.assertTrue(waitedMs >= 200L, "delete returned after " + waitedMs + "ms");
            Assertions.assertFalse(Files.exists(config.teamDir("alpha")));
            StoreException gone = Assertions.assertThrows(StoreException.class, () -> mailboxes.send(
                    "alpha", TeamRelayConfig.LEAD_NAME, MessageDraft.direct("worker", "late", "late")));
            Assertions.assertEquals(ErrorKind.NOT_FOUND, gone.kind());
            Assertions.assertFalse(Files.exists(config.inboxFile("alpha", TeamRelayConfig.LEAD_NAME)));
        } finally {
            holder.shutdownNow();
            deleteRecursively(root);
        }
    }

    private static Member member(String name) {
        return new Member(name, "general-purpose", "", "", null, "", false, 0L, "", MemberStatus.UNKNOWN);
    }

    private static TeamRelayContext context(TeamRelayConfig config, long lockTimeoutMs) {
        RuntimeSettings defaults = RuntimeSettings.defaults();
        RuntimeSettings settings = new RuntimeSettings(lockTimeoutMs, defaults.pollIntervalMs(),
                defaults.pollMaxWaitMs(), defaults.relayCheckIntervalMs(), defaults.relayTimeoutMs());
        return new TeamRelayContext(config, new FileDocumentStore(), settings);
    }

    private static TeamRegistry registry(TeamRelayConfig config) {
        return new TeamRegistry(new TeamRelayContext(config, new FileDocumentStore(), RuntimeSettings.defaults()), FIXED);
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
