package io.teamrelay.observability;

import io.teamrelay.storage.ErrorKind;
import io.teamrelay.storage.FileLockManager;
import io.teamrelay.storage.LockHandle;
import io.teamrelay.storage.LockManager;
import io.teamrelay.storage.StoreException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsFormHashChainAcrossWriters() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-audit-chain-");
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            Path auditFile = root.resolve("audit").resolve("audit.log");
            List<Callable<Void>> writers = new ArrayList<>();
            for (int w = 0; w < 3; w++) {
                AuditLogger logger = new AuditLogger(auditFile, new FileLockManager(), Duration.ofSeconds(10));
                String actor = "writer-" + w;
                writers.add(() -> {
                    for (int i = 0; i < 10; i++) {
                        logger.log(AuditLogger.AuditEvent.ok("task.create", actor, "alpha", String.valueOf(i), Map.of("n", i)));
                    }
                    return null;
                });
            }
            for (Future<Void> future : pool.invokeAll(writers)) {
                future.get(60, TimeUnit.SECONDS);
            }

            AuditLogger reader = new AuditLogger(auditFile, new FileLockManager(), Duration.ofSeconds(10));
            AuditLogger.Verification verification = reader.verify();
            Assertions.assertTrue(verification.ok(), verification.reason());
            Assertions.assertEquals(30, verification.rows());
            Assertions.assertFalse(reader.currentHash().isBlank());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksChain() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-audit-tamper-");
        try {
            Path auditFile = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(auditFile, new FileLockManager(), Duration.ofSeconds(5));
            logger.log(AuditLogger.AuditEvent.ok("team.create", "team-lead", "alpha", "alpha", Map.of()));
            logger.log(AuditLogger.AuditEvent.rejected("team.create", "team-lead", "alpha", "alpha",
                    StoreException.alreadyExists("Team 'alpha' already exists")));
            logger.log(AuditLogger.AuditEvent.ok("team.delete", "team-lead", "alpha", "alpha", Map.of()));

            List<String> lines = new ArrayList<>(Files.readAllLines(auditFile, StandardCharsets.UTF_8));
            Assertions.assertTrue(lines.get(1).contains("\"result\":\"rejected\""));
            Assertions.assertTrue(lines.get(1).contains("already_exists"));
            lines.set(1, lines.get(1).replace("rejected", "ok"));
            Files.write(auditFile, lines, StandardCharsets.UTF_8);

            AuditLogger.Verification verification = logger.verify();
            Assertions.assertFalse(verification.ok());
            Assertions.assertEquals(2, verification.brokenLine());
            Assertions.assertEquals("hash_mismatch", verification.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deferredRowKeepsItsPlaceInChain() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-audit-defer-");
        try {
            Path auditFile = root.resolve("audit").resolve("audit.log");
            AuditLogger logger = new AuditLogger(auditFile, new FileLockManager(), Duration.ofMillis(200));
            logger.log(AuditLogger.AuditEvent.ok("team.create", "team-lead", "alpha", "alpha", Map.of()));

            try (LockHandle ignored = new FileLockManager().acquire(LockManager.lockPathFor(auditFile), Duration.ofSeconds(5))) {
                Optional<StoreException> failure = logger.logOrDefer(
                        AuditLogger.AuditEvent.ok("task.create", "team-lead", "alpha", "late", Map.of()));
                Assertions.assertTrue(failure.isPresent());
                Assertions.assertEquals(ErrorKind.LOCK_TIMEOUT, failure.get().kind());
                Assertions.assertTrue(failure.get().retryable());
            }
            Assertions.assertEquals(1, logger.deferredCount());
            Assertions.assertEquals(1, Files.readAllLines(auditFile, StandardCharsets.UTF_8).size());

            Assertions.assertEquals(Optional.empty(), logger.logOrDefer(
                    AuditLogger.AuditEvent.ok("task.update", "team-lead", "alpha", "after", Map.of())));
            Assertions.assertEquals(0, logger.deferredCount());
            logger.flushDeferred();

            List<String> rows = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            Assertions.assertEquals(3, rows.size());
            Assertions.assertTrue(rows.get(1).contains("\"resource\":\"late\""));
            Assertions.assertTrue(rows.get(2).contains("\"resource\":\"after\""));
            AuditLogger.Verification verification = logger.verify();
            Assertions.assertTrue(verification.ok(), verification.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void emptyLogVerifies() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-audit-empty-");
        try {
            AuditLogger logger = new AuditLogger(root.resolve("audit.log"), new FileLockManager(), Duration.ofSeconds(5));
            Assertions.assertTrue(logger.verify().ok());
            Assertions.assertEquals("", logger.currentHash());
        } finally {
            deleteRecursively(root);
        }
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
