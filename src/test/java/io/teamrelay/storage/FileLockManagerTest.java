package io.teamrelay.storage;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class FileLockManagerTest {

    @Test
    void secondManagerTimesOutWhileLockIsHeld() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-lock-timeout-");
        try {
            Path lockPath = root.resolve("team").resolve("config.json.lock");
            FileLockManager first = new FileLockManager();
            FileLockManager second = new FileLockManager();

            try (LockHandle held = first.acquire(lockPath, Duration.ofSeconds(1))) {
                Assertions.assertTrue(Files.exists(lockPath));
                long started = System.nanoTime();
                StoreException timeout = Assertions.assertThrows(StoreException.class,
                        () -> second.acquire(lockPath, Duration.ofMillis(200)));
                long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
                Assertions.assertEquals(ErrorKind.LOCK_TIMEOUT, timeout.kind());
                Assertions.assertTrue(timeout.retryable());
                Assertions.assertTrue(waitedMs >= 150L, "waited only " + waitedMs + "ms");
                Assertions.assertEquals(lockPath.toAbsolutePath().normalize(), held.path());
            }

            try (LockHandle reacquired = second.acquire(lockPath, Duration.ofMillis(200))) {
                Assertions.assertNotNull(reacquired);
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void waiterProceedsOnceHolderReleases() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-lock-handoff-");
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Path lockPath = root.resolve("tasks").resolve(".lock");
            FileLockManager first = new FileLockManager();
            FileLockManager second = new FileLockManager();
            CountDownLatch waiting = new CountDownLatch(1);

            LockHandle held = first.acquire(lockPath, Duration.ofSeconds(1));
            Future<Boolean> waiter = pool.submit(() -> {
                waiting.countDown();
                try (LockHandle ignored = second.acquire(lockPath, Duration.ofSeconds(5))) {
                    return true;
                }
            });
            Assertions.assertTrue(waiting.await(2, TimeUnit.SECONDS));
            Thread.sleep(100L);
            Assertions.assertFalse(waiter.isDone());
            held.close();
            Assertions.assertTrue(waiter.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void closingTwiceIsHarmless() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-lock-close-");
        try {
            FileLockManager locks = new FileLockManager();
            Path lockPath = root.resolve("x.lock");
            LockHandle handle = locks.acquire(lockPath, Duration.ofSeconds(1));
            handle.close();
            handle.close();
            try (LockHandle again = locks.acquire(lockPath, Duration.ofMillis(100))) {
                Assertions.assertEquals(handle.path(), again.path());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lockIsNotReentrant() throws Exception {
        Path root = Files.createTempDirectory("teamrelay-lock-reentry-");
        try {
            FileLockManager locks = new FileLockManager();
            Path lockPath = root.resolve("inboxes").resolve(".lock");
            try (LockHandle ignored = locks.acquire(lockPath, Duration.ofSeconds(1))) {
                StoreException nested = Assertions.assertThrows(StoreException.class,
                        () -> locks.acquire(lockPath, Duration.ofMillis(50)));
                Assertions.assertEquals(ErrorKind.LOCK_TIMEOUT, nested.kind());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lockPathIsSiblingMarker() {
        Path doc = Path.of("teams", "alpha", "config.json");
        Assertions.assertEquals(Path.of("teams", "alpha", "config.json.lock"), LockManager.lockPathFor(doc));
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
