package io.teamrelay.storage;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process locks keyed by normalized path. Only threads sharing this instance see each other.
 */
public final class LocalLockManager implements LockManager {
    private final ConcurrentMap<Path, Semaphore> permits = new ConcurrentHashMap<>();

    @Override
    public LockHandle acquire(Path lockPath, Duration timeout) {
        Path key = normalize(lockPath);
        Semaphore permit = permits.computeIfAbsent(key, ignored -> new Semaphore(1, true));
        boolean acquired;
        try {
            acquired = permit.tryAcquire(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException(ErrorKind.LOCK_TIMEOUT, "Interrupted while waiting for lock: " + key, e);
        }
        if (!acquired) {
            throw StoreException.lockTimeout(key, timeout);
        }
        return new PermitHandle(key, permit);
    }

    static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static final class PermitHandle implements LockHandle {
        private final Path path;
        private final Semaphore permit;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private PermitHandle(Path path, Semaphore permit) {
            this.path = path;
            this.permit = permit;
        }

        @Override
        public Path path() {
            return path;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                permit.release();
            }
        }
    }
}
