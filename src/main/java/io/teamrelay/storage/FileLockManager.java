package io.teamrelay.storage;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Advisory OS file locks on a lock-marker file, honored by every process that goes through this class.
 *
 * <p>Threads of one instance queue on an in-process permit first, because the JVM rejects a second
 * {@link FileLock} on the same file. A lock held by another instance in the same JVM surfaces as
 * {@link OverlappingFileLockException} and is retried like a lock held by another process.
 */
public final class FileLockManager implements LockManager {
    static final long RETRY_INTERVAL_MS = 10L;

    private final LocalLockManager local = new LocalLockManager();

    @Override
    public LockHandle acquire(Path lockPath, Duration timeout) {
        long deadlineNanos = System.nanoTime() + timeout.toNanos();
        Path key = LocalLockManager.normalize(lockPath);
        LockHandle permit = local.acquire(key, timeout);
        FileChannel channel = null;
        try {
            Path parent = key.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(key, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            while (true) {
                FileLock lock = tryLock(channel);
                if (lock != null) {
                    return new FileLockHandle(key, channel, lock, permit);
                }
                if (System.nanoTime() >= deadlineNanos) {
                    throw StoreException.lockTimeout(key, timeout);
                }
                Thread.sleep(RETRY_INTERVAL_MS);
            }
        } catch (IOException e) {
            throw abandon(channel, permit, StoreException.io("Failed to lock " + key, e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw abandon(channel, permit,
                    new StoreException(ErrorKind.LOCK_TIMEOUT, "Interrupted while waiting for lock: " + key, e));
        } catch (RuntimeException e) {
            throw abandon(channel, permit, e);
        }
    }

    private static FileLock tryLock(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException held) {
            return null;
        }
    }

    private static RuntimeException abandon(FileChannel channel, LockHandle permit, RuntimeException failure) {
        try {
            if (channel != null) {
                channel.close();
            }
        } catch (IOException closeFailure) {
            failure.addSuppressed(closeFailure);
        } finally {
            permit.close();
        }
        return failure;
    }

    private static final class FileLockHandle implements LockHandle {
        private final Path path;
        private final FileChannel channel;
        private final FileLock lock;
        private final LockHandle permit;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private FileLockHandle(Path path, FileChannel channel, FileLock lock, LockHandle permit) {
            this.path = path;
            this.channel = channel;
            this.lock = lock;
            this.permit = permit;
        }

        @Override
        public Path path() {
            return path;
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                // Closing the channel also drops the lock, even when release() fails.
                try {
                    lock.release();
                } finally {
                    channel.close();
                }
            } catch (IOException e) {
                throw StoreException.io("Failed to release lock " + path, e);
            } finally {
                permit.close();
            }
        }
    }
}
