package io.teamrelay.storage;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

abstract class AbstractDocumentStore implements DocumentStore {
    private final LockManager lockManager;

    AbstractDocumentStore(LockManager lockManager) {
        this.lockManager = lockManager;
    }

    @Override
    public final <T> T modify(Path path, Path lockPath, Class<T> type, DocumentTransform<T> transform, Duration timeout) {
        try (LockHandle ignored = lockManager.acquire(lockPath, timeout)) {
            Optional<T> current = read(path, type);
            T next = transform.apply(current);
            if (next == null) {
                if (current.isPresent()) {
                    delete(path);
                }
                return null;
            }
            writeAtomic(path, next);
            return next;
        }
    }

    @Override
    public final <R> R withLock(Path lockPath, Duration timeout, Supplier<R> action) {
        try (LockHandle ignored = lockManager.acquire(lockPath, timeout)) {
            return action.get();
        }
    }

    @Override
    public final LockManager lockManager() {
        return lockManager;
    }
}
