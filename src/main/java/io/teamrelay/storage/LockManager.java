package io.teamrelay.storage;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Exclusive, timeout-bounded locks scoped to a path.
 *
 * <p>Locks are not reentrant. Acquiring a path that the same logical operation already holds
 * waits for the full timeout and then fails with {@link ErrorKind#LOCK_TIMEOUT}.
 */
public interface LockManager {
    Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    LockHandle acquire(Path lockPath, Duration timeout);

    default LockHandle acquire(Path lockPath) {
        return acquire(lockPath, DEFAULT_TIMEOUT);
    }

    /**
     * Lock marker used for single-document modifications: a hidden sibling named after the document.
     */
    static Path lockPathFor(Path documentPath) {
        Path fileName = documentPath.getFileName();
        return documentPath.resolveSibling(fileName + ".lock");
    }
}
