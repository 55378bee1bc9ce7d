package io.teamrelay.storage;

import java.nio.file.Path;

/**
 * One held advisory lock. Closing the handle releases the lock; closing twice is a no-op.
 */
public interface LockHandle extends AutoCloseable {
    Path path();

    @Override
    void close();
}
