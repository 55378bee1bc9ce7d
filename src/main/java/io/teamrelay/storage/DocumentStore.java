package io.teamrelay.storage;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Single-document persistence with validate-then-write modifications.
 *
 * <p>All modifications of one path are totally ordered by that path's lock. Nothing is ordered
 * across different paths; callers that need two documents to change together hold a shared lock
 * through {@link #withLock(Path, Duration, Supplier)}.
 */
public interface DocumentStore {
    <T> Optional<T> read(Path path, Class<T> type);

    void writeAtomic(Path path, Object document);

    /**
     * Locks {@code lockPath}, applies {@code transform} to the current document and commits the result.
     *
     * @return the committed document, or {@code null} when the transform removed it
     */
    <T> T modify(Path path, Path lockPath, Class<T> type, DocumentTransform<T> transform, Duration timeout);

    default <T> T modify(Path path, Class<T> type, DocumentTransform<T> transform, Duration timeout) {
        return modify(path, LockManager.lockPathFor(path), type, transform, timeout);
    }

    <R> R withLock(Path lockPath, Duration timeout, Supplier<R> action);

    boolean exists(Path path);

    /**
     * Documents directly inside {@code dir} whose file name ends with {@code suffix}, sorted by name.
     */
    List<Path> list(Path dir, String suffix);

    boolean delete(Path path);

    void deleteTree(Path dir);

    LockManager lockManager();
}
