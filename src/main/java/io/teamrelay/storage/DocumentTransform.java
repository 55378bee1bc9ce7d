package io.teamrelay.storage;

import java.util.Optional;

/**
 * Pure step of a read/modify/write cycle.
 *
 * <p>Receives the committed document, or empty when none exists, and returns the replacement.
 * Returning {@code null} removes the document. Throwing aborts the cycle before anything is written.
 */
@FunctionalInterface
public interface DocumentTransform<T> {
    T apply(Optional<T> current);
}
