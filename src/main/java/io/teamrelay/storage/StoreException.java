package io.teamrelay.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Typed failure raised by every store operation.
 *
 * <p>Validation failures are always raised before anything is written, so a caller that
 * catches one of these can assume the documents it touched are unchanged. {@link ErrorKind#IO_ERROR}
 * carries the original {@link IOException} as its cause.
 */
public final class StoreException extends RuntimeException {
    private final ErrorKind kind;

    public StoreException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean retryable() {
        return kind.retryable();
    }

    public static StoreException notFound(String message) {
        return new StoreException(ErrorKind.NOT_FOUND, message);
    }

    public static StoreException alreadyExists(String message) {
        return new StoreException(ErrorKind.ALREADY_EXISTS, message);
    }

    public static StoreException invalidName(String message) {
        return new StoreException(ErrorKind.INVALID_NAME, message);
    }

    public static StoreException invalidArgument(String message) {
        return new StoreException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static StoreException lockTimeout(Path lockPath, Duration timeout) {
        return new StoreException(
                ErrorKind.LOCK_TIMEOUT,
                "Timed out after " + timeout.toMillis() + "ms waiting for lock: " + lockPath
        );
    }

    public static StoreException cycleDetected(String message) {
        return new StoreException(ErrorKind.CYCLE_DETECTED, message);
    }

    public static StoreException unknownTask(String message) {
        return new StoreException(ErrorKind.UNKNOWN_TASK, message);
    }

    public static StoreException invalidTransition(String message) {
        return new StoreException(ErrorKind.INVALID_TRANSITION, message);
    }

    public static StoreException teammatesActive(String message) {
        return new StoreException(ErrorKind.TEAMMATES_ACTIVE, message);
    }

    public static StoreException io(String message, IOException cause) {
        return new StoreException(ErrorKind.IO_ERROR, message + ": " + cause.getMessage(), cause);
    }
}
