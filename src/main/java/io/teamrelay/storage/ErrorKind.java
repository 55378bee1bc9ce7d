package io.teamrelay.storage;

public enum ErrorKind {
    NOT_FOUND,
    ALREADY_EXISTS,
    INVALID_NAME,
    INVALID_ARGUMENT,
    LOCK_TIMEOUT,
    CYCLE_DETECTED,
    UNKNOWN_TASK,
    INVALID_TRANSITION,
    TEAMMATES_ACTIVE,
    IO_ERROR;

    public boolean retryable() {
        return this == LOCK_TIMEOUT;
    }

    public String code() {
        return name().toLowerCase();
    }
}
