package io.teamrelay.task;

import io.teamrelay.model.TaskStatus;
import io.teamrelay.storage.StoreException;

/**
 * Status state machine: pending -> in_progress -> completed, and any status -> deleted.
 */
public final class TaskTransitions {
    private TaskTransitions() {
    }

    public static boolean allowed(TaskStatus from, TaskStatus to) {
        if (from == to || to == TaskStatus.DELETED) {
            return true;
        }
        return (from == TaskStatus.PENDING && to == TaskStatus.IN_PROGRESS)
                || (from == TaskStatus.IN_PROGRESS && to == TaskStatus.COMPLETED);
    }

    public static void requireAllowed(long taskId, TaskStatus from, TaskStatus to) {
        if (!allowed(from, to)) {
            throw StoreException.invalidTransition(
                    "Task " + taskId + ": cannot transition from '" + from.wire() + "' to '" + to.wire() + "'");
        }
    }
}
