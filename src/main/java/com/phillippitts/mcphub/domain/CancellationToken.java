package com.phillippitts.mcphub.domain;

import com.phillippitts.mcphub.exception.TaskCancelledException;

/**
 * Cooperative cancellation flag observed at node and backend-invoke boundaries.
 */
public interface CancellationToken {

    /** Token for work that is never cancelled (direct calls outside the task manager). */
    CancellationToken NONE = new CancellationToken() {
        @Override
        public boolean isCancellationRequested() {
            return false;
        }

        @Override
        public String taskId() {
            return "none";
        }
    };

    boolean isCancellationRequested();

    /** Id of the task this token belongs to, used in error messages. */
    String taskId();

    /**
     * @throws TaskCancelledException if cancellation has been requested
     */
    default void throwIfCancelled() {
        if (isCancellationRequested()) {
            throw new TaskCancelledException(taskId());
        }
    }
}
