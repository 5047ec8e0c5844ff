package com.phillippitts.mcphub.exception;

import java.time.Duration;

/**
 * Thrown by synchronous task execution when the caller's deadline expires.
 * The task itself has already been asked to cancel when this is thrown.
 */
public class TaskTimeoutException extends McpHubException {

    private final String taskId;
    private final Duration timeout;

    public TaskTimeoutException(String taskId, Duration timeout) {
        super(ErrorKind.TIMEOUT, "Task " + taskId + " did not finish within " + timeout.toMillis() + " ms");
        this.taskId = taskId;
        this.timeout = timeout;
    }

    public String getTaskId() {
        return taskId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
