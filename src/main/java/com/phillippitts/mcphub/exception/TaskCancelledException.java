package com.phillippitts.mcphub.exception;

/**
 * Signals that a task observed a cancellation request and stopped.
 */
public class TaskCancelledException extends McpHubException {

    private final String taskId;

    public TaskCancelledException(String taskId) {
        super(ErrorKind.CANCELLED, "Task " + taskId + " was cancelled");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
