package com.phillippitts.mcphub.exception;

/**
 * Thrown when a task id is unknown or the task has already been reaped.
 */
public class TaskNotFoundException extends McpHubException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super(ErrorKind.TASK_NOT_FOUND, "Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
