package com.phillippitts.mcphub.exception;

/**
 * Thrown when a task is submitted for a kind that the current catalog does not know.
 */
public class UnknownTaskKindException extends McpHubException {

    private final String taskKind;

    public UnknownTaskKindException(String taskKind) {
        super(ErrorKind.UNKNOWN_TASK_KIND, "Unknown task kind: " + taskKind);
        this.taskKind = taskKind;
    }

    public String getTaskKind() {
        return taskKind;
    }
}
