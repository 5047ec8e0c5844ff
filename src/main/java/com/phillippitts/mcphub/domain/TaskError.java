package com.phillippitts.mcphub.domain;

import com.phillippitts.mcphub.exception.ErrorKind;
import com.phillippitts.mcphub.exception.McpHubException;

import java.util.Objects;

/**
 * Structured error recorded on a failed task.
 *
 * @param kind    error kind from the application taxonomy
 * @param message human-readable reason
 */
public record TaskError(ErrorKind kind, String message) {

    public TaskError {
        Objects.requireNonNull(kind, "kind must not be null");
        message = message == null ? kind.name() : message;
    }

    /**
     * Converts any throwable into a task error. Application exceptions keep their kind,
     * everything else is reported as {@link ErrorKind#EXECUTION_ERROR}.
     */
    public static TaskError from(Throwable t) {
        if (t instanceof McpHubException e) {
            return new TaskError(e.getKind(), e.getMessage());
        }
        String msg = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return new TaskError(ErrorKind.EXECUTION_ERROR, msg);
    }
}
