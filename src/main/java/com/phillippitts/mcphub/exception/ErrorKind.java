package com.phillippitts.mcphub.exception;

/**
 * Structured error kinds reported on failed tasks and API error bodies.
 */
public enum ErrorKind {
    UNKNOWN_TASK_KIND,
    TASK_NOT_FOUND,
    BACKEND_UNHEALTHY,
    BACKEND_TIMEOUT,
    BACKEND_INVOCATION_ERROR,
    ALL_BACKENDS_FAILED,
    MISSING_STATE_KEY,
    NO_MATCHING_EDGE,
    GRAPH_CYCLE,
    CONFIGURATION_ERROR,
    TIMEOUT,
    CANCELLED,
    /** A component failed with an exception outside this taxonomy. */
    EXECUTION_ERROR;

    /** @return true for errors recovered locally by the capability resolver */
    public boolean isBackendLocal() {
        return this == BACKEND_UNHEALTHY || this == BACKEND_TIMEOUT || this == BACKEND_INVOCATION_ERROR;
    }
}
