package com.phillippitts.mcphub.domain;

/**
 * Lifecycle states of a task. Transitions only move forward:
 * {@code PENDING -> RUNNING -> SUCCEEDED|FAILED}, {@code PENDING -> CANCELLED},
 * {@code RUNNING -> CANCELLED}.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    /**
     * @return true if moving from this status to {@code next} is a legal transition
     */
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next == SUCCEEDED || next == FAILED || next == CANCELLED;
            case SUCCEEDED, FAILED, CANCELLED -> false;
        };
    }
}
