package com.phillippitts.mcphub.service.task;

import com.phillippitts.mcphub.domain.TaskSnapshot;
import com.phillippitts.mcphub.domain.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Accepts work items and runs them on a bounded worker pool with pollable status.
 *
 * <p>Task kinds:
 * <ul>
 *   <li>{@code graph:<name>}: execute a registered component graph</li>
 *   <li>{@code component:<name>}: run one component against the payload</li>
 *   <li>{@code capability:<name>}: resolve one capability call</li>
 * </ul>
 */
public interface TaskManager {

    /**
     * Creates a task in {@code PENDING} and queues it.
     *
     * @return the new task id
     * @throws com.phillippitts.mcphub.exception.UnknownTaskKindException if the kind is not registered
     */
    String submit(String kind, Map<String, Object> payload);

    /**
     * @throws com.phillippitts.mcphub.exception.TaskNotFoundException if unknown or reaped
     */
    TaskSnapshot getStatus(String taskId);

    /**
     * Cancels a task. Pending tasks become {@code CANCELLED} without running; running tasks
     * stop at the next node or backend boundary; terminal tasks are left unchanged.
     *
     * @return the task's state right after the request
     * @throws com.phillippitts.mcphub.exception.TaskNotFoundException if unknown
     */
    TaskSnapshot cancel(String taskId);

    /**
     * Submits and waits for the result. On timeout the task is cancelled.
     *
     * @return the task result
     * @throws com.phillippitts.mcphub.exception.TaskTimeoutException   if the deadline passes
     * @throws com.phillippitts.mcphub.exception.TaskCancelledException if the task was cancelled
     * @throws com.phillippitts.mcphub.exception.McpHubException        with the task's error if it failed
     */
    Object runSync(String kind, Map<String, Object> payload, Duration timeout);

    /**
     * Lists tasks newest first.
     *
     * @param status only tasks in this status, or null for all
     * @param limit  maximum number returned
     */
    List<TaskSnapshot> list(TaskStatus status, int limit);

    /**
     * Removes terminal tasks that finished before {@code cutoff}.
     *
     * @return number of tasks removed
     */
    int reap(Instant cutoff);
}
