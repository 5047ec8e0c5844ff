package com.phillippitts.mcphub.service.events;

import com.phillippitts.mcphub.domain.TaskStatus;
import com.phillippitts.mcphub.exception.ErrorKind;

import java.time.Instant;

/**
 * Published once per task when it reaches a terminal status.
 *
 * @param errorKind null unless the task failed or was cancelled
 */
public record TaskCompletedEvent(String taskId, String kind, TaskStatus status, ErrorKind errorKind,
                                 long durationMs, Instant at) { }
