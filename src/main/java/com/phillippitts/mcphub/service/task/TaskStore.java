package com.phillippitts.mcphub.service.task;

import com.phillippitts.mcphub.domain.TaskSnapshot;

import java.util.Optional;

/**
 * Optional durable storage for task state. The in-memory table stays authoritative; the
 * store is written on every transition and consulted only for ids no longer in memory.
 */
public interface TaskStore {

    void persist(TaskSnapshot task);

    Optional<TaskSnapshot> load(String taskId);
}
