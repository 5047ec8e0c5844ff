package com.phillippitts.mcphub.service.task;

import com.phillippitts.mcphub.domain.TaskSnapshot;

import java.util.Optional;

/** Used when no {@link TaskStore} bean is configured. */
final class NoopTaskStore implements TaskStore {

    @Override
    public void persist(TaskSnapshot task) {
        // nothing to persist
    }

    @Override
    public Optional<TaskSnapshot> load(String taskId) {
        return Optional.empty();
    }
}
