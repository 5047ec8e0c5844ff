package com.phillippitts.mcphub.service.task;

import com.phillippitts.mcphub.config.properties.TaskProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodically removes finished tasks older than {@code mcp.tasks.retention-minutes}.
 */
@Component
class TaskReaper {

    private final TaskManager taskManager;
    private final Duration retention;
    private final Clock clock;

    @Autowired
    TaskReaper(TaskManager taskManager, TaskProperties props) {
        this(taskManager, Duration.ofMinutes(props.getRetentionMinutes()), Clock.systemUTC());
    }

    TaskReaper(TaskManager taskManager, Duration retention, Clock clock) {
        this.taskManager = taskManager;
        this.retention = retention;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${mcp.tasks.reaper-interval-ms:60000}",
            initialDelayString = "${mcp.tasks.reaper-interval-ms:60000}")
    int reap() {
        Instant cutoff = clock.instant().minus(retention);
        return taskManager.reap(cutoff);
    }
}
