package com.phillippitts.mcphub.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs backend fallback activity. Throttled per capability and backend so a dead backend
 * does not flood the log on every request.
 */
@Component
class BackendEventsListener {
    private static final Logger LOG = LogManager.getLogger(BackendEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    BackendEventsListener() {
        this(Clock.systemUTC());
    }

    BackendEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onFallback(BackendFallbackEvent e) {
        String key = "fallback-" + e.capability() + '-' + e.backend() + '-' + e.kind();
        if (shouldLog(key)) {
            LOG.warn("Backend {} for {} skipped: kind={}, reason={}", e.backend(), e.capability(), e.kind(), e.reason());
        }
    }

    @EventListener
    void onAllFailed(AllBackendsFailedEvent e) {
        if (shouldLog("all-failed-" + e.capability())) {
            LOG.error("No backend available for {} ({} tried)", e.capability(), e.failures().size());
        }
    }

    @EventListener
    void onTaskCompleted(TaskCompletedEvent e) {
        if (e.errorKind() != null) {
            LOG.info("Task {} ({}) finished {} with {} after {} ms",
                    e.taskId(), e.kind(), e.status(), e.errorKind(), e.durationMs());
        } else {
            LOG.debug("Task {} ({}) finished {} after {} ms", e.taskId(), e.kind(), e.status(), e.durationMs());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
