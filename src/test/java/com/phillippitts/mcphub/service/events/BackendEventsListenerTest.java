package com.phillippitts.mcphub.service.events;

import com.phillippitts.mcphub.domain.TaskStatus;
import com.phillippitts.mcphub.exception.ErrorKind;
import com.phillippitts.mcphub.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class BackendEventsListenerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
    private final BackendEventsListener listener = new BackendEventsListener(clock);

    @Test
    void logsOncePerKeyWithinThrottleWindow() {
        assertThat(listener.shouldLog("fallback-llm")).isTrue();
        assertThat(listener.shouldLog("fallback-llm")).isFalse();

        clock.advance(Duration.ofSeconds(59));
        assertThat(listener.shouldLog("fallback-llm")).isFalse();

        clock.advance(Duration.ofSeconds(2));
        assertThat(listener.shouldLog("fallback-llm")).isTrue();
    }

    @Test
    void keysAreThrottledIndependently() {
        assertThat(listener.shouldLog("fallback-a")).isTrue();
        assertThat(listener.shouldLog("fallback-b")).isTrue();
        assertThat(listener.shouldLog("fallback-a")).isFalse();
    }

    @Test
    void handlersAcceptEveryEventShape() {
        Instant now = clock.instant();
        assertThatCode(() -> {
            listener.onFallback(new BackendFallbackEvent("llm-generate", "anythingllm-chat",
                    ErrorKind.BACKEND_UNHEALTHY, "auth check failed", now));
            listener.onAllFailed(new AllBackendsFailedEvent("llm-generate", List.of(), now));
            listener.onTaskCompleted(new TaskCompletedEvent("t-1", "graph:x", TaskStatus.FAILED,
                    ErrorKind.EXECUTION_ERROR, 12, now));
            listener.onTaskCompleted(new TaskCompletedEvent("t-2", "graph:x", TaskStatus.SUCCEEDED, null, 3, now));
        }).doesNotThrowAnyException();
    }
}
