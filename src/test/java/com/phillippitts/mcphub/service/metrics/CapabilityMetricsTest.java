package com.phillippitts.mcphub.service.metrics;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CapabilityMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final CapabilityMetrics metrics = new CapabilityMetrics(registry);

    @Test
    void latencyIsTaggedByCapabilityAndBackend() {
        metrics.recordLatency("llm-generate", "anythingllm-chat", TimeUnit.MILLISECONDS.toNanos(40));
        metrics.recordLatency("llm-generate", "anythingllm-chat", TimeUnit.MILLISECONDS.toNanos(60));

        Timer timer = registry.get("mcphub.capability.latency")
                .tag("capability", "llm-generate")
                .tag("backend", "anythingllm-chat")
                .timer();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(100.0);
    }

    @Test
    void successCountsSeparateDegradedResults() {
        metrics.incrementSuccess("vector-search", "mock-search", true);
        metrics.incrementSuccess("vector-search", "mock-search", true);
        metrics.incrementSuccess("vector-search", "anythingllm-search", false);

        assertThat(registry.get("mcphub.capability.success").tag("degraded", "true").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("mcphub.capability.success").tag("degraded", "false").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void failuresAndCompletedTasksAreCounted() {
        metrics.incrementFailure("mail-sync", "mailbox-sync", "backend_unhealthy");
        metrics.incrementTaskCompleted("graph:email-reply", "succeeded");

        assertThat(registry.get("mcphub.capability.failure").tag("reason", "backend_unhealthy").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("mcphub.tasks.completed").tag("status", "succeeded").counter().count())
                .isEqualTo(1.0);
    }
}
