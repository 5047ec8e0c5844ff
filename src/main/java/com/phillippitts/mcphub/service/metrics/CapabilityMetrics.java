package com.phillippitts.mcphub.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for capability resolution and task completion.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Backend invoke latency per capability and backend</li>
 *   <li>Success counts, tagged with whether the result was degraded</li>
 *   <li>Failure counts per backend and error kind</li>
 *   <li>Completed tasks per kind and terminal status</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class CapabilityMetrics {

    private static final String METRIC_PREFIX = "mcphub";

    private final MeterRegistry registry;

    public CapabilityMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency of one backend invocation, successful or not.
     */
    public void recordLatency(String capability, String backend, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".capability.latency")
                .description("Time spent in one backend invocation")
                .tag("capability", capability)
                .tag("backend", backend)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String capability, String backend, boolean degraded) {
        Counter.builder(METRIC_PREFIX + ".capability.success")
                .description("Number of capability calls served")
                .tag("capability", capability)
                .tag("backend", backend)
                .tag("degraded", Boolean.toString(degraded))
                .register(registry)
                .increment();
    }

    /**
     * @param reason lower-case error kind, e.g. {@code backend_timeout}, or {@code all_backends_failed}
     *               with backend {@code none}
     */
    public void incrementFailure(String capability, String backend, String reason) {
        Counter.builder(METRIC_PREFIX + ".capability.failure")
                .description("Number of failed or skipped backend calls")
                .tag("capability", capability)
                .tag("backend", backend)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementTaskCompleted(String kind, String status) {
        Counter.builder(METRIC_PREFIX + ".tasks.completed")
                .description("Number of tasks that reached a terminal status")
                .tag("kind", kind)
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
