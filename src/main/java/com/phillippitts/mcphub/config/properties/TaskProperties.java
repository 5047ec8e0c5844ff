package com.phillippitts.mcphub.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the task manager.
 *
 * <pre>
 * mcp.tasks.max-workers=4
 * mcp.tasks.retention-minutes=60
 * mcp.tasks.reaper-interval-ms=60000
 * mcp.tasks.default-sync-timeout-ms=120000
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "mcp.tasks")
public class TaskProperties {

    /** Fixed number of task workers; extra tasks wait in FIFO order. */
    @Min(1)
    @Max(256)
    private final int maxWorkers;

    /** Terminal tasks older than this are removed by the reaper. */
    @Min(1)
    private final long retentionMinutes;

    @Min(1000)
    private final long reaperIntervalMs;

    /** Deadline for synchronous runs that do not name one. */
    @Min(1)
    private final long defaultSyncTimeoutMs;

    @ConstructorBinding
    public TaskProperties(Integer maxWorkers, Long retentionMinutes, Long reaperIntervalMs,
                          Long defaultSyncTimeoutMs) {
        this.maxWorkers = maxWorkers == null ? 4 : maxWorkers;
        this.retentionMinutes = retentionMinutes == null ? 60 : retentionMinutes;
        this.reaperIntervalMs = reaperIntervalMs == null ? 60_000 : reaperIntervalMs;
        this.defaultSyncTimeoutMs = defaultSyncTimeoutMs == null ? 120_000 : defaultSyncTimeoutMs;
    }

    /**
     * Convenience constructor for tests.
     */
    public TaskProperties(int maxWorkers) {
        this(maxWorkers, null, null, null);
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public long getRetentionMinutes() {
        return retentionMinutes;
    }

    public long getReaperIntervalMs() {
        return reaperIntervalMs;
    }

    public long getDefaultSyncTimeoutMs() {
        return defaultSyncTimeoutMs;
    }
}
