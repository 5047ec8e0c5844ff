package com.phillippitts.mcphub.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable point-in-time view of a task.
 *
 * <p>{@code result} is set only when {@code status} is {@link TaskStatus#SUCCEEDED};
 * {@code error} only when it is {@link TaskStatus#FAILED} or {@link TaskStatus#CANCELLED}.
 *
 * @param id         opaque task id
 * @param kind       task kind, e.g. {@code graph:meeting-followup}
 * @param payload    submitted payload
 * @param status     current status
 * @param result     result of a succeeded task, otherwise null
 * @param error      error of a failed or cancelled task, otherwise null
 * @param createdAt  submission time
 * @param startedAt  time a worker picked the task up, null while pending
 * @param finishedAt time the task reached a terminal status, null before that
 */
public record TaskSnapshot(
        String id,
        String kind,
        Map<String, Object> payload,
        TaskStatus status,
        Object result,
        TaskError error,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt
) {

    public TaskSnapshot {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        payload = payload == null ? Map.of() : payload;
        if (result != null && error != null) {
            throw new IllegalArgumentException("result and error are mutually exclusive");
        }
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
