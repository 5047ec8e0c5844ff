package com.phillippitts.mcphub.service.task;

import com.phillippitts.mcphub.domain.CancellationToken;
import com.phillippitts.mcphub.domain.TaskError;
import com.phillippitts.mcphub.domain.TaskSnapshot;
import com.phillippitts.mcphub.domain.TaskStatus;
import com.phillippitts.mcphub.exception.ErrorKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one task, owned by the task manager.
 *
 * <p>All transitions go through {@link #transition} under a lock and only move forward,
 * so a task reaches exactly one terminal status. The record doubles as the task's
 * {@link CancellationToken}.
 */
final class TaskRecord implements CancellationToken {
    private static final Logger LOG = LogManager.getLogger(TaskRecord.class);

    private final String id;
    private final String kind;
    private final Map<String, Object> payload;
    private final Instant createdAt;
    private final long sequence;

    private final ReentrantLock lock = new ReentrantLock();
    private final CountDownLatch terminal = new CountDownLatch(1);
    private volatile boolean cancelRequested;

    private TaskStatus status = TaskStatus.PENDING;
    private Object result;
    private TaskError error;
    private Throwable failure;
    private Instant startedAt;
    private Instant finishedAt;

    TaskRecord(String id, String kind, Map<String, Object> payload, Instant createdAt, long sequence) {
        this.id = id;
        this.kind = kind;
        this.payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.createdAt = createdAt;
        this.sequence = sequence;
    }

    String id() {
        return id;
    }

    String kind() {
        return kind;
    }

    Map<String, Object> payload() {
        return payload;
    }

    long sequence() {
        return sequence;
    }

    @Override
    public boolean isCancellationRequested() {
        return cancelRequested;
    }

    @Override
    public String taskId() {
        return id;
    }

    /** PENDING to RUNNING; false if the task was cancelled before a worker got to it. */
    boolean start(Instant now) {
        return transition(TaskStatus.RUNNING, now, null, null, null);
    }

    boolean succeed(Object value, Instant now) {
        return transition(TaskStatus.SUCCEEDED, now, value, null, null);
    }

    boolean fail(Throwable cause, Instant now) {
        return transition(TaskStatus.FAILED, now, null, TaskError.from(cause), cause);
    }

    boolean markCancelled(Instant now) {
        return transition(TaskStatus.CANCELLED, now, null,
                new TaskError(ErrorKind.CANCELLED, "Task " + id + " was cancelled"), null);
    }

    /**
     * Records a cancellation request. A pending task is cancelled immediately.
     *
     * @return true if this call moved the task to CANCELLED
     */
    boolean requestCancel(Instant now) {
        lock.lock();
        try {
            if (status.isTerminal()) {
                return false;
            }
            cancelRequested = true;
            if (status == TaskStatus.PENDING) {
                return markCancelled(now);
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    boolean awaitTerminal(Duration timeout) throws InterruptedException {
        return terminal.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** The exception a failed task ended with, or null. */
    Throwable failure() {
        lock.lock();
        try {
            return failure;
        } finally {
            lock.unlock();
        }
    }

    TaskSnapshot snapshot() {
        lock.lock();
        try {
            return new TaskSnapshot(id, kind, payload, status, result, error, createdAt, startedAt, finishedAt);
        } finally {
            lock.unlock();
        }
    }

    private boolean transition(TaskStatus next, Instant now, Object value, TaskError err, Throwable cause) {
        lock.lock();
        try {
            if (!status.canTransitionTo(next)) {
                LOG.debug("Ignoring transition {} -> {} for task {}", status, next, id);
                return false;
            }
            status = next;
            if (next == TaskStatus.RUNNING) {
                startedAt = now;
                return true;
            }
            result = value;
            error = err;
            failure = cause;
            finishedAt = now;
            terminal.countDown();
            return true;
        } finally {
            lock.unlock();
        }
    }
}
