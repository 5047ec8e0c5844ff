package com.phillippitts.mcphub.service.task;

import com.phillippitts.mcphub.domain.TaskSnapshot;
import com.phillippitts.mcphub.domain.TaskStatus;
import com.phillippitts.mcphub.exception.ConfigurationException;
import com.phillippitts.mcphub.exception.ErrorKind;
import com.phillippitts.mcphub.exception.McpHubException;
import com.phillippitts.mcphub.exception.TaskCancelledException;
import com.phillippitts.mcphub.exception.TaskNotFoundException;
import com.phillippitts.mcphub.exception.TaskTimeoutException;
import com.phillippitts.mcphub.exception.UnknownTaskKindException;
import com.phillippitts.mcphub.service.events.TaskCompletedEvent;
import com.phillippitts.mcphub.service.metrics.CapabilityMetrics;
import com.phillippitts.mcphub.service.registry.Catalog;
import com.phillippitts.mcphub.service.registry.ServiceRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Task manager backed by a fixed-size worker pool with an unbounded FIFO queue.
 *
 * <p>A saturated pool leaves tasks {@code PENDING}; that is the only backpressure. Every
 * exception thrown while running a task is caught at the task boundary and recorded, so a
 * worker thread never dies from task code.
 *
 * <p>Each task captures the catalog when a worker starts it and runs to completion on that
 * snapshot.
 */
@Service
public class DefaultTaskManager implements TaskManager {
    private static final Logger LOG = LogManager.getLogger(DefaultTaskManager.class);

    static final String MDC_TASK_ID = "taskId";
    static final String MDC_TASK_KIND = "taskKind";

    private final Map<String, TaskRecord> tasks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger running = new AtomicInteger();

    private final ServiceRegistry registry;
    private final TaskDispatcher dispatcher;
    private final Executor workers;
    private final TaskStore store;
    private final ApplicationEventPublisher publisher;
    private final CapabilityMetrics metrics;
    private final Clock clock;

    @Autowired
    public DefaultTaskManager(ServiceRegistry registry,
                              TaskDispatcher dispatcher,
                              @Qualifier("taskWorkerExecutor") Executor workers,
                              ObjectProvider<TaskStore> store,
                              ApplicationEventPublisher publisher,
                              CapabilityMetrics metrics) {
        this(registry, dispatcher, workers, store.getIfAvailable(NoopTaskStore::new), publisher, metrics,
                Clock.systemUTC());
    }

    DefaultTaskManager(ServiceRegistry registry, TaskDispatcher dispatcher, Executor workers, TaskStore store,
                       ApplicationEventPublisher publisher, CapabilityMetrics metrics, Clock clock) {
        this.registry = Objects.requireNonNull(registry);
        this.dispatcher = Objects.requireNonNull(dispatcher);
        this.workers = Objects.requireNonNull(workers);
        this.store = Objects.requireNonNull(store);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public String submit(String kind, Map<String, Object> payload) {
        Objects.requireNonNull(kind, "kind");
        if (!registry.isReady()) {
            throw new ConfigurationException("Service registry is not ready");
        }
        if (!registry.catalog().supports(kind)) {
            throw new UnknownTaskKindException(kind);
        }
        String id = UUID.randomUUID().toString();
        TaskRecord record = new TaskRecord(id, kind, payload, clock.instant(), sequence.incrementAndGet());
        tasks.put(id, record);
        persist(record);
        LOG.info("Submitted task {} kind={}", id, kind);
        try {
            workers.execute(() -> runTask(record));
        } catch (RejectedExecutionException e) {
            LOG.error("Worker pool rejected task {}", id, e);
            if (record.fail(e, clock.instant())) {
                finished(record);
            }
        }
        return id;
    }

    @Override
    public TaskSnapshot getStatus(String taskId) {
        TaskRecord record = tasks.get(taskId);
        if (record != null) {
            return record.snapshot();
        }
        return loadFromStore(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    @Override
    public TaskSnapshot cancel(String taskId) {
        TaskRecord record = tasks.get(taskId);
        if (record == null) {
            // A reaped or stored task is terminal; cancelling it is a no-op.
            return loadFromStore(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        }
        if (record.requestCancel(clock.instant())) {
            LOG.info("Task {} cancelled before start", taskId);
            finished(record);
        } else {
            LOG.debug("Cancellation requested for task {} in status {}", taskId, record.snapshot().status());
        }
        return record.snapshot();
    }

    @Override
    public Object runSync(String kind, Map<String, Object> payload, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        String id = submit(kind, payload);
        TaskRecord record = tasks.get(id);
        try {
            if (!record.awaitTerminal(timeout)) {
                cancel(id);
                LOG.warn("Synchronous task {} timed out after {} ms; cancelled", id, timeout.toMillis());
                throw new TaskTimeoutException(id, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(id);
            throw new TaskCancelledException(id);
        }

        TaskSnapshot snapshot = record.snapshot();
        switch (snapshot.status()) {
            case SUCCEEDED:
                return snapshot.result();
            case CANCELLED:
                throw new TaskCancelledException(id);
            case FAILED:
                Throwable failure = record.failure();
                if (failure instanceof McpHubException e) {
                    throw e;
                }
                throw new McpHubException(ErrorKind.EXECUTION_ERROR, snapshot.error().message(), failure);
            default:
                throw new IllegalStateException("Task " + id + " is not terminal: " + snapshot.status());
        }
    }

    @Override
    public List<TaskSnapshot> list(TaskStatus status, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return tasks.values().stream()
                .sorted(Comparator.comparingLong(TaskRecord::sequence).reversed())
                .map(TaskRecord::snapshot)
                .filter(s -> status == null || s.status() == status)
                .limit(limit)
                .toList();
    }

    @Override
    public int reap(Instant cutoff) {
        int removed = 0;
        for (TaskRecord record : tasks.values()) {
            TaskSnapshot s = record.snapshot();
            if (s.isTerminal() && s.finishedAt() != null && s.finishedAt().isBefore(cutoff)
                    && tasks.remove(record.id(), record)) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.info("Reaped {} finished task(s) older than {}", removed, cutoff);
        }
        return removed;
    }

    /** Number of tasks currently executing on a worker. */
    public int runningCount() {
        return running.get();
    }

    private void runTask(TaskRecord record) {
        if (!record.start(clock.instant())) {
            LOG.debug("Skipping task {}: no longer pending", record.id());
            return;
        }
        running.incrementAndGet();
        ThreadContext.put(MDC_TASK_ID, record.id());
        ThreadContext.put(MDC_TASK_KIND, record.kind());
        try {
            persist(record);
            Catalog catalog = registry.catalog();
            Object result = dispatcher.dispatch(record.id(), record.kind(), record.payload(), record, catalog);
            if (record.isCancellationRequested()) {
                record.markCancelled(clock.instant());
            } else {
                record.succeed(result, clock.instant());
            }
        } catch (TaskCancelledException e) {
            record.markCancelled(clock.instant());
        } catch (Exception e) {
            if (e instanceof McpHubException) {
                LOG.warn("Task {} failed: {}", record.id(), e.getMessage());
            } else {
                LOG.error("Task {} failed with unexpected error", record.id(), e);
            }
            record.fail(e, clock.instant());
        } catch (VirtualMachineError e) {
            LOG.error("Task {} aborted by fatal error", record.id(), e);
            record.fail(e, clock.instant());
            throw e;
        } catch (Error e) {
            LOG.error("Task {} failed with error", record.id(), e);
            record.fail(e, clock.instant());
        } finally {
            running.decrementAndGet();
            finished(record);
            ThreadContext.remove(MDC_TASK_ID);
            ThreadContext.remove(MDC_TASK_KIND);
        }
    }

    private void finished(TaskRecord record) {
        TaskSnapshot s = record.snapshot();
        persist(record);
        metrics.incrementTaskCompleted(s.kind(), s.status().name().toLowerCase(Locale.ROOT));
        long durationMs = s.finishedAt() == null ? 0 : Duration.between(s.createdAt(), s.finishedAt()).toMillis();
        publisher.publishEvent(new TaskCompletedEvent(s.id(), s.kind(), s.status(),
                s.error() == null ? null : s.error().kind(), durationMs, clock.instant()));
        LOG.info("Task {} {} in {} ms", s.id(), s.status(), durationMs);
    }

    private void persist(TaskRecord record) {
        try {
            store.persist(record.snapshot());
        } catch (RuntimeException e) {
            LOG.warn("Task store rejected snapshot of {}: {}", record.id(), e.toString());
        }
    }

    private Optional<TaskSnapshot> loadFromStore(String taskId) {
        try {
            return store.load(taskId);
        } catch (RuntimeException e) {
            LOG.warn("Task store lookup failed for {}: {}", taskId, e.toString());
            return Optional.empty();
        }
    }
}
