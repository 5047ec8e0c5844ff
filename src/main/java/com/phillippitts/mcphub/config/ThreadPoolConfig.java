package com.phillippitts.mcphub.config;

import com.phillippitts.mcphub.config.properties.TaskProperties;
import com.phillippitts.mcphub.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for task workers and backend calls.
 *
 * <p>Both pools copy the submitting thread's Log4j2 ThreadContext to the worker, so
 * {@code requestId}, {@code taskId} and {@code taskKind} follow the work across threads.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;
    private final TaskProperties taskProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties, TaskProperties taskProperties) {
        this.threadPoolProperties = threadPoolProperties;
        this.taskProperties = taskProperties;
    }

    /**
     * Fixed pool of {@code mcp.tasks.max-workers} threads over an unbounded FIFO queue.
     *
     * <p>Tasks beyond the worker count stay {@code PENDING} in submission order.
     */
    @Bean(name = "taskWorkerExecutor")
    public ThreadPoolTaskExecutor taskWorkerExecutor() {
        int workers = taskProperties.getMaxWorkers();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("task-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Pool for backend health probes and invocations, sized by {@code threadpool.backend.*}.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A caller-runs policy would
     * execute the call on the task worker and escape the per-backend timeout; the resolver
     * treats a rejection as that backend failing.
     */
    @Bean(name = "backendExecutor")
    public ThreadPoolTaskExecutor backendExecutor() {
        ThreadPoolProperties.BackendPoolProperties props = threadPoolProperties.getBackend();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
