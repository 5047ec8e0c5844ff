package com.phillippitts.mcphub.config;

import com.phillippitts.mcphub.config.properties.TaskProperties;
import com.phillippitts.mcphub.config.properties.ThreadPoolProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor workers;
    private ThreadPoolTaskExecutor backends;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (workers != null) {
            workers.shutdown();
        }
        if (backends != null) {
            backends.shutdown();
        }
    }

    @Test
    void workerPoolIsFixedAtMaxWorkers() {
        workers = new ThreadPoolConfig(new ThreadPoolProperties(), new TaskProperties(3)).taskWorkerExecutor();

        assertThat(workers.getCorePoolSize()).isEqualTo(3);
        assertThat(workers.getMaxPoolSize()).isEqualTo(3);
        assertThat(workers.getThreadNamePrefix()).isEqualTo("task-worker-");
    }

    @Test
    void backendPoolAbortsWhenSaturated() {
        backends = new ThreadPoolConfig(new ThreadPoolProperties(), new TaskProperties(1)).backendExecutor();

        assertThat(backends.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
        assertThat(backends.getCorePoolSize()).isEqualTo(8);
        assertThat(backends.getMaxPoolSize()).isEqualTo(16);
    }

    @Test
    void threadContextFollowsWorkToPoolThread() throws Exception {
        workers = new ThreadPoolConfig(new ThreadPoolProperties(), new TaskProperties(1)).taskWorkerExecutor();
        ThreadContext.put("requestId", "req-77");

        CompletableFuture<String> seen = new CompletableFuture<>();
        workers.execute(() -> seen.complete(ThreadContext.get("requestId")));

        assertThat(seen.get(5, TimeUnit.SECONDS)).isEqualTo("req-77");
    }

    @Test
    void poolThreadContextIsRestoredAfterRun() throws Exception {
        workers = new ThreadPoolConfig(new ThreadPoolProperties(), new TaskProperties(1)).taskWorkerExecutor();
        ThreadContext.put("taskId", "t-1");
        workers.submit(() -> ThreadContext.put("leak", "yes")).get(5, TimeUnit.SECONDS);
        ThreadContext.clearAll();

        CompletableFuture<String> leaked = new CompletableFuture<>();
        workers.execute(() -> leaked.complete(String.valueOf(ThreadContext.get("leak")) + "/"
                + ThreadContext.get("taskId")));

        assertThat(leaked.get(5, TimeUnit.SECONDS)).isEqualTo("null/null");
    }

    @Test
    void poolGaugesAreRegisteredForBothExecutors() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties(), new TaskProperties(2));
        workers = config.taskWorkerExecutor();
        backends = config.backendExecutor();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        new ThreadPoolMetricsConfig().executorPoolMetrics(workers, backends).bindTo(registry);

        assertThat(registry.get("mcphub.pool.size").tag("pool", "task-worker").gauge()).isNotNull();
        assertThat(registry.get("mcphub.pool.queued").tag("pool", "backend").gauge().value()).isZero();
        assertThat(registry.get("mcphub.pool.active").tag("pool", "backend").gauge()).isNotNull();
    }

    @Test
    void rejectionSurfacesAsException() {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getBackend().setCorePoolSize(1);
        props.getBackend().setMaxPoolSize(1);
        props.getBackend().setQueueCapacity(1);
        backends = new ThreadPoolConfig(props, new TaskProperties(1)).backendExecutor();
        CompletableFuture<Void> block = new CompletableFuture<>();

        backends.execute(block::join);
        backends.execute(block::join);
        try {
            assertThatThrownBy(() -> backends.execute(() -> { }))
                    .isInstanceOf(RejectedExecutionException.class);
        } finally {
            block.complete(null);
        }
    }
}
