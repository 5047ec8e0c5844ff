package com.phillippitts.mcphub.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes pool gauges for both executors:
 * {@code mcphub.pool.active}, {@code mcphub.pool.queued} and {@code mcphub.pool.size},
 * tagged {@code pool=task-worker|backend}.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    @Bean
    public MeterBinder executorPoolMetrics(@Qualifier("taskWorkerExecutor") ThreadPoolTaskExecutor taskWorkers,
                                           @Qualifier("backendExecutor") ThreadPoolTaskExecutor backends) {
        return registry -> {
            bind(registry, "task-worker", taskWorkers.getThreadPoolExecutor());
            bind(registry, "backend", backends.getThreadPoolExecutor());
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("mcphub.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Threads actively running work")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("mcphub.pool.queued", executor, e -> e.getQueue().size())
                .description("Work items waiting for a thread")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("mcphub.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads")
                .tag("pool", pool)
                .register(registry);
    }
}
