package com.phillippitts.mcphub.service.resolver;

import com.phillippitts.mcphub.domain.BackendFailure;
import com.phillippitts.mcphub.domain.CancellationToken;
import com.phillippitts.mcphub.domain.CapabilityResult;
import com.phillippitts.mcphub.exception.AllBackendsFailedException;
import com.phillippitts.mcphub.exception.BackendException;
import com.phillippitts.mcphub.exception.ErrorKind;
import com.phillippitts.mcphub.exception.TaskCancelledException;
import com.phillippitts.mcphub.service.backend.BackendAdapter;
import com.phillippitts.mcphub.service.backend.BackendDescriptor;
import com.phillippitts.mcphub.service.backend.CapabilityChain;
import com.phillippitts.mcphub.service.events.AllBackendsFailedEvent;
import com.phillippitts.mcphub.service.events.BackendFallbackEvent;
import com.phillippitts.mcphub.service.metrics.CapabilityMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Walks a capability's fallback chain and returns the first successful output.
 *
 * <p>For each enabled backend in ascending priority:
 * <ol>
 *   <li>Observe cancellation</li>
 *   <li>Probe health (cached, bounded by the backend's health timeout); skip if unhealthy</li>
 *   <li>Invoke with the backend's invoke timeout; on error or timeout record and move on</li>
 * </ol>
 * The chain's fallback entry is not probed and its output is tagged degraded. Each backend
 * is tried at most once per resolution. When nothing succeeds an
 * {@link AllBackendsFailedException} lists every failure in chain order.
 *
 * <p><b>Thread Model:</b> probes and invocations run on the bounded {@code backendExecutor};
 * the calling worker only waits. A timed-out invocation is not interrupted, its result is
 * dropped.
 */
@Service
public class CapabilityResolver {
    private static final Logger LOG = LogManager.getLogger(CapabilityResolver.class);

    private final HealthCache healthCache;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final CapabilityMetrics metrics;

    public CapabilityResolver(HealthCache healthCache,
                              @Qualifier("backendExecutor") Executor executor,
                              ApplicationEventPublisher publisher,
                              CapabilityMetrics metrics) {
        this.healthCache = Objects.requireNonNull(healthCache);
        this.executor = Objects.requireNonNull(executor);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Resolves one capability call.
     *
     * @param chain the capability's chain
     * @param input capability input, must match the adapters' input type
     * @param token cancellation token of the calling task
     * @param <O>   expected output type
     * @return output tagged with the serving backend
     * @throws AllBackendsFailedException if no backend produced a result
     * @throws TaskCancelledException     if cancellation was observed
     */
    public <O> CapabilityResult<O> resolve(CapabilityChain chain, Object input, CancellationToken token) {
        Objects.requireNonNull(chain, "chain");
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(token, "token");

        String capability = chain.capability();
        List<BackendFailure> failures = new ArrayList<>();

        for (BackendDescriptor d : chain.backends()) {
            token.throwIfCancelled();

            if (!d.fallback()) {
                HealthCache.Entry health = probe(d);
                if (!health.healthy()) {
                    recordFailure(capability, failures,
                            new BackendFailure(d.name(), ErrorKind.BACKEND_UNHEALTHY, health.reason()));
                    continue;
                }
            }

            long start = System.nanoTime();
            try {
                O output = invoke(d, input);
                metrics.recordLatency(capability, d.name(), System.nanoTime() - start);
                // A result that arrives after cancellation is discarded.
                token.throwIfCancelled();
                metrics.incrementSuccess(capability, d.name(), d.fallback());
                if (d.fallback()) {
                    LOG.info("Capability {} served by fallback {} (degraded) after {} failure(s)",
                            capability, d.name(), failures.size());
                } else {
                    LOG.debug("Capability {} served by {}", capability, d.name());
                }
                return new CapabilityResult<>(output, d.name(), d.fallback());
            } catch (BackendException e) {
                metrics.recordLatency(capability, d.name(), System.nanoTime() - start);
                recordFailure(capability, failures, new BackendFailure(d.name(), e.getKind(), e.getMessage()));
            }
        }

        LOG.warn("All {} backend(s) failed for capability {}", failures.size(), capability);
        metrics.incrementFailure(capability, "none", ErrorKind.ALL_BACKENDS_FAILED.name().toLowerCase(Locale.ROOT));
        publisher.publishEvent(new AllBackendsFailedEvent(capability, List.copyOf(failures), Instant.now()));
        throw new AllBackendsFailedException(capability, failures);
    }

    /**
     * Returns the cached health of a backend, probing it if the cache has no live entry.
     */
    public HealthCache.Entry probe(BackendDescriptor d) {
        return healthCache.get(d.name()).orElseGet(() -> {
            String reason = "";
            boolean healthy;
            CompletableFuture<Boolean> f = null;
            try {
                f = CompletableFuture.supplyAsync(d.adapter()::health, executor);
                healthy = Boolean.TRUE.equals(f.get(d.healthTimeout().toMillis(), TimeUnit.MILLISECONDS));
                if (!healthy) {
                    reason = "health check returned false";
                }
            } catch (TimeoutException e) {
                f.cancel(true);
                healthy = false;
                reason = "health check timed out after " + d.healthTimeout().toMillis() + " ms";
            } catch (ExecutionException e) {
                healthy = false;
                reason = "health check failed: " + describe(e.getCause());
            } catch (RejectedExecutionException e) {
                healthy = false;
                reason = "backend pool saturated";
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskCancelledException("interrupted");
            }
            return healthCache.put(d.name(), healthy, reason, d.healthTtl());
        });
    }

    @SuppressWarnings("unchecked")
    private <O> O invoke(BackendDescriptor d, Object input) {
        BackendAdapter<Object, Object> adapter = (BackendAdapter<Object, Object>) d.adapter();
        Duration timeout = d.invokeTimeout();
        CompletableFuture<Object> f;
        try {
            f = CompletableFuture.supplyAsync(() -> adapter.invoke(input), executor);
        } catch (RejectedExecutionException e) {
            throw new BackendException(ErrorKind.BACKEND_INVOCATION_ERROR, "backend pool saturated", d.name(), e);
        }
        try {
            Object out = f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (out == null) {
                throw new BackendException(ErrorKind.BACKEND_INVOCATION_ERROR, "backend returned no output", d.name());
            }
            return (O) out;
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new BackendException(ErrorKind.BACKEND_TIMEOUT,
                    "invoke timed out after " + timeout.toMillis() + " ms", d.name(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BackendException be) {
                throw be;
            }
            throw new BackendException(ErrorKind.BACKEND_INVOCATION_ERROR, describe(cause), d.name(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            throw new TaskCancelledException("interrupted");
        }
    }

    private void recordFailure(String capability, List<BackendFailure> failures, BackendFailure failure) {
        failures.add(failure);
        LOG.debug("Backend {} for {} failed: {} {}", failure.backend(), capability, failure.kind(), failure.reason());
        metrics.incrementFailure(capability, failure.backend(), failure.kind().name().toLowerCase(Locale.ROOT));
        publisher.publishEvent(new BackendFallbackEvent(capability, failure.backend(), failure.kind(),
                failure.reason(), Instant.now()));
    }

    private static String describe(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        return t.getMessage() != null ? t.getClass().getSimpleName() + ": " + t.getMessage()
                : t.getClass().getSimpleName();
    }
}
