package com.phillippitts.mcphub.service.graph;

import com.phillippitts.mcphub.domain.CancellationToken;
import com.phillippitts.mcphub.domain.CapabilityResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-execution handle given to components: the task's cancellation token and access to
 * capabilities. Records which backend served each capability call.
 */
public final class ExecutionContext {

    /**
     * One served capability call.
     */
    public record ServedCall(String capability, String backend, boolean degraded) { }

    private final String taskId;
    private final CancellationToken token;
    private final CapabilityInvoker invoker;
    private final List<ServedCall> served = Collections.synchronizedList(new ArrayList<>());

    public ExecutionContext(String taskId, CancellationToken token, CapabilityInvoker invoker) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.token = Objects.requireNonNull(token, "token");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
    }

    public String taskId() {
        return taskId;
    }

    public CancellationToken token() {
        return token;
    }

    /**
     * Invokes a capability through its fallback chain.
     *
     * @param capability capability name
     * @param input      capability input
     * @param <O>        expected output type
     * @return tagged output
     */
    @SuppressWarnings("unchecked")
    public <O> CapabilityResult<O> invoke(String capability, Object input) {
        CapabilityResult<?> result = invoker.invoke(capability, input, token);
        served.add(new ServedCall(capability, result.backend(), result.degraded()));
        return (CapabilityResult<O>) result;
    }

    public List<ServedCall> servedCalls() {
        synchronized (served) {
            return List.copyOf(served);
        }
    }

    public boolean anyDegraded() {
        return servedCalls().stream().anyMatch(ServedCall::degraded);
    }
}
