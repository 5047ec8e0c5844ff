package com.phillippitts.mcphub.service.task;

import com.phillippitts.mcphub.domain.CancellationToken;
import com.phillippitts.mcphub.domain.CapabilityResult;
import com.phillippitts.mcphub.exception.ConfigurationException;
import com.phillippitts.mcphub.exception.UnknownTaskKindException;
import com.phillippitts.mcphub.service.backend.CapabilityChain;
import com.phillippitts.mcphub.service.graph.CapabilityInvoker;
import com.phillippitts.mcphub.service.graph.ComponentGraph;
import com.phillippitts.mcphub.service.graph.ExecutionContext;
import com.phillippitts.mcphub.service.graph.PipelineComponent;
import com.phillippitts.mcphub.service.graph.PipelineState;
import com.phillippitts.mcphub.service.registry.Catalog;
import com.phillippitts.mcphub.service.resolver.CapabilityResolver;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs one task body against a catalog snapshot, selected by the kind prefix.
 */
@Component
public class TaskDispatcher {

    private final CapabilityResolver resolver;

    public TaskDispatcher(CapabilityResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @return a JSON-friendly result map
     * @throws UnknownTaskKindException if the catalog cannot run {@code kind}
     */
    public Map<String, Object> dispatch(String taskId, String kind, Map<String, Object> payload,
                                        CancellationToken token, Catalog catalog) {
        token.throwIfCancelled();
        if (kind.startsWith(Catalog.GRAPH_PREFIX)) {
            String name = kind.substring(Catalog.GRAPH_PREFIX.length());
            ComponentGraph graph = catalog.graph(name).orElseThrow(() -> new UnknownTaskKindException(kind));
            ExecutionContext ctx = new ExecutionContext(taskId, token, invoker(catalog));
            ComponentGraph.Run run = graph.execute(payload, ctx);
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("graph", name);
            result.put("visited", run.visited());
            result.put("state", run.state());
            result.put("servedBy", ctx.servedCalls());
            result.put("degraded", ctx.anyDegraded());
            return result;
        }
        if (kind.startsWith(Catalog.COMPONENT_PREFIX)) {
            String name = kind.substring(Catalog.COMPONENT_PREFIX.length());
            PipelineComponent component = catalog.component(name).orElseThrow(() -> new UnknownTaskKindException(kind));
            ExecutionContext ctx = new ExecutionContext(taskId, token, invoker(catalog));
            PipelineState state = new PipelineState(payload);
            state.merge(component.run(state, ctx));
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("component", name);
            result.put("state", state.snapshot());
            result.put("servedBy", ctx.servedCalls());
            result.put("degraded", ctx.anyDegraded());
            return result;
        }
        if (kind.startsWith(Catalog.CAPABILITY_PREFIX)) {
            String name = kind.substring(Catalog.CAPABILITY_PREFIX.length());
            CapabilityChain chain = catalog.chain(name).orElseThrow(() -> new UnknownTaskKindException(kind));
            CapabilityResult<Object> r = resolver.resolve(chain, CapabilityPayloads.toInput(name, payload), token);
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("capability", name);
            result.put("backend", r.backend());
            result.put("degraded", r.degraded());
            result.put("output", r.output());
            return result;
        }
        throw new UnknownTaskKindException(kind);
    }

    private CapabilityInvoker invoker(Catalog catalog) {
        return (capability, input, token) -> {
            CapabilityChain chain = catalog.chain(capability)
                    .orElseThrow(() -> new ConfigurationException("No chain registered for capability '" + capability + "'"));
            return resolver.resolve(chain, input, token);
        };
    }
}
