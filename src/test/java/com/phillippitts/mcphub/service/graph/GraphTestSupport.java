package com.phillippitts.mcphub.service.graph;

import com.phillippitts.mcphub.domain.CancellationToken;
import com.phillippitts.mcphub.domain.CapabilityResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Small components and contexts for graph tests.
 */
final class GraphTestSupport {

    private GraphTestSupport() {}

    /** Component that writes fixed values and records that it ran. */
    static PipelineComponent writing(String name, List<String> log, Map<String, Object> writes) {
        return PipelineComponent.of(name, writes.keySet(), (state, ctx) -> {
            log.add(name);
            return writes;
        });
    }

    static PipelineComponent writing(String name, Map<String, Object> writes) {
        return writing(name, new CopyOnWriteArrayList<>(), writes);
    }

    static PipelineComponent noop(String name) {
        return PipelineComponent.of(name, Set.of(), (state, ctx) -> Map.of());
    }

    static Map<String, PipelineComponent> byName(PipelineComponent... components) {
        Map<String, PipelineComponent> map = new LinkedHashMap<>();
        for (PipelineComponent c : components) {
            map.put(c.name(), c);
        }
        return map;
    }

    static ExecutionContext context() {
        return context(CancellationToken.NONE);
    }

    static ExecutionContext context(CancellationToken token) {
        return new ExecutionContext("task-1", token,
                (capability, input, t) -> new CapabilityResult<>("out:" + input, "stub", false));
    }
}
