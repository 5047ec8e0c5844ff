package com.phillippitts.mcphub.service.registry;

import com.phillippitts.mcphub.service.backend.CapabilityChain;
import com.phillippitts.mcphub.service.graph.ComponentGraph;
import com.phillippitts.mcphub.service.graph.PipelineComponent;

import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable, validated snapshot of chains, components and graphs.
 *
 * <p>A task captures the catalog when it starts and uses that snapshot until it finishes,
 * so a reload never changes wiring under a running execution.
 */
public final class Catalog {

    public static final String GRAPH_PREFIX = "graph:";
    public static final String COMPONENT_PREFIX = "component:";
    public static final String CAPABILITY_PREFIX = "capability:";

    private final long generation;
    private final Map<String, CapabilityChain> chains;
    private final Map<String, PipelineComponent> components;
    private final Map<String, ComponentGraph> graphs;

    Catalog(long generation, Map<String, CapabilityChain> chains, Map<String, PipelineComponent> components,
            Map<String, ComponentGraph> graphs) {
        this.generation = generation;
        this.chains = Map.copyOf(chains);
        this.components = Map.copyOf(components);
        this.graphs = Map.copyOf(graphs);
    }

    /** Increases by one with every successful build or reload. */
    public long generation() {
        return generation;
    }

    public Optional<CapabilityChain> chain(String capability) {
        return Optional.ofNullable(chains.get(capability));
    }

    public Optional<PipelineComponent> component(String name) {
        return Optional.ofNullable(components.get(name));
    }

    public Optional<ComponentGraph> graph(String name) {
        return Optional.ofNullable(graphs.get(name));
    }

    public Map<String, CapabilityChain> chains() {
        return chains;
    }

    public Map<String, ComponentGraph> graphs() {
        return graphs;
    }

    public Map<String, PipelineComponent> components() {
        return components;
    }

    /**
     * All task kinds this catalog can run, sorted.
     */
    public SortedSet<String> kinds() {
        SortedSet<String> kinds = new TreeSet<>();
        graphs.keySet().forEach(g -> kinds.add(GRAPH_PREFIX + g));
        components.keySet().forEach(c -> kinds.add(COMPONENT_PREFIX + c));
        chains.forEach((cap, chain) -> {
            if (!chain.isEmpty()) {
                kinds.add(CAPABILITY_PREFIX + cap);
            }
        });
        return kinds;
    }

    public boolean supports(String kind) {
        if (kind == null) {
            return false;
        }
        if (kind.startsWith(GRAPH_PREFIX)) {
            return graphs.containsKey(kind.substring(GRAPH_PREFIX.length()));
        }
        if (kind.startsWith(COMPONENT_PREFIX)) {
            return components.containsKey(kind.substring(COMPONENT_PREFIX.length()));
        }
        if (kind.startsWith(CAPABILITY_PREFIX)) {
            CapabilityChain chain = chains.get(kind.substring(CAPABILITY_PREFIX.length()));
            return chain != null && !chain.isEmpty();
        }
        return false;
    }
}
