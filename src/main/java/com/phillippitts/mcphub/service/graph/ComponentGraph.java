package com.phillippitts.mcphub.service.graph;

import com.phillippitts.mcphub.exception.MissingStateKeyException;
import com.phillippitts.mcphub.exception.NoMatchingEdgeException;
import com.phillippitts.mcphub.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A validated graph bound to its component instances. Immutable and safe to execute from
 * many tasks at once; each execution gets its own {@link PipelineState}.
 */
public final class ComponentGraph {
    private static final Logger LOG = LogManager.getLogger(ComponentGraph.class);

    /**
     * Outcome of one execution.
     *
     * @param state   final pipeline state
     * @param visited node names in execution order
     */
    public record Run(Map<String, Object> state, List<String> visited) { }

    private final GraphDefinition definition;
    private final Map<String, GraphNode> nodes;
    private final Map<String, PipelineComponent> components;
    private final GraphNode entry;

    /**
     * Validates {@code definition} against {@code components} and binds them.
     */
    public ComponentGraph(GraphDefinition definition, Map<String, ? extends PipelineComponent> components) {
        Objects.requireNonNull(definition, "definition");
        definition.validate(components);
        this.definition = definition;
        Map<String, GraphNode> byName = new LinkedHashMap<>();
        Map<String, PipelineComponent> bound = new LinkedHashMap<>();
        GraphNode e = null;
        for (GraphNode n : definition.nodes()) {
            byName.put(n.name(), n);
            bound.put(n.component(), components.get(n.component()));
            if (n.entry()) {
                e = n;
            }
        }
        this.nodes = Map.copyOf(byName);
        this.components = Map.copyOf(bound);
        this.entry = e;
    }

    public String name() {
        return definition.name();
    }

    public GraphDefinition definition() {
        return definition;
    }

    /**
     * Executes the graph.
     *
     * <p>The entry payload seeds the state. At each node the component runs, its update is
     * merged, and the first edge whose predicate holds is followed. Cancellation is observed
     * before every node.
     *
     * @throws MissingStateKeyException if a predicate reads a key that is absent
     * @throws NoMatchingEdgeException  if no edge of a node matches
     * @throws com.phillippitts.mcphub.exception.TaskCancelledException if cancelled
     */
    public Run execute(Map<String, ?> entryPayload, ExecutionContext ctx) {
        PipelineState state = new PipelineState(entryPayload);
        List<String> visited = new ArrayList<>();
        Set<String> ran = new HashSet<>();
        GraphNode current = entry;

        while (current != null) {
            ctx.token().throwIfCancelled();
            if (!ran.add(current.name())) {
                // Unreachable for a validated graph.
                throw new IllegalStateException("Node '" + current.name() + "' would run twice in " + name());
            }
            visited.add(current.name());

            PipelineComponent component = components.get(current.component());
            long start = System.nanoTime();
            Map<String, Object> update = component.run(state, ctx);
            state.merge(update);
            LOG.debug("Graph {} node {} ({}) done in {} ms, wrote {}", name(), current.name(),
                    component.name(), TimeUtils.elapsedMillis(start), update == null ? Set.of() : update.keySet());

            current = next(current, state);
        }
        return new Run(state.snapshot(), List.copyOf(visited));
    }

    private GraphNode next(GraphNode node, PipelineState state) {
        for (Edge e : node.edges()) {
            boolean matched;
            try {
                matched = e.matches(state);
            } catch (MissingStateKeyException ex) {
                throw new MissingStateKeyException(ex.getKey(), node.name());
            }
            if (matched) {
                return GraphDefinition.TERMINAL.equals(e.target()) ? null : nodes.get(e.target());
            }
        }
        throw new NoMatchingEdgeException(name(), node.name());
    }
}
