package com.phillippitts.mcphub.service.graph;

import java.util.List;
import java.util.Objects;

/**
 * A node of a component graph: which component to run and where to go next.
 *
 * @param name      node name, unique within the graph
 * @param component name of the registered component
 * @param entry     whether execution starts here
 * @param edges     outgoing edges in evaluation order
 */
public record GraphNode(String name, String component, boolean entry, List<Edge> edges) {

    public GraphNode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(component, "component must not be null");
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public static GraphNode entry(String name, String component, Edge... edges) {
        return new GraphNode(name, component, true, List.of(edges));
    }

    public static GraphNode of(String name, String component, Edge... edges) {
        return new GraphNode(name, component, false, List.of(edges));
    }
}
