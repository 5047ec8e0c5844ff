package com.phillippitts.mcphub.service.graph;

import com.phillippitts.mcphub.exception.ConfigurationException;
import com.phillippitts.mcphub.exception.GraphCycleException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Declarative wiring of a component graph, validated once at registration.
 *
 * <p>{@link #validate(Map)} checks, in order:
 * <ol>
 *   <li>node names are unique and exactly one node is the entry</li>
 *   <li>every node names a registered component and has at least one edge</li>
 *   <li>edge targets exist; an unconditional edge is the last edge of its node</li>
 *   <li>the graph is acyclic ({@link GraphCycleException} with the offending path)</li>
 *   <li>every node is reachable from the entry</li>
 *   <li>every edge predicate reads only keys guaranteed on all paths to it: the declared
 *       input keys plus outputs of components that ran on every path</li>
 * </ol>
 */
public final class GraphDefinition {

    /** Edge target that ends execution. */
    public static final String TERMINAL = "__end__";

    private final String name;
    private final List<GraphNode> nodes;
    private final Set<String> inputKeys;

    public GraphDefinition(String name, List<GraphNode> nodes, Set<String> inputKeys) {
        this.name = Objects.requireNonNull(name, "name");
        this.nodes = List.copyOf(nodes);
        this.inputKeys = inputKeys == null ? Set.of() : Set.copyOf(inputKeys);
    }

    public GraphDefinition(String name, List<GraphNode> nodes) {
        this(name, nodes, Set.of());
    }

    public String name() {
        return name;
    }

    public List<GraphNode> nodes() {
        return nodes;
    }

    /** Keys the entry payload is expected to provide. */
    public Set<String> inputKeys() {
        return inputKeys;
    }

    /** Component names referenced by this graph. */
    public Set<String> componentNames() {
        Set<String> names = new LinkedHashSet<>();
        nodes.forEach(n -> names.add(n.component()));
        return names;
    }

    /**
     * Validates the wiring against the available components.
     *
     * @param components registered components by name
     * @throws GraphCycleException    if the graph has a cycle
     * @throws ConfigurationException listing all other problems
     */
    public void validate(Map<String, ? extends PipelineComponent> components) {
        List<String> problems = new ArrayList<>();
        Map<String, GraphNode> byName = new LinkedHashMap<>();
        for (GraphNode n : nodes) {
            if (byName.putIfAbsent(n.name(), n) != null) {
                problems.add(prefix() + "duplicate node '" + n.name() + "'");
            }
        }
        if (nodes.isEmpty()) {
            problems.add(prefix() + "has no nodes");
        }
        if (byName.containsKey(TERMINAL)) {
            problems.add(prefix() + "node name '" + TERMINAL + "' is reserved");
        }
        List<String> entries = nodes.stream().filter(GraphNode::entry).map(GraphNode::name).toList();
        if (entries.size() != 1) {
            problems.add(prefix() + "must have exactly one entry node, found " + entries.size() + " " + entries);
        }

        for (GraphNode n : nodes) {
            if (!components.containsKey(n.component())) {
                problems.add(prefix() + "node '" + n.name() + "' references unknown component '" + n.component() + "'");
            }
            if (n.edges().isEmpty()) {
                problems.add(prefix() + "node '" + n.name() + "' has no outgoing edge");
            }
            for (int i = 0; i < n.edges().size(); i++) {
                Edge e = n.edges().get(i);
                if (!TERMINAL.equals(e.target()) && !byName.containsKey(e.target())) {
                    problems.add(prefix() + "node '" + n.name() + "' has an edge to unknown node '" + e.target() + "'");
                }
                if (e.isUnconditional() && i < n.edges().size() - 1) {
                    problems.add(prefix() + "node '" + n.name() + "' has edges after an unconditional edge");
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }

        detectCycle(byName);

        GraphNode entry = byName.get(entries.get(0));
        Set<String> reachable = reachableFrom(entry, byName);
        for (GraphNode n : nodes) {
            if (!reachable.contains(n.name())) {
                problems.add(prefix() + "node '" + n.name() + "' is unreachable from entry '" + entry.name() + "'");
            }
        }
        if (problems.isEmpty()) {
            checkGuaranteedKeys(entry, byName, components, problems);
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }

    private void detectCycle(Map<String, GraphNode> byName) {
        Map<String, Integer> color = new HashMap<>();
        Deque<String> path = new ArrayDeque<>();
        for (GraphNode n : nodes) {
            if (!color.containsKey(n.name())) {
                visit(n.name(), byName, color, path);
            }
        }
    }

    // 1 = on the current DFS path, 2 = finished
    private void visit(String node, Map<String, GraphNode> byName, Map<String, Integer> color, Deque<String> path) {
        color.put(node, 1);
        path.addLast(node);
        for (Edge e : byName.get(node).edges()) {
            String t = e.target();
            if (TERMINAL.equals(t)) {
                continue;
            }
            Integer c = color.get(t);
            if (c == null) {
                visit(t, byName, color, path);
            } else if (c == 1) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String p : path) {
                    if (p.equals(t)) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        cycle.add(p);
                    }
                }
                cycle.add(t);
                throw new GraphCycleException(name, cycle);
            }
        }
        path.removeLast();
        color.put(node, 2);
    }

    private static Set<String> reachableFrom(GraphNode entry, Map<String, GraphNode> byName) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(entry.name());
        seen.add(entry.name());
        while (!queue.isEmpty()) {
            for (Edge e : byName.get(queue.poll()).edges()) {
                if (!TERMINAL.equals(e.target()) && seen.add(e.target())) {
                    queue.add(e.target());
                }
            }
        }
        return seen;
    }

    private void checkGuaranteedKeys(GraphNode entry, Map<String, GraphNode> byName,
                                     Map<String, ? extends PipelineComponent> components, List<String> problems) {
        // Guaranteed-before sets, computed in topological order; the graph is acyclic here.
        Map<String, Set<String>> before = new HashMap<>();
        before.put(entry.name(), new HashSet<>(inputKeys));
        for (String nodeName : topologicalOrder(entry, byName)) {
            GraphNode n = byName.get(nodeName);
            Set<String> after = new HashSet<>(before.get(nodeName));
            after.addAll(components.get(n.component()).outputKeys());
            for (Edge e : n.edges()) {
                for (String key : e.referencedKeys()) {
                    if (!after.contains(key)) {
                        problems.add(prefix() + "edge " + n.name() + " " + e
                                + " reads '" + key + "' which is not written on every path to it");
                    }
                }
                if (TERMINAL.equals(e.target())) {
                    continue;
                }
                before.merge(e.target(), new HashSet<>(after), (existing, incoming) -> {
                    existing.retainAll(incoming);
                    return existing;
                });
            }
        }
    }

    private static List<String> topologicalOrder(GraphNode entry, Map<String, GraphNode> byName) {
        Map<String, Integer> indegree = new HashMap<>();
        Set<String> reachable = reachableFrom(entry, byName);
        for (String n : reachable) {
            indegree.putIfAbsent(n, 0);
            for (Edge e : byName.get(n).edges()) {
                if (!TERMINAL.equals(e.target())) {
                    indegree.merge(e.target(), 1, Integer::sum);
                }
            }
        }
        List<String> order = new ArrayList<>();
        // Sorted for a deterministic problem order.
        TreeSet<String> ready = new TreeSet<>();
        indegree.forEach((n, d) -> {
            if (d == 0) {
                ready.add(n);
            }
        });
        while (!ready.isEmpty()) {
            String n = ready.pollFirst();
            order.add(n);
            for (Edge e : byName.get(n).edges()) {
                if (!TERMINAL.equals(e.target()) && indegree.merge(e.target(), -1, Integer::sum) == 0) {
                    ready.add(e.target());
                }
            }
        }
        return order;
    }

    private String prefix() {
        return "Graph '" + name + "': ";
    }

    @Override
    public String toString() {
        return "GraphDefinition[" + name + ", nodes=" + nodes.stream().map(GraphNode::name).toList() + "]";
    }
}
