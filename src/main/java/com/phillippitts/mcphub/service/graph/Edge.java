package com.phillippitts.mcphub.service.graph;

import java.util.Objects;
import java.util.Set;

/**
 * Outgoing edge of a graph node.
 *
 * @param target    target node name, or {@link GraphDefinition#TERMINAL}
 * @param condition predicate that must hold to follow the edge; null means always
 */
public record Edge(String target, Condition condition) {

    public Edge {
        Objects.requireNonNull(target, "target must not be null");
    }

    public static Edge to(String target) {
        return new Edge(target, null);
    }

    public static Edge when(String expression, String target) {
        return new Edge(target, Condition.parse(expression));
    }

    public static Edge toTerminal() {
        return new Edge(GraphDefinition.TERMINAL, null);
    }

    public boolean isUnconditional() {
        return condition == null;
    }

    public boolean matches(PipelineState state) {
        return condition == null || condition.test(state);
    }

    public Set<String> referencedKeys() {
        return condition == null ? Set.of() : condition.referencedKeys();
    }

    @Override
    public String toString() {
        return condition == null ? "-> " + target : "-[" + condition + "]-> " + target;
    }
}
