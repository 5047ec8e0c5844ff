package com.phillippitts.mcphub.service.graph;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * A named unit of work in a component graph.
 *
 * <p>A component reads the shared {@link PipelineState} and returns a partial update that the
 * graph merges back. It must not mutate the state directly. Components reach backends only
 * through {@link ExecutionContext#invoke(String, Object)}.
 */
public interface PipelineComponent {

    String name();

    /**
     * Keys this component writes on every successful run. Used by graph validation to decide
     * which keys downstream edge predicates may rely on.
     */
    Set<String> outputKeys();

    /** Capabilities this component calls; each must have a usable chain at build time. */
    default Set<String> requiredCapabilities() {
        return Set.of();
    }

    /**
     * Runs the component.
     *
     * @return partial state update, never null
     */
    Map<String, Object> run(PipelineState state, ExecutionContext ctx);

    /**
     * Creates a component from a function, for wiring small steps and for tests.
     */
    static PipelineComponent of(String name, Set<String> outputKeys,
                                BiFunction<PipelineState, ExecutionContext, Map<String, Object>> body) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        Set<String> outputs = Set.copyOf(outputKeys);
        return new PipelineComponent() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Set<String> outputKeys() {
                return outputs;
            }

            @Override
            public Map<String, Object> run(PipelineState state, ExecutionContext ctx) {
                return body.apply(state, ctx);
            }

            @Override
            public String toString() {
                return "PipelineComponent[" + name + "]";
            }
        };
    }
}
