package com.phillippitts.mcphub.service.component;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.domain.Completion;
import com.phillippitts.mcphub.domain.CompletionRequest;
import com.phillippitts.mcphub.service.graph.ExecutionContext;
import com.phillippitts.mcphub.service.graph.PipelineComponent;
import com.phillippitts.mcphub.service.graph.PipelineState;

import java.util.Set;

/**
 * Base class for built-in components: fixed name, declared outputs and capabilities, and
 * small state helpers.
 */
abstract class AbstractComponent implements PipelineComponent {

    private final String name;
    private final Set<String> outputKeys;
    private final Set<String> capabilities;

    protected AbstractComponent(String name, Set<String> outputKeys, Set<String> capabilities) {
        this.name = name;
        this.outputKeys = Set.copyOf(outputKeys);
        this.capabilities = Set.copyOf(capabilities);
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final Set<String> outputKeys() {
        return outputKeys;
    }

    @Override
    public final Set<String> requiredCapabilities() {
        return capabilities;
    }

    protected String complete(ExecutionContext ctx, String prompt) {
        Completion c = ctx.<Completion>invoke(Capabilities.LLM_GENERATE, CompletionRequest.of(prompt)).output();
        return c.text().strip();
    }

    protected static String optionalString(PipelineState state, String key, String dflt) {
        return state.get(key).map(Object::toString).filter(s -> !s.isBlank()).orElse(dflt);
    }

    protected static int optionalInt(PipelineState state, String key, int dflt) {
        return state.get(key).map(v -> v instanceof Number n ? n.intValue() : Integer.parseInt(v.toString().strip()))
                .orElse(dflt);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
