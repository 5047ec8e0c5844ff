package com.phillippitts.mcphub.service.registry;

import com.phillippitts.mcphub.config.properties.McpProperties;
import com.phillippitts.mcphub.exception.ConfigurationException;
import com.phillippitts.mcphub.service.backend.BackendAdapter;
import com.phillippitts.mcphub.service.backend.BackendDescriptor;
import com.phillippitts.mcphub.service.graph.Edge;
import com.phillippitts.mcphub.service.graph.GraphDefinition;
import com.phillippitts.mcphub.service.graph.GraphNode;
import com.phillippitts.mcphub.service.graph.PipelineComponent;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates {@code mcp.capabilities.*} and {@code mcp.graphs.*} into a
 * {@link RegistrationSet}, resolving adapter and component names against the beans in the
 * context. Names are matched explicitly; nothing is discovered by scanning.
 */
@Component
public class ConfiguredRegistrations {

    private final McpProperties props;
    private final Map<String, BackendAdapter<?, ?>> adapters;
    private final List<PipelineComponent> components;
    private final List<String> duplicateAdapters = new ArrayList<>();

    public ConfiguredRegistrations(McpProperties props, List<BackendAdapter<?, ?>> adapters,
                                   List<PipelineComponent> components) {
        this.props = props;
        this.components = List.copyOf(components);
        Map<String, BackendAdapter<?, ?>> byName = new LinkedHashMap<>();
        for (BackendAdapter<?, ?> a : adapters) {
            if (byName.putIfAbsent(a.name(), a) != null) {
                duplicateAdapters.add("Adapter '" + a.name() + "' is provided by more than one bean");
            }
        }
        this.adapters = byName;
    }

    /**
     * @throws ConfigurationException if configuration names an unknown adapter or a malformed
     *                                edge condition, or if two adapters or two components share
     *                                a name
     */
    public RegistrationSet load() {
        RegistrationSet set = new RegistrationSet();
        List<String> problems = new ArrayList<>(duplicateAdapters);

        components.forEach(set::component);

        props.getCapabilities().forEach((capability, cfg) -> {
            if (cfg.isOptional()) {
                set.optionalCapability(capability);
            }
            for (McpProperties.BackendConfig b : cfg.getBackends()) {
                BackendAdapter<?, ?> adapter = adapters.get(b.getAdapter());
                if (adapter == null) {
                    problems.add("Capability '" + capability + "' references unknown adapter '"
                            + b.getAdapter() + "'; known: " + adapters.keySet());
                    continue;
                }
                set.backend(new BackendDescriptor(adapter.name(), capability, b.getPriority(), b.isEnabled(),
                        b.isFallback(), Duration.ofMillis(b.getHealthTimeoutMs()),
                        Duration.ofMillis(b.getInvokeTimeoutMs()), Duration.ofMillis(b.getHealthTtlMs()), adapter));
            }
        });

        props.getGraphs().forEach((name, cfg) -> {
            try {
                set.graph(toDefinition(name, cfg));
            } catch (ConfigurationException e) {
                problems.addAll(e.getProblems());
            }
        });

        problems.addAll(set.problems());
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
        return set;
    }

    static GraphDefinition toDefinition(String name, McpProperties.GraphConfig cfg) {
        List<GraphNode> nodes = new ArrayList<>();
        for (McpProperties.NodeConfig n : cfg.getNodes()) {
            List<Edge> edges = new ArrayList<>();
            for (McpProperties.EdgeConfig e : n.getEdges()) {
                edges.add(e.getWhen() == null || e.getWhen().isBlank()
                        ? Edge.to(e.getTarget())
                        : Edge.when(e.getWhen(), e.getTarget()));
            }
            nodes.add(new GraphNode(n.getName(), n.getComponent(), n.isEntry(), edges));
        }
        return new GraphDefinition(name, nodes, cfg.getInputKeys());
    }
}
