package com.phillippitts.mcphub.service.registry;

import com.phillippitts.mcphub.config.properties.McpProperties;
import com.phillippitts.mcphub.exception.ConfigurationException;
import com.phillippitts.mcphub.service.backend.BackendAdapter;
import com.phillippitts.mcphub.service.backend.BackendDescriptor;
import com.phillippitts.mcphub.service.graph.GraphDefinition;
import com.phillippitts.mcphub.service.graph.PipelineComponent;
import com.phillippitts.mcphub.testutil.StubBackend;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ConfiguredRegistrationsTest {

    private static McpProperties.BackendConfig backend(String adapter, int priority, boolean fallback) {
        McpProperties.BackendConfig b = new McpProperties.BackendConfig();
        b.setAdapter(adapter);
        b.setPriority(priority);
        b.setFallback(fallback);
        return b;
    }

    private static McpProperties.EdgeConfig edge(String target, String when) {
        McpProperties.EdgeConfig e = new McpProperties.EdgeConfig();
        e.setTarget(target);
        e.setWhen(when);
        return e;
    }

    private static McpProperties.NodeConfig node(String name, boolean entry, McpProperties.EdgeConfig... edges) {
        McpProperties.NodeConfig n = new McpProperties.NodeConfig();
        n.setName(name);
        n.setComponent(name);
        n.setEntry(entry);
        n.setEdges(List.of(edges));
        return n;
    }

    @Test
    void translatesChainsAndGraphs() {
        McpProperties props = new McpProperties();
        McpProperties.CapabilityConfig cap = new McpProperties.CapabilityConfig();
        McpProperties.BackendConfig primary = backend("real", 10, false);
        primary.setInvokeTimeoutMs(1_234);
        cap.setBackends(List.of(primary, backend("mock", 100, true)));
        props.setCapabilities(Map.of("llm-generate", cap));

        McpProperties.GraphConfig graph = new McpProperties.GraphConfig();
        graph.setInputKeys(Set.of("go"));
        graph.setNodes(List.of(
                node("first", true, edge("second", "go"), edge(GraphDefinition.TERMINAL, null)),
                node("second", false, edge(GraphDefinition.TERMINAL, " "))));
        props.setGraphs(Map.of("flow", graph));

        List<BackendAdapter<?, ?>> adapters = List.of(
                StubBackend.returning("real", "llm-generate", "x"),
                StubBackend.returning("mock", "llm-generate", "y"));
        List<PipelineComponent> components = List.of(
                PipelineComponent.of("first", Set.of(), (s, c) -> Map.of()),
                PipelineComponent.of("second", Set.of(), (s, c) -> Map.of()));

        RegistrationSet set = new ConfiguredRegistrations(props, adapters, components).load();

        assertThat(set.backends()).extracting(BackendDescriptor::name).containsExactly("real", "mock");
        assertThat(set.backends().get(0).invokeTimeout()).isEqualTo(Duration.ofMillis(1_234));
        assertThat(set.backends().get(1).fallback()).isTrue();
        assertThat(set.components()).containsOnlyKeys("first", "second");

        GraphDefinition def = set.graphs().get("flow");
        assertThat(def.inputKeys()).containsExactly("go");
        assertThat(def.nodes().get(0).edges().get(0).isUnconditional()).isFalse();
        assertThat(def.nodes().get(0).edges().get(1).isUnconditional()).isTrue();
        assertThat(def.nodes().get(1).edges().get(0).isUnconditional()).isTrue();

        ServiceRegistry registry = new ServiceRegistry();
        set.backends().forEach(registry::registerBackend);
        set.components().forEach(registry::registerComponent);
        set.graphs().forEach(registry::registerGraph);
        assertThat(registry.build().supports("graph:flow")).isTrue();
    }

    @Test
    void unknownAdapterIsReported() {
        McpProperties props = new McpProperties();
        McpProperties.CapabilityConfig cap = new McpProperties.CapabilityConfig();
        cap.setBackends(List.of(backend("does-not-exist", 1, false)));
        props.setCapabilities(Map.of("vector-search", cap));

        ConfiguredRegistrations registrations = new ConfiguredRegistrations(props, List.of(), List.of());
        ConfigurationException ex = catchThrowableOfType(registrations::load, ConfigurationException.class);

        assertThat(ex.getProblems()).singleElement().asString().contains("unknown adapter 'does-not-exist'");
    }

    @Test
    void malformedConditionIsReported() {
        McpProperties props = new McpProperties();
        McpProperties.GraphConfig graph = new McpProperties.GraphConfig();
        graph.setNodes(List.of(node("first", true, edge(GraphDefinition.TERMINAL, "not a key!"))));
        props.setGraphs(Map.of("flow", graph));

        ConfiguredRegistrations registrations = new ConfiguredRegistrations(props, List.of(), List.of());
        ConfigurationException ex = catchThrowableOfType(registrations::load, ConfigurationException.class);

        assertThat(ex.getProblems()).singleElement().asString().contains("Invalid state key");
    }

    @Test
    void duplicateComponentNamesAreReported() {
        List<PipelineComponent> components = List.of(
                PipelineComponent.of("dup", Set.of(), (s, c) -> Map.of()),
                PipelineComponent.of("dup", Set.of(), (s, c) -> Map.of("other", true)));

        ConfiguredRegistrations registrations = new ConfiguredRegistrations(new McpProperties(), List.of(), components);
        ConfigurationException ex = catchThrowableOfType(registrations::load, ConfigurationException.class);

        assertThat(ex.getProblems()).singleElement().asString().contains("Component 'dup' registered twice");
    }

    @Test
    void duplicateAdapterNamesAreReported() {
        List<BackendAdapter<?, ?>> adapters = List.of(
                StubBackend.returning("real", "llm-generate", "x"),
                StubBackend.returning("real", "llm-generate", "y"));

        ConfiguredRegistrations registrations = new ConfiguredRegistrations(new McpProperties(), adapters, List.of());
        ConfigurationException ex = catchThrowableOfType(registrations::load, ConfigurationException.class);

        assertThat(ex.getProblems()).singleElement().asString().contains("Adapter 'real'");
    }

    @Test
    void startupRefusesDuplicateComponents() {
        List<PipelineComponent> components = List.of(
                PipelineComponent.of("dup", Set.of(), (s, c) -> Map.of()),
                PipelineComponent.of("dup", Set.of(), (s, c) -> Map.of()));
        ServiceRegistry registry = new ServiceRegistry();
        RegistryInitializer initializer = new RegistryInitializer(registry,
                new ConfiguredRegistrations(new McpProperties(), List.of(), components));

        assertThatThrownBy(initializer::buildOnStartup).isInstanceOf(ConfigurationException.class);
        assertThat(registry.isReady()).isFalse();
    }
}
