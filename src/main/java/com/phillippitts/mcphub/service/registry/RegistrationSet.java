package com.phillippitts.mcphub.service.registry;

import com.phillippitts.mcphub.service.backend.BackendDescriptor;
import com.phillippitts.mcphub.service.graph.GraphDefinition;
import com.phillippitts.mcphub.service.graph.PipelineComponent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything a catalog is built from: backend descriptors, named components, named graph
 * definitions and the set of optional capabilities. Not thread-safe; fill it on one thread
 * and hand it to {@link ServiceRegistry}.
 */
public final class RegistrationSet {

    private final List<BackendDescriptor> backends = new ArrayList<>();
    private final Map<String, PipelineComponent> components = new LinkedHashMap<>();
    private final Map<String, GraphDefinition> graphs = new LinkedHashMap<>();
    private final Set<String> optionalCapabilities = new LinkedHashSet<>();
    private final List<String> problems = new ArrayList<>();

    public RegistrationSet backend(BackendDescriptor descriptor) {
        backends.add(Objects.requireNonNull(descriptor, "descriptor"));
        return this;
    }

    public RegistrationSet component(String name, PipelineComponent component) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(component, "component");
        if (components.putIfAbsent(name, component) != null) {
            problems.add("Component '" + name + "' registered twice");
        }
        return this;
    }

    public RegistrationSet component(PipelineComponent component) {
        return component(component.name(), component);
    }

    public RegistrationSet graph(String name, GraphDefinition definition) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(definition, "definition");
        if (!name.equals(definition.name())) {
            problems.add("Graph registered as '" + name + "' is named '" + definition.name() + "'");
        }
        if (graphs.putIfAbsent(name, definition) != null) {
            problems.add("Graph '" + name + "' registered twice");
        }
        return this;
    }

    public RegistrationSet graph(GraphDefinition definition) {
        return graph(definition.name(), definition);
    }

    public RegistrationSet optionalCapability(String capability) {
        optionalCapabilities.add(Objects.requireNonNull(capability, "capability"));
        return this;
    }

    public List<BackendDescriptor> backends() {
        return Collections.unmodifiableList(backends);
    }

    public Map<String, PipelineComponent> components() {
        return Collections.unmodifiableMap(components);
    }

    public Map<String, GraphDefinition> graphs() {
        return Collections.unmodifiableMap(graphs);
    }

    public Set<String> optionalCapabilities() {
        return Collections.unmodifiableSet(optionalCapabilities);
    }

    /** Problems detected while registering (duplicates, name mismatches). */
    List<String> problems() {
        return Collections.unmodifiableList(problems);
    }
}
