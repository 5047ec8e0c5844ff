package com.phillippitts.mcphub.service.registry;

import com.phillippitts.mcphub.exception.ConfigurationException;
import com.phillippitts.mcphub.exception.GraphCycleException;
import com.phillippitts.mcphub.service.backend.BackendDescriptor;
import com.phillippitts.mcphub.service.backend.CapabilityChain;
import com.phillippitts.mcphub.service.graph.ComponentGraph;
import com.phillippitts.mcphub.service.graph.GraphDefinition;
import com.phillippitts.mcphub.service.graph.PipelineComponent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide catalog of backend chains, components and graphs.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@code register*} calls collect registrations</li>
 *   <li>{@link #build()} validates everything and publishes the first {@link Catalog};
 *       only then is the registry ready</li>
 *   <li>{@link #reload(RegistrationSet)} builds a complete new catalog and swaps the single
 *       reference; on failure the current catalog keeps serving</li>
 * </ol>
 */
@Service
public class ServiceRegistry {
    private static final Logger LOG = LogManager.getLogger(ServiceRegistry.class);

    private final Object lock = new Object();
    private final AtomicReference<Catalog> current = new AtomicReference<>();
    private final AtomicLong generations = new AtomicLong();
    private RegistrationSet pending = new RegistrationSet();

    public void registerBackend(BackendDescriptor descriptor) {
        synchronized (lock) {
            requireNotBuilt();
            pending.backend(descriptor);
        }
    }

    public void registerComponent(String name, PipelineComponent component) {
        synchronized (lock) {
            requireNotBuilt();
            pending.component(name, component);
        }
    }

    public void registerGraph(String name, GraphDefinition definition) {
        synchronized (lock) {
            requireNotBuilt();
            pending.graph(name, definition);
        }
    }

    public void markOptional(String capability) {
        synchronized (lock) {
            requireNotBuilt();
            pending.optionalCapability(capability);
        }
    }

    /**
     * Validates all registrations and marks the registry ready.
     *
     * @return the published catalog
     * @throws GraphCycleException    if a graph has a cycle
     * @throws ConfigurationException listing every other problem
     */
    public Catalog build() {
        synchronized (lock) {
            requireNotBuilt();
            Catalog catalog = compile(pending);
            current.set(catalog);
            pending = null;
            LOG.info("Service registry ready: {} capability chain(s), {} component(s), {} graph(s)",
                    catalog.chains().size(), catalog.components().size(), catalog.graphs().size());
            return catalog;
        }
    }

    /**
     * Builds a new catalog and swaps it in. Executions already running finish on the
     * catalog they started with.
     *
     * @throws ConfigurationException if the new registrations are invalid; nothing is swapped
     */
    public Catalog reload(RegistrationSet registrations) {
        synchronized (lock) {
            if (!isReady()) {
                throw new IllegalStateException("Registry has not been built yet");
            }
            Catalog next = compile(registrations);
            Catalog previous = current.getAndSet(next);
            LOG.info("Catalog reloaded: generation {} -> {}", previous.generation(), next.generation());
            return next;
        }
    }

    public boolean isReady() {
        return current.get() != null;
    }

    /**
     * @throws IllegalStateException if {@link #build()} has not succeeded
     */
    public Catalog catalog() {
        Catalog c = current.get();
        if (c == null) {
            throw new IllegalStateException("Registry is not ready");
        }
        return c;
    }

    private void requireNotBuilt() {
        if (pending == null) {
            throw new IllegalStateException("Registry already built; use reload to replace the catalog");
        }
    }

    private Catalog compile(RegistrationSet set) {
        List<String> problems = new ArrayList<>(set.problems());
        Map<String, PipelineComponent> components = new LinkedHashMap<>(set.components());

        Map<String, ComponentGraph> graphs = new LinkedHashMap<>();
        for (Map.Entry<String, GraphDefinition> e : set.graphs().entrySet()) {
            try {
                graphs.put(e.getKey(), new ComponentGraph(e.getValue(), components));
            } catch (GraphCycleException cycle) {
                throw cycle;
            } catch (ConfigurationException invalid) {
                problems.addAll(invalid.getProblems());
            }
        }

        Map<String, List<BackendDescriptor>> byCapability = new LinkedHashMap<>();
        for (BackendDescriptor d : set.backends()) {
            byCapability.computeIfAbsent(d.capability(), k -> new ArrayList<>()).add(d);
        }
        Set<String> referenced = new LinkedHashSet<>(byCapability.keySet());
        components.values().forEach(c -> referenced.addAll(c.requiredCapabilities()));

        Map<String, CapabilityChain> chains = new LinkedHashMap<>();
        for (String capability : referenced) {
            try {
                chains.put(capability, CapabilityChain.of(capability,
                        set.optionalCapabilities().contains(capability),
                        byCapability.getOrDefault(capability, List.of())));
            } catch (ConfigurationException invalid) {
                problems.addAll(invalid.getProblems());
            }
        }

        if (!problems.isEmpty()) {
            problems.forEach(p -> LOG.error("Configuration problem: {}", p));
            throw new ConfigurationException(problems);
        }
        chains.values().forEach(c -> LOG.info("Capability chain {}", c));
        return new Catalog(generations.incrementAndGet(), chains, components, graphs);
    }
}
