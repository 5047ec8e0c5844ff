package com.phillippitts.mcphub.service.backend;

import com.phillippitts.mcphub.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, validated fallback chain for one capability.
 *
 * <p>Holds only enabled backends, sorted by ascending priority. At most one entry may be
 * marked as fallback and it must sort last.
 */
public final class CapabilityChain {

    private final String capability;
    private final boolean optional;
    private final List<BackendDescriptor> backends;

    private CapabilityChain(String capability, boolean optional, List<BackendDescriptor> backends) {
        this.capability = capability;
        this.optional = optional;
        this.backends = backends;
    }

    /**
     * Validates and builds a chain.
     *
     * @param capability  capability name
     * @param optional    whether an empty chain is acceptable
     * @param descriptors all configured descriptors for the capability, enabled or not
     * @return chain with enabled descriptors in priority order
     * @throws ConfigurationException listing every problem found
     */
    public static CapabilityChain of(String capability, boolean optional, List<BackendDescriptor> descriptors) {
        Objects.requireNonNull(capability, "capability must not be null");
        List<String> problems = new ArrayList<>();
        Set<Integer> priorities = new HashSet<>();
        Set<String> names = new HashSet<>();
        for (BackendDescriptor d : descriptors) {
            if (!capability.equals(d.capability())) {
                problems.add("Backend '" + d.name() + "' serves '" + d.capability()
                        + "' but is configured under '" + capability + "'");
            }
            if (!d.enabled()) {
                continue;
            }
            if (!priorities.add(d.priority())) {
                problems.add("Duplicate priority " + d.priority() + " in chain '" + capability + "'");
            }
            if (!names.add(d.name())) {
                problems.add("Backend '" + d.name() + "' appears twice in chain '" + capability + "'");
            }
        }

        List<BackendDescriptor> enabled = descriptors.stream()
                .filter(BackendDescriptor::enabled)
                .sorted(Comparator.comparingInt(BackendDescriptor::priority))
                .toList();

        for (int i = 0; i < enabled.size(); i++) {
            if (enabled.get(i).fallback() && i != enabled.size() - 1) {
                problems.add("Fallback backend '" + enabled.get(i).name()
                        + "' must have the highest priority value in chain '" + capability + "'");
            }
        }
        if (enabled.isEmpty() && !optional) {
            problems.add("Capability '" + capability + "' has no enabled backend");
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
        return new CapabilityChain(capability, optional, enabled);
    }

    public String capability() {
        return capability;
    }

    public boolean optional() {
        return optional;
    }

    /** Enabled backends in the order they are tried. */
    public List<BackendDescriptor> backends() {
        return backends;
    }

    public boolean isEmpty() {
        return backends.isEmpty();
    }

    @Override
    public String toString() {
        return capability + backends.stream().map(b -> b.name() + "(" + b.priority() + (b.fallback() ? ",fallback" : "") + ")").toList();
    }
}
