package com.phillippitts.mcphub.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Capability chains and graph wiring, loaded once when the catalog is built.
 *
 * <pre>
 * mcp.capabilities.transcribe-audio.backends[0].adapter=whisper-cli
 * mcp.capabilities.transcribe-audio.backends[0].priority=10
 * mcp.capabilities.transcribe-audio.backends[1].adapter=mock-transcribe
 * mcp.capabilities.transcribe-audio.backends[1].priority=100
 * mcp.capabilities.transcribe-audio.backends[1].fallback=true
 *
 * mcp.graphs.meeting-followup.input-keys=meeting.audio_path
 * mcp.graphs.meeting-followup.nodes[0].name=transcribe
 * mcp.graphs.meeting-followup.nodes[0].component=transcribe
 * mcp.graphs.meeting-followup.nodes[0].entry=true
 * mcp.graphs.meeting-followup.nodes[0].edges[0].target=summarize
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "mcp")
public class McpProperties {

    @Valid
    private Map<String, CapabilityConfig> capabilities = new LinkedHashMap<>();

    @Valid
    private Map<String, GraphConfig> graphs = new LinkedHashMap<>();

    public Map<String, CapabilityConfig> getCapabilities() {
        return capabilities;
    }

    public void setCapabilities(Map<String, CapabilityConfig> capabilities) {
        this.capabilities = capabilities;
    }

    public Map<String, GraphConfig> getGraphs() {
        return graphs;
    }

    public void setGraphs(Map<String, GraphConfig> graphs) {
        this.graphs = graphs;
    }

    /**
     * One capability: optional flag and its backends.
     */
    public static class CapabilityConfig {
        /** An optional capability may have no enabled backend. */
        private boolean optional;

        @Valid
        private List<BackendConfig> backends = new ArrayList<>();

        public boolean isOptional() {
            return optional;
        }

        public void setOptional(boolean optional) {
            this.optional = optional;
        }

        public List<BackendConfig> getBackends() {
            return backends;
        }

        public void setBackends(List<BackendConfig> backends) {
            this.backends = backends;
        }
    }

    /**
     * One chain entry, referencing an adapter bean by name.
     */
    public static class BackendConfig {
        @NotBlank
        private String adapter;
        private int priority;
        private boolean enabled = true;
        private boolean fallback;
        @Positive
        private long healthTimeoutMs = 500;
        @Positive
        private long invokeTimeoutMs = 30_000;
        @Positive
        private long healthTtlMs = 5_000;

        public String getAdapter() {
            return adapter;
        }

        public void setAdapter(String adapter) {
            this.adapter = adapter;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isFallback() {
            return fallback;
        }

        public void setFallback(boolean fallback) {
            this.fallback = fallback;
        }

        public long getHealthTimeoutMs() {
            return healthTimeoutMs;
        }

        public void setHealthTimeoutMs(long healthTimeoutMs) {
            this.healthTimeoutMs = healthTimeoutMs;
        }

        public long getInvokeTimeoutMs() {
            return invokeTimeoutMs;
        }

        public void setInvokeTimeoutMs(long invokeTimeoutMs) {
            this.invokeTimeoutMs = invokeTimeoutMs;
        }

        public long getHealthTtlMs() {
            return healthTtlMs;
        }

        public void setHealthTtlMs(long healthTtlMs) {
            this.healthTtlMs = healthTtlMs;
        }
    }

    /**
     * One graph: the keys its payload must provide and its nodes.
     */
    public static class GraphConfig {
        private Set<String> inputKeys = new LinkedHashSet<>();

        @Valid
        private List<NodeConfig> nodes = new ArrayList<>();

        public Set<String> getInputKeys() {
            return inputKeys;
        }

        public void setInputKeys(Set<String> inputKeys) {
            this.inputKeys = inputKeys;
        }

        public List<NodeConfig> getNodes() {
            return nodes;
        }

        public void setNodes(List<NodeConfig> nodes) {
            this.nodes = nodes;
        }
    }

    public static class NodeConfig {
        @NotBlank
        private String name;
        @NotBlank
        private String component;
        private boolean entry;
        @Valid
        private List<EdgeConfig> edges = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getComponent() {
            return component;
        }

        public void setComponent(String component) {
            this.component = component;
        }

        public boolean isEntry() {
            return entry;
        }

        public void setEntry(boolean entry) {
            this.entry = entry;
        }

        public List<EdgeConfig> getEdges() {
            return edges;
        }

        public void setEdges(List<EdgeConfig> edges) {
            this.edges = edges;
        }
    }

    /**
     * Edge to another node or to {@code __end__}; {@code when} is an optional condition.
     */
    public static class EdgeConfig {
        @NotBlank
        private String target;
        private String when;

        public String getTarget() {
            return target;
        }

        public void setTarget(String target) {
            this.target = target;
        }

        public String getWhen() {
            return when;
        }

        public void setWhen(String when) {
            this.when = when;
        }
    }
}
