package com.phillippitts.mcphub.exception;

import java.util.List;

/**
 * Thrown at registration time when a component graph contains a cycle.
 */
public class GraphCycleException extends ConfigurationException {

    private final String graphName;
    private final List<String> cycle;

    public GraphCycleException(String graphName, List<String> cycle) {
        super(ErrorKind.GRAPH_CYCLE,
                "Graph '" + graphName + "' contains a cycle: " + String.join(" -> ", cycle));
        this.graphName = graphName;
        this.cycle = List.copyOf(cycle);
    }

    public String getGraphName() {
        return graphName;
    }

    public List<String> getCycle() {
        return cycle;
    }
}
