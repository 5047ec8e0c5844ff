package com.phillippitts.mcphub.exception;

/**
 * Thrown when no outgoing edge of a node matches the current pipeline state.
 * This is a wiring error: every node should end with an unconditional edge or cover all cases.
 */
public class NoMatchingEdgeException extends McpHubException {

    private final String graphName;
    private final String nodeName;

    public NoMatchingEdgeException(String graphName, String nodeName) {
        super(ErrorKind.NO_MATCHING_EDGE,
                "No outgoing edge matched at node '" + nodeName + "' of graph '" + graphName + "'");
        this.graphName = graphName;
        this.nodeName = nodeName;
    }

    public String getGraphName() {
        return graphName;
    }

    public String getNodeName() {
        return nodeName;
    }
}
