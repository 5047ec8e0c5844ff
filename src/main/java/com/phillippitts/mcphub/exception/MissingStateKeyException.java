package com.phillippitts.mcphub.exception;

/**
 * Thrown when a component or edge predicate reads a pipeline state key that was never written.
 */
public class MissingStateKeyException extends McpHubException {

    private final String key;

    public MissingStateKeyException(String key) {
        super(ErrorKind.MISSING_STATE_KEY, "Pipeline state has no value for key '" + key + "'");
        this.key = key;
    }

    public MissingStateKeyException(String key, String nodeName) {
        super(ErrorKind.MISSING_STATE_KEY,
                "Pipeline state has no value for key '" + key + "' at node '" + nodeName + "'");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
