package com.phillippitts.mcphub.exception;

import java.util.List;

/**
 * Thrown when the registered catalog is invalid. Raised at startup or on reload, never per request.
 */
public class ConfigurationException extends McpHubException {

    private final List<String> problems;

    public ConfigurationException(String message) {
        this(ErrorKind.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(List<String> problems) {
        super(ErrorKind.CONFIGURATION_ERROR,
                "Invalid configuration (" + problems.size() + " problem(s)): " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    protected ConfigurationException(ErrorKind kind, String message) {
        super(kind, message);
        this.problems = List.of(message);
    }

    public List<String> getProblems() {
        return problems;
    }
}
