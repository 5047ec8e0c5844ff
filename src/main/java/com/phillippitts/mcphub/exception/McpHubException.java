package com.phillippitts.mcphub.exception;

import java.util.Objects;

/**
 * Base exception for all mcp-hub application-specific errors.
 * Every subclass carries an {@link ErrorKind} so failures can be reported as structured data.
 */
public class McpHubException extends RuntimeException {

    private final ErrorKind kind;

    public McpHubException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public McpHubException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
