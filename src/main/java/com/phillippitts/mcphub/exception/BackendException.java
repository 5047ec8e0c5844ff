package com.phillippitts.mcphub.exception;

/**
 * Thrown by a single backend adapter: unhealthy, timed out, or failed while invoking.
 *
 * <p>These errors are recovered by the capability resolver, which moves on to the next
 * backend in the chain. They only reach callers aggregated into
 * {@link AllBackendsFailedException}.
 */
public class BackendException extends McpHubException {

    private final String backendName;

    public BackendException(ErrorKind kind, String message, String backendName) {
        super(requireBackendKind(kind), message + " (backend: " + backendName + ")");
        this.backendName = backendName;
    }

    public BackendException(ErrorKind kind, String message, String backendName, Throwable cause) {
        super(requireBackendKind(kind), message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }

    private static ErrorKind requireBackendKind(ErrorKind kind) {
        if (kind == null || !kind.isBackendLocal()) {
            throw new IllegalArgumentException("not a backend error kind: " + kind);
        }
        return kind;
    }
}
