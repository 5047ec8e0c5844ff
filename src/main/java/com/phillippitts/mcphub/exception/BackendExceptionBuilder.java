package com.phillippitts.mcphub.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link BackendException} with structured context.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw BackendExceptionBuilder.create("Process failed")
 *         .backend("whisper-cli")
 *         .kind(ErrorKind.BACKEND_INVOCATION_ERROR)
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 *
 * throw BackendExceptionBuilder.create("Health probe timed out")
 *         .backend("anythingllm-chat")
 *         .kind(ErrorKind.BACKEND_TIMEOUT)
 *         .metadata("timeoutMs", 500)
 *         .build();
 * </pre>
 *
 * <p>The final message format is
 * {@code {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (backend: {name})}.
 */
public final class BackendExceptionBuilder {

    private final String message;
    private String backendName;
    private ErrorKind kind = ErrorKind.BACKEND_INVOCATION_ERROR;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private BackendExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static BackendExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new BackendExceptionBuilder(message);
    }

    public BackendExceptionBuilder backend(String backendName) {
        this.backendName = backendName;
        return this;
    }

    /**
     * Sets the error kind. Defaults to {@link ErrorKind#BACKEND_INVOCATION_ERROR}.
     */
    public BackendExceptionBuilder kind(ErrorKind kind) {
        this.kind = kind;
        return this;
    }

    public BackendExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /** Process exit code, for subprocess-backed adapters. */
    public BackendExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public BackendExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public BackendExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public BackendException build() {
        String detailedMessage = buildDetailedMessage();
        String backend = backendName != null ? backendName : "unknown";

        if (cause != null) {
            return new BackendException(kind, detailedMessage, backend, cause);
        }
        return new BackendException(kind, detailedMessage, backend);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
