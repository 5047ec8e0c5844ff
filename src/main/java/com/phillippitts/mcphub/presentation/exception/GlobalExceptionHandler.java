package com.phillippitts.mcphub.presentation.exception;

import com.phillippitts.mcphub.exception.AllBackendsFailedException;
import com.phillippitts.mcphub.exception.ConfigurationException;
import com.phillippitts.mcphub.exception.McpHubException;
import com.phillippitts.mcphub.exception.TaskNotFoundException;
import com.phillippitts.mcphub.exception.TaskTimeoutException;
import com.phillippitts.mcphub.exception.UnknownTaskKindException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API boundary.
 *
 * Converts domain exceptions to HTTP responses. 4xx bodies carry the exception message;
 * 5xx bodies never do.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(TaskNotFoundException.class)
    ResponseEntity<ApiError> handleTaskNotFound(TaskNotFoundException ex) {
        LOG.debug("Task not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex.getKind().name(), "Task not found", ex.getMessage());
    }

    /**
     * Client error - task kind not in the catalog (HTTP 400).
     */
    @ExceptionHandler(UnknownTaskKindException.class)
    ResponseEntity<ApiError> handleUnknownKind(UnknownTaskKindException ex) {
        LOG.warn("Rejected task: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getKind().name(), "Unknown task kind", ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        String details;
        if (ex instanceof MethodArgumentNotValidException invalid) {
            details = invalid.getBindingResult().getFieldErrors().stream()
                    .map(f -> f.getField() + " " + f.getDefaultMessage())
                    .collect(Collectors.joining("; "));
        } else if (ex instanceof MethodArgumentTypeMismatchException mismatch) {
            details = "Invalid value for parameter '" + mismatch.getName() + "'";
        } else {
            details = "Malformed request body";
        }
        LOG.warn("Bad request: {}", details);
        return error(HttpStatus.BAD_REQUEST, "BadRequest", "Invalid request", details);
    }

    /**
     * Synchronous run exceeded its deadline; the task has been cancelled (HTTP 504).
     */
    @ExceptionHandler(TaskTimeoutException.class)
    ResponseEntity<ApiError> handleTimeout(TaskTimeoutException ex) {
        LOG.warn("Synchronous task timed out: {}", ex.getMessage());
        return error(HttpStatus.GATEWAY_TIMEOUT, ex.getKind().name(), "Task timed out",
                "The task was cancelled; retry with a longer timeout or submit it asynchronously");
    }

    /**
     * Transient error - every backend of a capability failed (HTTP 503).
     */
    @ExceptionHandler(AllBackendsFailedException.class)
    ResponseEntity<ApiError> handleAllBackendsFailed(AllBackendsFailedException ex) {
        LOG.error("Capability {} unavailable: {} backend failure(s)", ex.getCapability(), ex.getFailures().size());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getKind().name(),
                "Capability temporarily unavailable", "Please retry in a few seconds");
    }

    @ExceptionHandler(ConfigurationException.class)
    ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex) {
        LOG.error("Configuration error: {}", ex.getProblems());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getKind().name(),
                "Service not configured", "Contact administrator");
    }

    /**
     * Registry not built yet (HTTP 503).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleNotReady(IllegalStateException ex) {
        LOG.error("Service not ready: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "ServiceUnavailable",
                "Service not ready", "Please retry in a few seconds");
    }

    @ExceptionHandler(McpHubException.class)
    ResponseEntity<ApiError> handleTaskFailure(McpHubException ex) {
        LOG.error("Task failed: kind={}", ex.getKind(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getKind().name(),
                "Task failed", "Please contact support with request ID");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
