package com.phillippitts.mcphub.exception;

import com.phillippitts.mcphub.domain.BackendFailure;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when every backend in a capability's fallback chain was skipped or failed.
 * Carries the per-backend failure reasons in the order the chain was tried.
 */
public class AllBackendsFailedException extends McpHubException {

    private final String capability;
    private final List<BackendFailure> failures;

    public AllBackendsFailedException(String capability, List<BackendFailure> failures) {
        super(ErrorKind.ALL_BACKENDS_FAILED, describe(capability, failures));
        this.capability = capability;
        this.failures = List.copyOf(failures);
    }

    public String getCapability() {
        return capability;
    }

    public List<BackendFailure> getFailures() {
        return failures;
    }

    private static String describe(String capability, List<BackendFailure> failures) {
        if (failures.isEmpty()) {
            return "No backends available for capability '" + capability + "'";
        }
        return "All backends failed for capability '" + capability + "': "
                + failures.stream()
                        .map(f -> f.backend() + "=" + f.kind() + "(" + f.reason() + ")")
                        .collect(Collectors.joining(", "));
    }
}
