package com.phillippitts.mcphub.domain;

import java.util.Objects;

/**
 * Output of a capability resolution, tagged with the backend that served it.
 *
 * @param output   backend output
 * @param backend  name of the serving backend
 * @param degraded true when the output came from the chain's always-available fallback
 * @param <O>      output type
 */
public record CapabilityResult<O>(O output, String backend, boolean degraded) {

    public CapabilityResult {
        Objects.requireNonNull(output, "output must not be null");
        Objects.requireNonNull(backend, "backend must not be null");
    }
}
