package com.phillippitts.mcphub.service.graph;

import com.phillippitts.mcphub.domain.CancellationToken;
import com.phillippitts.mcphub.domain.CapabilityResult;

/**
 * Resolves a capability call against the catalog an execution was started with.
 */
@FunctionalInterface
public interface CapabilityInvoker {

    CapabilityResult<?> invoke(String capability, Object input, CancellationToken token);
}
