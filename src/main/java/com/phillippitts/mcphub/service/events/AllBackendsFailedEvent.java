package com.phillippitts.mcphub.service.events;

import com.phillippitts.mcphub.domain.BackendFailure;

import java.time.Instant;
import java.util.List;

/** Published when no backend of a capability produced a result. */
public record AllBackendsFailedEvent(String capability, List<BackendFailure> failures, Instant at) { }
