package com.phillippitts.mcphub.service.events;

import com.phillippitts.mcphub.exception.ErrorKind;

import java.time.Instant;

/** Published when a backend is skipped or fails and the resolver moves to the next one. */
public record BackendFallbackEvent(String capability, String backend, ErrorKind kind, String reason, Instant at) { }
