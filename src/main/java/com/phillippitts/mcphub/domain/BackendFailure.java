package com.phillippitts.mcphub.domain;

import com.phillippitts.mcphub.exception.ErrorKind;

/**
 * Why one backend in a fallback chain did not produce a result.
 *
 * @param backend backend name
 * @param kind    one of the backend-local error kinds
 * @param reason  human-readable reason
 */
public record BackendFailure(String backend, ErrorKind kind, String reason) {
}
