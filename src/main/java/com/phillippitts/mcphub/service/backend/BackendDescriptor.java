package com.phillippitts.mcphub.service.backend;

import java.time.Duration;
import java.util.Objects;

/**
 * One configured entry of a capability's fallback chain.
 *
 * @param name          adapter name
 * @param capability    capability served
 * @param priority      lower values are tried first; distinct within a capability
 * @param enabled       disabled entries are never health-checked or invoked
 * @param fallback      marks the always-available last resort whose output is degraded
 * @param healthTimeout bound on one health probe
 * @param invokeTimeout bound on one invocation
 * @param healthTtl     how long a probe result is reused
 * @param adapter       the adapter instance
 */
public record BackendDescriptor(
        String name,
        String capability,
        int priority,
        boolean enabled,
        boolean fallback,
        Duration healthTimeout,
        Duration invokeTimeout,
        Duration healthTtl,
        BackendAdapter<?, ?> adapter
) {

    public static final Duration DEFAULT_HEALTH_TIMEOUT = Duration.ofMillis(500);
    public static final Duration DEFAULT_INVOKE_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_HEALTH_TTL = Duration.ofSeconds(5);

    public BackendDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(capability, "capability must not be null");
        Objects.requireNonNull(adapter, "adapter must not be null");
        healthTimeout = positiveOr(healthTimeout, DEFAULT_HEALTH_TIMEOUT, "healthTimeout");
        invokeTimeout = positiveOr(invokeTimeout, DEFAULT_INVOKE_TIMEOUT, "invokeTimeout");
        if (healthTtl == null) {
            healthTtl = DEFAULT_HEALTH_TTL;
        } else if (healthTtl.isNegative()) {
            throw new IllegalArgumentException("healthTtl must not be negative");
        }
    }

    /**
     * Creates an enabled, non-fallback descriptor with default timeouts.
     */
    public static BackendDescriptor of(BackendAdapter<?, ?> adapter, int priority) {
        return new BackendDescriptor(adapter.name(), adapter.capability(), priority, true, false,
                null, null, null, adapter);
    }

    public BackendDescriptor asFallback() {
        return new BackendDescriptor(name, capability, priority, enabled, true,
                healthTimeout, invokeTimeout, healthTtl, adapter);
    }

    public BackendDescriptor disabled() {
        return new BackendDescriptor(name, capability, priority, false, fallback,
                healthTimeout, invokeTimeout, healthTtl, adapter);
    }

    public BackendDescriptor withTimeouts(Duration health, Duration invoke, Duration ttl) {
        return new BackendDescriptor(name, capability, priority, enabled, fallback,
                health, invoke, ttl, adapter);
    }

    private static Duration positiveOr(Duration value, Duration dflt, String field) {
        if (value == null) {
            return dflt;
        }
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(field + " must be positive");
        }
        return value;
    }
}
