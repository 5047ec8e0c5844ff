package com.phillippitts.mcphub.service.health;

import com.phillippitts.mcphub.service.backend.BackendDescriptor;
import com.phillippitts.mcphub.service.backend.CapabilityChain;
import com.phillippitts.mcphub.service.registry.ServiceRegistry;
import com.phillippitts.mcphub.service.resolver.CapabilityResolver;
import com.phillippitts.mcphub.service.resolver.HealthCache;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator over every registered capability chain.
 *
 * <ul>
 *   <li>UP: every required capability has its top-priority backend healthy</li>
 *   <li>DEGRADED: every required capability can be served, some only by a lower backend or its fallback</li>
 *   <li>DOWN: a required capability has no healthy backend, or the registry is not built</li>
 * </ul>
 *
 * <p>Probes go through the resolver's health cache, so this endpoint does not add load on
 * backends within a TTL window.
 */
@Component
public class CapabilityHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final ServiceRegistry registry;
    private final CapabilityResolver resolver;

    public CapabilityHealthIndicator(ServiceRegistry registry, CapabilityResolver resolver) {
        this.registry = registry;
        this.resolver = resolver;
    }

    @Override
    public Health health() {
        if (!registry.isReady()) {
            return Health.down().withDetail("registry", "not built").build();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        boolean anyDown = false;
        boolean anyDegraded = false;

        for (CapabilityChain chain : registry.catalog().chains().values()) {
            Map<String, String> backends = new LinkedHashMap<>();
            int firstHealthy = -1;
            int index = 0;
            for (BackendDescriptor d : chain.backends()) {
                HealthCache.Entry e = resolver.probe(d);
                backends.put(d.name(), e.healthy() ? "UP" : "DOWN: " + e.reason());
                if (e.healthy() && firstHealthy < 0) {
                    firstHealthy = index;
                }
                index++;
            }

            String state;
            if (firstHealthy == 0) {
                state = "UP";
            } else if (firstHealthy > 0) {
                state = DEGRADED;
                anyDegraded = true;
            } else if (chain.optional()) {
                state = "UNAVAILABLE";
            } else {
                state = "DOWN";
                anyDown = true;
            }
            details.put(chain.capability(), Map.of("status", state, "backends", backends));
        }

        Health.Builder builder = new Health.Builder();
        if (anyDown) {
            builder.down();
        } else if (anyDegraded) {
            builder.status(DEGRADED);
        } else {
            builder.up();
        }
        return builder.withDetails(details).build();
    }
}
