package com.phillippitts.mcphub.service.resolver;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.TreeMap;

/**
 * Short-lived cache of backend health probe results, shared by all concurrent resolutions.
 *
 * <p>Both healthy and unhealthy results expire after the backend's TTL, so a recovered
 * backend is rediscovered on the next probe.
 */
@Component
public class HealthCache {

    /**
     * A cached probe result.
     *
     * @param healthy   probe outcome
     * @param reason    why the probe failed, empty when healthy
     * @param checkedAt when the probe ran
     * @param expiresAt after this instant the entry is ignored
     */
    public record Entry(boolean healthy, String reason, Instant checkedAt, Instant expiresAt) { }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public HealthCache() {
        this(Clock.systemUTC());
    }

    public HealthCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return the cached entry for a backend if present and not expired
     */
    public Optional<Entry> get(String backend) {
        Entry e = entries.get(backend);
        if (e == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(e.expiresAt())) {
            entries.remove(backend, e);
            return Optional.empty();
        }
        return Optional.of(e);
    }

    public Entry put(String backend, boolean healthy, String reason, Duration ttl) {
        Instant now = clock.instant();
        Entry e = new Entry(healthy, healthy ? "" : reason, now, now.plus(ttl));
        entries.put(backend, e);
        return e;
    }

    public void invalidate(String backend) {
        entries.remove(backend);
    }

    /** Unexpired entries by backend name, for health reporting. */
    public Map<String, Entry> snapshot() {
        Instant now = clock.instant();
        Map<String, Entry> copy = new TreeMap<>();
        entries.forEach((k, v) -> {
            if (now.isBefore(v.expiresAt())) {
                copy.put(k, v);
            }
        });
        return copy;
    }
}
