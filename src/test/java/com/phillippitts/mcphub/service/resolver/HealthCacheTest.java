package com.phillippitts.mcphub.service.resolver;

import com.phillippitts.mcphub.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class HealthCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final HealthCache cache = new HealthCache(clock);

    @Test
    void entryIsServedUntilItsTtlElapses() {
        cache.put("whisper-cli", true, "", Duration.ofSeconds(5));

        clock.advance(Duration.ofMillis(4_999));
        assertThat(cache.get("whisper-cli")).isPresent();

        clock.advance(Duration.ofMillis(1));
        assertThat(cache.get("whisper-cli")).isEmpty();
    }

    @Test
    void unhealthyResultsExpireToo() {
        cache.put("anythingllm-chat", false, "connection refused", Duration.ofSeconds(1));

        assertThat(cache.get("anythingllm-chat")).hasValueSatisfying(e -> {
            assertThat(e.healthy()).isFalse();
            assertThat(e.reason()).isEqualTo("connection refused");
        });

        clock.advance(Duration.ofSeconds(2));
        assertThat(cache.get("anythingllm-chat")).isEmpty();
    }

    @Test
    void healthyEntryDropsReason() {
        HealthCache.Entry e = cache.put("a", true, "ignored", Duration.ofSeconds(1));

        assertThat(e.reason()).isEmpty();
    }

    @Test
    void zeroTtlIsNeverServed() {
        cache.put("a", true, "", Duration.ZERO);

        assertThat(cache.get("a")).isEmpty();
    }

    @Test
    void snapshotHidesExpiredEntriesAndInvalidateRemoves() {
        cache.put("short", true, "", Duration.ofSeconds(1));
        cache.put("long", true, "", Duration.ofMinutes(1));
        cache.put("gone", true, "", Duration.ofMinutes(1));
        cache.invalidate("gone");

        clock.advance(Duration.ofSeconds(2));

        assertThat(cache.snapshot()).containsOnlyKeys("long");
    }
}
