package com.processsentinel.core.alert;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CooldownRegistry}.
 */
class CooldownRegistryTest {

    private MutableClock clock;
    private CooldownRegistry cooldowns;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        cooldowns = new CooldownRegistry(Duration.ofSeconds(60), clock);
    }

    @Test
    @DisplayName("Should grant a key once per cooldown window")
    void shouldGrantOncePerWindow() {
        assertThat(cooldowns.tryAcquire("system:cpu:critical")).isTrue();
        assertThat(cooldowns.tryAcquire("system:cpu:critical")).isFalse();

        clock.advance(Duration.ofSeconds(59));
        assertThat(cooldowns.tryAcquire("system:cpu:critical")).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(cooldowns.tryAcquire("system:cpu:critical")).isTrue();
    }

    @Test
    @DisplayName("Should track keys independently")
    void shouldTrackKeysIndependently() {
        assertThat(cooldowns.tryAcquire("process:a:cpu")).isTrue();
        assertThat(cooldowns.tryAcquire("process:b:cpu")).isTrue();
        assertThat(cooldowns.isInCooldown("process:a:cpu")).isTrue();
        assertThat(cooldowns.isInCooldown("process:c:cpu")).isFalse();
    }

    @Test
    @DisplayName("Should support get, set and delete")
    void shouldSupportBasicOperations() {
        cooldowns.set("k");
        assertThat(cooldowns.get("k")).contains(clock.instant());

        cooldowns.delete("k");
        assertThat(cooldowns.get("k")).isEmpty();
        assertThat(cooldowns.tryAcquire("k")).isTrue();
    }

    @Test
    @DisplayName("Should purge only expired keys")
    void shouldPurgeExpired() {
        cooldowns.set("old");
        clock.advance(Duration.ofSeconds(61));
        cooldowns.set("fresh");

        assertThat(cooldowns.purgeExpired()).isEqualTo(1);
        assertThat(cooldowns.get("old")).isEmpty();
        assertThat(cooldowns.get("fresh")).isPresent();
    }

    @Test
    @DisplayName("Should delete keys by prefix whether in cooldown or not")
    void shouldDeleteByPrefix() {
        cooldowns.set("process:7:cpu");
        clock.advance(Duration.ofSeconds(61));
        cooldowns.set("process:7:anomaly");
        cooldowns.set("process:70:cpu");

        assertThat(cooldowns.deleteByPrefix("process:7:")).isEqualTo(2);
        assertThat(cooldowns.size()).isEqualTo(1);
        assertThat(cooldowns.get("process:70:cpu")).isPresent();
    }

    @Test
    @DisplayName("Should grant exactly one of many concurrent claims")
    void shouldGrantExactlyOneConcurrently() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Callable<Boolean>> claims = new ArrayList<>();
        for (int i = 0; i < 64; i++) {
            claims.add(() -> cooldowns.tryAcquire("process:hot:anomaly"));
        }
        int granted = 0;
        for (Future<Boolean> f : pool.invokeAll(claims)) {
            if (f.get()) {
                granted++;
            }
        }
        pool.shutdown();

        assertThat(granted).isEqualTo(1);
    }
}
