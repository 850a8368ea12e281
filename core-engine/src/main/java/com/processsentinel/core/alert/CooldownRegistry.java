package com.processsentinel.core.alert;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks when each deduplication key last fired.
 *
 * <p>
 * {@link #tryAcquire(String)} checks and claims a key in one atomic step, so
 * two threads evaluating the same condition can never both pass the cooldown
 * check.
 * </p>
 *
 * @since 1.0.0
 */
public class CooldownRegistry {

    private final Duration period;
    private final Clock clock;
    private final ConcurrentMap<String, Instant> lastFired = new ConcurrentHashMap<>();

    public CooldownRegistry(Duration period, Clock clock) {
        this.period = Objects.requireNonNull(period, "period must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (period.isNegative()) {
            throw new IllegalArgumentException("period must not be negative, got: " + period);
        }
    }

    public Optional<Instant> get(String key) {
        return Optional.ofNullable(lastFired.get(key));
    }

    /** Record that {@code key} fired now. */
    public void set(String key) {
        lastFired.put(key, clock.instant());
    }

    public void delete(String key) {
        lastFired.remove(key);
    }

    /**
     * @return {@code true} while less than the cooldown period has passed since
     *         {@code key} last fired
     */
    public boolean isInCooldown(String key) {
        Instant last = lastFired.get(key);
        return last != null && isWithinPeriod(last, clock.instant());
    }

    /**
     * Claim {@code key} if it is not cooling down.
     *
     * @param key deduplication key
     * @return {@code true} if the caller may fire; the key is then marked as
     *         fired now
     */
    public boolean tryAcquire(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Instant now = clock.instant();
        boolean[] acquired = new boolean[1];
        lastFired.compute(key, (k, last) -> {
            if (last != null && isWithinPeriod(last, now)) {
                return last;
            }
            acquired[0] = true;
            return now;
        });
        return acquired[0];
    }

    /**
     * Forget keys whose cooldown has elapsed.
     *
     * @return number of keys removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = lastFired.size();
        lastFired.entrySet().removeIf(e -> !isWithinPeriod(e.getValue(), now));
        return before - lastFired.size();
    }

    /**
     * Forget every key starting with {@code prefix}, in cooldown or not.
     *
     * @return number of keys removed
     */
    public int deleteByPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        int before = lastFired.size();
        lastFired.keySet().removeIf(key -> key.startsWith(prefix));
        return before - lastFired.size();
    }

    public int size() {
        return lastFired.size();
    }

    public Duration getPeriod() {
        return period;
    }

    private boolean isWithinPeriod(Instant last, Instant now) {
        return Duration.between(last, now).compareTo(period) < 0;
    }
}
