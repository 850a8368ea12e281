package com.processsentinel.core.alert;

import com.processsentinel.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Heap-backed {@link AlertStore}. Stores and returns copies.
 *
 * <p>
 * {@link #purgeExpired(Instant)} applies the retention policy: resolved
 * alerts are dropped once {@code retention} has passed since they were
 * resolved (30 days by default).
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryAlertStore implements AlertStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryAlertStore.class);

    public static final Duration DEFAULT_RETENTION = Duration.ofDays(30);

    private final Duration retention;
    private final ConcurrentMap<String, Alert> alerts = new ConcurrentHashMap<>();

    public InMemoryAlertStore(Duration retention) {
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
    }

    public InMemoryAlertStore() {
        this(DEFAULT_RETENTION);
    }

    @Override
    public void insert(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        if (alerts.putIfAbsent(alert.getId(), Alert.copyOf(alert)) != null) {
            throw new AlertStoreException("Duplicate alert id: " + alert.getId());
        }
    }

    @Override
    public void update(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        if (alerts.replace(alert.getId(), Alert.copyOf(alert)) == null) {
            throw new AlertStoreException("No alert with id: " + alert.getId());
        }
    }

    @Override
    public Optional<Alert> findById(String id) {
        Alert alert = alerts.get(id);
        return alert != null ? Optional.of(Alert.copyOf(alert)) : Optional.empty();
    }

    @Override
    public List<Alert> findRecent(int limit, boolean unacknowledgedOnly) {
        return alerts.values().stream()
                .filter(a -> !unacknowledgedOnly || !a.isAcknowledged())
                .sorted(Comparator.comparing(Alert::getCreatedAt).reversed())
                .limit(Math.max(limit, 0))
                .map(Alert::copyOf)
                .toList();
    }

    @Override
    public List<Alert> findCreatedSince(Instant since) {
        return alerts.values().stream()
                .filter(a -> !a.getCreatedAt().isBefore(since))
                .map(Alert::copyOf)
                .toList();
    }

    @Override
    public int deleteResolvedCreatedBefore(Instant cutoff) {
        int before = alerts.size();
        alerts.values().removeIf(a -> a.isResolved() && a.getCreatedAt().isBefore(cutoff));
        return before - alerts.size();
    }

    /**
     * Drop resolved alerts whose retention has elapsed.
     *
     * @param now current time
     * @return number of alerts removed
     */
    public int purgeExpired(Instant now) {
        Instant cutoff = now.minus(retention);
        int before = alerts.size();
        alerts.values().removeIf(a -> a.isResolved() && a.getResolvedAt() != null
                && a.getResolvedAt().isBefore(cutoff));
        int removed = before - alerts.size();
        if (removed > 0) {
            LOG.info("Purged {} resolved alert(s) past {} retention", removed, retention);
        }
        return removed;
    }

    public int size() {
        return alerts.size();
    }
}
