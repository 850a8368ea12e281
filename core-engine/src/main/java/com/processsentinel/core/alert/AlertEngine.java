package com.processsentinel.core.alert;

import com.processsentinel.core.alert.rule.AlertRuleFactory;
import com.processsentinel.core.alert.rule.ProcessAlertRule;
import com.processsentinel.core.alert.rule.SystemThresholdRule;
import com.processsentinel.core.config.MonitorConfig;
import com.processsentinel.core.model.Alert;
import com.processsentinel.core.model.AlertType;
import com.processsentinel.core.model.AnalysisResult;
import com.processsentinel.core.model.Sample;
import com.processsentinel.core.model.SystemStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Turns threshold breaches and ML findings into deduplicated alerts and
 * manages their lifecycle.
 *
 * <h3>Deduplication</h3>
 * <p>
 * Every rule names a cooldown key. Within one cooldown window at most one
 * alert is created per key, however often the condition is observed. The key
 * is claimed before the alert is persisted and stays claimed if persistence
 * fails.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * open → acknowledged → resolved, or open → resolved. Resolved is terminal and
 * both transitions are idempotent. Alerts leave the active index once
 * acknowledged or resolved.
 * </p>
 *
 * <h3>Housekeeping</h3>
 * <p>
 * {@link #forgetProcess(String)} drops the cooldowns of a process that went
 * away and resolves its open alerts. {@link #runMaintenance(Duration)} purges
 * elapsed cooldowns, resolves open alerts past the retention and deletes
 * resolved ones past it.
 * </p>
 *
 * <h3>Failure Handling</h3>
 * <p>
 * {@link AlertStoreException}s are logged and turned into empty results so a
 * storage outage never stops evaluation of the remaining processes.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AlertEngine.class);

    public static final String DEFAULT_ACTOR = "system";

    private final AlertStore store;
    private final Clock clock;
    private final CooldownRegistry cooldowns;
    private final List<ProcessAlertRule> processRules;
    private final List<SystemThresholdRule> systemRules;
    private final ConcurrentMap<String, Alert> activeAlerts = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();

    public AlertEngine(MonitorConfig config, AlertStore store, Clock clock) {
        this(AlertRuleFactory.processRules(config), AlertRuleFactory.systemRules(config),
                new CooldownRegistry(Duration.ofSeconds(config.getCooldownSeconds()), clock), store, clock);
    }

    public AlertEngine(List<ProcessAlertRule> processRules, List<SystemThresholdRule> systemRules,
            CooldownRegistry cooldowns, AlertStore store, Clock clock) {
        this.processRules = List.copyOf(Objects.requireNonNull(processRules, "processRules must not be null"));
        this.systemRules = List.copyOf(Objects.requireNonNull(systemRules, "systemRules must not be null"));
        this.cooldowns = Objects.requireNonNull(cooldowns, "cooldowns must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Rule evaluation
    // ---------------------------------------------------------------

    /**
     * @param stats current host usage
     * @return alerts created, at most one per metric
     */
    public List<Alert> checkSystemThresholds(SystemStats stats) {
        Objects.requireNonNull(stats, "stats must not be null");
        List<Alert> alerts = new ArrayList<>();
        for (SystemThresholdRule rule : systemRules) {
            rule.evaluate(stats).flatMap(this::fire).ifPresent(alerts::add);
        }
        return alerts;
    }

    /**
     * @param sample   the process sample
     * @param analysis its analysis; rules needing ML output skip a {@code null}
     * @return alerts created
     */
    public List<Alert> checkProcessThresholds(Sample sample, AnalysisResult analysis) {
        Objects.requireNonNull(sample, "sample must not be null");
        List<Alert> alerts = new ArrayList<>();
        for (ProcessAlertRule rule : processRules) {
            rule.evaluate(sample, analysis).flatMap(this::fire).ifPresent(alerts::add);
        }
        return alerts;
    }

    private Optional<Alert> fire(AlertRequest request) {
        String key = request.getCooldownKey();
        if (key != null && !cooldowns.tryAcquire(key)) {
            LOG.trace("Alert key '{}' in cooldown – skipping", key);
            return Optional.empty();
        }
        return createAlert(request);
    }

    // ---------------------------------------------------------------
    // Creation & lifecycle
    // ---------------------------------------------------------------

    /**
     * Persist a new open alert and index it as active. Does not consult
     * cooldowns.
     *
     * @param request alert content
     * @return the alert, or empty when persistence failed
     */
    public Optional<Alert> createAlert(AlertRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Alert alert = Alert.builder()
                .id(UUID.randomUUID().toString())
                .type(request.getType())
                .severity(request.getSeverity())
                .source(request.getSource())
                .processId(request.getProcessId())
                .processName(request.getProcessName())
                .metric(request.getMetric())
                .message(request.getMessage())
                .details(request.getDetails())
                .mlDetected(request.isMlDetected())
                .algorithm(request.getAlgorithm())
                .createdAt(clock.instant())
                .build();
        try {
            store.insert(alert);
        } catch (AlertStoreException e) {
            LOG.error("Failed to persist alert '{}': {}", request.getMessage(), e.getMessage(), e);
            return Optional.empty();
        }
        activeAlerts.put(alert.getId(), alert);
        LOG.info("Alert [{}] {} (severity {}): {}", alert.getType().label(), alert.getId(),
                alert.getSeverity(), alert.getMessage());
        return Optional.of(alert);
    }

    /**
     * @param id    alert id
     * @param actor who acknowledges; {@code null} means {@value #DEFAULT_ACTOR}
     * @return the alert after the transition, or empty if unknown or the store
     *         failed
     */
    public Optional<Alert> acknowledgeAlert(String id, String actor) {
        String by = actor != null ? actor : DEFAULT_ACTOR;
        return transition(id, "acknowledge", alert -> alert.acknowledge(by, clock.instant()));
    }

    /**
     * @param id alert id
     * @return the resolved alert, or empty if unknown or the store failed
     */
    public Optional<Alert> resolveAlert(String id) {
        return transition(id, "resolve", alert -> alert.resolve(clock.instant()));
    }

    private Optional<Alert> transition(String id, String action, Function<Alert, Boolean> change) {
        if (id == null) {
            return Optional.empty();
        }
        synchronized (lifecycleLock) {
            try {
                Optional<Alert> found = store.findById(id);
                if (found.isEmpty()) {
                    LOG.debug("Cannot {} unknown alert {}", action, id);
                    return Optional.empty();
                }
                Alert alert = found.get();
                if (change.apply(alert)) {
                    store.update(alert);
                    LOG.info("Alert {}: {}", id, action);
                }
                activeAlerts.remove(id);
                return Optional.of(alert);
            } catch (AlertStoreException e) {
                LOG.error("Failed to {} alert {}: {}", action, id, e.getMessage(), e);
                return Optional.empty();
            }
        }
    }

    // ---------------------------------------------------------------
    // Housekeeping
    // ---------------------------------------------------------------

    /**
     * Drop the cooldown keys of {@code processId} and resolve its open alerts.
     *
     * @param processId process that is no longer observed
     * @return number of alerts resolved
     */
    public int forgetProcess(String processId) {
        Objects.requireNonNull(processId, "processId must not be null");
        int keys = cooldowns.deleteByPrefix(ProcessAlertRule.cooldownPrefix(processId));
        int resolved = resolveActive(alert -> processId.equals(alert.getProcessId()));
        if (keys > 0 || resolved > 0) {
            LOG.debug("Forgot process {}: {} cooldown key(s), {} alert(s) resolved",
                    processId, keys, resolved);
        }
        return resolved;
    }

    /**
     * Purge elapsed cooldowns, resolve open alerts created before the
     * retention window and delete resolved alerts created before it.
     *
     * @param retention how long alerts are kept
     * @return number of alerts deleted from the store
     */
    public int runMaintenance(Duration retention) {
        Objects.requireNonNull(retention, "retention must not be null");
        Instant cutoff = clock.instant().minus(retention);
        int keys = cooldowns.purgeExpired();
        int resolved = resolveActive(alert -> alert.getCreatedAt().isBefore(cutoff));
        int deleted;
        try {
            deleted = store.deleteResolvedCreatedBefore(cutoff);
        } catch (AlertStoreException e) {
            LOG.error("Failed to delete expired alerts: {}", e.getMessage(), e);
            deleted = 0;
        }
        LOG.debug("Maintenance: {} cooldown key(s) purged, {} alert(s) expired, {} deleted",
                keys, resolved, deleted);
        return deleted;
    }

    private int resolveActive(Predicate<Alert> filter) {
        int resolved = 0;
        for (Alert alert : activeAlerts.values()) {
            if (filter.test(alert) && resolveAlert(alert.getId()).isPresent()) {
                resolved++;
            }
        }
        return resolved;
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @return up to {@code limit} alerts, newest first; empty on store failure
     */
    public List<Alert> getRecentAlerts(int limit, boolean unacknowledgedOnly) {
        try {
            return store.findRecent(limit, unacknowledgedOnly);
        } catch (AlertStoreException e) {
            LOG.error("Failed to fetch recent alerts: {}", e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    /**
     * @param timeRange trailing window ending now
     * @return counts by type and of ML-detected alerts; empty on store failure
     */
    public Optional<AlertStats> getAlertStats(Duration timeRange) {
        Objects.requireNonNull(timeRange, "timeRange must not be null");
        try {
            List<Alert> alerts = store.findCreatedSince(clock.instant().minus(timeRange));
            Map<AlertType, Long> byType = new EnumMap<>(AlertType.class);
            long ml = 0;
            for (Alert alert : alerts) {
                byType.merge(alert.getType(), 1L, Long::sum);
                if (alert.isMlDetected()) {
                    ml++;
                }
            }
            return Optional.of(new AlertStats(alerts.size(), byType, ml, timeRange));
        } catch (AlertStoreException e) {
            LOG.error("Failed to compute alert stats: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Delete resolved alerts created more than {@code daysOld} days ago.
     *
     * @return number deleted; {@code 0} on store failure
     */
    public int clearOldAlerts(int daysOld) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(daysOld));
        try {
            int deleted = store.deleteResolvedCreatedBefore(cutoff);
            LOG.info("Cleared {} old alert(s)", deleted);
            return deleted;
        } catch (AlertStoreException e) {
            LOG.error("Failed to clear old alerts: {}", e.getMessage(), e);
            return 0;
        }
    }

    /** @return snapshot of alerts that are neither acknowledged nor resolved */
    public Collection<Alert> activeAlerts() {
        return List.copyOf(activeAlerts.values());
    }

    public CooldownRegistry getCooldowns() {
        return cooldowns;
    }
}
