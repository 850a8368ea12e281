package com.processsentinel.core.alert;

import com.processsentinel.core.config.MonitorConfig;
import com.processsentinel.core.model.Alert;
import com.processsentinel.core.model.AlertSource;
import com.processsentinel.core.model.AlertType;
import com.processsentinel.core.model.AnalysisResult;
import com.processsentinel.core.model.AnomalyAssessment;
import com.processsentinel.core.model.Classification;
import com.processsentinel.core.model.Sample;
import com.processsentinel.core.model.SystemStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertEngine}.
 */
class AlertEngineTest {

    private MutableClock clock;
    private InMemoryAlertStore store;
    private AlertEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T12:00:00Z"));
        store = new InMemoryAlertStore();
        engine = new AlertEngine(MonitorConfig.defaults(), store, clock);
    }

    // ------------------------------------------------------------------
    // Cooldown discipline
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should alert once per cooldown window for a hot process")
    void shouldDeduplicateProcessCpuAlerts() {
        Sample hot = Sample.builder("1234").processName("java").cpu(96).build();

        List<Alert> first = engine.checkProcessThresholds(hot, quietAnalysis());
        assertThat(first).hasSize(1);
        assertThat(first.get(0).getType()).isEqualTo(AlertType.WARNING);
        assertThat(first.get(0).getSource()).isEqualTo(AlertSource.THRESHOLD);
        assertThat(first.get(0).getDetails()).containsEntry("currentValue", 96.0);
        assertThat(first.get(0).getMessage()).isEqualTo("Process java using 96.0% CPU");

        clock.advance(Duration.ofSeconds(30));
        assertThat(engine.checkProcessThresholds(hot, quietAnalysis())).isEmpty();

        clock.advance(Duration.ofSeconds(30));
        assertThat(engine.checkProcessThresholds(hot, quietAnalysis())).hasSize(1);
    }

    @Test
    @DisplayName("Should emit only the critical tier for a system metric above both cutoffs")
    void shouldPreferCriticalTier() {
        List<Alert> alerts = engine.checkSystemThresholds(SystemStats.of(96, 10, 10));

        assertThat(alerts).hasSize(1);
        Alert alert = alerts.get(0);
        assertThat(alert.getType()).isEqualTo(AlertType.CRITICAL);
        assertThat(alert.getSeverity()).isEqualTo(9);
        assertThat(alert.getDetails()).containsEntry("currentValue", 96.0).containsEntry("threshold", 85.0);
        assertThat(alert.getMessage()).isEqualTo("System CPU usage critical at 96.0%");

        clock.advance(Duration.ofSeconds(10));
        assertThat(engine.checkSystemThresholds(SystemStats.of(96, 10, 10))).isEmpty();

        clock.advance(Duration.ofSeconds(50));
        assertThat(engine.checkSystemThresholds(SystemStats.of(96, 10, 10))).hasSize(1);
    }

    @Test
    @DisplayName("Should use separate keys for warning and critical tiers")
    void shouldKeyTiersSeparately() {
        assertThat(engine.checkSystemThresholds(SystemStats.of(72, 10, 10)))
                .singleElement().extracting(Alert::getType).isEqualTo(AlertType.WARNING);
        assertThat(engine.checkSystemThresholds(SystemStats.of(90, 10, 10)))
                .singleElement().extracting(Alert::getType).isEqualTo(AlertType.CRITICAL);
        assertThat(engine.getCooldowns().get("system:cpu:warning")).isPresent();
        assertThat(engine.getCooldowns().get("system:cpu:critical")).isPresent();
    }

    @Test
    @DisplayName("Should cover memory and disk alongside cpu")
    void shouldCheckEverySystemMetric() {
        List<Alert> alerts = engine.checkSystemThresholds(SystemStats.of(10, 92, 85));

        assertThat(alerts).extracting(Alert::getMetric).containsExactlyInAnyOrder("memory", "disk");
    }

    // ------------------------------------------------------------------
    // ML rules
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should escalate a critical anomaly and mark it ML-detected")
    void shouldRaiseCriticalAnomalyAlert() {
        Sample sample = Sample.builder("42").processName("worker").cpu(20).build();
        AnalysisResult analysis = new AnalysisResult(AnomalyAssessment.of(0.85, 0.6, 0.8),
                Classification.unknown(), Collections.emptyList(), clock.instant());

        List<Alert> alerts = engine.checkProcessThresholds(sample, analysis);

        assertThat(alerts).hasSize(1);
        Alert alert = alerts.get(0);
        assertThat(alert.getType()).isEqualTo(AlertType.CRITICAL);
        assertThat(alert.getSource()).isEqualTo(AlertSource.ANOMALY);
        assertThat(alert.isMlDetected()).isTrue();
        assertThat(alert.getAlgorithm()).isEqualTo("Isolation Forest");
        assertThat(alert.getDetails()).containsEntry("anomalyScore", 0.85).containsEntry("threshold", 0.6);
    }

    @Test
    @DisplayName("Should warn when the mean forecast exceeds the prediction limit")
    void shouldRaisePredictionAlert() {
        Sample sample = Sample.builder("42").processName("worker").cpu(70).build();
        AnalysisResult analysis = new AnalysisResult(AnomalyAssessment.normal(), Classification.unknown(),
                List.of(84.0, 88.0, 92.0), clock.instant());

        List<Alert> alerts = engine.checkProcessThresholds(sample, analysis);

        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getSource()).isEqualTo(AlertSource.PREDICTION);
            assertThat(alert.getDetails()).containsEntry("prediction", 88.0).containsEntry("currentValue", 70.0);
            assertThat(alert.getAlgorithm()).isEqualTo("Multilayer Perceptron");
        });
    }

    // ------------------------------------------------------------------
    // Creation & lifecycle
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should honour a severity override and index the alert as active")
    void shouldCreateAlertWithOverride() {
        Optional<Alert> alert = engine.createAlert(AlertRequest.builder(AlertType.INFO, AlertSource.SYSTEM)
                .message("models retrained")
                .severity(2)
                .build());

        assertThat(alert).isPresent();
        assertThat(alert.get().getSeverity()).isEqualTo(2);
        assertThat(engine.activeAlerts()).extracting(Alert::getId).containsExactly(alert.get().getId());
        assertThat(store.findById(alert.get().getId())).isPresent();
    }

    @Test
    @DisplayName("Should acknowledge and resolve idempotently, leaving the active index")
    void shouldManageLifecycle() {
        String id = engine.checkSystemThresholds(SystemStats.of(96, 10, 10)).get(0).getId();

        clock.advance(Duration.ofMinutes(1));
        Alert acked = engine.acknowledgeAlert(id, "ops").orElseThrow();
        assertThat(acked.isAcknowledged()).isTrue();
        assertThat(acked.getAcknowledgedBy()).isEqualTo("ops");
        assertThat(engine.activeAlerts()).isEmpty();

        clock.advance(Duration.ofMinutes(1));
        Alert again = engine.acknowledgeAlert(id, "someone-else").orElseThrow();
        assertThat(again.getAcknowledgedBy()).isEqualTo("ops");
        assertThat(again.getAcknowledgedAt()).isEqualTo(acked.getAcknowledgedAt());

        Alert resolved = engine.resolveAlert(id).orElseThrow();
        Instant resolvedAt = resolved.getResolvedAt();
        clock.advance(Duration.ofMinutes(1));
        assertThat(engine.resolveAlert(id).orElseThrow().getResolvedAt()).isEqualTo(resolvedAt);

        assertThat(store.findById(id)).get().satisfies(a -> {
            assertThat(a.isResolved()).isTrue();
            assertThat(a.isAcknowledged()).isTrue();
        });
    }

    @Test
    @DisplayName("Should return empty for unknown alert ids")
    void shouldReturnEmptyForUnknownId() {
        assertThat(engine.acknowledgeAlert("missing", "ops")).isEmpty();
        assertThat(engine.resolveAlert("missing")).isEmpty();
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should count alerts by type and ML detection within the range")
    void shouldComputeStats() {
        engine.checkSystemThresholds(SystemStats.of(96, 80, 10));
        engine.createAlert(AlertRequest.builder(AlertType.WARNING, AlertSource.ML)
                .message("ml finding").mlDetected(true).build());

        AlertStats stats = engine.getAlertStats(Duration.ofHours(24)).orElseThrow();

        assertThat(stats.getTotal()).isEqualTo(3);
        assertThat(stats.count(AlertType.CRITICAL)).isEqualTo(1);
        assertThat(stats.count(AlertType.WARNING)).isEqualTo(2);
        assertThat(stats.count(AlertType.INFO)).isZero();
        assertThat(stats.getMlDetected()).isEqualTo(1);

        clock.advance(Duration.ofHours(25));
        assertThat(engine.getAlertStats(Duration.ofHours(24)).orElseThrow().getTotal()).isZero();
    }

    @Test
    @DisplayName("Should clear only resolved alerts older than the cutoff")
    void shouldClearOldResolvedAlerts() {
        List<Alert> alerts = engine.checkSystemThresholds(SystemStats.of(96, 95, 10));
        engine.resolveAlert(alerts.get(0).getId());

        clock.advance(Duration.ofDays(31));
        engine.checkSystemThresholds(SystemStats.of(96, 10, 10));

        assertThat(engine.clearOldAlerts(30)).isEqualTo(1);
        assertThat(engine.getRecentAlerts(10, false)).hasSize(2);
    }

    // ------------------------------------------------------------------
    // Housekeeping
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should release cooldowns and active alerts of forgotten processes")
    void shouldForgetProcesses() {
        for (int pid = 0; pid < 1000; pid++) {
            Sample hot = Sample.builder(String.valueOf(pid)).processName("worker").cpu(96).build();
            assertThat(engine.checkProcessThresholds(hot, quietAnalysis())).hasSize(1);
        }
        assertThat(engine.activeAlerts()).hasSize(1000);
        assertThat(engine.getCooldowns().size()).isEqualTo(1000);
        assertThat(store.size()).isEqualTo(1000);

        for (int pid = 0; pid < 1000; pid++) {
            assertThat(engine.forgetProcess(String.valueOf(pid))).isEqualTo(1);
        }
        assertThat(engine.activeAlerts()).isEmpty();
        assertThat(engine.getCooldowns().size()).isZero();
        assertThat(engine.getRecentAlerts(1000, false)).allMatch(Alert::isResolved);

        clock.advance(Duration.ofDays(31));
        assertThat(engine.runMaintenance(Duration.ofDays(30))).isEqualTo(1000);
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Should forget only the named process")
    void shouldForgetOnlyNamedProcess() {
        engine.checkProcessThresholds(Sample.builder("1").cpu(96).build(), quietAnalysis());
        engine.checkProcessThresholds(Sample.builder("12").cpu(96).build(), quietAnalysis());

        engine.forgetProcess("1");

        assertThat(engine.getCooldowns().isInCooldown("process:1:cpu")).isFalse();
        assertThat(engine.getCooldowns().isInCooldown("process:12:cpu")).isTrue();
        assertThat(engine.activeAlerts()).extracting(Alert::getProcessId).containsExactly("12");
    }

    @Test
    @DisplayName("Should purge elapsed cooldowns and expire alerts past retention")
    void shouldRunMaintenance() {
        engine.checkSystemThresholds(SystemStats.of(96, 10, 10));

        clock.advance(Duration.ofSeconds(10));
        assertThat(engine.runMaintenance(Duration.ofDays(30))).isZero();
        assertThat(engine.activeAlerts()).hasSize(1);
        assertThat(engine.getCooldowns().size()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(5));
        assertThat(engine.runMaintenance(Duration.ofDays(30))).isZero();
        assertThat(engine.getCooldowns().size()).isZero();
        assertThat(engine.activeAlerts()).hasSize(1);

        clock.advance(Duration.ofDays(31));
        assertThat(engine.runMaintenance(Duration.ofDays(30))).isEqualTo(1);
        assertThat(engine.activeAlerts()).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Should return empty results, keep the cooldown claimed, when the store fails")
    void shouldSurviveStoreFailures() {
        AlertEngine failing = new AlertEngine(MonitorConfig.defaults(), new FailingStore(), clock);
        Sample hot = Sample.builder("9").cpu(99).build();

        assertThat(failing.checkProcessThresholds(hot, quietAnalysis())).isEmpty();
        assertThat(failing.getCooldowns().isInCooldown("process:9:cpu")).isTrue();
        assertThat(failing.activeAlerts()).isEmpty();
        assertThat(failing.acknowledgeAlert("x", "ops")).isEmpty();
        assertThat(failing.getRecentAlerts(10, false)).isEmpty();
        assertThat(failing.getAlertStats(Duration.ofHours(1))).isEmpty();
        assertThat(failing.clearOldAlerts(30)).isZero();
        assertThat(failing.runMaintenance(Duration.ofDays(30))).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AnalysisResult quietAnalysis() {
        return new AnalysisResult(AnomalyAssessment.normal(), Classification.unknown(),
                Collections.emptyList(), clock.instant());
    }

    private static final class FailingStore implements AlertStore {
        @Override
        public void insert(Alert alert) {
            throw new AlertStoreException("store offline");
        }

        @Override
        public void update(Alert alert) {
            throw new AlertStoreException("store offline");
        }

        @Override
        public Optional<Alert> findById(String id) {
            throw new AlertStoreException("store offline");
        }

        @Override
        public List<Alert> findRecent(int limit, boolean unacknowledgedOnly) {
            throw new AlertStoreException("store offline");
        }

        @Override
        public List<Alert> findCreatedSince(Instant since) {
            throw new AlertStoreException("store offline");
        }

        @Override
        public int deleteResolvedCreatedBefore(Instant cutoff) {
            throw new AlertStoreException("store offline");
        }
    }
}
