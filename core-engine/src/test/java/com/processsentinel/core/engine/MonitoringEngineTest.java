package com.processsentinel.core.engine;

import com.processsentinel.core.alert.InMemoryAlertStore;
import com.processsentinel.core.alert.MutableClock;
import com.processsentinel.core.config.MonitorConfig;
import com.processsentinel.core.config.MonitorConfigLoader;
import com.processsentinel.core.model.Alert;
import com.processsentinel.core.model.AnalysisResult;
import com.processsentinel.core.model.Classification;
import com.processsentinel.core.model.ModelStatus;
import com.processsentinel.core.model.Sample;
import com.processsentinel.core.model.SystemStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MonitoringEngine}.
 */
class MonitoringEngineTest {

    private MutableClock clock;
    private MonitoringEngine engine;

    @BeforeEach
    void setUp() {
        MonitorConfig config = MonitorConfigLoader.fromClasspath("test-monitor.yml");
        clock = new MutableClock(Instant.parse("2024-03-01T08:00:00Z"));
        engine = new MonitoringEngine(config, new InMemoryAlertStore(), clock, Runnable::run);
    }

    @Test
    @DisplayName("Should degrade to neutral defaults while untrained")
    void shouldAnalyzeWithUntrainedModels() {
        AnalysisResult result = engine.analyze(Sample.builder("p1").cpu(42).memory(300).build());

        assertThat(result.getAnomaly().getScore()).isZero();
        assertThat(result.getAnomaly().isAnomaly()).isFalse();
        assertThat(result.getClassification()).isEqualTo(Classification.unknown());
        assertThat(result.getPredictions()).isEmpty();
        assertThat(result.getTimestamp()).isEqualTo(clock.instant());
        assertThat(engine.getHistory().size("p1")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should train every model from history and report status")
    void shouldInitializeModels() {
        engine.initialize(history(3, 40));

        ModelStatus status = engine.getModelStatus();
        assertThat(status.getAnomalyDetector().isTrained()).isTrue();
        assertThat(status.getAnomalyDetector().getNumTrees()).isEqualTo(25);
        assertThat(status.getPredictor().isTrained()).isTrue();
        assertThat(status.getPredictor().getInputShape()).isEqualTo(5);
        assertThat(status.getClassifier().isTrained()).isTrue();
        assertThat(status.getClassifier().getClasses()).hasSize(6);
    }

    @Test
    @DisplayName("Should skip detector and predictor training with too little history")
    void shouldSkipTrainingWithFewSamples() {
        engine.initialize(history(1, 10));

        ModelStatus status = engine.getModelStatus();
        assertThat(status.getAnomalyDetector().isTrained()).isFalse();
        assertThat(status.getPredictor().isTrained()).isFalse();
        assertThat(status.getClassifier().isTrained()).isTrue();
    }

    @Test
    @DisplayName("Should forecast only once lookback samples are buffered")
    void shouldForecastAfterLookback() {
        engine.initialize(history(3, 40));

        for (int i = 0; i < 4; i++) {
            AnalysisResult early = engine.analyze(Sample.builder("fresh").cpu(30 + i).memory(200).build());
            assertThat(early.getPredictions()).isEmpty();
        }
        assertThat(engine.predictFuture("fresh", 3)).isEmpty();

        AnalysisResult result = engine.analyze(Sample.builder("fresh").cpu(35).memory(200).build());

        assertThat(result.getPredictions()).hasSize(3);
        assertThat(engine.predictFuture("fresh", 7)).hasValueSatisfying(p -> assertThat(p).hasSize(7));
        assertThat(result.getAnomaly().getScore()).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("Should route system and process checks through the alert engine")
    void shouldCheckThresholds() {
        List<Alert> system = engine.checkThresholds(SystemStats.of(85, 10, 10));
        assertThat(system).singleElement().extracting(Alert::getMetric).isEqualTo("cpu");

        Sample hot = Sample.builder("p9").processName("encoder").cpu(97).build();
        List<Alert> process = engine.checkProcessThresholds(hot, engine.analyze(hot));
        assertThat(process).extracting(Alert::getProcessId).containsOnly("p9");
        assertThat(engine.getAlertEngine().activeAlerts()).hasSize(1 + process.size());
    }

    @Test
    @DisplayName("Should drop history and cooldowns of a forgotten process")
    void shouldForgetProcess() {
        Sample hot = Sample.builder("p9").processName("encoder").cpu(97).build();
        engine.checkProcessThresholds(hot, engine.analyze(hot));
        assertThat(engine.getAlertEngine().activeAlerts()).isNotEmpty();

        assertThat(engine.forgetProcess("p9")).isTrue();

        assertThat(engine.getHistory().size("p9")).isZero();
        assertThat(engine.getAlertEngine().activeAlerts()).isEmpty();
        assertThat(engine.getAlertEngine().getCooldowns().size()).isZero();
        assertThat(engine.forgetProcess("p9")).isFalse();
    }

    @Test
    @DisplayName("Should run maintenance at most once per interval")
    void shouldGateMaintenance() {
        engine.checkThresholds(SystemStats.of(85, 10, 10));

        assertThat(engine.maybeRunMaintenance()).isTrue();
        assertThat(engine.getAlertEngine().getCooldowns().size()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(30));
        assertThat(engine.maybeRunMaintenance()).isFalse();

        clock.advance(Duration.ofSeconds(30));
        assertThat(engine.maybeRunMaintenance()).isTrue();
        assertThat(engine.getAlertEngine().getCooldowns().size()).isZero();
    }

    /** Chronological samples for {@code processes} processes with a gentle cpu wave. */
    private List<Sample> history(int processes, int perProcess) {
        List<Sample> samples = new ArrayList<>();
        Instant t = clock.instant().minus(Duration.ofHours(1));
        for (int i = 0; i < perProcess; i++) {
            for (int p = 0; p < processes; p++) {
                samples.add(Sample.builder("proc-" + p)
                        .processName("proc-" + p)
                        .timestamp(t.plusSeconds(i * 2L))
                        .cpu(20 + 10 * p + 5 * Math.sin(i / 3.0))
                        .memory(400 + 50 * p + i)
                        .threads(8)
                        .build());
            }
        }
        return samples;
    }
}
