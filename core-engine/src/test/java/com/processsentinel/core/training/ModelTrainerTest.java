package com.processsentinel.core.training;

import com.processsentinel.core.alert.MutableClock;
import com.processsentinel.core.classification.WorkloadClassifier;
import com.processsentinel.core.config.MonitorConfig;
import com.processsentinel.core.config.MonitorConfigLoader;
import com.processsentinel.core.detection.IsolationForest;
import com.processsentinel.core.features.FeatureEngineer;
import com.processsentinel.core.history.HistoryStore;
import com.processsentinel.core.model.Sample;
import com.processsentinel.core.prediction.SequencePredictor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ModelTrainer}.
 */
class ModelTrainerTest {

    private MonitorConfig config;
    private MutableClock clock;
    private IsolationForest detector;
    private SequencePredictor predictor;
    private WorkloadClassifier classifier;
    private HistoryStore history;
    private final List<Runnable> submitted = new ArrayList<>();

    @BeforeEach
    void setUp() {
        config = MonitorConfigLoader.fromClasspath("test-monitor.yml");
        clock = new MutableClock(Instant.parse("2024-03-01T08:00:00Z"));
        detector = new IsolationForest(10, 32, 0.1, 1L);
        predictor = new SequencePredictor(5, 4, 0.01, 1L);
        classifier = new WorkloadClassifier(10, 1, true);
        history = new HistoryStore(config.getHistoryCapacity());
    }

    private ModelTrainer trainer(Executor executor) {
        return new ModelTrainer(new FeatureEngineer(), detector, predictor, classifier, history,
                config, clock, executor);
    }

    @Test
    @DisplayName("Should need more than minSamples before training")
    void shouldRequireMinimumSamples() {
        ModelTrainer trainer = trainer(Runnable::run);

        assertThat(trainer.trainFrom(samples("p", 20))).isFalse();
        assertThat(detector.isTrained()).isFalse();

        assertThat(trainer.trainFrom(samples("p", 21))).isTrue();
        assertThat(detector.isTrained()).isTrue();
        assertThat(predictor.isTrained()).isTrue();
    }

    @Test
    @DisplayName("Should bootstrap the classifier from synthetic workloads")
    void shouldBootstrapClassifier() {
        assertThat(trainer(Runnable::run).bootstrapClassifier()).isTrue();
        assertThat(classifier.isTrained()).isTrue();
    }

    @Test
    @DisplayName("Should retrain from buffered history at most once per interval")
    void shouldRetrainOnInterval() {
        ModelTrainer trainer = trainer(Runnable::run);
        samples("p", 30).forEach(s -> history.append("p", s));

        assertThat(trainer.maybeRetrain()).isTrue();
        assertThat(detector.isTrained()).isTrue();
        assertThat(trainer.isRunning()).isFalse();

        clock.advance(Duration.ofSeconds(30));
        assertThat(trainer.maybeRetrain()).isFalse();

        clock.advance(Duration.ofSeconds(30));
        assertThat(trainer.maybeRetrain()).isTrue();
        assertThat(trainer.getLastRunAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("Should retry soon after a run that had too little history")
    void shouldRetryAfterEmptyRun() {
        ModelTrainer trainer = trainer(Runnable::run);
        samples("p", 10).forEach(s -> history.append("p", s));

        assertThat(trainer.maybeRetrain()).isTrue();
        assertThat(detector.isTrained()).isFalse();
        assertThat(trainer.getLastTrainedAt()).isNull();

        clock.advance(Duration.ofSeconds(10));
        assertThat(trainer.maybeRetrain()).isFalse();

        samples("p", 25).forEach(s -> history.append("p", s));
        clock.advance(Duration.ofSeconds(20));
        assertThat(trainer.maybeRetrain()).isTrue();
        assertThat(detector.isTrained()).isTrue();
        assertThat(trainer.getLastTrainedAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("Should not start a second run while one is in flight")
    void shouldNotOverlapRuns() {
        ModelTrainer trainer = trainer(submitted::add);

        assertThat(trainer.maybeRetrain()).isTrue();
        assertThat(trainer.isRunning()).isTrue();

        clock.advance(Duration.ofMinutes(5));
        assertThat(trainer.maybeRetrain()).isFalse();

        submitted.get(0).run();
        assertThat(trainer.isRunning()).isFalse();
        assertThat(trainer.maybeRetrain()).isTrue();
    }

    @Test
    @DisplayName("Should release the guard when the executor rejects the run")
    void shouldRecoverFromRejection() {
        ModelTrainer trainer = trainer(r -> {
            throw new java.util.concurrent.RejectedExecutionException("shut down");
        });

        assertThat(trainer.maybeRetrain()).isFalse();
        assertThat(trainer.isRunning()).isFalse();
    }

    private List<Sample> samples(String processId, int count) {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            samples.add(Sample.builder(processId).cpu(40 + (i % 7)).memory(300 + i).build());
        }
        return samples;
    }
}
