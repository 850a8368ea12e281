package com.processsentinel.core.training;

import com.processsentinel.core.classification.WorkloadClassifier;
import com.processsentinel.core.config.MonitorConfig;
import com.processsentinel.core.detection.AnomalyDetector;
import com.processsentinel.core.features.FeatureEngineer;
import com.processsentinel.core.history.HistoryStore;
import com.processsentinel.core.model.Sample;
import com.processsentinel.core.prediction.SequencePredictor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Trains the engine's models from historical samples and schedules periodic
 * retraining.
 *
 * <p>
 * Every training failure is caught here, logged at ERROR and leaves the
 * affected model in its previous state.
 * </p>
 *
 * <h3>Retraining</h3>
 * <p>
 * {@link #maybeRetrain()} submits a run to the supplied {@link Executor} when
 * no run is in flight and {@code training.retrainIntervalSeconds} have passed
 * since the last run that trained a model. Runs that train nothing, such as
 * those on too little history, are retried after
 * {@code training.retryIntervalSeconds}. Inference keeps using the old models
 * until each new one is installed.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelTrainer {

    private static final Logger LOG = LoggerFactory.getLogger(ModelTrainer.class);

    static final int SYNTHETIC_SAMPLES_PER_LABEL = 20;

    private final FeatureEngineer featureEngineer;
    private final AnomalyDetector anomalyDetector;
    private final SequencePredictor predictor;
    private final WorkloadClassifier classifier;
    private final HistoryStore history;
    private final MonitorConfig config;
    private final Clock clock;
    private final Executor executor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Instant lastRunAt;
    private volatile Instant lastTrainedAt;

    public ModelTrainer(FeatureEngineer featureEngineer, AnomalyDetector anomalyDetector,
            SequencePredictor predictor, WorkloadClassifier classifier, HistoryStore history,
            MonitorConfig config, Clock clock, Executor executor) {
        this.featureEngineer = Objects.requireNonNull(featureEngineer, "featureEngineer must not be null");
        this.anomalyDetector = Objects.requireNonNull(anomalyDetector, "anomalyDetector must not be null");
        this.predictor = Objects.requireNonNull(predictor, "predictor must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    // ---------------------------------------------------------------
    // Training
    // ---------------------------------------------------------------

    /**
     * Train the anomaly detector and the predictor from historical samples.
     *
     * <p>
     * Nothing is trained unless more than {@code training.minSamples} samples
     * are given. Samples are grouped by process in encounter order; each one is
     * turned into a feature vector against the samples of its process that
     * precede it. The predictor learns the cpu series of the process with the
     * most samples, capped at {@code training.maxSeriesLength} recent points.
     * </p>
     *
     * @param samples chronological samples, possibly from many processes
     * @return {@code true} if at least one model was trained
     */
    public boolean trainFrom(List<Sample> samples) {
        MonitorConfig.TrainingSettings training = config.getTraining();
        if (samples == null || samples.size() <= training.getMinSamples()) {
            LOG.info("Insufficient data for training: {} sample(s), need more than {}",
                    samples == null ? 0 : samples.size(), training.getMinSamples());
            return false;
        }

        Map<String, List<Sample>> byProcess = new LinkedHashMap<>();
        for (Sample sample : samples) {
            byProcess.computeIfAbsent(sample.getProcessId(), k -> new ArrayList<>()).add(sample);
        }

        boolean detectorTrained = trainAnomalyDetector(byProcess);
        boolean predictorTrained = trainPredictor(byProcess);
        return detectorTrained || predictorTrained;
    }

    private boolean trainAnomalyDetector(Map<String, List<Sample>> byProcess) {
        int window = config.getHistoryCapacity();
        List<double[]> vectors = new ArrayList<>();
        for (List<Sample> series : byProcess.values()) {
            for (int i = 0; i < series.size(); i++) {
                List<Sample> prior = series.subList(Math.max(0, i - window), i);
                vectors.add(featureEngineer.engineerFeatures(series.get(i), prior).toArray());
            }
        }
        try {
            anomalyDetector.fit(vectors.toArray(new double[0][]));
            return true;
        } catch (ModelTrainingException e) {
            LOG.error("Anomaly detector training failed: {}", e.getMessage(), e);
            return false;
        }
    }

    private boolean trainPredictor(Map<String, List<Sample>> byProcess) {
        String longest = null;
        int longestSize = -1;
        for (Map.Entry<String, List<Sample>> entry : byProcess.entrySet()) {
            if (entry.getValue().size() > longestSize) {
                longest = entry.getKey();
                longestSize = entry.getValue().size();
            }
        }
        if (longest == null) {
            return false;
        }

        MonitorConfig.TrainingSettings training = config.getTraining();
        List<Sample> series = byProcess.get(longest);
        List<Sample> recent = series.subList(Math.max(0, series.size() - training.getMaxSeriesLength()), series.size());
        double[] cpu = FeatureEngineer.metricSeries(recent, Sample.CPU);

        if (cpu.length < training.getMinSamples()) {
            LOG.info("Insufficient data for predictor training on process {}: {} point(s)", longest, cpu.length);
            return false;
        }

        MonitorConfig.PredictorSettings settings = config.getPredictor();
        LOG.info("Training predictor on process {} ({} points)", longest, cpu.length);
        try {
            predictor.train(cpu, settings.getEpochs(), settings.getBatchSize());
            return true;
        } catch (ModelTrainingException e) {
            LOG.error("Predictor training failed: {}", e.getMessage(), e);
            return false;
        }
    }

    /**
     * Train the classifier on synthetic archetype workloads.
     *
     * @return {@code true} if the classifier was trained
     */
    public boolean bootstrapClassifier() {
        Random random = new Random(config.getClassifier().getSeed());
        try {
            classifier.train(SyntheticWorkloads.generate(SYNTHETIC_SAMPLES_PER_LABEL, random));
            return true;
        } catch (ModelTrainingException e) {
            LOG.error("Classifier bootstrap failed: {}", e.getMessage(), e);
            return false;
        }
    }

    // ---------------------------------------------------------------
    // Periodic retraining
    // ---------------------------------------------------------------

    /**
     * Submit a retraining run from the current history if one is due.
     *
     * @return {@code true} if a run was submitted
     */
    public boolean maybeRetrain() {
        Instant now = clock.instant();
        MonitorConfig.TrainingSettings training = config.getTraining();
        if (!elapsed(lastTrainedAt, now, training.getRetrainIntervalSeconds())
                || !elapsed(lastRunAt, now, training.getRetryIntervalSeconds())) {
            return false;
        }
        if (!running.compareAndSet(false, true)) {
            LOG.trace("Retraining already in progress – skipping");
            return false;
        }
        lastRunAt = now;
        try {
            executor.execute(() -> {
                try {
                    if (retrainFromHistory()) {
                        lastTrainedAt = now;
                    }
                } finally {
                    running.set(false);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            running.set(false);
            LOG.error("Retraining rejected by executor: {}", e.getMessage(), e);
            return false;
        }
    }

    private static boolean elapsed(Instant since, Instant now, long seconds) {
        return since == null || Duration.between(since, now).compareTo(Duration.ofSeconds(seconds)) >= 0;
    }

    private boolean retrainFromHistory() {
        List<Sample> samples = new ArrayList<>();
        for (String processId : history.processIds()) {
            samples.addAll(history.all(processId));
        }
        LOG.info("Retraining from {} buffered sample(s) across {} process(es)",
                samples.size(), history.processIds().size());
        try {
            return trainFrom(samples);
        } catch (RuntimeException e) {
            LOG.error("Retraining failed: {}", e.getMessage(), e);
            return false;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Start of the most recent submitted run, whether or not it trained anything. */
    public Instant getLastRunAt() {
        return lastRunAt;
    }

    /** Start of the most recent run that trained at least one model. */
    public Instant getLastTrainedAt() {
        return lastTrainedAt;
    }
}
