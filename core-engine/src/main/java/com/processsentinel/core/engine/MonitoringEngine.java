package com.processsentinel.core.engine;

import com.processsentinel.core.alert.AlertEngine;
import com.processsentinel.core.alert.AlertStore;
import com.processsentinel.core.classification.WorkloadClassifier;
import com.processsentinel.core.config.MonitorConfig;
import com.processsentinel.core.config.ThresholdLevels;
import com.processsentinel.core.detection.IsolationForest;
import com.processsentinel.core.features.FeatureEngineer;
import com.processsentinel.core.features.FeatureVector;
import com.processsentinel.core.history.HistoryStore;
import com.processsentinel.core.model.Alert;
import com.processsentinel.core.model.AnalysisResult;
import com.processsentinel.core.model.AnomalyAssessment;
import com.processsentinel.core.model.Classification;
import com.processsentinel.core.model.ModelStatus;
import com.processsentinel.core.model.Sample;
import com.processsentinel.core.model.SystemStats;
import com.processsentinel.core.prediction.SequencePredictor;
import com.processsentinel.core.training.ModelTrainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Entry point of the analytics core: runs every sample through feature
 * engineering, anomaly scoring, classification and forecasting, and hands
 * the outcome to the {@link AlertEngine}.
 *
 * <p>
 * One engine is built per hosting task and passed explicitly to whoever needs
 * it. All inference paths are fail-safe; a model that is untrained or faults
 * contributes its neutral default to the {@link AnalysisResult}.
 * </p>
 *
 * <h3>Usage</h3>
 *
 * <pre>{@code
 * MonitoringEngine engine = MonitoringEngine.create(config, new InMemoryAlertStore());
 * engine.initialize(historicalSamples);
 * AnalysisResult result = engine.analyze(sample);
 * List<Alert> alerts = engine.checkProcessThresholds(sample, result);
 * }</pre>
 *
 * @since 1.0.0
 */
public class MonitoringEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringEngine.class);

    private final MonitorConfig config;
    private final Clock clock;
    private final FeatureEngineer featureEngineer;
    private final IsolationForest anomalyDetector;
    private final SequencePredictor predictor;
    private final WorkloadClassifier classifier;
    private final HistoryStore history;
    private final AlertEngine alertEngine;
    private final ModelTrainer trainer;
    private volatile Instant lastMaintenanceAt;

    /**
     * Build an engine whose background retraining runs on {@code executor}.
     *
     * @param config   validated configuration
     * @param store    alert persistence collaborator
     * @param clock    time source for analysis timestamps, cooldowns and
     *                 retrain scheduling
     * @param executor runs retraining jobs
     */
    public MonitoringEngine(MonitorConfig config, AlertStore store, Clock clock, Executor executor) {
        this.config = Objects.requireNonNull(config, "MonitorConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        MonitorConfig.AnomalyDetectorSettings detectorSettings = config.getAnomalyDetector();
        MonitorConfig.PredictorSettings predictorSettings = config.getPredictor();
        MonitorConfig.ClassifierSettings classifierSettings = config.getClassifier();

        this.featureEngineer = new FeatureEngineer();
        this.anomalyDetector = new IsolationForest(detectorSettings.getNumTrees(),
                detectorSettings.getSampleSize(), detectorSettings.getContamination(), detectorSettings.getSeed());
        this.predictor = new SequencePredictor(predictorSettings.getLookback(), predictorSettings.getHiddenUnits(),
                predictorSettings.getLearningRate(), predictorSettings.getSeed());
        this.classifier = new WorkloadClassifier(classifierSettings.getNumTrees(), classifierSettings.getSeed(),
                classifierSettings.isProbabilityEstimates());
        this.history = new HistoryStore(config.getHistoryCapacity());
        this.alertEngine = new AlertEngine(config, store, clock);
        this.trainer = new ModelTrainer(featureEngineer, anomalyDetector, predictor, classifier, history,
                config, clock, executor);

        LOG.info("Monitoring engine created: {}", config);
    }

    /**
     * Engine on the system clock that retrains on the calling thread.
     */
    public static MonitoringEngine create(MonitorConfig config, AlertStore store) {
        return new MonitoringEngine(config, store, Clock.systemUTC(), Runnable::run);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Train the anomaly detector and predictor from historical samples and
     * bootstrap the classifier on synthetic workloads. Never throws on
     * training failure.
     *
     * @param historicalSamples chronological samples; may be empty
     */
    public void initialize(List<Sample> historicalSamples) {
        LOG.info("Initializing models from {} historical sample(s)",
                historicalSamples == null ? 0 : historicalSamples.size());
        trainer.trainFrom(historicalSamples);
        trainer.bootstrapClassifier();
        LOG.info("Models initialized: {}", describe(getModelStatus()));
    }

    // ---------------------------------------------------------------
    // Analysis
    // ---------------------------------------------------------------

    /**
     * Analyze one process sample and append it to the process's history.
     *
     * <p>
     * Features are computed against the history that precedes the sample;
     * the forecast includes it.
     * </p>
     *
     * @param sample the sample
     * @return the analysis; never {@code null}
     */
    public AnalysisResult analyze(Sample sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        String processId = sample.getProcessId();

        List<Sample> prior = history.all(processId);
        FeatureVector features = featureEngineer.engineerFeatures(sample, prior);
        history.append(processId, sample);

        ThresholdLevels levels = config.threshold(MonitorConfig.ANOMALY_SCORE);
        double score = anomalyDetector.predict(features.toArray());
        AnomalyAssessment anomaly = AnomalyAssessment.of(score, levels.getWarning(), levels.getCritical());

        Classification classification = classifier.predict(sample);
        List<Double> predictions = predictFuture(processId, config.getForecastSteps())
                .orElse(Collections.emptyList());

        return new AnalysisResult(anomaly, classification, predictions, clock.instant());
    }

    /**
     * Forecast a process's cpu usage.
     *
     * @param processId process key
     * @param steps     values to forecast
     * @return the forecast, or empty when the predictor is untrained or fewer
     *         than {@code lookback} samples are buffered
     */
    public Optional<List<Double>> predictFuture(String processId, int steps) {
        if (!predictor.isTrained()) {
            return Optional.empty();
        }
        int lookback = predictor.getLookback();
        double[] window = history.series(processId, Sample.CPU, lookback);
        if (window.length < lookback) {
            return Optional.empty();
        }
        try {
            return Optional.of(predictor.predictMultiStep(window, steps));
        } catch (RuntimeException e) {
            LOG.debug("Forecast for {} failed: {}", processId, e.getMessage());
            return Optional.empty();
        }
    }

    // ---------------------------------------------------------------
    // Alerting
    // ---------------------------------------------------------------

    public List<Alert> checkThresholds(SystemStats stats) {
        return alertEngine.checkSystemThresholds(stats);
    }

    public List<Alert> checkProcessThresholds(Sample sample, AnalysisResult analysis) {
        return alertEngine.checkProcessThresholds(sample, analysis);
    }

    // ---------------------------------------------------------------
    // Housekeeping
    // ---------------------------------------------------------------

    /**
     * Drop everything held for a process that is no longer observed: its
     * history window and cooldowns. Its open alerts are resolved.
     *
     * @return {@code true} if the process had history
     */
    public boolean forgetProcess(String processId) {
        boolean hadHistory = history.remove(processId);
        alertEngine.forgetProcess(processId);
        return hadHistory;
    }

    /**
     * Run alert maintenance when {@code maintenanceIntervalSeconds} have
     * passed since the previous run. The first call always runs.
     *
     * @return {@code true} if maintenance ran
     */
    public boolean maybeRunMaintenance() {
        Instant now = clock.instant();
        Instant last = lastMaintenanceAt;
        if (last != null
                && Duration.between(last, now).getSeconds() < config.getMaintenanceIntervalSeconds()) {
            return false;
        }
        lastMaintenanceAt = now;
        alertEngine.runMaintenance(Duration.ofDays(config.getAlertRetentionDays()));
        return true;
    }

    // ---------------------------------------------------------------
    // Status & accessors
    // ---------------------------------------------------------------

    public ModelStatus getModelStatus() {
        return new ModelStatus(
                new ModelStatus.DetectorStatus(anomalyDetector.isTrained(), anomalyDetector.getNumTrees()),
                new ModelStatus.PredictorStatus(predictor.isTrained(), predictor.getLookback()),
                new ModelStatus.ClassifierStatus(classifier.isTrained(), classifier.getClasses()));
    }

    private static String describe(ModelStatus status) {
        return "anomalyDetector=" + status.getAnomalyDetector().isTrained()
                + ", predictor=" + status.getPredictor().isTrained()
                + ", classifier=" + status.getClassifier().isTrained();
    }

    public MonitorConfig getConfig() {
        return config;
    }

    public HistoryStore getHistory() {
        return history;
    }

    public AlertEngine getAlertEngine() {
        return alertEngine;
    }

    public ModelTrainer getTrainer() {
        return trainer;
    }

    public IsolationForest getAnomalyDetector() {
        return anomalyDetector;
    }

    public SequencePredictor getPredictor() {
        return predictor;
    }

    public WorkloadClassifier getClassifier() {
        return classifier;
    }

    public FeatureEngineer getFeatureEngineer() {
        return featureEngineer;
    }
}
