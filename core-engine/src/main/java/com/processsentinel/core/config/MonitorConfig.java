package com.processsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Top-level POJO for the monitor YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional; omitted keys keep the
 * defaults shown):
 * </p>
 *
 * <pre>
 * cooldownSeconds: 60
 * historyCapacity: 100
 * forecastSteps: 5
 * processCpuLimit: 90
 * predictionLimit: 85
 * alertRetentionDays: 30
 * maintenanceIntervalSeconds: 60
 * thresholds:
 *   cpu:          { warning: 70,  critical: 85 }
 *   memory:       { warning: 75,  critical: 90 }
 *   disk:         { warning: 80,  critical: 95 }
 *   anomalyScore: { warning: 0.6, critical: 0.8 }
 * anomalyDetector: { numTrees: 100, sampleSize: 256, contamination: 0.1, seed: 42 }
 * predictor:  { lookback: 10, hiddenUnits: 50, epochs: 30, batchSize: 16, learningRate: 0.005, seed: 42 }
 * classifier: { numTrees: 100, seed: 42, probabilityEstimates: true }
 * training:   { minSamples: 50, retrainIntervalSeconds: 300, maxSeriesLength: 500 }
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every value is legal.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ANOMALY_SCORE = "anomalyScore";

    private long cooldownSeconds = 60;
    private int historyCapacity = 100;
    private int forecastSteps = 5;
    private double processCpuLimit = 90;
    private double predictionLimit = 85;
    private int alertRetentionDays = 30;
    private long maintenanceIntervalSeconds = 60;
    private Map<String, ThresholdLevels> thresholds = defaultThresholds();
    private AnomalyDetectorSettings anomalyDetector = new AnomalyDetectorSettings();
    private PredictorSettings predictor = new PredictorSettings();
    private ClassifierSettings classifier = new ClassifierSettings();
    private TrainingSettings training = new TrainingSettings();

    /**
     * @return a configuration holding only defaults
     */
    public static MonitorConfig defaults() {
        return new MonitorConfig();
    }

    private static Map<String, ThresholdLevels> defaultThresholds() {
        Map<String, ThresholdLevels> defaults = new LinkedHashMap<>();
        defaults.put("cpu", new ThresholdLevels(70, 85));
        defaults.put("memory", new ThresholdLevels(75, 90));
        defaults.put("disk", new ThresholdLevels(80, 95));
        defaults.put(ANOMALY_SCORE, new ThresholdLevels(0.6, 0.8));
        return defaults;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every value, collecting all errors before failing.
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (cooldownSeconds < 0) {
            errors.add("'cooldownSeconds' must be >= 0");
        }
        if (historyCapacity < 1) {
            errors.add("'historyCapacity' must be >= 1");
        }
        if (forecastSteps < 1) {
            errors.add("'forecastSteps' must be >= 1");
        }
        if (alertRetentionDays < 1) {
            errors.add("'alertRetentionDays' must be >= 1");
        }
        if (maintenanceIntervalSeconds < 1) {
            errors.add("'maintenanceIntervalSeconds' must be >= 1");
        }
        if (thresholds == null || !thresholds.containsKey(ANOMALY_SCORE)) {
            errors.add("'thresholds' must define '" + ANOMALY_SCORE + "'");
        }
        if (thresholds != null) {
            thresholds.forEach((metric, levels) -> {
                if (levels == null) {
                    errors.add("Threshold '" + metric + "' is empty");
                } else if (levels.getWarning() > levels.getCritical()) {
                    errors.add("Threshold '" + metric + "' has warning > critical");
                }
            });
        }
        if (anomalyDetector.getNumTrees() < 1) {
            errors.add("'anomalyDetector.numTrees' must be >= 1");
        }
        if (anomalyDetector.getSampleSize() < 2) {
            errors.add("'anomalyDetector.sampleSize' must be >= 2");
        }
        if (predictor.getLookback() < 1) {
            errors.add("'predictor.lookback' must be >= 1");
        }
        if (predictor.getHiddenUnits() < 1) {
            errors.add("'predictor.hiddenUnits' must be >= 1");
        }
        if (predictor.getEpochs() < 1 || predictor.getBatchSize() < 1) {
            errors.add("'predictor.epochs' and 'predictor.batchSize' must be >= 1");
        }
        if (predictor.getLearningRate() <= 0) {
            errors.add("'predictor.learningRate' must be > 0");
        }
        if (classifier.getNumTrees() < 1) {
            errors.add("'classifier.numTrees' must be >= 1");
        }
        if (training.getMinSamples() < 1) {
            errors.add("'training.minSamples' must be >= 1");
        }
        if (training.getRetryIntervalSeconds() < 1) {
            errors.add("'training.retryIntervalSeconds' must be >= 1");
        }
        if (training.getMaxSeriesLength() <= predictor.getLookback()) {
            errors.add("'training.maxSeriesLength' must exceed 'predictor.lookback'");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Monitor configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * @param metric threshold key such as {@code cpu} or {@code anomalyScore}
     * @return the levels for the metric; never {@code null} after validation for
     *         {@link #ANOMALY_SCORE}
     */
    public ThresholdLevels threshold(String metric) {
        return thresholds.get(metric);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public long getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(long cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    public int getForecastSteps() {
        return forecastSteps;
    }

    public void setForecastSteps(int forecastSteps) {
        this.forecastSteps = forecastSteps;
    }

    public double getProcessCpuLimit() {
        return processCpuLimit;
    }

    public void setProcessCpuLimit(double processCpuLimit) {
        this.processCpuLimit = processCpuLimit;
    }

    public double getPredictionLimit() {
        return predictionLimit;
    }

    public void setPredictionLimit(double predictionLimit) {
        this.predictionLimit = predictionLimit;
    }

    /** @return age after which open alerts are auto-resolved and resolved ones deleted */
    public int getAlertRetentionDays() {
        return alertRetentionDays;
    }

    public void setAlertRetentionDays(int alertRetentionDays) {
        this.alertRetentionDays = alertRetentionDays;
    }

    public long getMaintenanceIntervalSeconds() {
        return maintenanceIntervalSeconds;
    }

    public void setMaintenanceIntervalSeconds(long maintenanceIntervalSeconds) {
        this.maintenanceIntervalSeconds = maintenanceIntervalSeconds;
    }

    public Map<String, ThresholdLevels> getThresholds() {
        return thresholds;
    }

    /**
     * Set thresholds; entries merge over the defaults so a file may override a
     * single metric.
     *
     * @param thresholds metric to levels
     */
    public void setThresholds(Map<String, ThresholdLevels> thresholds) {
        Map<String, ThresholdLevels> merged = defaultThresholds();
        if (thresholds != null) {
            merged.putAll(thresholds);
        }
        this.thresholds = merged;
    }

    public AnomalyDetectorSettings getAnomalyDetector() {
        return anomalyDetector;
    }

    public void setAnomalyDetector(AnomalyDetectorSettings anomalyDetector) {
        this.anomalyDetector = Objects.requireNonNullElseGet(anomalyDetector, AnomalyDetectorSettings::new);
    }

    public PredictorSettings getPredictor() {
        return predictor;
    }

    public void setPredictor(PredictorSettings predictor) {
        this.predictor = Objects.requireNonNullElseGet(predictor, PredictorSettings::new);
    }

    public ClassifierSettings getClassifier() {
        return classifier;
    }

    public void setClassifier(ClassifierSettings classifier) {
        this.classifier = Objects.requireNonNullElseGet(classifier, ClassifierSettings::new);
    }

    public TrainingSettings getTraining() {
        return training;
    }

    public void setTraining(TrainingSettings training) {
        this.training = Objects.requireNonNullElseGet(training, TrainingSettings::new);
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "cooldownSeconds=" + cooldownSeconds +
                ", historyCapacity=" + historyCapacity +
                ", forecastSteps=" + forecastSteps +
                ", thresholds=" + thresholds +
                '}';
    }

    // ---------------------------------------------------------------
    // Model settings
    // ---------------------------------------------------------------

    /** Isolation forest hyperparameters. */
    public static class AnomalyDetectorSettings implements Serializable {
        private static final long serialVersionUID = 1L;

        private int numTrees = 100;
        private int sampleSize = 256;
        private double contamination = 0.1;

        /** {@code null} draws from an unseeded source. */
        private Long seed = 42L;

        public int getNumTrees() {
            return numTrees;
        }

        public void setNumTrees(int numTrees) {
            this.numTrees = numTrees;
        }

        public int getSampleSize() {
            return sampleSize;
        }

        public void setSampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
        }

        public double getContamination() {
            return contamination;
        }

        public void setContamination(double contamination) {
            this.contamination = contamination;
        }

        public Long getSeed() {
            return seed;
        }

        public void setSeed(Long seed) {
            this.seed = seed;
        }
    }

    /** Sequence predictor hyperparameters. */
    public static class PredictorSettings implements Serializable {
        private static final long serialVersionUID = 1L;

        private int lookback = 10;
        private int hiddenUnits = 50;
        private int epochs = 30;
        private int batchSize = 16;
        private double learningRate = 0.005;
        private Long seed = 42L;

        public int getLookback() {
            return lookback;
        }

        public void setLookback(int lookback) {
            this.lookback = lookback;
        }

        public int getHiddenUnits() {
            return hiddenUnits;
        }

        public void setHiddenUnits(int hiddenUnits) {
            this.hiddenUnits = hiddenUnits;
        }

        public int getEpochs() {
            return epochs;
        }

        public void setEpochs(int epochs) {
            this.epochs = epochs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public double getLearningRate() {
            return learningRate;
        }

        public void setLearningRate(double learningRate) {
            this.learningRate = learningRate;
        }

        public Long getSeed() {
            return seed;
        }

        public void setSeed(Long seed) {
            this.seed = seed;
        }
    }

    /** Workload classifier hyperparameters. */
    public static class ClassifierSettings implements Serializable {
        private static final long serialVersionUID = 1L;

        private int numTrees = 100;
        private int seed = 42;
        private boolean probabilityEstimates = true;

        public int getNumTrees() {
            return numTrees;
        }

        public void setNumTrees(int numTrees) {
            this.numTrees = numTrees;
        }

        public int getSeed() {
            return seed;
        }

        public void setSeed(int seed) {
            this.seed = seed;
        }

        public boolean isProbabilityEstimates() {
            return probabilityEstimates;
        }

        public void setProbabilityEstimates(boolean probabilityEstimates) {
            this.probabilityEstimates = probabilityEstimates;
        }
    }

    /** When and on how much data models are retrained. */
    public static class TrainingSettings implements Serializable {
        private static final long serialVersionUID = 1L;

        private int minSamples = 50;
        private long retrainIntervalSeconds = 300;

        /** Delay before retrying after a run that trained nothing. */
        private long retryIntervalSeconds = 30;
        private int maxSeriesLength = 500;

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public long getRetrainIntervalSeconds() {
            return retrainIntervalSeconds;
        }

        public void setRetrainIntervalSeconds(long retrainIntervalSeconds) {
            this.retrainIntervalSeconds = retrainIntervalSeconds;
        }

        public long getRetryIntervalSeconds() {
            return retryIntervalSeconds;
        }

        public void setRetryIntervalSeconds(long retryIntervalSeconds) {
            this.retryIntervalSeconds = retryIntervalSeconds;
        }

        public int getMaxSeriesLength() {
            return maxSeriesLength;
        }

        public void setMaxSeriesLength(int maxSeriesLength) {
            this.maxSeriesLength = maxSeriesLength;
        }
    }
}
