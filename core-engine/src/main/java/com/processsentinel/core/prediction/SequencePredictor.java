package com.processsentinel.core.prediction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.processsentinel.core.features.FeatureEngineer;
import com.processsentinel.core.features.ScalerParams;
import com.processsentinel.core.training.ModelTrainingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.classifiers.functions.MultilayerPerceptron;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.SerializationHelper;
import weka.core.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Neural-network forecaster for a single univariate resource series.
 *
 * <p>
 * The model is a Weka {@link MultilayerPerceptron} over {@code lookback}
 * numeric lag attributes of the min-max scaled series, with the next value as
 * its numeric class. Multi-step forecasts feed each prediction back into the
 * input window. Windows shorter than {@code lookback} are padded with their
 * first value; longer ones are cut to their most recent {@code lookback}
 * values.
 * </p>
 *
 * <h3>Fallback</h3>
 * <p>
 * Inference never throws. When the model is untrained or produces a
 * non-finite value the forecast is the last element of the input window, or
 * {@code 0} for an empty window.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Training fits a fresh network off-lock and installs it under the write
 * lock, so a failed run keeps the previous model. Inference holds the read
 * lock and serializes on the network itself, since Weka's perceptron keeps
 * per-call state in its nodes.
 * </p>
 *
 * @since 1.0.0
 */
public class SequencePredictor {

    private static final Logger LOG = LoggerFactory.getLogger(SequencePredictor.class);

    private static final String SERIES_KEY = "series";
    private static final String CLASS_ATTRIBUTE = "next";
    private static final String MODEL_SUFFIX = ".model";
    private static final double VALIDATION_SPLIT = 0.2;
    private static final double MOMENTUM = 0.2;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int lookback;
    private final int hiddenUnits;
    private final double learningRate;
    private final Long seed;
    private final Instances header;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private MultilayerPerceptron network;
    private ScalerParams scaling;

    /**
     * @param lookback     input window length
     * @param hiddenUnits  hidden layer width
     * @param learningRate backpropagation step size
     * @param seed         weight-init seed, or {@code null}
     */
    public SequencePredictor(int lookback, int hiddenUnits, double learningRate, Long seed) {
        if (lookback < 1) {
            throw new IllegalArgumentException("lookback must be >= 1, got: " + lookback);
        }
        if (hiddenUnits < 1) {
            throw new IllegalArgumentException("hiddenUnits must be >= 1, got: " + hiddenUnits);
        }
        if (!(learningRate > 0)) {
            throw new IllegalArgumentException("learningRate must be > 0, got: " + learningRate);
        }
        this.lookback = lookback;
        this.hiddenUnits = hiddenUnits;
        this.learningRate = learningRate;
        this.seed = seed;
        this.header = buildHeader(lookback);
    }

    private static Instances buildHeader(int lookback) {
        ArrayList<Attribute> attributes = new ArrayList<>();
        for (int i = 1; i <= lookback; i++) {
            attributes.add(new Attribute("lag" + i));
        }
        attributes.add(new Attribute(CLASS_ATTRIBUTE));
        Instances instances = new Instances("resource-series", attributes, 0);
        instances.setClassIndex(lookback);
        return instances;
    }

    // ---------------------------------------------------------------
    // Training
    // ---------------------------------------------------------------

    /**
     * Fit the network on lookback-to-next pairs cut from {@code series}.
     *
     * <p>
     * The last 20% of the pairs are held out and only used for the logged
     * validation loss. Weka's perceptron updates its weights after every
     * pair, so {@code batchSize} is validated but does not group updates.
     * </p>
     *
     * @param series    raw values in their original units
     * @param epochs    passes over the training pairs
     * @param batchSize pairs per optimizer step; must be positive
     * @throws ModelTrainingException if the series is too short or contains
     *                                non-finite values, or the network fails
     *                                to converge
     */
    public void train(double[] series, int epochs, int batchSize) {
        if (series == null || series.length < lookback + 2) {
            throw new ModelTrainingException("Series needs at least " + (lookback + 2)
                    + " points, got: " + (series == null ? 0 : series.length));
        }
        for (double value : series) {
            if (!Double.isFinite(value)) {
                throw new ModelTrainingException("Series contains a non-finite value: " + value);
            }
        }
        if (epochs < 1 || batchSize < 1) {
            throw new ModelTrainingException("epochs and batchSize must be >= 1");
        }

        FeatureEngineer engineer = new FeatureEngineer();
        double[] normalized = engineer.normalize(series, SERIES_KEY);
        ScalerParams params = engineer.scaler(SERIES_KEY);

        List<double[]> windows = new ArrayList<>();
        for (double[] window : engineer.createWindows(normalized, lookback + 1, 1)) {
            windows.add(window);
        }
        int validationSize = (int) Math.floor(windows.size() * VALIDATION_SPLIT);
        int trainSize = windows.size() - validationSize;

        Instances trainSet = new Instances(header, trainSize);
        for (double[] window : windows.subList(0, trainSize)) {
            trainSet.add(new DenseInstance(1.0, window));
        }

        MultilayerPerceptron candidate = newNetwork(epochs);
        try {
            candidate.buildClassifier(trainSet);
        } catch (Exception e) {
            throw new ModelTrainingException("Sequence predictor training failed: " + e.getMessage(), e);
        }

        double loss = meanSquaredError(candidate, windows.subList(0, trainSize));
        if (!Double.isFinite(loss)) {
            throw new ModelTrainingException("Training diverged: loss = " + loss);
        }
        LOG.info("Epochs {}: loss = {}, val_loss = {}", epochs,
                String.format("%.4f", loss),
                String.format("%.4f", meanSquaredError(candidate, windows.subList(trainSize, windows.size()))));

        lock.writeLock().lock();
        try {
            this.network = candidate;
            this.scaling = params;
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Sequence predictor trained on {} points (lookback={}, hiddenUnits={})",
                series.length, lookback, hiddenUnits);
    }

    private MultilayerPerceptron newNetwork(int epochs) {
        MultilayerPerceptron mlp = new MultilayerPerceptron();
        mlp.setHiddenLayers(String.valueOf(hiddenUnits));
        mlp.setTrainingTime(epochs);
        mlp.setLearningRate(learningRate);
        mlp.setMomentum(MOMENTUM);
        mlp.setSeed(seed != null ? seed.intValue() : new Random().nextInt());
        mlp.setGUI(false);
        return mlp;
    }

    private double meanSquaredError(MultilayerPerceptron model, List<double[]> windows) {
        if (windows.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        try {
            for (double[] window : windows) {
                Instance instance = new DenseInstance(1.0, window);
                instance.setDataset(header);
                double error = model.classifyInstance(instance) - window[lookback];
                sum += error * error;
            }
        } catch (Exception e) {
            return Double.NaN;
        }
        return sum / windows.size();
    }

    // ---------------------------------------------------------------
    // Inference
    // ---------------------------------------------------------------

    /**
     * Predict the value following {@code window}.
     *
     * @param window recent values in original units, oldest first
     * @return forecast, or the fallback described on the class
     */
    public double predict(double[] window) {
        double fallback = fallback(window);
        lock.readLock().lock();
        try {
            if (network == null || scaling == null || window == null || window.length == 0) {
                return fallback;
            }
            Instance instance = toInstance(window, scaling);
            double output;
            synchronized (network) {
                output = network.classifyInstance(instance);
            }
            if (Utils.isMissingValue(output)) {
                return fallback;
            }
            double value = scaling.unscale(output);
            return Double.isFinite(value) ? value : fallback;
        } catch (Exception e) {
            LOG.debug("Forecast failed – using last value: {}", e.getMessage());
            return fallback;
        } finally {
            lock.readLock().unlock();
        }
    }

    private Instance toInstance(double[] window, ScalerParams params) {
        double[] values = new double[lookback + 1];
        int offset = window.length - lookback;
        for (int i = 0; i < lookback; i++) {
            values[i] = params.scale(window[Math.max(0, offset + i)]);
        }
        values[lookback] = Utils.missingValue();
        Instance instance = new DenseInstance(1.0, values);
        instance.setDataset(header);
        return instance;
    }

    /**
     * Forecast {@code steps} values ahead by feeding each prediction back in.
     *
     * @param window recent values, oldest first
     * @param steps  number of values to forecast
     * @return exactly {@code steps} values
     */
    public List<Double> predictMultiStep(double[] window, int steps) {
        List<Double> predictions = new ArrayList<>(Math.max(steps, 0));
        if (steps <= 0) {
            return predictions;
        }
        if (!isTrained()) {
            double fallback = fallback(window);
            for (int i = 0; i < steps; i++) {
                predictions.add(fallback);
            }
            return predictions;
        }

        double[] buffer = window == null ? new double[0] : window.clone();
        for (int i = 0; i < steps; i++) {
            double next = predict(buffer);
            predictions.add(next);
            buffer = shift(buffer, next);
        }
        return predictions;
    }

    private static double[] shift(double[] buffer, double next) {
        if (buffer.length == 0) {
            return new double[] { next };
        }
        double[] shifted = new double[buffer.length];
        System.arraycopy(buffer, 1, shifted, 0, buffer.length - 1);
        shifted[buffer.length - 1] = next;
        return shifted;
    }

    private static double fallback(double[] window) {
        return window != null && window.length > 0 ? window[window.length - 1] : 0.0;
    }

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------

    /**
     * Write the scaling and shape as JSON to {@code path} and the serialized
     * Weka network next to it, in {@code <path>.model}.
     *
     * @param path target JSON file
     * @throws IOException           if either file cannot be written
     * @throws IllegalStateException if the model is untrained
     */
    public void save(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        MultilayerPerceptron model;
        SequenceModelState state;
        Path modelPath = modelPath(path);
        lock.readLock().lock();
        try {
            if (network == null || scaling == null) {
                throw new IllegalStateException("Cannot save an untrained predictor");
            }
            model = network;
            state = new SequenceModelState(lookback, hiddenUnits, modelPath.getFileName().toString(),
                    scaling.getMin(), scaling.getMax());
        } finally {
            lock.readLock().unlock();
        }
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try {
            synchronized (model) {
                SerializationHelper.write(modelPath.toString(), model);
            }
        } catch (Exception e) {
            throw new IOException("Failed to write network to " + modelPath + ": " + e.getMessage(), e);
        }
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), state);
        LOG.info("Sequence predictor saved to {}", path);
    }

    /**
     * Replace the current model with one previously written by {@link #save}.
     *
     * @param path source JSON file
     * @throws IOException              if either file cannot be read or parsed
     * @throws IllegalArgumentException if the stored shape does not match this
     *                                  predictor
     */
    public void load(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        SequenceModelState state = MAPPER.readValue(path.toFile(), SequenceModelState.class);
        if (state.getModelFile() == null) {
            throw new IOException("Stored model at " + path + " names no network file");
        }
        if (state.getLookback() != lookback || state.getHiddenUnits() != hiddenUnits) {
            throw new IllegalArgumentException("Stored model has lookback=" + state.getLookback()
                    + ", hiddenUnits=" + state.getHiddenUnits() + "; expected lookback=" + lookback
                    + ", hiddenUnits=" + hiddenUnits);
        }
        Path modelPath = path.resolveSibling(state.getModelFile());
        Object restored;
        try {
            restored = SerializationHelper.read(modelPath.toString());
        } catch (Exception e) {
            throw new IOException("Failed to read network from " + modelPath + ": " + e.getMessage(), e);
        }
        if (!(restored instanceof MultilayerPerceptron)) {
            throw new IOException("File " + modelPath + " does not hold a multilayer perceptron");
        }
        ScalerParams params = new ScalerParams(state.getMin(), state.getMax());

        lock.writeLock().lock();
        try {
            this.network = (MultilayerPerceptron) restored;
            this.scaling = params;
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Sequence predictor loaded from {}", path);
    }

    private static Path modelPath(Path path) {
        return path.resolveSibling(path.getFileName() + MODEL_SUFFIX);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public boolean isTrained() {
        lock.readLock().lock();
        try {
            return network != null && scaling != null;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getLookback() {
        return lookback;
    }

    public int getHiddenUnits() {
        return hiddenUnits;
    }
}
