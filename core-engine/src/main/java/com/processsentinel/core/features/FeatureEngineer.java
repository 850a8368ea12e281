package com.processsentinel.core.features;

import com.processsentinel.core.model.Sample;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Feature engineering and scaling for process samples.
 *
 * <p>
 * Apart from the scaling parameters it remembers per feature name, the
 * engineer is stateless. Scaling parameters are held in concurrent maps, so a
 * single instance may be shared across evaluation threads.
 * </p>
 *
 * @since 1.0.0
 */
public class FeatureEngineer {

    private final Map<String, ScalerParams> minMaxScalers = new ConcurrentHashMap<>();
    private final Map<String, double[]> standardScalers = new ConcurrentHashMap<>();

    // ---------------------------------------------------------------
    // Scaling
    // ---------------------------------------------------------------

    /**
     * Min-max scale values into [0, 1] and remember the parameters under
     * {@code featureName}.
     *
     * @param values      values to scale; must not be empty
     * @param featureName key for later {@link #denormalize}
     * @return scaled copy
     */
    public double[] normalize(double[] values, String featureName) {
        Objects.requireNonNull(featureName, "featureName must not be null");
        requireNonEmpty(values);

        double min = Arrays.stream(values).min().orElse(0);
        double max = Arrays.stream(values).max().orElse(0);
        ScalerParams params = new ScalerParams(min, max);
        minMaxScalers.put(featureName, params);

        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = params.scale(values[i]);
        }
        return scaled;
    }

    /**
     * Invert {@link #normalize} for the same feature name.
     *
     * @param normalized  scaled values
     * @param featureName key used when normalizing
     * @return values in the original units
     * @throws UnknownScalerException if {@code featureName} was never normalized
     */
    public double[] denormalize(double[] normalized, String featureName) {
        ScalerParams params = minMaxScalers.get(featureName);
        if (params == null) {
            throw new UnknownScalerException(featureName);
        }
        double[] values = new double[normalized.length];
        for (int i = 0; i < normalized.length; i++) {
            values[i] = params.unscale(normalized[i]);
        }
        return values;
    }

    /**
     * Z-score values with the population mean and standard deviation. A
     * constant series uses a standard deviation of 1.
     *
     * @param values      values to standardize; must not be empty
     * @param featureName key under which mean and deviation are kept
     * @return standardized copy
     */
    public double[] standardize(double[] values, String featureName) {
        Objects.requireNonNull(featureName, "featureName must not be null");
        requireNonEmpty(values);

        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        double mean = stats.getMean();
        double std = Math.sqrt(stats.getPopulationVariance());
        if (std == 0 || !Double.isFinite(std)) {
            std = 1.0;
        }
        standardScalers.put(featureName, new double[] { mean, std });

        double[] standardized = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            standardized[i] = (values[i] - mean) / std;
        }
        return standardized;
    }

    /**
     * @param featureName feature key
     * @return remembered min-max parameters, or {@code null}
     */
    public ScalerParams scaler(String featureName) {
        return minMaxScalers.get(featureName);
    }

    /**
     * @param featureName feature key
     * @return remembered {@code [mean, std]} from {@link #standardize}, or
     *         {@code null}
     */
    public double[] standardization(String featureName) {
        double[] params = standardScalers.get(featureName);
        return params != null ? params.clone() : null;
    }

    // ---------------------------------------------------------------
    // Feature engineering
    // ---------------------------------------------------------------

    /**
     * Build the feature vector of a sample given its recent history.
     *
     * <p>
     * With an empty history, every rolling statistic is {@code 0}.
     * </p>
     *
     * @param sample  the current sample
     * @param history earlier samples of the same process, oldest first
     * @return the engineered features
     */
    public FeatureVector engineerFeatures(Sample sample, List<Sample> history) {
        Objects.requireNonNull(sample, "sample must not be null");

        double cpu = sample.metric(Sample.CPU);
        double memory = sample.metric(Sample.MEMORY);
        double threads = sample.metric(Sample.THREADS);
        double divisor = threads == 0 ? 1.0 : threads;

        double[] features = new double[FeatureVector.DIMENSION];
        features[0] = cpu;
        features[1] = memory;
        features[2] = threads;
        features[3] = cpu / divisor;
        features[4] = memory / divisor;

        if (history != null && !history.isEmpty()) {
            double[] cpuHistory = metricSeries(history, Sample.CPU);
            double[] memoryHistory = metricSeries(history, Sample.MEMORY);

            DescriptiveStatistics cpuStats = new DescriptiveStatistics(cpuHistory);
            DescriptiveStatistics memoryStats = new DescriptiveStatistics(memoryHistory);

            features[5] = cpuStats.getMean();
            features[6] = Math.sqrt(cpuStats.getPopulationVariance());
            features[7] = trend(cpuHistory);
            features[8] = memoryStats.getMean();
            features[9] = Math.sqrt(memoryStats.getPopulationVariance());
            features[10] = trend(memoryHistory);
        }

        return new FeatureVector(features);
    }

    /**
     * Ordinary least squares slope of value against index.
     *
     * @param series values in time order
     * @return the slope, or {@code 0} for fewer than two points
     */
    public double trend(double[] series) {
        if (series == null || series.length < 2) {
            return 0.0;
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < series.length; i++) {
            regression.addData(i, series[i]);
        }
        double slope = regression.getSlope();
        return Double.isFinite(slope) ? slope : 0.0;
    }

    /**
     * Extract one metric from a run of samples.
     *
     * @param samples samples in time order
     * @param metric  metric key
     * @return the metric values
     */
    public static double[] metricSeries(List<Sample> samples, String metric) {
        double[] series = new double[samples.size()];
        for (int i = 0; i < series.length; i++) {
            series[i] = samples.get(i).metric(metric);
        }
        return series;
    }

    // ---------------------------------------------------------------
    // Cleaning & windowing
    // ---------------------------------------------------------------

    /**
     * Replace {@code null} and {@code NaN} entries.
     *
     * <p>
     * When no entry is valid the input is returned unchanged.
     * </p>
     *
     * @param series   values with gaps
     * @param strategy how to compute the replacement
     * @return a new list with gaps filled, or {@code series} itself
     */
    public List<Double> fillMissing(List<Double> series, FillStrategy strategy) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");

        double[] valid = series.stream()
                .filter(v -> v != null && !v.isNaN())
                .mapToDouble(Double::doubleValue)
                .toArray();
        if (valid.length == 0) {
            return series;
        }

        double fill = switch (strategy) {
            case MEAN -> Arrays.stream(valid).average().orElse(0);
            case MEDIAN -> {
                double[] sorted = valid.clone();
                Arrays.sort(sorted);
                yield sorted[sorted.length / 2];
            }
            case ZERO -> 0.0;
        };

        List<Double> filled = new ArrayList<>(series.size());
        for (Double v : series) {
            filled.add(v == null || v.isNaN() ? fill : v);
        }
        return filled;
    }

    /**
     * Contiguous windows over a series.
     *
     * <p>
     * The result is lazy and restartable: each call to
     * {@link Iterable#iterator()} walks the series again from the start.
     * </p>
     *
     * @param series     source values
     * @param windowSize length of each window; must be positive
     * @param stride     offset between window starts; must be positive
     * @return the windows, empty when the series is shorter than one window
     */
    public Iterable<double[]> createWindows(double[] series, int windowSize, int stride) {
        Objects.requireNonNull(series, "series must not be null");
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got: " + windowSize);
        }
        if (stride < 1) {
            throw new IllegalArgumentException("stride must be >= 1, got: " + stride);
        }
        return () -> new Iterator<>() {
            private int start = 0;

            @Override
            public boolean hasNext() {
                return start + windowSize <= series.length;
            }

            @Override
            public double[] next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                double[] window = Arrays.copyOfRange(series, start, start + windowSize);
                start += stride;
                return window;
            }
        };
    }

    private static void requireNonEmpty(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
    }
}
