package com.processsentinel.core.detection;

import java.util.List;

/**
 * Contract for unsupervised anomaly scorers.
 *
 * <p>
 * Scoring is fail-safe: implementations return {@code 0} (normal) instead of
 * throwing when they are untrained or the input is malformed. Training may
 * fail and leaves the previous model in place when it does.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyDetector {

    /**
     * Train on a dataset of feature vectors.
     *
     * @param dataset rows of equal length
     * @throws com.processsentinel.core.training.ModelTrainingException if the
     *                                                                  dataset is
     *                                                                  unusable
     */
    void fit(double[][] dataset);

    /**
     * Score one vector.
     *
     * @param features feature vector
     * @return anomaly score in [0, 1]; {@code 0} when scoring is not possible
     */
    double predict(double[] features);

    /**
     * Score several vectors.
     *
     * @param vectors feature vectors; {@code null} yields an empty list
     * @return one score per vector
     */
    List<Double> predictBatch(List<double[]> vectors);

    boolean isTrained();
}
