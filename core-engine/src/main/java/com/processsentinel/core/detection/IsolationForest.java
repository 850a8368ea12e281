package com.processsentinel.core.detection;

import com.processsentinel.core.training.ModelTrainingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Isolation forest anomaly detector.
 *
 * <p>
 * Anomalies are isolated by fewer random splits than normal points, so a
 * short average path length across many random trees means a high score:
 * {@code score = 2^(-E[h(x)] / c(sampleSize))}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * {@link #fit} grows the new ensemble without holding a lock and installs it
 * under the write lock; {@link #predict} holds the read lock. Concurrent
 * scoring is safe, and a failed fit leaves the old ensemble in place.
 * </p>
 *
 * <h3>Reproducibility</h3>
 * <p>
 * Pass a seed to make tree construction deterministic. Each call to
 * {@link #fit} with the same seed and data yields the same forest.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForest implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForest.class);

    private final int numTrees;
    private final int sampleSize;
    private final double contamination;
    private final Long seed;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private List<IsolationTree> trees = Collections.emptyList();
    private int dimension;
    private boolean trained;

    /**
     * @param numTrees      number of trees in the ensemble
     * @param sampleSize    bootstrap sample size per tree
     * @param contamination expected anomaly share; informational only
     * @param seed          random seed, or {@code null} for an unseeded source
     * @throws IllegalArgumentException if {@code numTrees < 1} or
     *                                  {@code sampleSize < 2}
     */
    public IsolationForest(int numTrees, int sampleSize, double contamination, Long seed) {
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be >= 1, got: " + numTrees);
        }
        if (sampleSize < 2) {
            throw new IllegalArgumentException("sampleSize must be >= 2, got: " + sampleSize);
        }
        this.numTrees = numTrees;
        this.sampleSize = sampleSize;
        this.contamination = contamination;
        this.seed = seed;
    }

    public IsolationForest() {
        this(100, 256, 0.1, null);
    }

    @Override
    public void fit(double[][] dataset) {
        if (dataset == null || dataset.length == 0) {
            throw new ModelTrainingException("Cannot fit isolation forest on an empty dataset");
        }
        int dim = dataset[0] != null ? dataset[0].length : 0;
        if (dim == 0) {
            throw new ModelTrainingException("Feature vectors must not be empty");
        }
        for (double[] row : dataset) {
            if (row == null || row.length != dim) {
                throw new ModelTrainingException("All feature vectors must have length " + dim);
            }
        }

        Random random = seed != null ? new Random(seed) : new Random();
        int maxDepth = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));
        int drawSize = Math.min(sampleSize, dataset.length);

        List<IsolationTree> grown = new ArrayList<>(numTrees);
        for (int t = 0; t < numTrees; t++) {
            List<double[]> sample = new ArrayList<>(drawSize);
            for (int j = 0; j < drawSize; j++) {
                sample.add(dataset[random.nextInt(dataset.length)]);
            }
            grown.add(IsolationTree.build(sample, maxDepth, random));
        }

        lock.writeLock().lock();
        try {
            this.trees = Collections.unmodifiableList(grown);
            this.dimension = dim;
            this.trained = true;
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Isolation forest trained with {} trees on {} points ({} features)",
                numTrees, dataset.length, dim);
    }

    @Override
    public double predict(double[] features) {
        lock.readLock().lock();
        try {
            if (!trained || trees.isEmpty() || features == null || features.length != dimension) {
                return 0.0;
            }
            double total = 0.0;
            for (IsolationTree tree : trees) {
                total += tree.pathLength(features);
            }
            double avgPathLength = total / trees.size();
            double score = Math.pow(2.0, -avgPathLength / IsolationTree.averagePathLength(sampleSize));
            return Double.isFinite(score) ? score : 0.0;
        } catch (RuntimeException e) {
            LOG.debug("Anomaly scoring failed – reporting normal: {}", e.getMessage());
            return 0.0;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Double> predictBatch(List<double[]> vectors) {
        if (vectors == null) {
            return Collections.emptyList();
        }
        List<Double> scores = new ArrayList<>(vectors.size());
        for (double[] vector : vectors) {
            scores.add(predict(vector));
        }
        return scores;
    }

    @Override
    public boolean isTrained() {
        lock.readLock().lock();
        try {
            return trained;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getNumTrees() {
        return numTrees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public double getContamination() {
        return contamination;
    }

    List<IsolationTree> trees() {
        lock.readLock().lock();
        try {
            return trees;
        } finally {
            lock.readLock().unlock();
        }
    }
}
