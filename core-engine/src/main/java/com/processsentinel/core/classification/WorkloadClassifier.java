package com.processsentinel.core.classification;

import com.processsentinel.core.model.Classification;
import com.processsentinel.core.model.Sample;
import com.processsentinel.core.training.ModelTrainingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.classifiers.Classifier;
import weka.classifiers.trees.RandomForest;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Supervised workload classifier over the raw resource metrics of a sample.
 *
 * <p>
 * Each sample becomes an 8-dimensional vector: cpu, memory, threads,
 * priority, ioRead, ioWrite, networkSent and networkReceived. The default
 * model is a Weka {@link RandomForest}; a different Weka classifier may be
 * supplied through the factory constructor.
 * </p>
 *
 * <h3>Probabilities</h3>
 * <p>
 * Class probabilities are an optional capability. With
 * {@code probabilityEstimates} disabled the predicted label is returned with
 * confidence {@code 0} and no probability map.
 * </p>
 *
 * <h3>Fallback</h3>
 * <p>
 * An untrained classifier, or any fault during inference, yields
 * {@link Classification#unknown()}.
 * </p>
 *
 * @since 1.0.0
 */
public class WorkloadClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(WorkloadClassifier.class);

    static final String[] FEATURE_NAMES = {
            Sample.CPU, Sample.MEMORY, Sample.THREADS, "priority",
            Sample.IO_READ, Sample.IO_WRITE, Sample.NETWORK_SENT, Sample.NETWORK_RECEIVED
    };

    private static final String CLASS_ATTRIBUTE = "workload";

    private final Supplier<Classifier> classifierFactory;
    private final boolean probabilityEstimates;
    private final Instances header;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private Classifier model;

    /**
     * @param classifierFactory    creates an unfitted Weka classifier per
     *                             training run
     * @param probabilityEstimates whether predictions carry class probabilities
     */
    public WorkloadClassifier(Supplier<Classifier> classifierFactory, boolean probabilityEstimates) {
        this.classifierFactory = Objects.requireNonNull(classifierFactory, "classifierFactory must not be null");
        this.probabilityEstimates = probabilityEstimates;
        this.header = buildHeader();
    }

    /**
     * Random forest classifier.
     *
     * @param numTrees             trees in the forest
     * @param seed                 random seed
     * @param probabilityEstimates whether predictions carry class probabilities
     */
    public WorkloadClassifier(int numTrees, int seed, boolean probabilityEstimates) {
        this(randomForest(numTrees, seed), probabilityEstimates);
    }

    public WorkloadClassifier() {
        this(100, 42, true);
    }

    /**
     * @param numTrees trees in the forest
     * @param seed     random seed
     * @return a factory for configured {@link RandomForest} instances
     */
    public static Supplier<Classifier> randomForest(int numTrees, int seed) {
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be >= 1, got: " + numTrees);
        }
        return () -> {
            RandomForest forest = new RandomForest();
            forest.setNumIterations(numTrees);
            forest.setSeed(seed);
            forest.setNumFeatures((int) Math.ceil(FEATURE_NAMES.length * 0.8));
            return forest;
        };
    }

    private static Instances buildHeader() {
        ArrayList<Attribute> attributes = new ArrayList<>();
        for (String name : FEATURE_NAMES) {
            attributes.add(new Attribute(name));
        }
        attributes.add(new Attribute(CLASS_ATTRIBUTE, new ArrayList<>(WorkloadLabels.ALL)));
        Instances instances = new Instances("process-workloads", attributes, 0);
        instances.setClassIndex(FEATURE_NAMES.length);
        return instances;
    }

    // ---------------------------------------------------------------
    // Training
    // ---------------------------------------------------------------

    /**
     * Fit a new model on labeled samples.
     *
     * @param trainingData samples with labels from {@link WorkloadLabels}
     * @throws ModelTrainingException if the data is empty, a label is unknown,
     *                                or the underlying classifier fails
     */
    public void train(List<LabeledSample> trainingData) {
        if (trainingData == null || trainingData.isEmpty()) {
            throw new ModelTrainingException("Cannot train classifier on an empty dataset");
        }

        Instances dataset = new Instances(header, trainingData.size());
        for (LabeledSample item : trainingData) {
            int classIndex = WorkloadLabels.ALL.indexOf(item.getLabel());
            if (classIndex < 0) {
                throw new ModelTrainingException("Unknown workload label: '" + item.getLabel() + "'");
            }
            double[] values = new double[FEATURE_NAMES.length + 1];
            System.arraycopy(extractFeatures(item.getSample()), 0, values, 0, FEATURE_NAMES.length);
            values[FEATURE_NAMES.length] = classIndex;
            dataset.add(new DenseInstance(1.0, values));
        }

        Classifier candidate = classifierFactory.get();
        try {
            candidate.buildClassifier(dataset);
        } catch (Exception e) {
            throw new ModelTrainingException("Classifier training failed: " + e.getMessage(), e);
        }

        lock.writeLock().lock();
        try {
            this.model = candidate;
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Workload classifier trained on {} samples", trainingData.size());
    }

    // ---------------------------------------------------------------
    // Inference
    // ---------------------------------------------------------------

    /**
     * @param sample process sample
     * @return predicted workload, or {@link Classification#unknown()}
     */
    public Classification predict(Sample sample) {
        lock.readLock().lock();
        try {
            if (model == null || sample == null) {
                return Classification.unknown();
            }
            Instance instance = toInstance(sample);
            double raw = model.classifyInstance(instance);
            if (Utils.isMissingValue(raw) || raw < 0 || raw >= WorkloadLabels.ALL.size()) {
                LOG.debug("Classifier returned no class ({}) – reporting unknown", raw);
                return Classification.unknown();
            }
            int predicted = (int) raw;
            String label = WorkloadLabels.ALL.get(predicted);

            if (!probabilityEstimates) {
                return new Classification(label, 0.0, Collections.emptyMap());
            }

            double[] distribution = model.distributionForInstance(instance);
            Map<String, Double> probabilities = new LinkedHashMap<>();
            for (int i = 0; i < WorkloadLabels.ALL.size(); i++) {
                probabilities.put(WorkloadLabels.ALL.get(i), i < distribution.length ? distribution[i] : 0.0);
            }
            double confidence = predicted < distribution.length ? distribution[predicted] : 0.0;
            return new Classification(label, confidence, probabilities);
        } catch (Exception e) {
            LOG.debug("Classification failed – reporting unknown: {}", e.getMessage());
            return Classification.unknown();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Classification> predictBatch(List<Sample> samples) {
        if (samples == null) {
            return Collections.emptyList();
        }
        List<Classification> results = new ArrayList<>(samples.size());
        for (Sample sample : samples) {
            results.add(predict(sample));
        }
        return results;
    }

    private Instance toInstance(Sample sample) {
        double[] values = new double[FEATURE_NAMES.length + 1];
        System.arraycopy(extractFeatures(sample), 0, values, 0, FEATURE_NAMES.length);
        values[FEATURE_NAMES.length] = Utils.missingValue();
        Instance instance = new DenseInstance(1.0, values);
        instance.setDataset(header);
        return instance;
    }

    static double[] extractFeatures(Sample sample) {
        return new double[] {
                sample.metric(Sample.CPU),
                sample.metric(Sample.MEMORY),
                sample.metric(Sample.THREADS),
                sample.getPriority(),
                sample.metric(Sample.IO_READ),
                sample.metric(Sample.IO_WRITE),
                sample.metric(Sample.NETWORK_SENT),
                sample.metric(Sample.NETWORK_RECEIVED)
        };
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public boolean isTrained() {
        lock.readLock().lock();
        try {
            return model != null;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> getClasses() {
        return WorkloadLabels.ALL;
    }

    public boolean isProbabilityEstimates() {
        return probabilityEstimates;
    }
}
