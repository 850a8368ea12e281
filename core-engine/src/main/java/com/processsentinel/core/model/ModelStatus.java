package com.processsentinel.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Training state of the engine's three models, as reported to dashboards.
 *
 * @since 1.0.0
 */
public final class ModelStatus implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DetectorStatus anomalyDetector;
    private final PredictorStatus predictor;
    private final ClassifierStatus classifier;

    public ModelStatus(DetectorStatus anomalyDetector, PredictorStatus predictor, ClassifierStatus classifier) {
        this.anomalyDetector = anomalyDetector;
        this.predictor = predictor;
        this.classifier = classifier;
    }

    public DetectorStatus getAnomalyDetector() {
        return anomalyDetector;
    }

    public PredictorStatus getPredictor() {
        return predictor;
    }

    public ClassifierStatus getClassifier() {
        return classifier;
    }

    public static final class DetectorStatus implements Serializable {
        private static final long serialVersionUID = 1L;
        private final boolean trained;
        private final int numTrees;

        public DetectorStatus(boolean trained, int numTrees) {
            this.trained = trained;
            this.numTrees = numTrees;
        }

        public boolean isTrained() {
            return trained;
        }

        public int getNumTrees() {
            return numTrees;
        }
    }

    public static final class PredictorStatus implements Serializable {
        private static final long serialVersionUID = 1L;
        private final boolean trained;
        private final int inputShape;

        public PredictorStatus(boolean trained, int inputShape) {
            this.trained = trained;
            this.inputShape = inputShape;
        }

        public boolean isTrained() {
            return trained;
        }

        public int getInputShape() {
            return inputShape;
        }
    }

    public static final class ClassifierStatus implements Serializable {
        private static final long serialVersionUID = 1L;
        private final boolean trained;
        private final List<String> classes;

        public ClassifierStatus(boolean trained, List<String> classes) {
            this.trained = trained;
            this.classes = List.copyOf(classes);
        }

        public boolean isTrained() {
            return trained;
        }

        public List<String> getClasses() {
            return classes;
        }
    }
}
