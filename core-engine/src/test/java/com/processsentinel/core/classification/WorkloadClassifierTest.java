package com.processsentinel.core.classification;

import com.processsentinel.core.model.Classification;
import com.processsentinel.core.model.Sample;
import com.processsentinel.core.training.ModelTrainingException;
import com.processsentinel.core.training.SyntheticWorkloads;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import weka.classifiers.AbstractClassifier;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Utils;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link WorkloadClassifier}.
 */
class WorkloadClassifierTest {

    private static final List<String> ARCHETYPES = List.of(
            WorkloadLabels.WEB_SERVER, WorkloadLabels.DATABASE, WorkloadLabels.ML_TRAINING,
            WorkloadLabels.CACHE, WorkloadLabels.SYSTEM);

    @Test
    @DisplayName("Should return exactly unknown/0/{} when untrained")
    void shouldReturnUnknownWhenUntrained() {
        WorkloadClassifier classifier = new WorkloadClassifier();

        Classification result = classifier.predict(Sample.builder("p1").cpu(50).build());

        assertThat(classifier.isTrained()).isFalse();
        assertThat(result).isEqualTo(Classification.unknown());
        assertThat(result.getLabel()).isEqualTo(Classification.UNKNOWN);
        assertThat(result.getConfidence()).isZero();
        assertThat(result.getProbabilities()).isEmpty();
    }

    @Test
    @DisplayName("Should recover held-out archetype labels above 80%")
    void shouldClassifySeparableArchetypes() {
        WorkloadClassifier classifier = new WorkloadClassifier(50, 42, true);
        classifier.train(SyntheticWorkloads.generate(ARCHETYPES, 20, new Random(1)));

        List<LabeledSample> heldOut = SyntheticWorkloads.generate(ARCHETYPES, 10, new Random(2));
        long correct = heldOut.stream()
                .filter(s -> classifier.predict(s.getSample()).getLabel().equals(s.getLabel()))
                .count();

        assertThat((double) correct / heldOut.size()).isGreaterThan(0.8);
    }

    @Test
    @DisplayName("Should report class probabilities that sum to one")
    void shouldReportProbabilities() {
        WorkloadClassifier classifier = new WorkloadClassifier(30, 42, true);
        classifier.train(SyntheticWorkloads.generate(20, new Random(3)));

        Sample mlJob = SyntheticWorkloads.generate(List.of(WorkloadLabels.ML_TRAINING), 1, new Random(4))
                .get(0).getSample();
        Classification result = classifier.predict(mlJob);

        assertThat(result.getProbabilities()).containsOnlyKeys(WorkloadLabels.ALL);
        assertThat(result.getProbabilities().values().stream().mapToDouble(Double::doubleValue).sum())
                .isCloseTo(1.0, within(1e-6));
        assertThat(result.getConfidence()).isEqualTo(result.getProbabilities().get(result.getLabel()));
    }

    @Test
    @DisplayName("Should return the label with no probabilities when estimates are disabled")
    void shouldOmitProbabilitiesWhenDisabled() {
        WorkloadClassifier classifier = new WorkloadClassifier(30, 42, false);
        classifier.train(SyntheticWorkloads.generate(20, new Random(5)));

        Sample dbSample = SyntheticWorkloads.generate(List.of(WorkloadLabels.DATABASE), 1, new Random(6))
                .get(0).getSample();
        Classification result = classifier.predict(dbSample);

        assertThat(result.getLabel()).isIn(WorkloadLabels.ALL);
        assertThat(result.getConfidence()).isZero();
        assertThat(result.getProbabilities()).isEmpty();
    }

    @Test
    @DisplayName("Should reject empty data and unknown labels")
    void shouldRejectInvalidTrainingData() {
        WorkloadClassifier classifier = new WorkloadClassifier();

        assertThatThrownBy(() -> classifier.train(List.of()))
                .isInstanceOf(ModelTrainingException.class);
        assertThatThrownBy(() -> classifier.train(List.of(
                new LabeledSample(Sample.builder("p1").cpu(1).build(), "batch-job"))))
                .isInstanceOf(ModelTrainingException.class)
                .hasMessageContaining("batch-job");
        assertThat(classifier.isTrained()).isFalse();
    }

    @Test
    @DisplayName("Should classify a batch element-wise")
    void shouldPredictBatch() {
        WorkloadClassifier classifier = new WorkloadClassifier();
        List<Sample> samples = List.of(Sample.builder("a").build(), Sample.builder("b").build());

        assertThat(classifier.predictBatch(samples)).containsExactly(Classification.unknown(), Classification.unknown());
        assertThat(classifier.predictBatch(null)).isEmpty();
    }

    @Test
    @DisplayName("Should report unknown when the model yields no class")
    void shouldReportUnknownForMissingPrediction() {
        WorkloadClassifier classifier = new WorkloadClassifier(NoVerdictClassifier::new, true);
        classifier.train(SyntheticWorkloads.generate(2, new Random(7)));

        Classification result = classifier.predict(Sample.builder("p1").cpu(50).build());

        assertThat(classifier.isTrained()).isTrue();
        assertThat(result).isEqualTo(Classification.unknown());
    }

    /** Weka classifier that never commits to a class. */
    private static final class NoVerdictClassifier extends AbstractClassifier {

        private static final long serialVersionUID = 1L;

        @Override
        public void buildClassifier(Instances data) {
        }

        @Override
        public double classifyInstance(Instance instance) {
            return Utils.missingValue();
        }
    }
}
