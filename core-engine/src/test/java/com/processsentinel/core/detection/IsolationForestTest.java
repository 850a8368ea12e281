package com.processsentinel.core.detection;

import com.processsentinel.core.training.ModelTrainingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IsolationForest}.
 */
class IsolationForestTest {

    private double[][] cluster;

    @BeforeEach
    void setUp() {
        Random random = new Random(1);
        cluster = new double[300][];
        for (int i = 0; i < cluster.length; i++) {
            cluster[i] = new double[] { 50 + random.nextGaussian() * 2, 500 + random.nextGaussian() * 10 };
        }
    }

    @Test
    @DisplayName("Should score an isolated point higher than a cluster member")
    void shouldScoreOutlierHigher() {
        IsolationForest forest = new IsolationForest(100, 256, 0.1, 42L);
        forest.fit(cluster);

        double inlier = forest.predict(new double[] { 50, 500 });
        double outlier = forest.predict(new double[] { 95, 2000 });

        assertThat(outlier).isGreaterThan(inlier);
        assertThat(outlier).isGreaterThan(0.55);
        assertThat(inlier).isLessThan(0.55);
    }

    @Test
    @DisplayName("Should keep every score in (0, 1]")
    void shouldBoundScores() {
        IsolationForest forest = new IsolationForest(50, 64, 0.1, 3L);
        forest.fit(cluster);

        List<Double> scores = forest.predictBatch(Arrays.asList(cluster).subList(0, 50));

        assertThat(scores).hasSize(50).allSatisfy(s -> assertThat(s).isGreaterThan(0.0).isLessThanOrEqualTo(1.0));
    }

    @Test
    @DisplayName("Should be deterministic for a fixed seed")
    void shouldBeDeterministicWithSeed() {
        IsolationForest first = new IsolationForest(30, 64, 0.1, 11L);
        IsolationForest second = new IsolationForest(30, 64, 0.1, 11L);
        first.fit(cluster);
        second.fit(cluster);

        double[] point = { 60, 520 };
        assertThat(first.predict(point)).isEqualTo(second.predict(point));
    }

    @Test
    @DisplayName("Should return 0 when untrained or given malformed input")
    void shouldFailSafe() {
        IsolationForest forest = new IsolationForest(10, 32, 0.1, 1L);
        assertThat(forest.isTrained()).isFalse();
        assertThat(forest.predict(new double[] { 1, 2 })).isZero();

        forest.fit(cluster);
        assertThat(forest.predict(null)).isZero();
        assertThat(forest.predict(new double[] { 1, 2, 3 })).isZero();
        assertThat(forest.predictBatch(null)).isEmpty();
    }

    @Test
    @DisplayName("Should reject empty or ragged data and keep the prior model")
    void shouldRejectBadDatasetAndKeepState() {
        IsolationForest forest = new IsolationForest(10, 32, 0.1, 1L);
        forest.fit(cluster);
        double before = forest.predict(new double[] { 50, 500 });

        assertThatThrownBy(() -> forest.fit(new double[0][]))
                .isInstanceOf(ModelTrainingException.class);
        assertThatThrownBy(() -> forest.fit(new double[][] { { 1, 2 }, { 3 } }))
                .isInstanceOf(ModelTrainingException.class);

        assertThat(forest.isTrained()).isTrue();
        assertThat(forest.predict(new double[] { 50, 500 })).isEqualTo(before);
    }

    @Test
    @DisplayName("Should limit tree depth to ceil(log2(sampleSize))")
    void shouldLimitDepth() {
        IsolationForest forest = new IsolationForest(5, 16, 0.1, 5L);
        forest.fit(cluster);

        for (IsolationTree tree : forest.trees()) {
            assertThat(depth(tree.getRoot())).isLessThanOrEqualTo(4);
        }
    }

    @Test
    @DisplayName("Should use zero leaf correction for n <= 1")
    void shouldComputeAveragePathLength() {
        assertThat(IsolationTree.averagePathLength(0)).isZero();
        assertThat(IsolationTree.averagePathLength(1)).isZero();
        assertThat(IsolationTree.averagePathLength(2)).isCloseTo(2 * IsolationTree.EULER_GAMMA - 1.0, within(1e-12));
    }

    private static int depth(IsolationNode node) {
        if (node.isLeaf()) {
            return 0;
        }
        IsolationNode.Internal internal = (IsolationNode.Internal) node;
        return 1 + Math.max(depth(internal.getLeft()), depth(internal.getRight()));
    }
}
