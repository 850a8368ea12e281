package com.processsentinel.core.detection;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * A single randomly partitioned isolation tree.
 *
 * <p>
 * Built once and read-only afterwards, so one tree may be traversed by many
 * threads at the same time.
 * </p>
 *
 * @since 1.0.0
 */
public final class IsolationTree implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Euler–Mascheroni constant. */
    static final double EULER_GAMMA = 0.5772156649;

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    /**
     * Grow a tree over {@code sample}.
     *
     * @param sample   training points
     * @param maxDepth depth at which every node becomes a leaf
     * @param random   source of split features and values
     * @return the tree
     */
    public static IsolationTree build(List<double[]> sample, int maxDepth, Random random) {
        return new IsolationTree(grow(sample, 0, maxDepth, random));
    }

    private static IsolationNode grow(List<double[]> data, int depth, int maxDepth, Random random) {
        if (data.size() <= 1 || depth >= maxDepth) {
            return new IsolationNode.Leaf(data.size());
        }

        int numFeatures = data.get(0).length;
        int featureIndex = random.nextInt(numFeatures);

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] point : data) {
            min = Math.min(min, point[featureIndex]);
            max = Math.max(max, point[featureIndex]);
        }
        double splitValue = min + random.nextDouble() * (max - min);

        List<double[]> left = new ArrayList<>();
        List<double[]> right = new ArrayList<>();
        for (double[] point : data) {
            if (point[featureIndex] < splitValue) {
                left.add(point);
            } else {
                right.add(point);
            }
        }

        if (left.isEmpty() || right.isEmpty()) {
            return new IsolationNode.Leaf(data.size());
        }

        return new IsolationNode.Internal(featureIndex, splitValue,
                grow(left, depth + 1, maxDepth, random),
                grow(right, depth + 1, maxDepth, random));
    }

    /**
     * Depth at which {@code point} lands plus the expected remaining depth of
     * the leaf it lands in.
     *
     * @param point vector to route; must match the training dimension
     * @return estimated path length
     */
    public double pathLength(double[] point) {
        IsolationNode node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = ((IsolationNode.Internal) node).route(point);
            depth++;
        }
        return depth + averagePathLength(((IsolationNode.Leaf) node).getSize());
    }

    IsolationNode getRoot() {
        return root;
    }

    /**
     * Average path length of an unsuccessful binary search tree lookup over
     * {@code n} points: {@code c(n) = 2(ln(n-1) + γ) - 2(n-1)/n}.
     *
     * @param n number of points
     * @return {@code c(n)}, or {@code 0} for {@code n <= 1}
     */
    public static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        return 2.0 * (Math.log(n - 1) + EULER_GAMMA) - (2.0 * (n - 1) / n);
    }
}
