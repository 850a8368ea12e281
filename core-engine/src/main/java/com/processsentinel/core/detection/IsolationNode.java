package com.processsentinel.core.detection;

import java.io.Serializable;
import java.util.Objects;

/**
 * Node of an {@link IsolationTree}: either a {@link Leaf} or an
 * {@link Internal} split that exclusively owns its two children.
 *
 * @since 1.0.0
 */
public abstract class IsolationNode implements Serializable {

    private static final long serialVersionUID = 1L;

    private IsolationNode() {
    }

    public abstract boolean isLeaf();

    /** Terminal node remembering how many training points reached it. */
    public static final class Leaf extends IsolationNode {

        private static final long serialVersionUID = 1L;

        private final int size;

        public Leaf(int size) {
            this.size = size;
        }

        public int getSize() {
            return size;
        }

        @Override
        public boolean isLeaf() {
            return true;
        }
    }

    /** Split on one feature: values below {@code splitValue} go left. */
    public static final class Internal extends IsolationNode {

        private static final long serialVersionUID = 1L;

        private final int featureIndex;
        private final double splitValue;
        private final IsolationNode left;
        private final IsolationNode right;

        public Internal(int featureIndex, double splitValue, IsolationNode left, IsolationNode right) {
            this.featureIndex = featureIndex;
            this.splitValue = splitValue;
            this.left = Objects.requireNonNull(left, "left must not be null");
            this.right = Objects.requireNonNull(right, "right must not be null");
        }

        public int getFeatureIndex() {
            return featureIndex;
        }

        public double getSplitValue() {
            return splitValue;
        }

        public IsolationNode getLeft() {
            return left;
        }

        public IsolationNode getRight() {
            return right;
        }

        /**
         * @param point vector being routed
         * @return the child the point descends into
         */
        public IsolationNode route(double[] point) {
            return point[featureIndex] < splitValue ? left : right;
        }

        @Override
        public boolean isLeaf() {
            return false;
        }
    }
}
