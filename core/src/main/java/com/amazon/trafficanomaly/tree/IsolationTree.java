/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.trafficanomaly.tree;

import static com.amazon.trafficanomaly.CommonUtils.checkArgument;
import static com.amazon.trafficanomaly.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Random;

import com.amazon.trafficanomaly.Visitor;
import com.amazon.trafficanomaly.anomalydetection.PathLengthVisitor;
import com.amazon.trafficanomaly.config.SplitPolicy;

/**
 * A binary tree that recursively partitions a sample of scalar values. Values
 * that are easy to separate from the rest of the sample end up in shallow
 * leaves, which is what makes path lengths useful as an anomaly score.
 * <p>
 * The tree is built once and is never modified afterwards.
 */
public class IsolationTree {

    private final Node root;

    public IsolationTree(Node root) {
        this.root = checkNotNull(root, "root must not be null");
    }

    /**
     * Build a tree over the given sample.
     *
     * @param sample      the training values; not modified
     * @param maxDepth    partitioning stops at this depth
     * @param splitPolicy how split values are chosen
     * @param random      the generator used by randomized split policies
     * @return the tree
     */
    public static IsolationTree build(double[] sample, int maxDepth, SplitPolicy splitPolicy, Random random) {
        checkNotNull(sample, "sample must not be null");
        checkNotNull(splitPolicy, "splitPolicy must not be null");
        checkArgument(maxDepth >= 0, "maxDepth cannot be negative");
        checkArgument(splitPolicy == SplitPolicy.MIDPOINT || random != null,
                "a random generator is required for " + splitPolicy);
        return new IsolationTree(buildNode(Arrays.copyOf(sample, sample.length), 0, maxDepth, splitPolicy, random));
    }

    static Node buildNode(double[] data, int depth, int maxDepth, SplitPolicy splitPolicy, Random random) {
        if (depth >= maxDepth || data.length <= 1) {
            return new LeafNode(data.length);
        }

        double min = data[0];
        double max = data[0];
        for (double value : data) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        if (min == max) {
            return new LeafNode(data.length);
        }

        double splitValue = chooseSplit(min, max, splitPolicy, random);

        int leftCount = 0;
        for (double value : data) {
            if (value < splitValue) {
                leftCount++;
            }
        }
        double[] left = new double[leftCount];
        double[] right = new double[data.length - leftCount];
        int li = 0;
        int ri = 0;
        for (double value : data) {
            if (value < splitValue) {
                left[li++] = value;
            } else {
                right[ri++] = value;
            }
        }

        return new InternalNode(splitValue, buildNode(left, depth + 1, maxDepth, splitPolicy, random),
                buildNode(right, depth + 1, maxDepth, splitPolicy, random));
    }

    static double chooseSplit(double min, double max, SplitPolicy splitPolicy, Random random) {
        switch (splitPolicy) {
        case UNIFORM_RANDOM:
            return min + random.nextDouble() * (max - min);
        case MIDPOINT:
        default:
            return min + (max - min) * 0.5;
        }
    }

    /**
     * Route a value from the root to a leaf, presenting every node on the path to
     * the visitor.
     *
     * @param value   the value to route
     * @param visitor the visitor
     * @param <R>     the result type of the visitor
     * @return the result of the visitor
     */
    public <R> R traverse(double value, Visitor<R> visitor) {
        checkNotNull(visitor, "visitor must not be null");
        Node node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            InternalNode internal = (InternalNode) node;
            visitor.accept(internal, depth);
            node = internal.isLeftOf(value) ? internal.getLeftChild() : internal.getRightChild();
            depth++;
        }
        visitor.acceptLeaf((LeafNode) node, depth);
        return visitor.getResult();
    }

    /**
     * @param value a value
     * @return the depth of the leaf reached by the value, corrected by the
     *         expected remaining depth of that leaf
     */
    public double pathLength(double value) {
        return traverse(value, new PathLengthVisitor());
    }

    public Node getRoot() {
        return root;
    }

    /**
     * @return the number of training values in the tree
     */
    public int getMass() {
        return root.getMass();
    }

    /**
     * @return the length of the longest root-to-leaf path
     */
    public int getHeight() {
        return height(root);
    }

    private static int height(Node node) {
        if (node.isLeaf()) {
            return 0;
        }
        InternalNode internal = (InternalNode) node;
        return 1 + Math.max(height(internal.getLeftChild()), height(internal.getRightChild()));
    }
}
