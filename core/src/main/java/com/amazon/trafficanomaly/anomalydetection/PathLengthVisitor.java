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

package com.amazon.trafficanomaly.anomalydetection;

import static com.amazon.trafficanomaly.CommonUtils.averagePathLength;

import com.amazon.trafficanomaly.Visitor;
import com.amazon.trafficanomaly.tree.InternalNode;
import com.amazon.trafficanomaly.tree.LeafNode;

/**
 * Computes the isolation path length of a value: one edge for every internal
 * node on the path, plus c(size) for the leaf where the traversal ends. A leaf
 * that still holds several training values stands for a subtree that was never
 * built, and c(size) is its expected depth.
 */
public class PathLengthVisitor implements Visitor<Double> {

    private double pathLength;

    public PathLengthVisitor() {
        pathLength = 0;
    }

    @Override
    public void accept(InternalNode node, int depthOfNode) {
        pathLength += 1;
    }

    @Override
    public void acceptLeaf(LeafNode leafNode, int depthOfNode) {
        pathLength += averagePathLength(leafNode.getSize());
    }

    /**
     * @return the path length accumulated so far
     */
    @Override
    public Double getResult() {
        return pathLength;
    }
}
