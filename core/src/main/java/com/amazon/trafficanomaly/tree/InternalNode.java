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

import static com.amazon.trafficanomaly.CommonUtils.checkNotNull;

/**
 * A node that partitions the values reaching it: values strictly less than the
 * split value go to the left child, all others to the right child.
 */
public class InternalNode extends Node {

    private final double splitValue;

    private final Node leftChild;

    private final Node rightChild;

    public InternalNode(double splitValue, Node leftChild, Node rightChild) {
        this.splitValue = splitValue;
        this.leftChild = checkNotNull(leftChild, "leftChild must not be null");
        this.rightChild = checkNotNull(rightChild, "rightChild must not be null");
    }

    /**
     * @param value a value being routed through the tree
     * @return true if the value belongs to the left subtree
     */
    public boolean isLeftOf(double value) {
        return value < splitValue;
    }

    public double getSplitValue() {
        return splitValue;
    }

    public Node getLeftChild() {
        return leftChild;
    }

    public Node getRightChild() {
        return rightChild;
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    @Override
    public int getMass() {
        return leftChild.getMass() + rightChild.getMass();
    }
}
