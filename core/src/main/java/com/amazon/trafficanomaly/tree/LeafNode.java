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

/**
 * A terminal node. It records how many training values were left unseparated
 * when partitioning stopped.
 */
public class LeafNode extends Node {

    private final int size;

    public LeafNode(int size) {
        checkArgument(size >= 0, "size cannot be negative");
        this.size = size;
    }

    public int getSize() {
        return size;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public int getMass() {
        return size;
    }
}
