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

package com.amazon.trafficanomaly;

import com.amazon.trafficanomaly.tree.InternalNode;
import com.amazon.trafficanomaly.tree.LeafNode;

/**
 * This is the interface for a visitor which can be used to query an isolation
 * tree to produce a result. A visitor is submitted to
 * {@link com.amazon.trafficanomaly.tree.IsolationTree#traverse(double, Visitor)},
 * and during the traversal the {@link #accept} method is invoked on every
 * internal node of the root-to-leaf path, followed by a single call to
 * {@link #acceptLeaf}.
 */
public interface Visitor<R> {

    /**
     * Visit an internal node in the traversal path.
     *
     * @param node        the node being visited
     * @param depthOfNode the depth of the node being visited
     */
    void accept(InternalNode node, int depthOfNode);

    /**
     * Visit the leaf node that ends the traversal path.
     *
     * @param leafNode    the leaf node being visited
     * @param depthOfNode the depth of the leaf node
     */
    void acceptLeaf(LeafNode leafNode, int depthOfNode);

    /**
     * At the end of the traversal, this method is called to obtain the result
     * computed by the visitor.
     *
     * @return the result value computed by the visitor.
     */
    R getResult();
}
