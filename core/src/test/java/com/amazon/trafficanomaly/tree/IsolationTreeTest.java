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

import static com.amazon.trafficanomaly.CommonUtils.averagePathLength;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.trafficanomaly.Visitor;
import com.amazon.trafficanomaly.config.SplitPolicy;

public class IsolationTreeTest {

    private static final double EPSILON = 1e-9;

    private IsolationTree tree;

    @BeforeEach
    public void setUp() {
        // The sample 1, 2, 3, 4 is split at 2.5, then at 1.5 and 3.5:
        //
        //          2.5
        //        /     \
        //      1.5     3.5
        //     /   \   /   \
        //    1     2 3     4
        tree = IsolationTree.build(new double[] { 4, 1, 3, 2 }, 2, SplitPolicy.MIDPOINT, null);
    }

    @Test
    public void testMidpointStructure() {
        assertEquals(4, tree.getMass());
        assertEquals(2, tree.getHeight());

        InternalNode root = (InternalNode) tree.getRoot();
        assertEquals(2.5, root.getSplitValue());
        assertEquals(1.5, ((InternalNode) root.getLeftChild()).getSplitValue());
        assertEquals(3.5, ((InternalNode) root.getRightChild()).getSplitValue());
        assertTrue(root.isLeftOf(2.0));
        assertFalse(root.isLeftOf(2.5));
    }

    @Test
    public void testPathLength() {
        assertEquals(2.0, tree.pathLength(1.0));
        assertEquals(2.0, tree.pathLength(3.7));
        assertEquals(2.0, tree.pathLength(-100.0));
        assertEquals(2.0, tree.pathLength(1e9));
    }

    @Test
    public void testIdenticalValuesFormOneLeaf() {
        IsolationTree constant = IsolationTree.build(new double[] { 5, 5, 5 }, 8, SplitPolicy.MIDPOINT, null);
        assertThat(constant.getRoot(), instanceOf(LeafNode.class));
        assertEquals(3, constant.getMass());
        assertThat(constant.pathLength(5.0), closeTo(averagePathLength(3), EPSILON));
    }

    @Test
    public void testDepthLimit() {
        IsolationTree shallow = IsolationTree.build(new double[] { 1, 2, 3, 4 }, 0, SplitPolicy.MIDPOINT, null);
        assertTrue(shallow.getRoot().isLeaf());
        assertEquals(0, shallow.getHeight());

        IsolationTree oneLevel = IsolationTree.build(new double[] { 1, 2, 3, 4 }, 1, SplitPolicy.MIDPOINT, null);
        assertEquals(1, oneLevel.getHeight());
        assertThat(oneLevel.pathLength(1.0), closeTo(1 + averagePathLength(2), EPSILON));
    }

    @Test
    public void testEmptySample() {
        IsolationTree empty = IsolationTree.build(new double[0], 4, SplitPolicy.MIDPOINT, null);
        assertEquals(0, empty.getMass());
        assertThat(empty.pathLength(1.0), is(0.0));
    }

    @Test
    public void testRandomSplitUsesGenerator() {
        Random random = mock(Random.class);
        when(random.nextDouble()).thenReturn(0.25);

        IsolationTree randomTree = IsolationTree.build(new double[] { 0, 8 }, 4, SplitPolicy.UNIFORM_RANDOM, random);
        assertEquals(2.0, ((InternalNode) randomTree.getRoot()).getSplitValue());
        verify(random, times(1)).nextDouble();
    }

    @Test
    public void testRandomSplitRequiresGenerator() {
        assertThrows(IllegalArgumentException.class,
                () -> IsolationTree.build(new double[] { 1, 2 }, 4, SplitPolicy.UNIFORM_RANDOM, null));
        assertThrows(IllegalArgumentException.class,
                () -> IsolationTree.build(new double[] { 1, 2 }, -1, SplitPolicy.MIDPOINT, null));
    }

    @Test
    public void testBuildCopiesSample() {
        double[] sample = { 1, 2, 3, 4 };
        IsolationTree copy = IsolationTree.build(sample, 2, SplitPolicy.MIDPOINT, null);
        sample[0] = 100;
        assertEquals(2.5, ((InternalNode) copy.getRoot()).getSplitValue());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testTraverseVisitsPathInOrder() {
        Visitor<String> visitor = mock(Visitor.class);
        when(visitor.getResult()).thenReturn("done");

        assertEquals("done", tree.traverse(3.0, visitor));

        verify(visitor).accept(eq((InternalNode) tree.getRoot()), eq(0));
        verify(visitor).accept(eq((InternalNode) ((InternalNode) tree.getRoot()).getRightChild()), eq(1));
        verify(visitor, times(2)).accept(any(InternalNode.class), anyInt());
        verify(visitor).acceptLeaf(any(LeafNode.class), eq(2));
    }
}
