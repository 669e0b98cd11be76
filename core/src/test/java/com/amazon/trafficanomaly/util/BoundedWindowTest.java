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

package com.amazon.trafficanomaly.util;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class BoundedWindowTest {

    @Test
    public void testNewWindowIsEmpty() {
        BoundedWindow window = new BoundedWindow(5);
        assertEquals(0, window.size());
        assertEquals(5, window.capacity());
        assertTrue(window.isEmpty());
        assertFalse(window.isFull());
        assertArrayEquals(new double[0], window.toArray());
    }

    @Test
    public void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedWindow(0));
        assertThrows(IllegalArgumentException.class, () -> new BoundedWindow(-3));
    }

    @Test
    public void testEvictsOldestValues() {
        BoundedWindow window = new BoundedWindow(3);
        for (int i = 1; i <= 5; i++) {
            window.add(i);
        }

        assertEquals(3, window.size());
        assertTrue(window.isFull());
        assertArrayEquals(new double[] { 3, 4, 5 }, window.toArray());
        assertEquals(3, window.get(0));
        assertEquals(5, window.getLast());
    }

    @Test
    public void testGrowsPastInitialStore() {
        int capacity = BoundedWindow.INITIAL_STORE_SIZE * 2 + 8;
        BoundedWindow window = new BoundedWindow(capacity);
        for (int i = 0; i < capacity + 10; i++) {
            window.add(i);
            assertEquals(Math.min(i + 1, capacity), window.size());
            assertEquals(i, window.getLast());
        }

        double[] expected = new double[capacity];
        for (int i = 0; i < capacity; i++) {
            expected[i] = i + 10;
        }
        assertArrayEquals(expected, window.toArray());
    }

    @Test
    public void testGetOutOfRange() {
        BoundedWindow window = new BoundedWindow(4);
        assertThrows(IllegalArgumentException.class, window::getLast);
        window.add(1.0);
        assertThrows(IllegalArgumentException.class, () -> window.get(1));
        assertThrows(IllegalArgumentException.class, () -> window.get(-1));
    }

    @Test
    public void testToArrayDoesNotExposeState() {
        BoundedWindow window = new BoundedWindow(2);
        window.add(1.0);
        double[] values = window.toArray();
        values[0] = 42.0;
        assertEquals(1.0, window.get(0));
    }

    @Test
    public void testClear() {
        BoundedWindow window = new BoundedWindow(2);
        window.add(1.0);
        window.add(2.0);
        window.add(3.0);
        window.clear();
        assertTrue(window.isEmpty());

        window.add(7.0);
        assertArrayEquals(new double[] { 7.0 }, window.toArray());
    }
}
