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

import static com.amazon.trafficanomaly.CommonUtils.checkArgument;

import java.util.Arrays;

/**
 * A fixed capacity FIFO buffer of doubles. Once the buffer is full, every
 * insertion evicts the oldest value. Values are stored in a circular array that
 * grows on demand up to the capacity.
 */
public class BoundedWindow {

    static final int INITIAL_STORE_SIZE = 16;

    private final int capacity;

    private double[] store;

    // position of the oldest value in store
    private int start;

    private int size;

    public BoundedWindow(int capacity) {
        checkArgument(capacity > 0, "capacity must be greater than 0");
        this.capacity = capacity;
        this.store = new double[Math.min(capacity, INITIAL_STORE_SIZE)];
        this.start = 0;
        this.size = 0;
    }

    /**
     * Append a value, evicting the oldest value if the window is full.
     *
     * @param value the value to append
     */
    public void add(double value) {
        if (size == capacity) {
            store[start] = value;
            start = (start + 1) % capacity;
            return;
        }
        if (size == store.length) {
            grow();
        }
        store[(start + size) % store.length] = value;
        size++;
    }

    /**
     * @param index position counted from the oldest value
     * @return the value at that position
     */
    public double get(int index) {
        checkArgument(index >= 0 && index < size, "index out of range");
        return store[(start + index) % store.length];
    }

    /**
     * @return the most recently added value
     */
    public double getLast() {
        checkArgument(size > 0, "window is empty");
        return get(size - 1);
    }

    /**
     * @return a copy of the values, oldest first
     */
    public double[] toArray() {
        double[] result = new double[size];
        for (int i = 0; i < size; i++) {
            result[i] = store[(start + i) % store.length];
        }
        return result;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == capacity;
    }

    public void clear() {
        start = 0;
        size = 0;
    }

    // the window is never full while growing, so values are unrolled into order
    private void grow() {
        double[] values = toArray();
        store = Arrays.copyOf(values, (int) Math.min(capacity, 2L * store.length));
        start = 0;
    }
}
