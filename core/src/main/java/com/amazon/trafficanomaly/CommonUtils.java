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

import java.util.Objects;

/**
 * A collection of common utility functions.
 */
public class CommonUtils {

    /**
     * The Euler-Mascheroni constant, truncated to the precision used when
     * normalizing isolation path lengths.
     */
    public static final double EULER_MASCHERONI = 0.5772156649;

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * The expected path length of an unsuccessful search in a binary search tree
     * built over {@code n} items. Isolation path lengths are normalized by this
     * value; leaves that hold more than one item also add it to the depth at which
     * the traversal stopped.
     *
     * @param n the number of items
     * @return c(n), which is 0 for n &lt;= 1
     */
    public static double averagePathLength(int n) {
        if (n <= 1) {
            return 0;
        }
        return 2 * (Math.log(n - 1) + EULER_MASCHERONI) - 2.0 * (n - 1) / n;
    }

    /**
     * The arithmetic mean of the values, 0 for an empty array.
     *
     * @param values the values
     * @return the mean
     */
    public static double mean(double[] values) {
        checkNotNull(values, "values must not be null");
        if (values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * The population standard deviation (divisor n) of the values around the
     * supplied mean, 0 for an empty array.
     *
     * @param values the values
     * @param mean   the mean of the values
     * @return the standard deviation
     */
    public static double populationStandardDeviation(double[] values, double mean) {
        checkNotNull(values, "values must not be null");
        if (values.length == 0) {
            return 0;
        }
        double sumOfSquares = 0;
        for (double value : values) {
            sumOfSquares += (value - mean) * (value - mean);
        }
        return Math.sqrt(sumOfSquares / values.length);
    }
}
