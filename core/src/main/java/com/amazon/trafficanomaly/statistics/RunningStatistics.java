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

package com.amazon.trafficanomaly.statistics;

import static com.amazon.trafficanomaly.CommonUtils.checkArgument;

import lombok.Getter;

/**
 * Running mean, population standard deviation, minimum and maximum of a stream
 * of values, updated in constant time per value (Welford's method).
 */
public class RunningStatistics {

    @Getter
    protected long count = 0;

    protected double mean = 0;

    // sum of squared differences from the current mean
    protected double sumOfSquares = 0;

    protected double min = Double.POSITIVE_INFINITY;

    protected double max = Double.NEGATIVE_INFINITY;

    public void update(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        sumOfSquares += delta * (value - mean);
        min = Math.min(min, value);
        max = Math.max(max, value);
    }

    public double getMean() {
        checkArgument(count > 0, "incorrect invocation for mean");
        return mean;
    }

    public double getDeviation() {
        checkArgument(count > 0, "incorrect invocation for standard deviation");
        double variance = sumOfSquares / count;
        return (variance > 0) ? Math.sqrt(variance) : 0;
    }

    public double getMin() {
        checkArgument(count > 0, "incorrect invocation for minimum");
        return min;
    }

    public double getMax() {
        checkArgument(count > 0, "incorrect invocation for maximum");
        return max;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public void reset() {
        count = 0;
        mean = 0;
        sumOfSquares = 0;
        min = Double.POSITIVE_INFINITY;
        max = Double.NEGATIVE_INFINITY;
    }
}
