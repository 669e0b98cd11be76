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

package com.amazon.trafficanomaly.timeseries;

import static com.amazon.trafficanomaly.CommonUtils.checkArgument;
import static com.amazon.trafficanomaly.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * The additive components of a series: value[i] = trend[i] + seasonal[i] +
 * residual[i]. All three arrays have the length of the decomposed series.
 */
public class SeasonalDecomposition {

    private final double[] trend;

    private final double[] seasonal;

    private final double[] residual;

    public SeasonalDecomposition(double[] trend, double[] seasonal, double[] residual) {
        checkNotNull(trend, "trend must not be null");
        checkNotNull(seasonal, "seasonal must not be null");
        checkNotNull(residual, "residual must not be null");
        checkArgument(trend.length == seasonal.length && seasonal.length == residual.length,
                "components must have the same length");
        this.trend = Arrays.copyOf(trend, trend.length);
        this.seasonal = Arrays.copyOf(seasonal, seasonal.length);
        this.residual = Arrays.copyOf(residual, residual.length);
    }

    public double[] getTrend() {
        return Arrays.copyOf(trend, trend.length);
    }

    public double[] getSeasonal() {
        return Arrays.copyOf(seasonal, seasonal.length);
    }

    public double[] getResidual() {
        return Arrays.copyOf(residual, residual.length);
    }

    public int getLength() {
        return trend.length;
    }
}
