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
import static com.amazon.trafficanomaly.CommonUtils.mean;
import static com.amazon.trafficanomaly.CommonUtils.populationStandardDeviation;
import static com.amazon.trafficanomaly.returntypes.AnomalyResult.INSUFFICIENT_DATA;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AccessLevel;
import lombok.Getter;

import com.amazon.trafficanomaly.returntypes.AnomalyResult;
import com.amazon.trafficanomaly.returntypes.DetailValue;
import com.amazon.trafficanomaly.util.BoundedWindow;

/**
 * Detects values that do not fit the trend and the seasonal pattern of a
 * series. The history is decomposed additively into trend, seasonal and
 * residual components, and the latest residual is tested with a Z-score against
 * all residuals.
 * <p>
 * The history keeps the most recent {@code seasonality * historyPeriods}
 * values.
 */
@Getter
public class TimeSeriesDetector {

    public static final String TIME_SERIES = "time_series";

    public static final int DEFAULT_SEASONALITY = 24;

    public static final int DEFAULT_HISTORY_PERIODS = 10;

    public static final double DEFAULT_THRESHOLD = 3.0;

    private final int seasonality;

    private final int historyPeriods;

    @Getter(AccessLevel.NONE)
    private final BoundedWindow history;

    public TimeSeriesDetector() {
        this(DEFAULT_SEASONALITY);
    }

    public TimeSeriesDetector(int seasonality) {
        this(seasonality, DEFAULT_HISTORY_PERIODS);
    }

    /**
     * @param seasonality    the length of one seasonal period, in points
     * @param historyPeriods how many periods of history to keep; at least 2, since
     *                       a decomposition needs two full periods
     */
    public TimeSeriesDetector(int seasonality, int historyPeriods) {
        checkArgument(seasonality > 0, "seasonality must be greater than 0");
        checkArgument(historyPeriods >= 2, "at least two periods of history are required");
        checkArgument((long) seasonality * historyPeriods <= Integer.MAX_VALUE, "history capacity is too large");
        this.seasonality = seasonality;
        this.historyPeriods = historyPeriods;
        this.history = new BoundedWindow(seasonality * historyPeriods);
    }

    public void addPoint(double value) {
        history.add(value);
    }

    /**
     * @return a copy of the history, oldest value first
     */
    public double[] getHistoryValues() {
        return history.toArray();
    }

    /**
     * Decompose the history. With fewer than two full periods the trend is the
     * history itself and the other two components are zero.
     * <p>
     * The trend is a centered moving average: the sum over the window
     * [i - s/2, i + s/2] divided by s, where s is the seasonality. Points closer
     * than s/2 to either end keep their own value as trend. The seasonal component
     * is the mean detrended value of each phase i mod s.
     *
     * @return the decomposition of the current history
     */
    public SeasonalDecomposition seasonalDecompose() {
        double[] values = history.toArray();
        int n = values.length;
        if (n < 2 * seasonality) {
            return new SeasonalDecomposition(values, new double[n], new double[n]);
        }

        int half = seasonality / 2;
        double[] trend = new double[n];
        for (int i = 0; i < n; i++) {
            if (i < half || i >= n - half) {
                trend[i] = values[i];
            } else {
                double sum = 0;
                for (int j = i - half; j < i + half + 1; j++) {
                    sum += values[j];
                }
                trend[i] = sum / seasonality;
            }
        }

        double[] seasonal = new double[n];
        for (int phase = 0; phase < seasonality; phase++) {
            double sum = 0;
            int count = 0;
            for (int j = phase; j < n; j += seasonality) {
                sum += values[j] - trend[j];
                count++;
            }
            double average = sum / count;
            for (int j = phase; j < n; j += seasonality) {
                seasonal[j] = average;
            }
        }

        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            residual[i] = values[i] - trend[i] - seasonal[i];
        }
        return new SeasonalDecomposition(trend, seasonal, residual);
    }

    public AnomalyResult detectAnomaly(double value) {
        return detectAnomaly(value, DEFAULT_THRESHOLD);
    }

    public AnomalyResult detectAnomaly(double value, double threshold) {
        addPoint(value);
        if (history.size() < 2 * seasonality) {
            return AnomalyResult.withoutVerdict(TIME_SERIES, threshold, INSUFFICIENT_DATA);
        }

        SeasonalDecomposition decomposition = seasonalDecompose();
        double[] residual = decomposition.getResidual();
        double residualMean = mean(residual);
        double residualStd = populationStandardDeviation(residual, residualMean);
        if (residualStd == 0) {
            residualStd = 1.0;
        }

        int last = residual.length - 1;
        double currentResidual = residual[last];
        double zscore = Math.abs(currentResidual - residualMean) / residualStd;

        Map<String, DetailValue> details = new LinkedHashMap<>();
        details.put("trend", DetailValue.of(decomposition.getTrend()[last]));
        details.put("seasonal", DetailValue.of(decomposition.getSeasonal()[last]));
        details.put("residual", DetailValue.of(currentResidual));
        details.put("zscore", DetailValue.of(zscore));
        return new AnomalyResult(zscore > threshold, zscore, threshold, TIME_SERIES, details);
    }
}
