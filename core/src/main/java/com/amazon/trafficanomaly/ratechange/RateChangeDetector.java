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

package com.amazon.trafficanomaly.ratechange;

import static com.amazon.trafficanomaly.CommonUtils.mean;
import static com.amazon.trafficanomaly.CommonUtils.populationStandardDeviation;
import static com.amazon.trafficanomaly.returntypes.AnomalyResult.INSUFFICIENT_DATA;
import static com.amazon.trafficanomaly.returntypes.AnomalyResult.NO_RATE_DATA;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import com.amazon.trafficanomaly.returntypes.AnomalyResult;
import com.amazon.trafficanomaly.returntypes.DetailValue;
import com.amazon.trafficanomaly.util.BoundedWindow;

/**
 * Detects abrupt changes in the rate of change of a timestamped series. Rates
 * are computed between consecutive points of a sliding window; the latest rate
 * is compared with the distribution of all rates in the window.
 */
public class RateChangeDetector {

    public static final String RATE_CHANGE = "rate_change";

    public static final int DEFAULT_WINDOW_SIZE = 10;

    public static final double DEFAULT_THRESHOLD = 2.0;

    private final BoundedWindow timestamps;

    private final BoundedWindow values;

    public RateChangeDetector() {
        this(DEFAULT_WINDOW_SIZE);
    }

    public RateChangeDetector(int windowSize) {
        this.timestamps = new BoundedWindow(windowSize);
        this.values = new BoundedWindow(windowSize);
    }

    public void addPoint(double timestamp, double value) {
        timestamps.add(timestamp);
        values.add(value);
    }

    /**
     * @return the rates between consecutive points whose timestamps increase;
     *         pairs with a non-positive time difference are skipped
     */
    public double[] calculateRates() {
        double[] rates = new double[Math.max(0, values.size() - 1)];
        int count = 0;
        for (int i = 1; i < values.size(); i++) {
            double timeDifference = timestamps.get(i) - timestamps.get(i - 1);
            if (timeDifference > 0) {
                rates[count++] = (values.get(i) - values.get(i - 1)) / timeDifference;
            }
        }
        return Arrays.copyOf(rates, count);
    }

    public AnomalyResult detectRateChange() {
        return detectRateChange(DEFAULT_THRESHOLD);
    }

    /**
     * @param threshold the Z-score of the latest rate at or above which the change
     *                  is anomalous
     * @return the result
     */
    public AnomalyResult detectRateChange(double threshold) {
        if (values.size() < 3) {
            return AnomalyResult.withoutVerdict(RATE_CHANGE, threshold, INSUFFICIENT_DATA);
        }

        double[] rates = calculateRates();
        if (rates.length == 0) {
            return AnomalyResult.withoutVerdict(RATE_CHANGE, threshold, NO_RATE_DATA);
        }

        double meanRate = mean(rates);
        double stdRate = populationStandardDeviation(rates, meanRate);
        if (stdRate == 0) {
            stdRate = 1.0;
        }
        double currentRate = rates[rates.length - 1];
        double zscore = Math.abs(currentRate - meanRate) / stdRate;

        Map<String, DetailValue> details = new LinkedHashMap<>();
        details.put("current_rate", DetailValue.of(currentRate));
        details.put("mean_rate", DetailValue.of(meanRate));
        details.put("std_rate", DetailValue.of(stdRate));
        details.put("zscore", DetailValue.of(zscore));
        return new AnomalyResult(zscore >= threshold, zscore, threshold, RATE_CHANGE, details);
    }

    public int size() {
        return values.size();
    }

    public int getWindowSize() {
        return values.capacity();
    }

    public double[] getTimestamps() {
        return timestamps.toArray();
    }

    public double[] getValues() {
        return values.toArray();
    }
}
