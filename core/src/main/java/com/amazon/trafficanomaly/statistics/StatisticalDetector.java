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

import static com.amazon.trafficanomaly.CommonUtils.mean;
import static com.amazon.trafficanomaly.CommonUtils.populationStandardDeviation;
import static com.amazon.trafficanomaly.returntypes.AnomalyResult.INSUFFICIENT_DATA;
import static com.amazon.trafficanomaly.returntypes.AnomalyResult.ZERO_VARIANCE;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import com.amazon.trafficanomaly.returntypes.AnomalyResult;
import com.amazon.trafficanomaly.returntypes.DetailValue;
import com.amazon.trafficanomaly.util.BoundedWindow;

/**
 * Outlier tests over a sliding window of the most recent values: Z-score,
 * interquartile range and median absolute deviation. Each test first adds the
 * value under test to the window, so the window statistics include it.
 */
public class StatisticalDetector {

    public static final String ZSCORE = "zscore";
    public static final String IQR = "iqr";
    public static final String MAD = "mad";

    public static final int DEFAULT_WINDOW_SIZE = 100;
    public static final double DEFAULT_ZSCORE_THRESHOLD = 3.0;
    public static final double DEFAULT_IQR_MULTIPLIER = 1.5;
    public static final double DEFAULT_MAD_THRESHOLD = 3.5;

    // scales the MAD so that it estimates the standard deviation of normal data
    static final double MAD_SCALE = 0.6745;

    private final BoundedWindow window;

    public StatisticalDetector() {
        this(DEFAULT_WINDOW_SIZE);
    }

    public StatisticalDetector(int windowSize) {
        this.window = new BoundedWindow(windowSize);
    }

    public void addPoint(double value) {
        window.add(value);
    }

    /**
     * @return a copy of the window, oldest value first
     */
    public double[] getWindowValues() {
        return window.toArray();
    }

    /**
     * @return the mean of the window, 0 if it is empty
     */
    public double calculateMean() {
        return mean(window.toArray());
    }

    /**
     * @return the population standard deviation of the window, 0 if it has fewer
     *         than two values
     */
    public double calculateStd() {
        if (window.size() < 2) {
            return 0.0;
        }
        double[] values = window.toArray();
        return populationStandardDeviation(values, mean(values));
    }

    public AnomalyResult zscoreDetection(double value) {
        return zscoreDetection(value, DEFAULT_ZSCORE_THRESHOLD);
    }

    public AnomalyResult zscoreDetection(double value, double threshold) {
        addPoint(value);
        if (window.size() < 2) {
            return AnomalyResult.withoutVerdict(ZSCORE, threshold, INSUFFICIENT_DATA);
        }

        double mean = calculateMean();
        double std = calculateStd();
        if (std == 0) {
            return AnomalyResult.withoutVerdict(ZSCORE, threshold, ZERO_VARIANCE);
        }

        double zscore = Math.abs((value - mean) / std);
        Map<String, DetailValue> details = new LinkedHashMap<>();
        details.put("mean", DetailValue.of(mean));
        details.put("std", DetailValue.of(std));
        details.put("zscore", DetailValue.of(zscore));
        return new AnomalyResult(zscore > threshold, zscore, threshold, ZSCORE, details);
    }

    public AnomalyResult iqrDetection(double value) {
        return iqrDetection(value, DEFAULT_IQR_MULTIPLIER);
    }

    /**
     * Interquartile fence test. Quartiles are read at the indexes n/4 and 3n/4 of
     * the sorted window, without interpolation.
     *
     * @param value      the value under test
     * @param multiplier the width of the fences in units of the IQR
     * @return the result; the score is the distance to the nearer fence in units
     *         of the IQR when the value is outside the fences, and 0 otherwise
     */
    public AnomalyResult iqrDetection(double value, double multiplier) {
        addPoint(value);
        if (window.size() < 4) {
            return AnomalyResult.withoutVerdict(IQR, 0.0, INSUFFICIENT_DATA);
        }

        double[] sorted = window.toArray();
        Arrays.sort(sorted);
        int n = sorted.length;
        double q1 = sorted[n / 4];
        double q3 = sorted[3 * n / 4];
        double iqr = q3 - q1;

        double lowerBound = q1 - multiplier * iqr;
        double upperBound = q3 + multiplier * iqr;
        boolean anomaly = value < lowerBound || value > upperBound;

        double score = 0.0;
        if (anomaly && iqr > 0) {
            score = Math.min(Math.abs(value - lowerBound), Math.abs(value - upperBound)) / iqr;
        }

        Map<String, DetailValue> details = new LinkedHashMap<>();
        details.put("q1", DetailValue.of(q1));
        details.put("q3", DetailValue.of(q3));
        details.put("iqr", DetailValue.of(iqr));
        details.put("lower_bound", DetailValue.of(lowerBound));
        details.put("upper_bound", DetailValue.of(upperBound));
        return new AnomalyResult(anomaly, score, multiplier, IQR, details);
    }

    public AnomalyResult madDetection(double value) {
        return madDetection(value, DEFAULT_MAD_THRESHOLD);
    }

    /**
     * Modified Z-score test based on the median absolute deviation. The median is
     * the element at index n/2 of the sorted window; a MAD of 0 is replaced by 1.
     *
     * @param value     the value under test
     * @param threshold the modified Z-score above which the value is anomalous
     * @return the result
     */
    public AnomalyResult madDetection(double value, double threshold) {
        addPoint(value);
        if (window.size() < 2) {
            return AnomalyResult.withoutVerdict(MAD, threshold, INSUFFICIENT_DATA);
        }

        double[] sorted = window.toArray();
        Arrays.sort(sorted);
        double median = sorted[sorted.length / 2];

        double[] deviations = new double[sorted.length];
        for (int i = 0; i < sorted.length; i++) {
            deviations[i] = Math.abs(sorted[i] - median);
        }
        Arrays.sort(deviations);
        double mad = deviations[deviations.length / 2];
        if (mad == 0) {
            mad = 1.0;
        }

        double modifiedZscore = MAD_SCALE * Math.abs(value - median) / mad;
        Map<String, DetailValue> details = new LinkedHashMap<>();
        details.put("median", DetailValue.of(median));
        details.put("mad", DetailValue.of(mad));
        details.put("modified_zscore", DetailValue.of(modifiedZscore));
        return new AnomalyResult(modifiedZscore > threshold, modifiedZscore, threshold, MAD, details);
    }
}
