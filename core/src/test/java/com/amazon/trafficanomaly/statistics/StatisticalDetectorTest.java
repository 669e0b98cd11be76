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

import static com.amazon.trafficanomaly.returntypes.AnomalyResult.INSUFFICIENT_DATA;
import static com.amazon.trafficanomaly.returntypes.AnomalyResult.ZERO_VARIANCE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.trafficanomaly.returntypes.AnomalyResult;

public class StatisticalDetectorTest {

    private static final double EPSILON = 1e-9;

    private StatisticalDetector detector;

    @BeforeEach
    public void setUp() {
        detector = new StatisticalDetector(10);
    }

    @Test
    public void testZscoreInsufficientData() {
        AnomalyResult result = detector.zscoreDetection(5.0);
        assertFalse(result.isAnomaly());
        assertEquals(0.0, result.getScore());
        assertEquals(Optional.of(INSUFFICIENT_DATA), result.getReason());
        assertEquals(StatisticalDetector.ZSCORE, result.getMethod());
        assertEquals(1, detector.getWindowValues().length);
    }

    @Test
    public void testZscoreZeroVariance() {
        for (int i = 0; i < 4; i++) {
            detector.addPoint(5.0);
        }
        AnomalyResult result = detector.zscoreDetection(5.0);
        assertFalse(result.isAnomaly());
        assertEquals(Optional.of(ZERO_VARIANCE), result.getReason());
    }

    @Test
    public void testZscoreConstantFullWindow() {
        StatisticalDetector small = new StatisticalDetector(5);
        for (int i = 0; i < 5; i++) {
            small.addPoint(10.0);
        }
        AnomalyResult result = small.zscoreDetection(10.0);
        assertFalse(result.isAnomaly());
        assertEquals(0.0, result.getScore());
        assertEquals(Optional.of(ZERO_VARIANCE), result.getReason());
        assertEquals(5, small.getWindowValues().length);
    }

    // a single outlier among n values has a z-score of at most (n - 1) / sqrt(n),
    // about 1.79 for a window of 5, so the spike needs the larger window
    @Test
    public void testZscoreSpike() {
        for (int i = 1; i <= 5; i++) {
            detector.addPoint(i);
        }
        AnomalyResult result = detector.zscoreDetection(100.0, 2.0);

        assertTrue(result.isAnomaly());
        assertThat(result.getScore(), greaterThan(2.0));
        assertEquals(2.0, result.getThreshold());
        assertThat(result.getDetail("mean").get().asDouble(), closeTo(115.0 / 6, EPSILON));
        assertEquals(result.getScore(), result.getDetail("zscore").get().asDouble());
    }

    @Test
    public void testZscoreOrdinaryValue() {
        for (int i = 1; i <= 5; i++) {
            detector.addPoint(i);
        }
        AnomalyResult result = detector.zscoreDetection(3.0);
        assertFalse(result.isAnomaly());
        assertThat(result.getScore(), closeTo(0.0, EPSILON));
    }

    @Test
    public void testReadsAreIdempotent() {
        detector.addPoint(1.0);
        detector.addPoint(3.0);

        double mean = detector.calculateMean();
        double std = detector.calculateStd();
        assertEquals(mean, detector.calculateMean());
        assertEquals(std, detector.calculateStd());
        assertEquals(2.0, mean);
        assertEquals(1.0, std);
        assertEquals(2, detector.getWindowValues().length);
    }

    @Test
    public void testStdOfSingleValue() {
        detector.addPoint(7.0);
        assertEquals(0.0, detector.calculateStd());
        assertEquals(7.0, detector.calculateMean());
    }

    @Test
    public void testIqrInsufficientData() {
        detector.addPoint(1.0);
        detector.addPoint(2.0);
        AnomalyResult result = detector.iqrDetection(3.0);
        assertFalse(result.isAnomaly());
        assertEquals(0.0, result.getThreshold());
        assertEquals(Optional.of(INSUFFICIENT_DATA), result.getReason());
    }

    @Test
    public void testIqrOutlier() {
        for (int i = 1; i <= 8; i++) {
            detector.addPoint(i);
        }
        AnomalyResult result = detector.iqrDetection(100.0);

        assertTrue(result.isAnomaly());
        assertEquals(StatisticalDetector.DEFAULT_IQR_MULTIPLIER, result.getThreshold());
        assertEquals(3.0, result.getDetail("q1").get().asDouble());
        assertEquals(7.0, result.getDetail("q3").get().asDouble());
        assertEquals(4.0, result.getDetail("iqr").get().asDouble());
        assertEquals(-3.0, result.getDetail("lower_bound").get().asDouble());
        assertEquals(13.0, result.getDetail("upper_bound").get().asDouble());
        assertThat(result.getScore(), closeTo(87.0 / 4, EPSILON));
    }

    @Test
    public void testIqrInlierHasZeroScore() {
        for (int i = 1; i <= 8; i++) {
            detector.addPoint(i);
        }
        AnomalyResult result = detector.iqrDetection(5.0);
        assertFalse(result.isAnomaly());
        assertEquals(0.0, result.getScore());
        assertEquals(6.0, result.getDetail("q3").get().asDouble());
    }

    @Test
    public void testMadOutlier() {
        for (int i = 10; i <= 14; i++) {
            detector.addPoint(i);
        }
        AnomalyResult result = detector.madDetection(50.0);

        assertTrue(result.isAnomaly());
        assertEquals(13.0, result.getDetail("median").get().asDouble());
        assertEquals(2.0, result.getDetail("mad").get().asDouble());
        assertThat(result.getScore(), closeTo(StatisticalDetector.MAD_SCALE * 37 / 2, EPSILON));
    }

    @Test
    public void testMadOfConstantWindowIsReplacedByOne() {
        for (int i = 0; i < 5; i++) {
            detector.addPoint(4.0);
        }
        AnomalyResult result = detector.madDetection(4.0);
        assertFalse(result.isAnomaly());
        assertEquals(1.0, result.getDetail("mad").get().asDouble());
        assertThat(result.getScore(), is(0.0));
    }

    @Test
    public void testMadInsufficientData() {
        AnomalyResult result = detector.madDetection(4.0);
        assertEquals(Optional.of(INSUFFICIENT_DATA), result.getReason());
        assertEquals(StatisticalDetector.DEFAULT_MAD_THRESHOLD, result.getThreshold());
    }

    @Test
    public void testWindowValuesAreACopy() {
        detector.addPoint(1.0);
        detector.addPoint(2.0);

        double[] values = detector.getWindowValues();
        values[0] = 50.0;

        assertEquals(1.0, detector.getWindowValues()[0]);
        assertEquals(1.5, detector.calculateMean());
    }

    @Test
    public void testWindowKeepsMostRecentValues() {
        for (int i = 0; i < 25; i++) {
            detector.addPoint(i);
        }
        assertEquals(10, detector.getWindowValues().length);
        assertEquals(15.0, detector.getWindowValues()[0]);
        assertEquals(19.5, detector.calculateMean());
    }
}
