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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class RunningStatisticsTest {

    @Test
    public void testUpdate() {
        RunningStatistics statistics = new RunningStatistics();
        for (double value : new double[] { 2, 4, 4, 4, 5, 5, 7, 9 }) {
            statistics.update(value);
        }

        assertEquals(8, statistics.getCount());
        assertThat(statistics.getMean(), closeTo(5.0, 1e-12));
        assertThat(statistics.getDeviation(), closeTo(2.0, 1e-12));
        assertEquals(2.0, statistics.getMin());
        assertEquals(9.0, statistics.getMax());
    }

    @Test
    public void testEmpty() {
        RunningStatistics statistics = new RunningStatistics();
        assertTrue(statistics.isEmpty());
        assertThrows(IllegalArgumentException.class, statistics::getMean);
        assertThrows(IllegalArgumentException.class, statistics::getDeviation);
    }

    @Test
    public void testReset() {
        RunningStatistics statistics = new RunningStatistics();
        statistics.update(3.0);
        statistics.reset();
        assertTrue(statistics.isEmpty());
        statistics.update(1.0);
        assertEquals(1.0, statistics.getMean());
        assertEquals(0.0, statistics.getDeviation());
    }
}
