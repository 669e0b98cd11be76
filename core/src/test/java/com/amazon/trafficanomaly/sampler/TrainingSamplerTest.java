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

package com.amazon.trafficanomaly.sampler;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.trafficanomaly.config.SamplingStrategy;

public class TrainingSamplerTest {

    private double[] data;

    @BeforeEach
    public void setUp() {
        data = new double[10];
        for (int i = 0; i < data.length; i++) {
            data[i] = i;
        }
    }

    @Test
    public void testStrideSample() {
        assertArrayEquals(new double[] { 0, 3, 6, 9 }, TrainingSampler.strideSample(data, 5));
        assertArrayEquals(new double[] { 0, 2, 4, 6, 8 }, TrainingSampler.strideSample(data, 10));
        assertArrayEquals(new double[] { 0 }, TrainingSampler.strideSample(data, 1));
    }

    @Test
    public void testStrideSamplerIsDeterministic() {
        TrainingSampler sampler = new TrainingSampler(SamplingStrategy.STRIDE, null);
        assertArrayEquals(sampler.sample(data, 5), sampler.sample(data, 5));
        assertEquals(SamplingStrategy.STRIDE, sampler.getStrategy());
    }

    @Test
    public void testUniformSampleWithoutReplacement() {
        TrainingSampler sampler = new TrainingSampler(SamplingStrategy.UNIFORM_RANDOM, new Random(42));
        double[] sample = sampler.sample(data, 6);

        assertEquals(6, sample.length);
        assertEquals(6, Arrays.stream(sample).distinct().count());
        for (double value : sample) {
            assertThat(value, greaterThanOrEqualTo(0.0));
            assertThat(value, lessThan(10.0));
        }

        double[] all = sampler.sample(data, data.length);
        Arrays.sort(all);
        assertArrayEquals(data, all);
    }

    @Test
    public void testBootstrapSample() {
        TrainingSampler sampler = new TrainingSampler(SamplingStrategy.BOOTSTRAP, new Random(7));
        double[] sample = sampler.sample(data, 10);
        assertEquals(10, sample.length);
        for (double value : sample) {
            assertEquals(Math.rint(value), value);
            assertThat(value, lessThan(10.0));
        }
    }

    @Test
    public void testSeededSamplersAgree() {
        TrainingSampler first = new TrainingSampler(SamplingStrategy.UNIFORM_RANDOM, new Random(3));
        TrainingSampler second = new TrainingSampler(SamplingStrategy.UNIFORM_RANDOM, new Random(3));
        assertArrayEquals(first.sample(data, 4), second.sample(data, 4));
    }

    @Test
    public void testInvalidArguments() {
        TrainingSampler sampler = new TrainingSampler(SamplingStrategy.STRIDE, null);
        assertThrows(IllegalArgumentException.class, () -> sampler.sample(data, 0));
        assertThrows(IllegalArgumentException.class, () -> sampler.sample(data, 11));
        assertThrows(IllegalArgumentException.class, () -> new TrainingSampler(SamplingStrategy.BOOTSTRAP, null));
        assertThrows(NullPointerException.class, () -> new TrainingSampler(null, new Random()));
    }
}
