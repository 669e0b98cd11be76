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

import static com.amazon.trafficanomaly.CommonUtils.checkArgument;
import static com.amazon.trafficanomaly.CommonUtils.checkNotNull;

import java.util.Random;

import com.amazon.trafficanomaly.config.SamplingStrategy;

/**
 * Draws the per-tree training samples of an isolation forest.
 */
public class TrainingSampler {

    private final SamplingStrategy strategy;

    private final Random random;

    /**
     * @param strategy the sampling strategy
     * @param random   the generator for the randomized strategies; may be null
     *                 for {@link SamplingStrategy#STRIDE}
     */
    public TrainingSampler(SamplingStrategy strategy, Random random) {
        this.strategy = checkNotNull(strategy, "strategy must not be null");
        checkArgument(strategy == SamplingStrategy.STRIDE || random != null,
                "a random generator is required for " + strategy);
        this.random = random;
    }

    /**
     * @param data       the training data; not modified
     * @param sampleSize the requested sample size, at most data.length
     * @return the sample for one tree
     */
    public double[] sample(double[] data, int sampleSize) {
        checkNotNull(data, "data must not be null");
        checkArgument(sampleSize > 0 && sampleSize <= data.length, "sample size must be in [1, data.length]");
        switch (strategy) {
        case UNIFORM_RANDOM:
            return uniformSample(data, sampleSize);
        case BOOTSTRAP:
            return bootstrapSample(data, sampleSize);
        case STRIDE:
        default:
            return strideSample(data, sampleSize);
        }
    }

    /**
     * Every k-th value starting with the first, where k = n / sampleSize + 1. The
     * result can be shorter than sampleSize.
     *
     * @param data       the training data
     * @param sampleSize the requested sample size
     * @return the strided values in their original order
     */
    public static double[] strideSample(double[] data, int sampleSize) {
        int stride = data.length / sampleSize + 1;
        double[] sample = new double[(data.length + stride - 1) / stride];
        for (int i = 0, j = 0; i < data.length; i += stride, j++) {
            sample[j] = data[i];
        }
        return sample;
    }

    // partial Fisher-Yates shuffle over the indexes
    double[] uniformSample(double[] data, int sampleSize) {
        int[] indexes = new int[data.length];
        for (int i = 0; i < indexes.length; i++) {
            indexes[i] = i;
        }
        double[] sample = new double[sampleSize];
        for (int i = 0; i < sampleSize; i++) {
            int j = i + random.nextInt(indexes.length - i);
            int swap = indexes[i];
            indexes[i] = indexes[j];
            indexes[j] = swap;
            sample[i] = data[indexes[i]];
        }
        return sample;
    }

    double[] bootstrapSample(double[] data, int sampleSize) {
        double[] sample = new double[sampleSize];
        for (int i = 0; i < sampleSize; i++) {
            sample[i] = data[random.nextInt(data.length)];
        }
        return sample;
    }

    public SamplingStrategy getStrategy() {
        return strategy;
    }
}
