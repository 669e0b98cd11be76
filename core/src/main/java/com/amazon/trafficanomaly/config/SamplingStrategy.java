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

package com.amazon.trafficanomaly.config;

/**
 * How an isolation forest draws the training sample of each tree.
 */
public enum SamplingStrategy {

    /**
     * Take every k-th value of the training data, with k = n / sampleSize + 1.
     * Fully deterministic; every tree receives the same sample. This is the
     * default.
     */
    STRIDE,

    /**
     * Draw sampleSize values without replacement, using the seeded generator of
     * the forest.
     */
    UNIFORM_RANDOM,

    /**
     * Draw sampleSize values with replacement, using the seeded generator of the
     * forest.
     */
    BOOTSTRAP
}
