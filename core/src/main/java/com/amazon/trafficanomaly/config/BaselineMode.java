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
 * How a behavioral baseline is maintained when new values are learned for a
 * pattern.
 */
public enum BaselineMode {

    /**
     * Keep the (capped) value history of every pattern and recompute mean,
     * standard deviation, minimum and maximum over the whole history after each
     * batch. Cost is linear in the history length per batch.
     */
    RECOMPUTE,

    /**
     * Fold each value into a running (Welford) accumulator and keep no history.
     * Constant cost per value. The accumulated statistics cover every value ever
     * learned for the pattern and can differ from RECOMPUTE in the last bits.
     */
    INCREMENTAL
}
