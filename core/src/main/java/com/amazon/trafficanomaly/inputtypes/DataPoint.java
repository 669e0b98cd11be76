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

package com.amazon.trafficanomaly.inputtypes;

import lombok.Getter;

/**
 * A single observation of a gateway metric.
 */
@Getter
public class DataPoint {

    // seconds or any other monotone unit; only differences are used
    private final double timestamp;

    private final double value;

    // behavioral pattern the observation belongs to, may be null
    private final String patternKey;

    public DataPoint(double timestamp, double value) {
        this(timestamp, value, null);
    }

    public DataPoint(double timestamp, double value, String patternKey) {
        this.timestamp = timestamp;
        this.value = value;
        this.patternKey = patternKey;
    }

    @Override
    public String toString() {
        return String.format("DataPoint(timestamp=%s, value=%s, patternKey=%s)", timestamp, value, patternKey);
    }
}
