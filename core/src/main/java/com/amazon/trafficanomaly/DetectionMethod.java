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

package com.amazon.trafficanomaly;

import com.amazon.trafficanomaly.inputtypes.DataPoint;
import com.amazon.trafficanomaly.returntypes.AnomalyResult;

/**
 * A named entry of the pipeline registry: runs one detector on one data point.
 * Implementations may update detector state as a side effect and must return a
 * result for every input.
 */
@FunctionalInterface
public interface DetectionMethod {

    AnomalyResult detect(DataPoint point);
}
