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
 * What the pipeline does with a requested detection method name that is not in
 * its registry.
 */
public enum UnknownMethodPolicy {

    /**
     * ignore the name (after logging a warning) and run the remaining methods
     */
    SKIP,

    /**
     * fail the call with an UnknownDetectionMethodException before any detector
     * runs
     */
    REJECT
}
