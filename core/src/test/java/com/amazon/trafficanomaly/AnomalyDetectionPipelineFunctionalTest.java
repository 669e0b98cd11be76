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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.amazon.trafficanomaly.returntypes.AnomalyResult;
import com.amazon.trafficanomaly.testutils.TrafficTestData;

@Tag("functional")
public class AnomalyDetectionPipelineFunctionalTest {

    private AnomalyDetectionPipeline pipeline;

    @BeforeEach
    public void setUp() {
        pipeline = new AnomalyDetectionPipeline();
        pipeline.train(TrafficTestData.linearWithCycle(200));
    }

    @Test
    public void testSpikeIsFlaggedByMajority() {
        Map<String, AnomalyResult> results = pipeline.detect(5000.0);
        AnomalyResult ensemble = pipeline.aggregateResults(results);

        assertTrue(results.get("zscore").isAnomaly());
        assertTrue(results.get("iqr").isAnomaly());
        assertTrue(results.get("mad").isAnomaly());
        assertTrue(ensemble.isAnomaly());
        assertThat(ensemble.getDetail("anomaly_count").get().asLong(), greaterThanOrEqualTo(3L));
    }

    @Test
    public void testDropIsFlaggedByMajority() {
        AnomalyResult ensemble = pipeline.aggregateResults(pipeline.detect(10.0));
        assertTrue(ensemble.isAnomaly());
    }

    @Test
    public void testContinuationIsNotFlagged() {
        Map<String, AnomalyResult> results = pipeline.detect(200.0);
        AnomalyResult ensemble = pipeline.aggregateResults(results);

        assertFalse(results.get("zscore").isAnomaly());
        assertFalse(results.get("iqr").isAnomaly());
        assertFalse(results.get("mad").isAnomaly());
        assertFalse(ensemble.isAnomaly());
        assertThat(ensemble.getDetail("anomaly_count").get().asLong(), lessThanOrEqualTo(1L));
    }
}
