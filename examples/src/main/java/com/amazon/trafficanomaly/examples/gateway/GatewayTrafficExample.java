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

package com.amazon.trafficanomaly.examples.gateway;

import lombok.extern.slf4j.Slf4j;

import com.amazon.trafficanomaly.AnomalyDetectionPipeline;
import com.amazon.trafficanomaly.examples.Example;
import com.amazon.trafficanomaly.returntypes.AnomalyResult;
import com.amazon.trafficanomaly.testutils.TrafficTestData;

/**
 * Train the default pipeline on a rising request-rate series, then replay the
 * series with a spike and a drop injected and print every value the ensemble
 * flags.
 */
@Slf4j
public class GatewayTrafficExample implements Example {

    public static void main(String[] args) throws Exception {
        new GatewayTrafficExample().run();
    }

    @Override
    public String command() {
        return "gateway";
    }

    @Override
    public String description() {
        return "flag request-rate spikes and drops with the default ensemble";
    }

    @Override
    public void run() throws Exception {
        int dataSize = 200;
        double[] normalData = TrafficTestData.linearWithCycle(dataSize);

        double[] testData = normalData.clone();
        testData[50] = 200; // spike
        testData[100] = 10; // drop

        AnomalyDetectionPipeline pipeline = new AnomalyDetectionPipeline();
        pipeline.train(normalData);
        log.info("Pipeline trained on {} values", dataSize);

        int flagged = 0;
        for (int i = 0; i < testData.length; i++) {
            AnomalyResult ensemble = pipeline.aggregateResults(pipeline.detect(testData[i]));
            if (ensemble.isAnomaly()) {
                flagged++;
                System.out.printf("Index %d: value %.2f - ANOMALY (score: %.2f)%n", i, testData[i],
                        ensemble.getScore());
                System.out.printf("  Details: %s%n", ensemble.getDetails());
            }
        }

        System.out.printf("%d of %d values flagged%n", flagged, testData.length);
    }
}
