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

package com.amazon.trafficanomaly.examples.behavioral;

import java.util.LinkedHashMap;
import java.util.Map;

import com.amazon.trafficanomaly.behavioral.BehavioralDetector;
import com.amazon.trafficanomaly.config.BaselineMode;
import com.amazon.trafficanomaly.examples.Example;
import com.amazon.trafficanomaly.returntypes.AnomalyResult;
import com.amazon.trafficanomaly.testutils.TrafficTestData;

/**
 * Learn per-client request-rate baselines and check a few observations against
 * them.
 */
public class BehavioralBaselineExample implements Example {

    public static void main(String[] args) throws Exception {
        new BehavioralBaselineExample().run();
    }

    @Override
    public String command() {
        return "behavioral";
    }

    @Override
    public String description() {
        return "compare clients against their own learned request-rate baselines";
    }

    @Override
    public void run() throws Exception {
        BehavioralDetector detector = new BehavioralDetector(BaselineMode.INCREMENTAL);

        // base rate and noise per client
        Map<String, double[]> clients = new LinkedHashMap<>();
        clients.put("mobile-app", new double[] { 120, 10 });
        clients.put("partner-api", new double[] { 900, 60 });
        clients.put("batch-job", new double[] { 15, 2 });

        long seed = 1;
        for (Map.Entry<String, double[]> client : clients.entrySet()) {
            double mu = client.getValue()[0];
            double sigma = client.getValue()[1];
            TrafficTestData generator = new TrafficTestData(mu, sigma, mu, sigma, 0.0, 1.0);
            detector.learnPattern(client.getKey(), generator.generateTestData(500, seed++));
            System.out.printf("%-12s baseline %s%n", client.getKey(), detector.getBaseline(client.getKey()).get());
        }

        check(detector, "mobile-app", 125);
        check(detector, "mobile-app", 400);
        check(detector, "partner-api", 120);
        check(detector, "batch-job", 16);
        check(detector, "unknown-client", 50);
    }

    private static void check(BehavioralDetector detector, String client, double requestsPerMinute) {
        AnomalyResult result = detector.detectDeviation(client, requestsPerMinute);
        String verdict = result.getReason().orElse(result.isAnomaly() ? "ANOMALY" : "normal");
        System.out.printf("%-14s %8.1f req/min -> %s (score %.2f)%n", client, requestsPerMinute, verdict,
                result.getScore());
    }
}
