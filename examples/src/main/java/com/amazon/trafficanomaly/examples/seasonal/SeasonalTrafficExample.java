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

package com.amazon.trafficanomaly.examples.seasonal;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.amazon.trafficanomaly.AnomalyDetectionPipeline;
import com.amazon.trafficanomaly.examples.Example;
import com.amazon.trafficanomaly.inputtypes.DataPoint;
import com.amazon.trafficanomaly.returntypes.AnomalyResult;
import com.amazon.trafficanomaly.testutils.TrafficTestData;

/**
 * Stream an hourly series with a daily cycle through the seasonal and rate
 * detectors. A burst is injected on the fourth day.
 */
public class SeasonalTrafficExample implements Example {

    public static void main(String[] args) throws Exception {
        new SeasonalTrafficExample().run();
    }

    @Override
    public String command() {
        return "seasonal";
    }

    @Override
    public String description() {
        return "detect bursts in hourly traffic with a daily cycle";
    }

    @Override
    public void run() throws Exception {
        int hoursPerDay = 24;
        int days = 7;
        double[] traffic = TrafficTestData.seasonal(hoursPerDay * days, hoursPerDay, 1000, 300, 20, 2024);
        int burstHour = 3 * hoursPerDay + 10;
        traffic[burstHour] += 2500;

        AnomalyDetectionPipeline pipeline = AnomalyDetectionPipeline.builder().seasonality(hoursPerDay).build();
        Set<String> methods = new LinkedHashSet<>(Arrays.asList("time_series", "rate_change", "zscore"));

        for (int hour = 0; hour < traffic.length; hour++) {
            // timestamps in seconds
            DataPoint point = new DataPoint(hour * 3600.0, traffic[hour]);
            Map<String, AnomalyResult> results = pipeline.detect(point, methods);

            StringBuilder flags = new StringBuilder();
            for (AnomalyResult result : results.values()) {
                if (result.isAnomaly()) {
                    flags.append(String.format(" %s(%.2f)", result.getMethod(), result.getScore()));
                }
            }
            if (flags.length() > 0) {
                System.out.printf("day %d hour %2d: %8.1f%s%n", hour / hoursPerDay, hour % hoursPerDay,
                        traffic[hour], flags);
            }
        }

        System.out.printf("Burst injected at day %d hour %d%n", burstHour / hoursPerDay, burstHour % hoursPerDay);
    }
}
