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

package com.amazon.trafficanomaly.examples.serialization;

import java.util.LinkedHashMap;
import java.util.Map;

import com.amazon.trafficanomaly.AnomalyDetectionPipeline;
import com.amazon.trafficanomaly.examples.Example;
import com.amazon.trafficanomaly.returntypes.AnomalyResult;
import com.amazon.trafficanomaly.returntypes.DetailValue;
import com.amazon.trafficanomaly.testutils.TrafficTestData;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Render detection results as JSON using
 * <a href="https://github.com/FasterXML/jackson">Jackson</a>, for example to
 * return them from a gateway admin endpoint.
 */
public class JsonResultExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonResultExample().run();
    }

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "print per-method and ensemble results as a JSON document";
    }

    @Override
    public void run() throws Exception {
        AnomalyDetectionPipeline pipeline = new AnomalyDetectionPipeline();
        pipeline.train(new TrafficTestData().generateTestData(1000, 7));

        Map<String, AnomalyResult> results = pipeline.detect(650.0);
        AnomalyResult ensemble = pipeline.aggregateResults(results);

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("value", 650.0);
        document.put("ensemble", toJsonObject(ensemble));
        Map<String, Object> methods = new LinkedHashMap<>();
        for (Map.Entry<String, AnomalyResult> entry : results.entrySet()) {
            methods.put(entry.getKey(), toJsonObject(entry.getValue()));
        }
        document.put("methods", methods);

        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        System.out.println(json);
        System.out.printf("JSON size = %d bytes%n", json.getBytes().length);
    }

    static Map<String, Object> toJsonObject(AnomalyResult result) {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("method", result.getMethod());
        object.put("is_anomaly", result.isAnomaly());
        object.put("score", result.getScore());
        object.put("threshold", result.getThreshold());
        object.put("details", DetailValue.toObjects(result.getDetails()));
        return object;
    }
}
