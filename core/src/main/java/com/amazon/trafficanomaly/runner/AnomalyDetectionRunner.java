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

package com.amazon.trafficanomaly.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.amazon.trafficanomaly.AnomalyDetectionPipeline;
import com.amazon.trafficanomaly.inputtypes.DataPoint;
import com.amazon.trafficanomaly.returntypes.AnomalyResult;

public class AnomalyDetectionRunner extends SimpleRunner {

    public AnomalyDetectionRunner() {
        super(AnomalyDetectionRunner.class.getName(),
                "Train on the leading input rows, then append the ensemble verdict, the ensemble score and the "
                        + "verdict of each selected method to every following row.",
                EnsembleTransformer::new);
    }

    public static void main(String... args) throws IOException {
        AnomalyDetectionRunner runner = new AnomalyDetectionRunner();
        runner.parse(args);
        System.out.println("Reading from stdin... (Ctrl-c to exit)");
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        System.out.println("Done.");
    }

    public static class EnsembleTransformer implements LineTransformer {

        public static final String ENSEMBLE_ANOMALY = "ensemble_anomaly";

        public static final String ENSEMBLE_SCORE = "ensemble_score";

        private static final String NOT_AVAILABLE = "NA";

        private final AnomalyDetectionPipeline pipeline;

        private final Set<String> methods;

        public EnsembleTransformer(AnomalyDetectionPipeline pipeline, Set<String> methods) {
            this.pipeline = pipeline;
            this.methods = Collections.unmodifiableSet(new LinkedHashSet<>(methods));
        }

        @Override
        public List<String> getResultValues(DataPoint point) {
            Map<String, AnomalyResult> results = pipeline.detect(point, methods);
            AnomalyResult ensemble = pipeline.aggregateResults(results);

            List<String> values = new ArrayList<>();
            values.add(Boolean.toString(ensemble.isAnomaly()));
            values.add(Double.toString(ensemble.getScore()));
            for (String method : methods) {
                AnomalyResult result = results.get(method);
                values.add(result == null ? NOT_AVAILABLE : Boolean.toString(result.isAnomaly()));
            }
            return values;
        }

        @Override
        public List<String> getEmptyResultValue() {
            return Collections.nCopies(methods.size() + 2, NOT_AVAILABLE);
        }

        @Override
        public List<String> getResultColumnNames() {
            List<String> names = new ArrayList<>();
            names.add(ENSEMBLE_ANOMALY);
            names.add(ENSEMBLE_SCORE);
            names.addAll(methods);
            return names;
        }

        @Override
        public AnomalyDetectionPipeline getPipeline() {
            return pipeline;
        }

        public Set<String> getMethods() {
            return methods;
        }
    }
}
