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

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.trafficanomaly.returntypes.AnomalyResult;
import com.amazon.trafficanomaly.testutils.TrafficTestData;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class AnomalyDetectionPipelineBenchmark {

    public final static int TRAINING_SIZE = 1_000;

    public final static int DATA_SIZE = 5_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "100", "1000" })
        int windowSize;

        double[] trainingData;
        double[] data;
        AnomalyDetectionPipeline pipeline;
        Set<String> allMethods;

        @Setup(Level.Trial)
        public void setUpData() {
            TrafficTestData testData = new TrafficTestData();
            trainingData = testData.generateTestData(TRAINING_SIZE, 17);
            data = testData.generateTestData(DATA_SIZE, 18);
            allMethods = new LinkedHashSet<>(Arrays.asList("zscore", "iqr", "mad", "isolation_forest",
                    "time_series", "behavioral", "rate_change"));
        }

        @Setup(Level.Invocation)
        public void setUpPipeline() {
            pipeline = AnomalyDetectionPipeline.builder().windowSize(windowSize).build();
            pipeline.train(trainingData);
        }
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public AnomalyResult detectDefaultMethods(BenchmarkState state, Blackhole blackhole) {
        AnomalyDetectionPipeline pipeline = state.pipeline;
        AnomalyResult ensemble = null;
        for (double value : state.data) {
            ensemble = pipeline.aggregateResults(pipeline.detect(value));
        }
        blackhole.consume(ensemble);
        return ensemble;
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public AnomalyResult detectAllMethods(BenchmarkState state, Blackhole blackhole) {
        AnomalyDetectionPipeline pipeline = state.pipeline;
        AnomalyResult ensemble = null;
        for (double value : state.data) {
            ensemble = pipeline.aggregateResults(pipeline.detect(value, state.allMethods));
        }
        blackhole.consume(ensemble);
        return ensemble;
    }
}
