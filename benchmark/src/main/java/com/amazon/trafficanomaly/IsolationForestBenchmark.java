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

import com.amazon.trafficanomaly.config.SamplingStrategy;
import com.amazon.trafficanomaly.config.SplitPolicy;
import com.amazon.trafficanomaly.testutils.TrafficTestData;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class IsolationForestBenchmark {

    public final static int DATA_SIZE = 10_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "50", "100" })
        int numberOfTrees;

        @Param({ "64", "256" })
        int sampleSize;

        @Param({ "STRIDE", "UNIFORM_RANDOM" })
        SamplingStrategy samplingStrategy;

        double[] data;
        IsolationForest forest;

        @Setup(Level.Trial)
        public void setUpData() {
            data = new TrafficTestData().generateTestData(DATA_SIZE, 99);
        }

        @Setup(Level.Invocation)
        public void setUpForest() {
            forest = IsolationForest.builder().numberOfTrees(numberOfTrees).sampleSize(sampleSize)
                    .samplingStrategy(samplingStrategy).splitPolicy(SplitPolicy.MIDPOINT).randomSeed(99).build();
        }
    }

    private IsolationForest forest;

    @Benchmark
    public IsolationForest fit(BenchmarkState state) {
        forest = state.forest;
        forest.fit(state.data);
        return forest;
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public IsolationForest fitAndPredict(BenchmarkState state, Blackhole blackhole) {
        double[] data = state.data;
        forest = state.forest;
        forest.fit(data);

        double score = 0.0;
        for (int i = 0; i < data.length; i++) {
            score = forest.getAnomalyScore(data[i]);
        }

        blackhole.consume(score);
        return forest;
    }
}
