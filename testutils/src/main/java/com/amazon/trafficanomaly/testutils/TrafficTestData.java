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

package com.amazon.trafficanomaly.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * Synthetic traffic series. The mixture generator samples from a base normal
 * distribution (normal traffic) and an anomaly normal distribution (bursts),
 * with random transitions between the two regimes. All generators are
 * deterministic for a given seed.
 */
public class TrafficTestData {

    private final double baseMu;
    private final double baseSigma;
    private final double anomalyMu;
    private final double anomalySigma;
    private final double transitionToAnomalyProbability;
    private final double transitionToBaseProbability;

    public TrafficTestData(double baseMu, double baseSigma, double anomalyMu, double anomalySigma,
            double transitionToAnomalyProbability, double transitionToBaseProbability) {
        this.baseMu = baseMu;
        this.baseSigma = baseSigma;
        this.anomalyMu = anomalyMu;
        this.anomalySigma = anomalySigma;
        this.transitionToAnomalyProbability = transitionToAnomalyProbability;
        this.transitionToBaseProbability = transitionToBaseProbability;
    }

    public TrafficTestData() {
        this(100.0, 5.0, 400.0, 20.0, 0.01, 0.3);
    }

    public double[] generateTestData(int size, long seed) {
        return generateLabeledTestData(size, seed).getValues();
    }

    public LabeledTraffic generateLabeledTestData(int size, long seed) {
        Random rng = new Random(seed);
        NormalDistribution dist = new NormalDistribution(rng);
        double[] values = new double[size];
        int[] anomalies = new int[size];
        int numberOfAnomalies = 0;
        boolean anomaly = false;

        for (int i = 0; i < size; i++) {
            if (!anomaly) {
                values[i] = dist.nextDouble(baseMu, baseSigma);
                if (rng.nextDouble() < transitionToAnomalyProbability) {
                    anomaly = true;
                }
            } else {
                values[i] = dist.nextDouble(anomalyMu, anomalySigma);
                anomalies[numberOfAnomalies++] = i;
                if (rng.nextDouble() < transitionToBaseProbability) {
                    anomaly = false;
                }
            }
        }

        return new LabeledTraffic(values, Arrays.copyOf(anomalies, numberOfAnomalies));
    }

    /**
     * A rising series with a short repeating cycle: {@code 100 + 0.5 i + 2 (i mod 10)}.
     *
     * @param size the number of values
     * @return the series
     */
    public static double[] linearWithCycle(int size) {
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = 100 + i * 0.5 + (i % 10) * 2;
        }
        return values;
    }

    /**
     * A sine wave around a level with additive normal noise.
     *
     * @param size       the number of values
     * @param period     the length of one cycle, in values
     * @param level      the mean of the series
     * @param amplitude  the amplitude of the cycle
     * @param noiseSigma the standard deviation of the noise, 0 for none
     * @param seed       the random seed
     * @return the series
     */
    public static double[] seasonal(int size, int period, double level, double amplitude, double noiseSigma,
            long seed) {
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = level + amplitude * Math.sin(2 * Math.PI * i / period);
            if (noiseSigma > 0) {
                values[i] += dist.nextDouble(0, noiseSigma);
            }
        }
        return values;
    }

    public static class LabeledTraffic {
        private final double[] values;
        private final int[] anomalyIndexes;

        LabeledTraffic(double[] values, int[] anomalyIndexes) {
            this.values = values;
            this.anomalyIndexes = anomalyIndexes;
        }

        public double[] getValues() {
            return values;
        }

        // indexes of the values drawn from the anomaly distribution
        public int[] getAnomalyIndexes() {
            return anomalyIndexes;
        }
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // Box-Muller transform
                double u = rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
