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

import static com.amazon.trafficanomaly.CommonUtils.averagePathLength;
import static com.amazon.trafficanomaly.CommonUtils.checkArgument;
import static com.amazon.trafficanomaly.CommonUtils.checkNotNull;
import static com.amazon.trafficanomaly.CommonUtils.checkState;
import static com.amazon.trafficanomaly.returntypes.AnomalyResult.NOT_TRAINED;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.trafficanomaly.config.SamplingStrategy;
import com.amazon.trafficanomaly.config.SplitPolicy;
import com.amazon.trafficanomaly.returntypes.AnomalyResult;
import com.amazon.trafficanomaly.returntypes.DetailValue;
import com.amazon.trafficanomaly.sampler.TrainingSampler;
import com.amazon.trafficanomaly.tree.IsolationTree;

/**
 * An ensemble of isolation trees over scalar values.
 * <p>
 * Each call to {@link #fit(double[])} replaces all trees. A tree is built from a
 * sample of at most {@code sampleSize} training values and is partitioned until
 * depth ceil(log2(effective sample size)). A value is scored by its average
 * path length h over the trees as 2^(-h / c(sampleSize)), so that values
 * isolated close to the root score close to 1.
 * <p>
 * With the default {@link SamplingStrategy#STRIDE} and
 * {@link SplitPolicy#MIDPOINT} the forest is fully deterministic: fitting the
 * same data twice yields identical trees and identical scores. The randomized
 * options draw from a generator seeded with {@code randomSeed} at the start of
 * every fit, so they are reproducible as well.
 */
@Slf4j
@Getter
public class IsolationForest {

    public static final String ISOLATION_FOREST = "isolation_forest";

    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    public static final int DEFAULT_SAMPLE_SIZE = 256;

    public static final double DEFAULT_THRESHOLD = 0.6;

    public static final long DEFAULT_RANDOM_SEED = 42L;

    public static final SamplingStrategy DEFAULT_SAMPLING_STRATEGY = SamplingStrategy.STRIDE;

    public static final SplitPolicy DEFAULT_SPLIT_POLICY = SplitPolicy.MIDPOINT;

    private final int numberOfTrees;

    private final int sampleSize;

    private final SamplingStrategy samplingStrategy;

    private final SplitPolicy splitPolicy;

    private final long randomSeed;

    // sample size used by the last fit, min(sampleSize, data.length)
    private int effectiveSampleSize;

    private boolean trained;

    private List<IsolationTree> trees;

    public IsolationForest() {
        this(new Builder());
    }

    public IsolationForest(int numberOfTrees, int sampleSize) {
        this(new Builder().numberOfTrees(numberOfTrees).sampleSize(sampleSize));
    }

    protected IsolationForest(Builder builder) {
        checkArgument(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(builder.sampleSize > 0, "sampleSize must be greater than 0");
        checkNotNull(builder.samplingStrategy, "samplingStrategy must not be null");
        checkNotNull(builder.splitPolicy, "splitPolicy must not be null");
        this.numberOfTrees = builder.numberOfTrees;
        this.sampleSize = builder.sampleSize;
        this.samplingStrategy = builder.samplingStrategy;
        this.splitPolicy = builder.splitPolicy;
        this.randomSeed = builder.randomSeed;
        this.trees = Collections.emptyList();
        this.trained = false;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build the trees from the training data. Any previous trees are discarded.
     * Fitting an empty array leaves the forest untrained.
     *
     * @param data the training values
     */
    public void fit(double[] data) {
        checkNotNull(data, "data must not be null");
        if (data.length == 0) {
            log.warn("Isolation forest fit called with no data, the forest stays untrained");
            trees = Collections.emptyList();
            effectiveSampleSize = 0;
            trained = false;
            return;
        }

        effectiveSampleSize = Math.min(data.length, sampleSize);
        int maxDepth = maxDepth(effectiveSampleSize);
        Random random = new Random(randomSeed);
        TrainingSampler sampler = new TrainingSampler(samplingStrategy, random);

        List<IsolationTree> newTrees = new ArrayList<>(numberOfTrees);
        for (int i = 0; i < numberOfTrees; i++) {
            double[] sample = sampler.sample(data, effectiveSampleSize);
            newTrees.add(IsolationTree.build(sample, maxDepth, splitPolicy, random));
        }
        trees = Collections.unmodifiableList(newTrees);
        trained = true;
        log.debug("Fitted {} isolation trees on {} values (sample size {}, max depth {}, {} / {})", numberOfTrees,
                data.length, effectiveSampleSize, maxDepth, samplingStrategy, splitPolicy);
    }

    /**
     * @param n a positive sample size
     * @return ceil(log2(n)), computed exactly
     */
    static int maxDepth(int n) {
        checkArgument(n > 0, "n must be greater than 0");
        return 32 - Integer.numberOfLeadingZeros(n - 1);
    }

    public AnomalyResult predict(double value) {
        return predict(value, DEFAULT_THRESHOLD);
    }

    /**
     * Score a value against the trees.
     *
     * @param value     the value to score
     * @param threshold scores strictly above the threshold are anomalous
     * @return the result; {@code not_trained} if the forest has not been fitted
     */
    public AnomalyResult predict(double value, double threshold) {
        if (!trained) {
            return AnomalyResult.withoutVerdict(ISOLATION_FOREST, threshold, NOT_TRAINED);
        }

        double averagePath = getAveragePathLength(value);
        double score = scoreFromPathLength(averagePath);

        Map<String, DetailValue> details = new LinkedHashMap<>();
        details.put("avg_path_length", DetailValue.of(averagePath));
        details.put("anomaly_score", DetailValue.of(score));
        return new AnomalyResult(score > threshold, score, threshold, ISOLATION_FOREST, details);
    }

    /**
     * @param value a value
     * @return the mean path length of the value over all trees
     */
    public double getAveragePathLength(double value) {
        checkState(trained, "forest has not been fitted");
        double sum = 0;
        for (IsolationTree tree : trees) {
            sum += tree.pathLength(value);
        }
        return sum / trees.size();
    }

    /**
     * @param value a value
     * @return the anomaly score in [0, 1] of the value
     */
    public double getAnomalyScore(double value) {
        return scoreFromPathLength(getAveragePathLength(value));
    }

    // normalized by the configured sample size, not the effective one
    double scoreFromPathLength(double averagePath) {
        double normalizer = averagePathLength(sampleSize);
        return normalizer > 0 ? Math.pow(2, -averagePath / normalizer) : 0;
    }

    /**
     * @return the trees of the last fit, empty if the forest is not trained
     */
    public List<IsolationTree> getTrees() {
        return trees;
    }

    public static class Builder {

        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = DEFAULT_SAMPLE_SIZE;
        private SamplingStrategy samplingStrategy = DEFAULT_SAMPLING_STRATEGY;
        private SplitPolicy splitPolicy = DEFAULT_SPLIT_POLICY;
        private long randomSeed = DEFAULT_RANDOM_SEED;

        public Builder numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        public Builder samplingStrategy(SamplingStrategy samplingStrategy) {
            this.samplingStrategy = samplingStrategy;
            return this;
        }

        public Builder splitPolicy(SplitPolicy splitPolicy) {
            this.splitPolicy = splitPolicy;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public IsolationForest build() {
            return new IsolationForest(this);
        }
    }
}
