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

import static com.amazon.trafficanomaly.CommonUtils.checkArgument;
import static com.amazon.trafficanomaly.CommonUtils.checkNotNull;
import static com.amazon.trafficanomaly.IsolationForest.ISOLATION_FOREST;
import static com.amazon.trafficanomaly.behavioral.BehavioralDetector.BEHAVIORAL;
import static com.amazon.trafficanomaly.ratechange.RateChangeDetector.RATE_CHANGE;
import static com.amazon.trafficanomaly.statistics.StatisticalDetector.IQR;
import static com.amazon.trafficanomaly.statistics.StatisticalDetector.MAD;
import static com.amazon.trafficanomaly.statistics.StatisticalDetector.ZSCORE;
import static com.amazon.trafficanomaly.timeseries.TimeSeriesDetector.TIME_SERIES;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.trafficanomaly.behavioral.BehavioralDetector;
import com.amazon.trafficanomaly.config.BaselineMode;
import com.amazon.trafficanomaly.config.SamplingStrategy;
import com.amazon.trafficanomaly.config.SplitPolicy;
import com.amazon.trafficanomaly.config.UnknownMethodPolicy;
import com.amazon.trafficanomaly.inputtypes.DataPoint;
import com.amazon.trafficanomaly.ratechange.RateChangeDetector;
import com.amazon.trafficanomaly.returntypes.AnomalyResult;
import com.amazon.trafficanomaly.returntypes.DetailValue;
import com.amazon.trafficanomaly.statistics.StatisticalDetector;
import com.amazon.trafficanomaly.timeseries.TimeSeriesDetector;

/**
 * Runs a selectable set of detectors on each observation of one metric and
 * combines their verdicts by strict majority vote.
 * <p>
 * The pipeline owns one instance of every detector. Detectors are reached
 * through a registry that maps a method name to a {@link DetectionMethod}; the
 * built-in names are {@code zscore}, {@code iqr}, {@code mad},
 * {@code isolation_forest}, {@code time_series}, {@code behavioral} and
 * {@code rate_change}. Every detection call updates detector state, so calls
 * for the same metric must be serialized. Use one pipeline per metric.
 */
@Slf4j
@Getter
public class AnomalyDetectionPipeline {

    public static final String ENSEMBLE = "ensemble";

    public static final double ENSEMBLE_THRESHOLD = 0.5;

    public static final Set<String> DEFAULT_METHODS = Collections
            .unmodifiableSet(new LinkedHashSet<>(Arrays.asList(ZSCORE, IQR, MAD, ISOLATION_FOREST)));

    public static final String DEFAULT_PATTERN_KEY = "default";

    public static final UnknownMethodPolicy DEFAULT_UNKNOWN_METHOD_POLICY = UnknownMethodPolicy.SKIP;

    private final StatisticalDetector statistical;

    private final IsolationForest isolationForest;

    private final TimeSeriesDetector timeSeries;

    private final BehavioralDetector behavioral;

    private final RateChangeDetector rateChange;

    // key learned by train() and used for points without a pattern key
    private final String defaultPatternKey;

    private final UnknownMethodPolicy unknownMethodPolicy;

    private final double zscoreThreshold;

    private final double iqrMultiplier;

    private final double madThreshold;

    private final double isolationForestThreshold;

    private final double timeSeriesThreshold;

    private final double behavioralThreshold;

    private final double rateChangeThreshold;

    // logical clock for observations that carry no timestamp
    private long pointsSeen;

    @Getter(AccessLevel.NONE)
    private final Map<String, DetectionMethod> registry;

    public AnomalyDetectionPipeline() {
        this(new Builder());
    }

    protected AnomalyDetectionPipeline(Builder builder) {
        builder.validate();
        this.statistical = new StatisticalDetector(builder.windowSize);
        this.isolationForest = IsolationForest.builder().numberOfTrees(builder.numberOfTrees)
                .sampleSize(builder.sampleSize).samplingStrategy(builder.samplingStrategy)
                .splitPolicy(builder.splitPolicy).randomSeed(builder.randomSeed).build();
        this.timeSeries = new TimeSeriesDetector(builder.seasonality, builder.historyPeriods);
        this.behavioral = new BehavioralDetector(builder.baselineMode, builder.maxHistoryPerPattern);
        this.rateChange = new RateChangeDetector(builder.rateWindowSize);
        this.defaultPatternKey = builder.defaultPatternKey;
        this.unknownMethodPolicy = builder.unknownMethodPolicy;
        this.zscoreThreshold = builder.zscoreThreshold;
        this.iqrMultiplier = builder.iqrMultiplier;
        this.madThreshold = builder.madThreshold;
        this.isolationForestThreshold = builder.isolationForestThreshold;
        this.timeSeriesThreshold = builder.timeSeriesThreshold;
        this.behavioralThreshold = builder.behavioralThreshold;
        this.rateChangeThreshold = builder.rateChangeThreshold;
        this.pointsSeen = 0;
        this.registry = new LinkedHashMap<>();
        registerBuiltInMethods();
    }

    public static Builder builder() {
        return new Builder();
    }

    private void registerBuiltInMethods() {
        registry.put(ZSCORE, point -> statistical.zscoreDetection(point.getValue(), zscoreThreshold));
        registry.put(IQR, point -> statistical.iqrDetection(point.getValue(), iqrMultiplier));
        registry.put(MAD, point -> statistical.madDetection(point.getValue(), madThreshold));
        registry.put(ISOLATION_FOREST, point -> isolationForest.predict(point.getValue(), isolationForestThreshold));
        registry.put(TIME_SERIES, point -> timeSeries.detectAnomaly(point.getValue(), timeSeriesThreshold));
        registry.put(BEHAVIORAL, point -> behavioral.detectDeviation(
                point.getPatternKey() == null ? defaultPatternKey : point.getPatternKey(), point.getValue(),
                behavioralThreshold));
        registry.put(RATE_CHANGE, point -> {
            rateChange.addPoint(point.getTimestamp(), point.getValue());
            return rateChange.detectRateChange(rateChangeThreshold);
        });
    }

    /**
     * Add a detection method to the registry, or replace the method registered
     * under the same name. New names run after the built-in ones.
     *
     * @param name   the method name used in detection requests and results
     * @param method the method
     */
    public void registerMethod(String name, DetectionMethod method) {
        checkNotNull(name, "name must not be null");
        checkNotNull(method, "method must not be null");
        registry.put(name, method);
    }

    /**
     * @return the registered method names in the order they run
     */
    public Set<String> getRegisteredMethods() {
        return Collections.unmodifiableSet(registry.keySet());
    }

    /**
     * Seed the detectors with historical values: fits the isolation forest, fills
     * the statistical window (only the most recent values survive) and learns the
     * baseline of the default pattern key.
     *
     * @param data historical values of the metric
     */
    public void train(double[] data) {
        checkNotNull(data, "data must not be null");
        isolationForest.fit(data);
        for (double value : data) {
            statistical.addPoint(value);
        }
        behavioral.learnPattern(defaultPatternKey, data);
        log.debug("Trained pipeline on {} values", data.length);
    }

    /**
     * Run the default methods on a value.
     *
     * @param value the observed value
     * @return the result of every method, keyed by method name
     */
    public Map<String, AnomalyResult> detect(double value) {
        return detect(value, null);
    }

    /**
     * Run the requested methods on a value. The value is stamped with the number
     * of observations seen so far, which serves as the time axis of the
     * {@code rate_change} method.
     *
     * @param value   the observed value
     * @param methods the method names to run, or null for {@link #DEFAULT_METHODS}
     * @return the result of every method that ran, keyed by method name
     */
    public Map<String, AnomalyResult> detect(double value, Set<String> methods) {
        return detect(new DataPoint(pointsSeen, value), methods);
    }

    /**
     * Run the requested methods on an observation. Methods run in registry order.
     * Names missing from the registry are handled according to the
     * {@link UnknownMethodPolicy} of the pipeline.
     *
     * @param point   the observation
     * @param methods the method names to run, or null for {@link #DEFAULT_METHODS}
     * @return the result of every method that ran, keyed by method name
     * @throws IllegalArgumentException        if a method name is null
     * @throws UnknownDetectionMethodException if a name is unknown and the policy
     *                                         is {@link UnknownMethodPolicy#REJECT}
     */
    public Map<String, AnomalyResult> detect(DataPoint point, Set<String> methods) {
        checkNotNull(point, "point must not be null");
        Set<String> requested = methods == null ? DEFAULT_METHODS : methods;

        List<String> unknown = new ArrayList<>();
        for (String name : requested) {
            checkArgument(name != null, "method names must not be null");
            if (!registry.containsKey(name)) {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            if (unknownMethodPolicy == UnknownMethodPolicy.REJECT) {
                throw new UnknownDetectionMethodException(unknown, registry.keySet());
            }
            log.warn("Skipping unknown detection methods {}", unknown);
        }

        Map<String, AnomalyResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, DetectionMethod> entry : registry.entrySet()) {
            if (requested.contains(entry.getKey())) {
                results.put(entry.getKey(), entry.getValue().detect(point));
            }
        }
        pointsSeen++;
        return results;
    }

    /**
     * Combine per-method results. The ensemble is anomalous when strictly more
     * than half of the methods flag an anomaly; its score is the mean score.
     *
     * @param results per-method results, keyed by method name
     * @return the ensemble result
     */
    public AnomalyResult aggregateResults(Map<String, AnomalyResult> results) {
        checkNotNull(results, "results must not be null");
        int anomalyCount = 0;
        double scoreSum = 0;
        Map<String, DetailValue> votes = new LinkedHashMap<>();
        for (Map.Entry<String, AnomalyResult> entry : results.entrySet()) {
            AnomalyResult result = entry.getValue();
            if (result.isAnomaly()) {
                anomalyCount++;
            }
            scoreSum += result.getScore();
            votes.put(entry.getKey(), DetailValue.of(result.isAnomaly()));
        }
        int total = results.size();
        double averageScore = total > 0 ? scoreSum / total : 0;

        Map<String, DetailValue> details = new LinkedHashMap<>();
        details.put("anomaly_count", DetailValue.of((long) anomalyCount));
        details.put("total_methods", DetailValue.of((long) total));
        details.put("methods", DetailValue.ofMap(votes));
        return new AnomalyResult(anomalyCount > total / 2.0, averageScore, ENSEMBLE_THRESHOLD, ENSEMBLE, details);
    }

    /**
     * Convenience for {@link #detect(DataPoint, Set)} followed by
     * {@link #aggregateResults(Map)}.
     *
     * @param point   the observation
     * @param methods the method names to run, or null for {@link #DEFAULT_METHODS}
     * @return the ensemble result
     */
    public AnomalyResult detectEnsemble(DataPoint point, Set<String> methods) {
        return aggregateResults(detect(point, methods));
    }

    public static class Builder {

        private int windowSize = StatisticalDetector.DEFAULT_WINDOW_SIZE;
        private int numberOfTrees = IsolationForest.DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = IsolationForest.DEFAULT_SAMPLE_SIZE;
        private SamplingStrategy samplingStrategy = IsolationForest.DEFAULT_SAMPLING_STRATEGY;
        private SplitPolicy splitPolicy = IsolationForest.DEFAULT_SPLIT_POLICY;
        private long randomSeed = IsolationForest.DEFAULT_RANDOM_SEED;
        private int seasonality = TimeSeriesDetector.DEFAULT_SEASONALITY;
        private int historyPeriods = TimeSeriesDetector.DEFAULT_HISTORY_PERIODS;
        private int rateWindowSize = RateChangeDetector.DEFAULT_WINDOW_SIZE;
        private BaselineMode baselineMode = BaselineMode.RECOMPUTE;
        private int maxHistoryPerPattern = BehavioralDetector.DEFAULT_MAX_HISTORY_PER_PATTERN;
        private String defaultPatternKey = DEFAULT_PATTERN_KEY;
        private UnknownMethodPolicy unknownMethodPolicy = DEFAULT_UNKNOWN_METHOD_POLICY;
        private double zscoreThreshold = StatisticalDetector.DEFAULT_ZSCORE_THRESHOLD;
        private double iqrMultiplier = StatisticalDetector.DEFAULT_IQR_MULTIPLIER;
        private double madThreshold = StatisticalDetector.DEFAULT_MAD_THRESHOLD;
        private double isolationForestThreshold = IsolationForest.DEFAULT_THRESHOLD;
        private double timeSeriesThreshold = TimeSeriesDetector.DEFAULT_THRESHOLD;
        private double behavioralThreshold = BehavioralDetector.DEFAULT_THRESHOLD;
        private double rateChangeThreshold = RateChangeDetector.DEFAULT_THRESHOLD;

        void validate() {
            checkArgument(windowSize > 0, "windowSize must be greater than 0");
            checkArgument(numberOfTrees > 0, "numberOfTrees must be greater than 0");
            checkArgument(sampleSize > 0, "sampleSize must be greater than 0");
            checkArgument(seasonality > 0, "seasonality must be greater than 0");
            checkArgument(historyPeriods >= 2, "historyPeriods must be at least 2");
            checkArgument(rateWindowSize > 0, "rateWindowSize must be greater than 0");
            checkArgument(maxHistoryPerPattern > 0, "maxHistoryPerPattern must be greater than 0");
            checkNotNull(samplingStrategy, "samplingStrategy must not be null");
            checkNotNull(splitPolicy, "splitPolicy must not be null");
            checkNotNull(baselineMode, "baselineMode must not be null");
            checkNotNull(defaultPatternKey, "defaultPatternKey must not be null");
            checkNotNull(unknownMethodPolicy, "unknownMethodPolicy must not be null");
            checkArgument(iqrMultiplier >= 0, "iqrMultiplier cannot be negative");
        }

        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

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

        public Builder seasonality(int seasonality) {
            this.seasonality = seasonality;
            return this;
        }

        public Builder historyPeriods(int historyPeriods) {
            this.historyPeriods = historyPeriods;
            return this;
        }

        public Builder rateWindowSize(int rateWindowSize) {
            this.rateWindowSize = rateWindowSize;
            return this;
        }

        public Builder baselineMode(BaselineMode baselineMode) {
            this.baselineMode = baselineMode;
            return this;
        }

        public Builder maxHistoryPerPattern(int maxHistoryPerPattern) {
            this.maxHistoryPerPattern = maxHistoryPerPattern;
            return this;
        }

        public Builder defaultPatternKey(String defaultPatternKey) {
            this.defaultPatternKey = defaultPatternKey;
            return this;
        }

        public Builder unknownMethodPolicy(UnknownMethodPolicy unknownMethodPolicy) {
            this.unknownMethodPolicy = unknownMethodPolicy;
            return this;
        }

        public Builder zscoreThreshold(double zscoreThreshold) {
            this.zscoreThreshold = zscoreThreshold;
            return this;
        }

        public Builder iqrMultiplier(double iqrMultiplier) {
            this.iqrMultiplier = iqrMultiplier;
            return this;
        }

        public Builder madThreshold(double madThreshold) {
            this.madThreshold = madThreshold;
            return this;
        }

        public Builder isolationForestThreshold(double isolationForestThreshold) {
            this.isolationForestThreshold = isolationForestThreshold;
            return this;
        }

        public Builder timeSeriesThreshold(double timeSeriesThreshold) {
            this.timeSeriesThreshold = timeSeriesThreshold;
            return this;
        }

        public Builder behavioralThreshold(double behavioralThreshold) {
            this.behavioralThreshold = behavioralThreshold;
            return this;
        }

        public Builder rateChangeThreshold(double rateChangeThreshold) {
            this.rateChangeThreshold = rateChangeThreshold;
            return this;
        }

        public AnomalyDetectionPipeline build() {
            return new AnomalyDetectionPipeline(this);
        }
    }
}
