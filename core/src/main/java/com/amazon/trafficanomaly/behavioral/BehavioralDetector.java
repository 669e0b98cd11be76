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

package com.amazon.trafficanomaly.behavioral;

import static com.amazon.trafficanomaly.CommonUtils.checkArgument;
import static com.amazon.trafficanomaly.CommonUtils.checkNotNull;
import static com.amazon.trafficanomaly.CommonUtils.mean;
import static com.amazon.trafficanomaly.CommonUtils.populationStandardDeviation;
import static com.amazon.trafficanomaly.returntypes.AnomalyResult.PATTERN_NOT_LEARNED;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.Getter;

import com.amazon.trafficanomaly.config.BaselineMode;
import com.amazon.trafficanomaly.returntypes.AnomalyResult;
import com.amazon.trafficanomaly.returntypes.DetailValue;
import com.amazon.trafficanomaly.statistics.RunningStatistics;
import com.amazon.trafficanomaly.util.BoundedWindow;

/**
 * Learns a baseline (mean, standard deviation, minimum, maximum) per pattern key,
 * for example per client or per route, and flags values that deviate from the
 * baseline of their key by more than a number of standard deviations.
 */
public class BehavioralDetector {

    public static final String BEHAVIORAL = "behavioral";

    public static final double DEFAULT_THRESHOLD = 3.0;

    public static final int DEFAULT_MAX_HISTORY_PER_PATTERN = 10_000;

    @Getter
    private final BaselineMode baselineMode;

    @Getter
    private final int maxHistoryPerPattern;

    // RECOMPUTE mode only
    private final Map<String, BoundedWindow> histories;

    // INCREMENTAL mode only
    private final Map<String, RunningStatistics> accumulators;

    private final Map<String, PatternBaseline> baselines;

    public BehavioralDetector() {
        this(BaselineMode.RECOMPUTE, DEFAULT_MAX_HISTORY_PER_PATTERN);
    }

    public BehavioralDetector(BaselineMode baselineMode) {
        this(baselineMode, DEFAULT_MAX_HISTORY_PER_PATTERN);
    }

    /**
     * @param baselineMode         how baselines are maintained
     * @param maxHistoryPerPattern the number of most recent values retained per
     *                             key in {@link BaselineMode#RECOMPUTE} mode
     */
    public BehavioralDetector(BaselineMode baselineMode, int maxHistoryPerPattern) {
        this.baselineMode = checkNotNull(baselineMode, "baselineMode must not be null");
        checkArgument(maxHistoryPerPattern > 0, "maxHistoryPerPattern must be greater than 0");
        this.maxHistoryPerPattern = maxHistoryPerPattern;
        this.histories = new HashMap<>();
        this.accumulators = new HashMap<>();
        this.baselines = new HashMap<>();
    }

    /**
     * Add values to the history of a pattern and update its baseline. In
     * {@link BaselineMode#RECOMPUTE} mode the baseline is recomputed from the
     * whole retained history.
     *
     * @param patternKey the pattern
     * @param values     the observed values; an empty batch changes nothing
     */
    public void learnPattern(String patternKey, double[] values) {
        checkNotNull(patternKey, "patternKey must not be null");
        checkNotNull(values, "values must not be null");
        if (values.length == 0) {
            return;
        }

        if (baselineMode == BaselineMode.INCREMENTAL) {
            RunningStatistics accumulator = accumulators.computeIfAbsent(patternKey, k -> new RunningStatistics());
            for (double value : values) {
                accumulator.update(value);
            }
            baselines.put(patternKey, new PatternBaseline(accumulator.getMean(), accumulator.getDeviation(),
                    accumulator.getMin(), accumulator.getMax(), accumulator.getCount()));
            return;
        }

        BoundedWindow history = histories.computeIfAbsent(patternKey, k -> new BoundedWindow(maxHistoryPerPattern));
        for (double value : values) {
            history.add(value);
        }
        baselines.put(patternKey, recompute(history.toArray()));
    }

    static PatternBaseline recompute(double[] values) {
        double mean = mean(values);
        double std = populationStandardDeviation(values, mean);
        double min = values[0];
        double max = values[0];
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        return new PatternBaseline(mean, std, min, max, values.length);
    }

    public AnomalyResult detectDeviation(String patternKey, double value) {
        return detectDeviation(patternKey, value, DEFAULT_THRESHOLD);
    }

    public AnomalyResult detectDeviation(String patternKey, double value, double threshold) {
        PatternBaseline baseline = patternKey == null ? null : baselines.get(patternKey);
        if (baseline == null) {
            return AnomalyResult.withoutVerdict(BEHAVIORAL, threshold, PATTERN_NOT_LEARNED);
        }

        double mean = baseline.getMean();
        double std = baseline.getStd() == 0 ? 1.0 : baseline.getStd();
        double zscore = Math.abs(value - mean) / std;

        Map<String, DetailValue> details = new LinkedHashMap<>();
        details.put("pattern_key", DetailValue.of(patternKey));
        details.put("expected_mean", DetailValue.of(mean));
        details.put("expected_std", DetailValue.of(std));
        details.put("zscore", DetailValue.of(zscore));
        return new AnomalyResult(zscore > threshold, zscore, threshold, BEHAVIORAL, details);
    }

    public Optional<PatternBaseline> getBaseline(String patternKey) {
        return Optional.ofNullable(baselines.get(patternKey));
    }

    public Set<String> getPatternKeys() {
        return Collections.unmodifiableSet(baselines.keySet());
    }

    /**
     * @param patternKey a pattern
     * @return the number of values retained for the pattern; always 0 in
     *         {@link BaselineMode#INCREMENTAL} mode
     */
    public int getHistorySize(String patternKey) {
        BoundedWindow history = histories.get(patternKey);
        return history == null ? 0 : history.size();
    }
}
