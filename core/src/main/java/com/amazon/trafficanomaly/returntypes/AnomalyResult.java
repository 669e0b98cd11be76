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

package com.amazon.trafficanomaly.returntypes;

import static com.amazon.trafficanomaly.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;

/**
 * The verdict of a single detector (or of the ensemble) for one value. When a
 * detector cannot compute a verdict, for example because it has not seen enough
 * data, the result is not anomalous and the {@code reason} detail names the
 * condition.
 */
@Getter
public class AnomalyResult {

    public static final String REASON = "reason";

    public static final String INSUFFICIENT_DATA = "insufficient_data";
    public static final String ZERO_VARIANCE = "zero_variance";
    public static final String NOT_TRAINED = "not_trained";
    public static final String NO_RATE_DATA = "no_rate_data";
    public static final String PATTERN_NOT_LEARNED = "pattern_not_learned";

    private final boolean anomaly;

    private final double score;

    private final double threshold;

    // name of the detection method that produced this result
    private final String method;

    // diagnostics; not a stable schema
    private final Map<String, DetailValue> details;

    public AnomalyResult(boolean anomaly, double score, double threshold, String method,
            Map<String, DetailValue> details) {
        this.anomaly = anomaly;
        this.score = score;
        this.threshold = threshold;
        this.method = checkNotNull(method, "method must not be null");
        checkNotNull(details, "details must not be null");
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * A non-anomalous result with a zero score explaining why no verdict was
     * computed.
     *
     * @param method    the detection method
     * @param threshold the threshold the method would have applied
     * @param reason    one of the reason constants of this class
     * @return the result
     */
    public static AnomalyResult withoutVerdict(String method, double threshold, String reason) {
        return new AnomalyResult(false, 0.0, threshold, method,
                Collections.singletonMap(REASON, DetailValue.of(reason)));
    }

    /**
     * @return the reason detail, if this result carries one
     */
    public Optional<String> getReason() {
        DetailValue value = details.get(REASON);
        return value == null ? Optional.empty() : Optional.of(value.asString());
    }

    public Optional<DetailValue> getDetail(String key) {
        return Optional.ofNullable(details.get(key));
    }

    @Override
    public String toString() {
        return String.format("AnomalyResult(method=%s, anomaly=%s, score=%s, threshold=%s, details=%s)", method,
                anomaly, score, threshold, details);
    }
}
