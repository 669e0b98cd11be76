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
import static com.amazon.trafficanomaly.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import lombok.Getter;

/**
 * An immutable diagnostic value attached to an {@link AnomalyResult}. The value
 * is a tagged variant: exactly one of the typed payloads is present, as
 * indicated by {@link #getKind()}.
 */
public final class DetailValue {

    public enum Kind {
        FLOAT, INT, STRING, BOOLEAN, LIST, MAP
    }

    @Getter
    private final Kind kind;

    private final Object payload;

    private DetailValue(Kind kind, Object payload) {
        this.kind = kind;
        this.payload = payload;
    }

    public static DetailValue of(double value) {
        return new DetailValue(Kind.FLOAT, value);
    }

    public static DetailValue of(long value) {
        return new DetailValue(Kind.INT, value);
    }

    public static DetailValue of(String value) {
        checkNotNull(value, "value must not be null");
        return new DetailValue(Kind.STRING, value);
    }

    public static DetailValue of(boolean value) {
        return new DetailValue(Kind.BOOLEAN, value);
    }

    public static DetailValue ofList(List<DetailValue> values) {
        checkNotNull(values, "values must not be null");
        return new DetailValue(Kind.LIST, Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public static DetailValue ofMap(Map<String, DetailValue> values) {
        checkNotNull(values, "values must not be null");
        return new DetailValue(Kind.MAP, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public double asDouble() {
        checkState(kind == Kind.FLOAT || kind == Kind.INT, "not a numeric value: " + kind);
        return ((Number) payload).doubleValue();
    }

    public long asLong() {
        checkState(kind == Kind.INT, "not an integer value: " + kind);
        return (Long) payload;
    }

    public String asString() {
        checkState(kind == Kind.STRING, "not a string value: " + kind);
        return (String) payload;
    }

    public boolean asBoolean() {
        checkState(kind == Kind.BOOLEAN, "not a boolean value: " + kind);
        return (Boolean) payload;
    }

    @SuppressWarnings("unchecked")
    public List<DetailValue> asList() {
        checkState(kind == Kind.LIST, "not a list value: " + kind);
        return (List<DetailValue>) payload;
    }

    @SuppressWarnings("unchecked")
    public Map<String, DetailValue> asMap() {
        checkState(kind == Kind.MAP, "not a map value: " + kind);
        return (Map<String, DetailValue>) payload;
    }

    /**
     * Converts the value into plain Java objects: {@code Double}, {@code Long},
     * {@code String}, {@code Boolean}, {@code List} or {@code Map}, recursively.
     * Useful for logging and JSON rendering.
     *
     * @return the unwrapped value
     */
    public Object toObject() {
        switch (kind) {
        case LIST:
            List<Object> list = new ArrayList<>();
            for (DetailValue value : asList()) {
                list.add(value.toObject());
            }
            return list;
        case MAP:
            return toObjects(asMap());
        default:
            return payload;
        }
    }

    /**
     * Unwraps every value of a details map, see {@link #toObject()}.
     *
     * @param details a details map
     * @return an ordered map of plain Java objects
     */
    public static Map<String, Object> toObjects(Map<String, DetailValue> details) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, DetailValue> entry : details.entrySet()) {
            result.put(entry.getKey(), entry.getValue().toObject());
        }
        return result;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DetailValue)) {
            return false;
        }
        DetailValue that = (DetailValue) other;
        return kind == that.kind && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, payload);
    }

    @Override
    public String toString() {
        return String.valueOf(payload);
    }
}
