/*
 * Copyright © 2022-2024 StreamNative Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.streamnative.searchbench.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.NonNull;

/**
 * One sample of a category time series: the interval quantiles and the interval rate, taken at
 * {@code timestamp} epoch seconds.
 */
public record DataPoint(
        @JsonProperty("Timestamp") long timestamp,
        @JsonProperty("Value") @NonNull Map<String, Double> value) {

    public static final Comparator<DataPoint> BY_TIMESTAMP =
            Comparator.comparingLong(DataPoint::timestamp);

    public DataPoint {
        value = Collections.unmodifiableMap(new LinkedHashMap<>(value));
    }

    public static DataPoint of(long timestamp, @NonNull Quantiles quantiles, double rate) {
        var value = new LinkedHashMap<String, Double>();
        value.put("q50", quantiles.q50());
        value.put("q95", quantiles.q95());
        value.put("q99", quantiles.q99());
        value.put("rate", rate);
        return new DataPoint(timestamp, value);
    }

    public double rate() {
        return value.getOrDefault("rate", 0.0);
    }
}
