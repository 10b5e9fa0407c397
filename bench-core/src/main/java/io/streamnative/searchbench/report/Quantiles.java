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
import io.streamnative.searchbench.stats.Rates;
import org.HdrHistogram.AbstractHistogram;

/** Latency quantiles in milliseconds. All zero for a histogram without values. */
public record Quantiles(
        @JsonProperty("q50") double q50,
        @JsonProperty("q95") double q95,
        @JsonProperty("q99") double q99) {

    public static final Quantiles ZERO = new Quantiles(0, 0, 0);

    public static Quantiles of(AbstractHistogram histogram) {
        if (histogram.getTotalCount() == 0) {
            return ZERO;
        }
        return new Quantiles(
                Rates.toMillis(histogram.getValueAtPercentile(50)),
                Rates.toMillis(histogram.getValueAtPercentile(95)),
                Rates.toMillis(histogram.getValueAtPercentile(99)));
    }
}
