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
package io.streamnative.searchbench.stats;

import org.HdrHistogram.ConcurrentHistogram;
import org.HdrHistogram.Histogram;
import org.HdrHistogram.Recorder;

/**
 * The cumulative and instantaneous latency histograms of one category, in microseconds.
 *
 * <p>Recording is safe from any number of threads. The cumulative histogram accumulates for the
 * lifetime of the run. The instantaneous one is drained by {@link #intervalHistogram()}, which
 * only the reporter calls.
 */
public final class LatencyHistograms {
    public static final long LOWEST_TRACKABLE_MICROS = 1;
    public static final long HIGHEST_TRACKABLE_MICROS = 1_000_000;
    public static final int SIGNIFICANT_DIGITS = 3;

    private final Histogram cumulative =
            new ConcurrentHistogram(LOWEST_TRACKABLE_MICROS, HIGHEST_TRACKABLE_MICROS, SIGNIFICANT_DIGITS);
    private final Recorder instantaneous =
            new Recorder(LOWEST_TRACKABLE_MICROS, HIGHEST_TRACKABLE_MICROS, SIGNIFICANT_DIGITS);

    // recycled between interval snapshots
    private Histogram interval;

    public static boolean isTrackable(long micros) {
        return micros >= LOWEST_TRACKABLE_MICROS && micros <= HIGHEST_TRACKABLE_MICROS;
    }

    /**
     * Records a latency in both histograms.
     *
     * @return false if the value is outside the trackable range and was dropped
     */
    public boolean recordValue(long micros) {
        if (!isTrackable(micros)) {
            return false;
        }
        cumulative.recordValue(micros);
        instantaneous.recordValue(micros);
        return true;
    }

    /** Lifetime number of recorded values. Never decreases. */
    public long totalCount() {
        return cumulative.getTotalCount();
    }

    public long valueAtPercentile(double percentile) {
        return cumulative.getValueAtPercentile(percentile);
    }

    /** A stable copy of the cumulative histogram. */
    public Histogram cumulativeSnapshot() {
        return cumulative.copy();
    }

    /**
     * Returns the values recorded since the previous call and starts a new interval. The returned
     * histogram is reused by the next call and must not be retained.
     */
    public synchronized Histogram intervalHistogram() {
        interval = instantaneous.getIntervalHistogram(interval);
        return interval;
    }
}
