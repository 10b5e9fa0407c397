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

import io.streamnative.searchbench.processor.CmdStat;
import io.streamnative.searchbench.processor.Stat;
import io.streamnative.searchbench.record.CommandCategory;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Aggregation point shared by all workers: per-category latency histograms, a histogram over
 * all categories, and process-wide byte counters. All methods are thread-safe and need no
 * external locking.
 */
@Slf4j
public final class StatRecorder {
    private final Map<CommandCategory, LatencyHistograms> histograms;
    private final LatencyHistograms total = new LatencyHistograms();

    private final AtomicLong txTotalBytes = new AtomicLong();
    private final AtomicLong rxTotalBytes = new AtomicLong();
    private final AtomicLong failedCommands = new AtomicLong();
    private final AtomicLong outOfRange = new AtomicLong();

    public StatRecorder() {
        var map = new EnumMap<CommandCategory, LatencyHistograms>(CommandCategory.class);
        for (CommandCategory category : CommandCategory.values()) {
            map.put(category, new LatencyHistograms());
        }
        this.histograms = Collections.unmodifiableMap(map);
    }

    /** Records every observation of a processed batch. */
    public void record(@NonNull Stat stat) {
        for (CmdStat cmdStat : stat.cmdStats()) {
            record(cmdStat);
        }
        if (stat.getFailedCommands() > 0) {
            failedCommands.addAndGet(stat.getFailedCommands());
        }
    }

    public void record(@NonNull CmdStat cmdStat) {
        txTotalBytes.addAndGet(cmdStat.txBytes());
        rxTotalBytes.addAndGet(cmdStat.rxBytes());
        if (recordValue(total, cmdStat.latencyMicros())) {
            histograms.get(cmdStat.category()).recordValue(cmdStat.latencyMicros());
        }
    }

    /**
     * Records a latency into the given histograms. Values outside the trackable range are dropped
     * and counted, never recorded.
     */
    public boolean recordValue(@NonNull LatencyHistograms target, long micros) {
        if (target.recordValue(micros)) {
            return true;
        }
        outOfRange.incrementAndGet();
        log.debug("Dropping latency of {}us, outside of the trackable range", micros);
        return false;
    }

    public LatencyHistograms histograms(@NonNull CommandCategory category) {
        return histograms.get(category);
    }

    public LatencyHistograms total() {
        return total;
    }

    public long txTotalBytes() {
        return txTotalBytes.get();
    }

    public long rxTotalBytes() {
        return rxTotalBytes.get();
    }

    public long failedCommands() {
        return failedCommands.get();
    }

    public long outOfRangeObservations() {
        return outOfRange.get();
    }

    /** A point-in-time view of every counter. */
    public StatCounts counts() {
        var perCategory = new EnumMap<CommandCategory, Long>(CommandCategory.class);
        histograms.forEach((category, h) -> perCategory.put(category, h.totalCount()));
        return new StatCounts(perCategory, txTotalBytes.get(), rxTotalBytes.get());
    }
}
