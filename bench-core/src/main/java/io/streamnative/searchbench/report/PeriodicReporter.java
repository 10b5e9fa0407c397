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

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import com.google.common.base.Strings;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.streamnative.searchbench.record.CommandCategory;
import io.streamnative.searchbench.stats.LatencyHistograms;
import io.streamnative.searchbench.stats.Rates;
import io.streamnative.searchbench.stats.StatCounts;
import io.streamnative.searchbench.stats.StatRecorder;
import io.streamnative.searchbench.util.Runs;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs the progress of the run once per reporting period and samples the instantaneous
 * histograms into one time series per category.
 *
 * <p>Ticks run on a dedicated scheduler thread. A tick only reads the cumulative histograms and
 * counters; it drains the instantaneous histograms, which nothing else does.
 */
@Slf4j
public final class PeriodicReporter implements AutoCloseable {
    private static final int COLUMN_WIDTH = 20;
    private static final String[] HEADER = {
        "setup writes/sec",
        "writes/sec",
        "updates/sec",
        "reads/sec",
        "cursor reads/sec",
        "deletes/sec",
        "current ops/sec",
        "total ops",
        "TX BW/s",
        "RX BW/s"
    };

    private final StatRecorder recorder;
    private final Duration period;
    private final Ticker ticker;
    private final Clock clock;
    private final Map<CommandCategory, List<DataPoint>> series = new EnumMap<>(CommandCategory.class);

    private ScheduledExecutorService executor;
    private StatCounts previous = StatCounts.ZERO;
    private long previousNanos;

    public PeriodicReporter(
            @NonNull StatRecorder recorder,
            @NonNull Duration period,
            @NonNull Ticker ticker,
            @NonNull Clock clock) {
        this.recorder = recorder;
        this.period = period;
        this.ticker = ticker;
        this.clock = clock;
        for (CommandCategory category : CommandCategory.values()) {
            series.put(category, new ArrayList<>());
        }
    }

    public boolean isEnabled() {
        return !period.isZero();
    }

    /** Marks the start of the first interval and, unless reporting is disabled, starts ticking. */
    public synchronized void start() {
        previousNanos = ticker.read();
        previous = recorder.counts();
        if (!isEnabled()) {
            return;
        }
        log.info(row(HEADER));
        executor =
                Executors.newSingleThreadScheduledExecutor(
                        new ThreadFactoryBuilder()
                                .setNameFormat("search-bench-reporter")
                                .setDaemon(true)
                                .build());
        long periodNanos = period.toNanos();
        executor.scheduleAtFixedRate(
                () -> Runs.safeRun(log, "periodic report", this::tick),
                periodNanos,
                periodNanos,
                NANOSECONDS);
    }

    /** Closes the current interval: logs one report line and appends one sample per category. */
    public synchronized void tick() {
        long now = ticker.read();
        long elapsed = now - previousNanos;
        long timestamp = clock.instant().getEpochSecond();
        StatCounts current = recorder.counts();

        String[] columns = new String[HEADER.length];
        int column = 0;
        for (CommandCategory category : CommandCategory.values()) {
            LatencyHistograms histograms = recorder.histograms(category);
            double rate = Rates.rate(current.count(category), previous.count(category), elapsed);
            columns[column++] = rateColumn(rate, histograms.valueAtPercentile(50));

            var interval = histograms.intervalHistogram();
            double intervalRate = Rates.rate(interval.getTotalCount(), 0, elapsed);
            series.get(category).add(DataPoint.of(timestamp, Quantiles.of(interval), intervalRate));
        }
        // the total pair is sampled only to keep its interval aligned with the categories
        recorder.total().intervalHistogram();

        double opsRate = Rates.rate(current.totalOps(), previous.totalOps(), elapsed);
        columns[column++] = rateColumn(opsRate, recorder.total().valueAtPercentile(50));
        columns[column++] = Long.toString(current.totalOps());
        columns[column++] =
                ByteSizes.format(Rates.rate(current.txBytes(), previous.txBytes(), elapsed)) + "B/s";
        columns[column] =
                ByteSizes.format(Rates.rate(current.rxBytes(), previous.rxBytes(), elapsed)) + "B/s";
        log.info(row(columns));

        previous = current;
        previousNanos = now;
    }

    /** The samples collected so far, per category, ordered by timestamp. */
    public synchronized Map<CommandCategory, List<DataPoint>> timeSeries() {
        var copy = new EnumMap<CommandCategory, List<DataPoint>>(CommandCategory.class);
        series.forEach(
                (category, points) -> {
                    var sorted = new ArrayList<>(points);
                    sorted.sort(DataPoint.BY_TIMESTAMP);
                    copy.put(category, List.copyOf(sorted));
                });
        return copy;
    }

    @Override
    public void close() {
        ScheduledExecutorService toStop;
        synchronized (this) {
            toStop = executor;
            executor = null;
        }
        if (toStop != null) {
            // outside the monitor, a running tick needs it to finish
            MoreExecutors.shutdownAndAwaitTermination(toStop, 5, TimeUnit.SECONDS);
        }
    }

    private static String rateColumn(double rate, long q50Micros) {
        return String.format(Locale.ROOT, "%.0f (%.3f)", rate, Rates.toMillis(q50Micros));
    }

    private static String row(String[] columns) {
        var line = new StringBuilder();
        for (String column : columns) {
            line.append(Strings.padStart(column, COLUMN_WIDTH, ' '));
        }
        return line.toString();
    }
}
