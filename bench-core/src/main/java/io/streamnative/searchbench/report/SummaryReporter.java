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

import io.streamnative.searchbench.BenchmarkConfig;
import io.streamnative.searchbench.record.CommandCategory;
import io.streamnative.searchbench.stats.Rates;
import io.streamnative.searchbench.stats.StatCounts;
import io.streamnative.searchbench.stats.StatRecorder;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Summarizes a finished run: logs the overall statistics and assembles the result document. */
@Slf4j
@RequiredArgsConstructor
public final class SummaryReporter {
    @NonNull private final BenchmarkConfig config;
    @NonNull private final StatRecorder recorder;

    /**
     * Builds the result document of the run. Must be called after every worker has finished.
     *
     * @param start wall clock time the scan started at
     * @param end wall clock time the last worker finished at
     * @param elapsedNanos monotonic duration of the run
     */
    public ResultDocument summarize(
            @NonNull Instant start,
            @NonNull Instant end,
            long elapsedNanos,
            @NonNull Map<String, Object> dbSpecificConfigs,
            @NonNull Map<CommandCategory, List<DataPoint>> timeSeries,
            long skippedRecords) {
        StatCounts counts = recorder.counts();
        long totalOps = counts.totalOps();

        var totals =
                ResultDocument.Totals.builder()
                        .totalOps(totalOps)
                        .setupWrites(counts.count(CommandCategory.SETUP_WRITE))
                        .writes(counts.count(CommandCategory.WRITE))
                        .reads(counts.count(CommandCategory.READ))
                        .readsCursor(counts.count(CommandCategory.CURSOR_READ))
                        .updates(counts.count(CommandCategory.UPDATE))
                        .deletes(counts.count(CommandCategory.DELETE))
                        .txBytes(counts.txBytes())
                        .rxBytes(counts.rxBytes())
                        .failedCommands(recorder.failedCommands())
                        .outOfRangeObservations(recorder.outOfRangeObservations())
                        .skippedRecords(skippedRecords)
                        .build();

        var ratios =
                new ResultDocument.MeasuredRatios(
                        Rates.ratio(counts.writes(), totalOps),
                        Rates.ratio(counts.reads(), totalOps),
                        Rates.ratio(counts.count(CommandCategory.UPDATE), totalOps),
                        Rates.ratio(counts.count(CommandCategory.DELETE), totalOps));

        double txRate = Rates.rate(counts.txBytes(), 0, elapsedNanos);
        double rxRate = Rates.rate(counts.rxBytes(), 0, elapsedNanos);
        var rates =
                ResultDocument.OverallRates.builder()
                        .setupWriteRate(rate(counts, CommandCategory.SETUP_WRITE, elapsedNanos))
                        .writeRate(rate(counts, CommandCategory.WRITE, elapsedNanos))
                        .readRate(rate(counts, CommandCategory.READ, elapsedNanos))
                        .readCursorRate(rate(counts, CommandCategory.CURSOR_READ, elapsedNanos))
                        .updateRate(rate(counts, CommandCategory.UPDATE, elapsedNanos))
                        .deleteRate(rate(counts, CommandCategory.DELETE, elapsedNanos))
                        .overallOpsRate(Rates.rate(totalOps, 0, elapsedNanos))
                        .overallTxByteRate(txRate)
                        .overallRxByteRate(rxRate)
                        .txByteRateStr(ByteSizes.format(txRate))
                        .rxByteRateStr(ByteSizes.format(rxRate))
                        .build();

        var series = new LinkedHashMap<String, List<DataPoint>>();
        var quantiles = new LinkedHashMap<String, Quantiles>();
        for (CommandCategory category : CommandCategory.values()) {
            series.put(category.getResultKey() + "Ts", timeSeries.getOrDefault(category, List.of()));
            quantiles.put(
                    category.getResultKey(),
                    Quantiles.of(recorder.histograms(category).cumulativeSnapshot()));
        }

        logSummary(counts, elapsedNanos, rates);

        return ResultDocument.builder()
                .startTime(start.getEpochSecond())
                .endTime(end.getEpochSecond())
                .durationMillis(elapsedNanos / 1_000_000)
                .batchSize(config.batchSize())
                .workers(config.workers())
                .limit(config.limit())
                .dbName(config.dbName())
                .metadata(config.metadata())
                .resultFormatVersion(ResultDocument.CURRENT_FORMAT_VERSION)
                .dbSpecificConfigs(dbSpecificConfigs)
                .totals(totals)
                .measuredRatios(ratios)
                .overallRates(rates)
                .timeSeries(series)
                .overallQuantiles(quantiles)
                .build();
    }

    private static double rate(StatCounts counts, CommandCategory category, long elapsedNanos) {
        return Rates.rate(counts.count(category), 0, elapsedNanos);
    }

    private void logSummary(StatCounts counts, long elapsedNanos, ResultDocument.OverallRates rates) {
        var summary = new StringBuilder();
        summary.append(
                String.format(
                        Locale.ROOT,
                        "Summary:%nIssued %d Commands in %.3fsec with %d workers%n\tOverall stats:%n",
                        counts.totalOps(),
                        elapsedNanos / 1e9,
                        config.workers()));
        summary.append(
                line("Total", rates.overallOpsRate(), recorder.total().valueAtPercentile(50)));
        for (CommandCategory category : CommandCategory.values()) {
            summary.append(
                    line(
                            category.getDisplayName(),
                            Rates.rate(counts.count(category), 0, elapsedNanos),
                            recorder.histograms(category).valueAtPercentile(50)));
        }
        summary.append(
                String.format(
                        Locale.ROOT,
                        "\tOverall TX Byte Rate: %sB/sec%n\tOverall RX Byte Rate: %sB/sec",
                        rates.txByteRateStr(),
                        rates.rxByteRateStr()));
        if (recorder.failedCommands() > 0) {
            summary.append(
                    String.format(Locale.ROOT, "%n\tFailed commands: %d", recorder.failedCommands()));
        }
        log.info("{}", summary);
    }

    private static String line(String name, double rate, long q50Micros) {
        return String.format(
                Locale.ROOT,
                "\t- %-14s %10.0f ops/sec\tq50 lat %.3f ms%n",
                name,
                rate,
                Rates.toMillis(q50Micros));
    }
}
