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
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * The result document written at the end of a successful run. Property names are kept stable
 * so results of different runs can be compared with each other.
 */
@Builder
public record ResultDocument(
        @JsonProperty("StartTime") long startTime,
        @JsonProperty("EndTime") long endTime,
        @JsonProperty("DurationMillis") long durationMillis,
        @JsonProperty("BatchSize") int batchSize,
        @JsonProperty("Workers") int workers,
        @JsonProperty("Limit") long limit,
        @JsonProperty("DbName") String dbName,
        @JsonProperty("Metadata") String metadata,
        @JsonProperty("ResultFormatVersion") String resultFormatVersion,
        @JsonProperty("DBSpecificConfigs") Map<String, Object> dbSpecificConfigs,
        @JsonProperty("Totals") Totals totals,
        @JsonProperty("MeasuredRatios") MeasuredRatios measuredRatios,
        @JsonProperty("OverallRates") OverallRates overallRates,
        @JsonProperty("TimeSeries") Map<String, List<DataPoint>> timeSeries,
        @JsonProperty("OverallQuantiles") Map<String, Quantiles> overallQuantiles) {

    public static final String CURRENT_FORMAT_VERSION = "0.1";

    @Builder
    public record Totals(
            @JsonProperty("TotalOps") long totalOps,
            @JsonProperty("SetupWrites") long setupWrites,
            @JsonProperty("Writes") long writes,
            @JsonProperty("Reads") long reads,
            @JsonProperty("ReadsCursor") long readsCursor,
            @JsonProperty("Updates") long updates,
            @JsonProperty("Deletes") long deletes,
            @JsonProperty("TxBytes") long txBytes,
            @JsonProperty("RxBytes") long rxBytes,
            @JsonProperty("FailedCommands") long failedCommands,
            @JsonProperty("OutOfRangeObservations") long outOfRangeObservations,
            @JsonProperty("SkippedRecords") long skippedRecords) {}

    /** Share of each kind of operation, {@code -1} when nothing was measured. */
    public record MeasuredRatios(
            @JsonProperty("MeasuredWriteRatio") double writeRatio,
            @JsonProperty("MeasuredReadRatio") double readRatio,
            @JsonProperty("MeasuredUpdateRatio") double updateRatio,
            @JsonProperty("MeasuredDeleteRatio") double deleteRatio) {}

    /** Rates over the whole run, in operations or bytes per second. */
    @Builder
    public record OverallRates(
            @JsonProperty("setupWriteRate") double setupWriteRate,
            @JsonProperty("writeRate") double writeRate,
            @JsonProperty("readRate") double readRate,
            @JsonProperty("readCursorRate") double readCursorRate,
            @JsonProperty("updateRate") double updateRate,
            @JsonProperty("deleteRate") double deleteRate,
            @JsonProperty("overallOpsRate") double overallOpsRate,
            @JsonProperty("overallTxByteRate") double overallTxByteRate,
            @JsonProperty("overallRxByteRate") double overallRxByteRate,
            @JsonProperty("txByteRateStr") String txByteRateStr,
            @JsonProperty("rxByteRateStr") String rxByteRateStr) {}
}
