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

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.streamnative.searchbench.BenchmarkConfig;
import io.streamnative.searchbench.processor.CmdStat;
import io.streamnative.searchbench.processor.Stat;
import io.streamnative.searchbench.record.CommandCategory;
import io.streamnative.searchbench.stats.StatRecorder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResultDocumentTest {

    static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    static final Instant END = START.plusSeconds(4);

    static ResultDocument summarize(StatRecorder recorder, BenchmarkConfig config) {
        var series = new EnumMap<CommandCategory, List<DataPoint>>(CommandCategory.class);
        series.put(
                CommandCategory.WRITE,
                List.of(DataPoint.of(START.getEpochSecond() + 1, new Quantiles(1.0, 2.0, 3.0), 250.0)));
        return new SummaryReporter(config, recorder)
                .summarize(
                        START,
                        END,
                        TimeUnit.SECONDS.toNanos(4),
                        Map.of("host", "localhost:6379", "pipeline", 50),
                        series,
                        2);
    }

    static StatRecorder recorderWithTraffic() {
        var recorder = new StatRecorder();
        var stat = Stat.empty();
        for (int i = 0; i < 600; i++) {
            stat.add(CmdStat.of(CommandCategory.WRITE, "w" + i, 1_000, 100, 10));
        }
        for (int i = 0; i < 200; i++) {
            stat.add(CmdStat.of(CommandCategory.READ, "r" + i, 4_000, 50, 1_000));
        }
        stat.add(CmdStat.of(CommandCategory.DELETE, "d", 700, 20, 0));
        recorder.record(stat.addFailures(5));
        return recorder;
    }

    @Nested
    class Summary {

        @Test
        void totalsAndRates() {
            var config = BenchmarkConfig.builder().workers(4).batchSize(100).metadata("nightly").build();

            ResultDocument document = summarize(recorderWithTraffic(), config);

            assertThat(document.durationMillis()).isEqualTo(4000);
            assertThat(document.startTime()).isEqualTo(START.getEpochSecond());
            assertThat(document.endTime()).isEqualTo(END.getEpochSecond());
            assertThat(document.resultFormatVersion()).isEqualTo("0.1");
            assertThat(document.workers()).isEqualTo(4);
            assertThat(document.dbName()).isEqualTo("idx1");
            assertThat(document.metadata()).isEqualTo("nightly");

            var totals = document.totals();
            assertThat(totals.totalOps()).isEqualTo(801);
            assertThat(totals.writes()).isEqualTo(600);
            assertThat(totals.reads()).isEqualTo(200);
            assertThat(totals.deletes()).isEqualTo(1);
            assertThat(totals.txBytes()).isEqualTo(600 * 100 + 200 * 50 + 20);
            assertThat(totals.failedCommands()).isEqualTo(5);
            assertThat(totals.skippedRecords()).isEqualTo(2);

            assertThat(document.overallRates().writeRate()).isEqualTo(150.0);
            assertThat(document.overallRates().overallOpsRate()).isEqualTo(801 / 4.0);
            assertThat(document.overallQuantiles().get("read").q50()).isBetween(3.99, 4.01);
            assertThat(document.overallQuantiles().get("update")).isEqualTo(Quantiles.ZERO);
            assertThat(document.timeSeries()).containsOnlyKeys(
                    "setupWriteTs", "writeTs", "updateTs", "readTs", "readCursorTs", "deleteTs");
            assertThat(document.timeSeries().get("writeTs")).hasSize(1);
        }

        @Test
        void ratiosWithoutTrafficAreUndefined() {
            ResultDocument document = summarize(new StatRecorder(), BenchmarkConfig.builder().build());

            var ratios = document.measuredRatios();
            assertThat(ratios.writeRatio()).isEqualTo(-1.0);
            assertThat(ratios.readRatio()).isEqualTo(-1.0);
            assertThat(ratios.updateRatio()).isEqualTo(-1.0);
            assertThat(ratios.deleteRatio()).isEqualTo(-1.0);
        }

        @Test
        void ratiosShareTheTotal() {
            ResultDocument document = summarize(recorderWithTraffic(), BenchmarkConfig.builder().build());

            var ratios = document.measuredRatios();
            assertThat(ratios.writeRatio()).isEqualTo(600 / 801.0);
            assertThat(ratios.readRatio()).isEqualTo(200 / 801.0);
            assertThat(ratios.deleteRatio()).isEqualTo(1 / 801.0);
        }
    }

    @Nested
    class Serialization {

        @Test
        void roundTripsThroughJson() throws Exception {
            ResultDocument document = summarize(recorderWithTraffic(), BenchmarkConfig.builder().build());

            String json = new JsonResultWriter().writeValueAsString(document);
            ResultDocument read = JsonResultWriter.mapper().readValue(json, ResultDocument.class);

            assertThat(read).usingRecursiveComparison().isEqualTo(document);
        }

        @Test
        void usesTheStablePropertyNames() throws Exception {
            ResultDocument document = summarize(recorderWithTraffic(), BenchmarkConfig.builder().build());

            JsonNode json =
                    JsonResultWriter.mapper()
                            .readTree(new JsonResultWriter().writeValueAsString(document));

            assertThat(json.fieldNames())
                    .toIterable()
                    .contains(
                            "StartTime",
                            "EndTime",
                            "DurationMillis",
                            "DBSpecificConfigs",
                            "Totals",
                            "MeasuredRatios",
                            "OverallRates",
                            "TimeSeries",
                            "OverallQuantiles");
            assertThat(json.at("/Totals/TotalOps").asLong()).isEqualTo(801);
            assertThat(json.at("/OverallRates/txByteRateStr").asText()).endsWith("K");
            assertThat(json.at("/TimeSeries/writeTs/0/Value/rate").asDouble()).isEqualTo(250.0);
            assertThat(json.at("/TimeSeries/writeTs/0/Timestamp").asLong())
                    .isEqualTo(START.getEpochSecond() + 1);
        }

        @Test
        void writesThePrettyDocumentToAFile(@TempDir Path dir) throws Exception {
            ResultDocument document = summarize(recorderWithTraffic(), BenchmarkConfig.builder().build());
            Path out = dir.resolve("result.json");

            new JsonResultWriter().write(document, out);

            assertThat(Files.readString(out)).contains("\"ResultFormatVersion\" : \"0.1\"");
        }
    }
}
