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
package io.streamnative.searchbench;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.streamnative.searchbench.channel.DuplexChannel;
import io.streamnative.searchbench.db.DbCreator;
import io.streamnative.searchbench.processor.PipelinedProcessor;
import io.streamnative.searchbench.processor.Processor;
import io.streamnative.searchbench.processor.TargetClient;
import io.streamnative.searchbench.processor.TargetException;
import io.streamnative.searchbench.record.CommandCategory;
import io.streamnative.searchbench.record.CommandRecord;
import io.streamnative.searchbench.record.ListRecordSource;
import io.streamnative.searchbench.record.RecordSource;
import io.streamnative.searchbench.record.Records;
import io.streamnative.searchbench.report.ResultDocument;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

class BenchmarkRunnerTest {

    /** Answers every command with "OK", failing every {@code failEvery}-th round trip. */
    static final class FakeTarget {
        final AtomicLong roundTrips = new AtomicLong();
        final AtomicLong commands = new AtomicLong();
        final AtomicLong clients = new AtomicLong();
        final AtomicLong closed = new AtomicLong();
        final int failEvery;

        FakeTarget(int failEvery) {
            this.failEvery = failEvery;
        }

        TargetClient connect() {
            clients.incrementAndGet();
            return new TargetClient() {
                @Override
                public List<Object> execute(List<CommandRecord> batch) throws TargetException {
                    long trip = roundTrips.incrementAndGet();
                    if (failEvery > 0 && trip % failEvery == 0) {
                        throw new TargetException("ERR injected");
                    }
                    commands.addAndGet(batch.size());
                    return new ArrayList<>(Collections.nCopies(batch.size(), "OK"));
                }

                @Override
                public void close() {
                    closed.incrementAndGet();
                }
            };
        }
    }

    static final class FakeBenchmark implements Benchmark {
        final BenchmarkConfig config;
        final FakeTarget target;
        final List<CommandRecord> input;
        final DbCreator dbCreator = mock(DbCreator.class);
        final FakeTicker ticker;

        FakeBenchmark(BenchmarkConfig config, FakeTarget target, List<CommandRecord> input, FakeTicker ticker) {
            this.config = config;
            this.target = target;
            this.input = input;
            this.ticker = ticker;
        }

        @Override
        public RecordSource recordSource(BufferedReader reader) {
            return new ListRecordSource(input);
        }

        @Override
        public Processor newProcessor() {
            return new PipelinedProcessor(config, (address, poolSize, clusterMode) -> target.connect(), ticker);
        }

        @Override
        public DbCreator dbCreator() {
            return dbCreator;
        }

        @Override
        public Map<String, Object> configurationParameters() {
            return Map.of("pipeline", config.pipeline());
        }
    }

    FakeTicker ticker;
    Clock clock;

    @BeforeEach
    void setup() {
        ticker = new FakeTicker().setAutoIncrementStep(Duration.ofNanos(1_000));
        clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    }

    private BenchmarkRunner runner(BenchmarkConfig config) {
        return new BenchmarkRunner(config, ticker, clock, new ByteArrayInputStream(new byte[0]));
    }

    private static BenchmarkConfig.BenchmarkConfigBuilder config() {
        return BenchmarkConfig.builder()
                .workers(4)
                .batchSize(100)
                .pipeline(50)
                .reportingPeriod(Duration.ZERO);
    }

    @Test
    void replaysEveryRecordExactlyOnce() {
        var config = config().build();
        var target = new FakeTarget(0);
        var benchmark = new FakeBenchmark(config, target, Records.writes(10_000), ticker);

        ResultDocument result = runner(config).run(benchmark);

        assertThat(target.roundTrips).hasValue(200);
        assertThat(target.commands).hasValue(10_000);
        assertThat(target.clients).hasValue(4);
        assertThat(target.closed).hasValue(4);
        assertThat(result.totals().totalOps()).isEqualTo(10_000);
        assertThat(result.totals().writes()).isEqualTo(10_000);
        assertThat(result.totals().txBytes()).isEqualTo(10_000 * 20L);
        assertThat(result.totals().failedCommands()).isZero();
        assertThat(result.measuredRatios().writeRatio()).isEqualTo(1.0);
        assertThat(result.dbSpecificConfigs()).containsEntry("pipeline", 50);
    }

    @Test
    void failedRoundTripsAreToleratedWhenContinuingOnError() {
        var config = config().continueOnError(true).build();
        var target = new FakeTarget(10);
        var benchmark = new FakeBenchmark(config, target, Records.writes(10_000), ticker);

        ResultDocument result = runner(config).run(benchmark);

        assertThat(target.roundTrips).hasValue(200);
        assertThat(result.totals().failedCommands()).isEqualTo(20 * 50);
        assertThat(result.totals().totalOps()).isEqualTo(10_000 - 20 * 50);
    }

    @Test
    void failedRoundTripAbortsTheRunOtherwise(@TempDir Path dir) {
        Path out = dir.resolve("result.json");
        var config = config().jsonOutFile(out.toString()).build();
        var target = new FakeTarget(10);
        var benchmark = new FakeBenchmark(config, target, Records.writes(10_000), ticker);

        assertThatThrownBy(() -> runner(config).run(benchmark))
                .isInstanceOf(BenchmarkException.class)
                .hasMessageContaining("benchmark aborted");
        assertThat(out).doesNotExist();
        verify(benchmark.dbCreator).close();
    }

    @Test
    void writesTheResultDocument(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("result.json");
        var config = config().jsonOutFile(out.toString()).metadata("ci").build();
        var benchmark = new FakeBenchmark(config, new FakeTarget(0), Records.writes(1_000), ticker);

        runner(config).run(benchmark);

        assertThat(Files.readString(out)).contains("\"Metadata\" : \"ci\"").contains("\"TotalOps\" : 1000");
    }

    @Test
    void dryRunOnlyReadsTheInput() throws Exception {
        var config = config().doLoad(false).build();
        var target = new FakeTarget(0);
        var input = Records.writes(5_000);
        var benchmark = new FakeBenchmark(config, target, input, ticker);

        ResultDocument result = runner(config).run(benchmark);

        assertThat(target.clients).hasValue(0);
        assertThat(result.totals().totalOps()).isZero();
        assertThat(result.measuredRatios().readRatio()).isEqualTo(-1.0);
        verify(benchmark.dbCreator, never()).init();
    }

    @Test
    void limitBoundsTheReplay() {
        var config = config().limit(1_234).build();
        var target = new FakeTarget(0);
        var benchmark = new FakeBenchmark(config, target, Records.writes(10_000), ticker);

        ResultDocument result = runner(config).run(benchmark);

        assertThat(target.commands).hasValue(1_234);
        assertThat(result.limit()).isEqualTo(1_234);
    }

    @Test
    void mixedCategoriesAreAccountedSeparately() {
        var config = config().build();
        var input = new ArrayList<CommandRecord>();
        for (int i = 0; i < 900; i++) {
            CommandCategory category = CommandCategory.values()[i % CommandCategory.values().length];
            input.add(Records.record(category, i));
        }
        var benchmark = new FakeBenchmark(config, new FakeTarget(0), input, ticker);

        ResultDocument result = runner(config).run(benchmark);

        var totals = result.totals();
        assertThat(totals.setupWrites()).isEqualTo(150);
        assertThat(totals.readsCursor()).isEqualTo(150);
        assertThat(totals.updates()).isEqualTo(150);
        assertThat(result.measuredRatios().writeRatio()).isEqualTo(300 / 900.0);
    }

    @Test
    void missingInputFileIsFatal() {
        var config = config().fileName("/does/not/exist.csv").build();
        var benchmark = new FakeBenchmark(config, new FakeTarget(0), List.of(), ticker);

        assertThatThrownBy(() -> runner(config).run(benchmark))
                .isInstanceOf(BenchmarkException.class)
                .hasMessageContaining("cannot open file for read");
    }

    @Test
    void channelsFollowTheWorkQueueLayout() {
        List<DuplexChannel> perWorker = runner(config().workers(5).build()).createChannels();
        assertThat(perWorker).hasSize(5).allSatisfy(c -> assertThat(c.getCapacity()).isEqualTo(1));

        List<DuplexChannel> shared =
                runner(config().workers(5).workQueues(2).build()).createChannels();
        assertThat(shared).hasSize(2).allSatisfy(c -> assertThat(c.getCapacity()).isEqualTo(3));
    }

    @Nested
    class DbCreation {
        DbCreator dbCreator = mock(DbCreator.class);

        @Test
        void existingDatabaseAbortsWhenRequested() throws Exception {
            when(dbCreator.exists("idx1")).thenReturn(true);
            var runner = runner(config().doAbortOnExist(true).build());

            assertThatThrownBy(() -> runner.useDbCreator(dbCreator))
                    .isInstanceOf(BenchmarkException.class)
                    .hasMessage("database \"idx1\" exists: aborting.");
            verify(dbCreator, never()).create("idx1");
        }

        @Test
        void existingDatabaseIsRecreated() throws Exception {
            when(dbCreator.exists("idx1")).thenReturn(true);

            runner(config().build()).useDbCreator(dbCreator);

            InOrder order = inOrder(dbCreator);
            order.verify(dbCreator).init();
            order.verify(dbCreator).removeOld("idx1");
            order.verify(dbCreator).create("idx1");
            order.verify(dbCreator).postCreate("idx1");
        }

        @Test
        void creationCanBeSkipped() throws Exception {
            when(dbCreator.exists("idx1")).thenReturn(true);

            runner(config().doCreateDb(false).build()).useDbCreator(dbCreator);

            verify(dbCreator, never()).removeOld("idx1");
            verify(dbCreator, never()).create("idx1");
            verify(dbCreator).postCreate("idx1");
        }

        @Test
        void dryRunLeavesTheDatabaseAlone() {
            runner(config().doLoad(false).build()).useDbCreator(dbCreator);

            verifyNoInteractions(dbCreator);
        }

        @Test
        void targetFailureIsFatal() throws Exception {
            when(dbCreator.exists("idx1")).thenThrow(new TargetException("connection refused"));

            assertThatThrownBy(() -> runner(config().build()).useDbCreator(dbCreator))
                    .isInstanceOf(BenchmarkException.class)
                    .hasCauseInstanceOf(TargetException.class);
        }
    }
}
