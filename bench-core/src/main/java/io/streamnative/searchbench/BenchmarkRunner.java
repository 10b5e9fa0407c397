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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import io.streamnative.searchbench.channel.DuplexChannel;
import io.streamnative.searchbench.db.DbCreator;
import io.streamnative.searchbench.processor.TargetException;
import io.streamnative.searchbench.record.RecordSource;
import io.streamnative.searchbench.report.JsonResultWriter;
import io.streamnative.searchbench.report.PeriodicReporter;
import io.streamnative.searchbench.report.ResultDocument;
import io.streamnative.searchbench.report.SummaryReporter;
import io.streamnative.searchbench.scan.Scanner;
import io.streamnative.searchbench.stats.StatRecorder;
import io.streamnative.searchbench.worker.WorkerPool;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one benchmark end to end: prepares the database, wires the scanner to the worker pool
 * through the channels, reports while the run progresses and summarizes it at the end.
 *
 * <p>Any fatal error surfaces as a {@link BenchmarkException} from {@link #run(Benchmark)}, in
 * which case no result document is written.
 */
@Slf4j
public final class BenchmarkRunner {
    static final int READ_BUFFER_SIZE = 4 << 20;

    private static final String DB_EXISTS_FORMAT = "database \"%s\" exists: aborting.";

    private final BenchmarkConfig config;
    private final Ticker ticker;
    private final Clock clock;
    private final InputStream stdin;

    @Getter private final StatRecorder recorder = new StatRecorder();

    public BenchmarkRunner(@NonNull BenchmarkConfig config) {
        this(config, Ticker.systemTicker(), Clock.systemUTC(), System.in);
    }

    BenchmarkRunner(
            @NonNull BenchmarkConfig config,
            @NonNull Ticker ticker,
            @NonNull Clock clock,
            @NonNull InputStream stdin) {
        this.config = config;
        this.ticker = ticker;
        this.clock = clock;
        this.stdin = stdin;
    }

    /**
     * Runs the benchmark to completion.
     *
     * @return the result document, also written to the configured output file if any
     * @throws BenchmarkException if the run could not be set up or a worker failed
     */
    public ResultDocument run(@NonNull Benchmark benchmark) {
        log.info("Starting benchmark with {}", config);
        try (BufferedReader reader = openInput();
                DbCreator dbCreator = benchmark.dbCreator()) {
            useDbCreator(dbCreator);
            ResultDocument result = load(benchmark, benchmark.recordSource(reader));
            if (!config.jsonOutFile().isEmpty()) {
                new JsonResultWriter().write(result, Path.of(config.jsonOutFile()));
            }
            return result;
        } catch (IOException ex) {
            throw new BenchmarkException("failed to release the benchmark input", ex);
        }
    }

    private ResultDocument load(Benchmark benchmark, RecordSource source) {
        List<DuplexChannel> channels = createChannels();
        var pool =
                new WorkerPool(
                        channels, config.workers(), benchmark::newProcessor, recorder, config.doLoad());
        var scanner = new Scanner(channels, benchmark.indexer(channels.size()));
        var reporter = new PeriodicReporter(recorder, config.reportingPeriod(), ticker, clock);

        pool.start();
        Instant start = clock.instant();
        Stopwatch stopwatch = Stopwatch.createStarted(ticker);
        long scanned;
        try (reporter) {
            reporter.start();
            try {
                scanned = scanner.scan(source, config.batchSize(), config.limit());
            } catch (RuntimeException ex) {
                pool.abort(ex);
                throw ex;
            }
            pool.join();
        }
        Instant end = clock.instant();
        long elapsedNanos = stopwatch.elapsed(TimeUnit.NANOSECONDS);
        log.info("Scanned {} records, skipped {} malformed ones", scanned, source.skipped());

        return new SummaryReporter(config, recorder)
                .summarize(
                        start,
                        end,
                        elapsedNanos,
                        benchmark.configurationParameters(),
                        reporter.timeSeries(),
                        source.skipped());
    }

    /**
     * Prepares the target database. The creator is initialized even when nothing is created
     * since it may open the session the other steps need.
     */
    void useDbCreator(DbCreator dbCreator) {
        if (!config.doLoad()) {
            return;
        }
        String dbName = config.dbName();
        try {
            dbCreator.init();
            boolean exists = dbCreator.exists(dbName);
            if (exists && config.doAbortOnExist()) {
                throw new BenchmarkException(String.format(DB_EXISTS_FORMAT, dbName));
            }
            if (config.doCreateDb()) {
                if (exists) {
                    log.info("Removing existing database {}", dbName);
                    dbCreator.removeOld(dbName);
                }
                dbCreator.create(dbName);
                log.info("Created database {}", dbName);
            }
            dbCreator.postCreate(dbName);
        } catch (TargetException ex) {
            throw new BenchmarkException("failed to prepare database " + dbName, ex);
        }
    }

    List<DuplexChannel> createChannels() {
        int count = config.channelCount();
        int capacity = config.channelCapacity();
        List<DuplexChannel> channels = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            channels.add(new DuplexChannel(capacity));
        }
        return channels;
    }

    private BufferedReader openInput() {
        if (config.fileName().isEmpty()) {
            log.info("Reading commands from standard input");
            return new BufferedReader(new InputStreamReader(stdin, UTF_8), READ_BUFFER_SIZE);
        }
        try {
            InputStream in = Files.newInputStream(Path.of(config.fileName()));
            return new BufferedReader(new InputStreamReader(in, UTF_8), READ_BUFFER_SIZE);
        } catch (IOException ex) {
            throw new BenchmarkException("cannot open file for read " + config.fileName(), ex);
        }
    }
}
