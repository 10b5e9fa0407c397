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
package io.streamnative.searchbench.redisearch;

import io.streamnative.searchbench.BenchmarkConfig;
import io.streamnative.searchbench.BenchmarkException;
import io.streamnative.searchbench.BenchmarkRunner;
import java.time.Duration;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

@Slf4j
@CommandLine.Command(
        name = "redisearch",
        mixinStandardHelpOptions = true,
        description = "Replays a stream of RediSearch commands and measures latency and throughput")
public final class RediSearchOptions implements Callable<Integer> {

    /* Target */
    @CommandLine.Option(
            names = {"--host"},
            description = "The host:port for Redis connection")
    String host = "localhost:6379";

    @CommandLine.Option(
            names = {"--cluster-mode"},
            arity = "0..1",
            fallbackValue = "true",
            description = "Whether the target is a Redis cluster")
    boolean clusterMode = false;

    @CommandLine.Option(
            names = {"--connections"},
            description = "The number of pooled connections per worker")
    int connections = 1;

    @CommandLine.Option(
            names = {"--pipeline"},
            description = "The number of commands sent in a single pipelined round trip")
    int pipeline = 50;

    @CommandLine.Option(
            names = {"--continue-on-error"},
            arity = "0..1",
            fallbackValue = "true",
            description = "Whether to continue when a pipelined round trip fails")
    boolean continueOnError = false;

    @CommandLine.Option(
            names = {"--debug"},
            description = "Debug level, above 0 dumps the commands of failed round trips")
    int debug = 0;

    @CommandLine.Option(
            names = {"--measure-rx-bytes"},
            arity = "0..1",
            fallbackValue = "true",
            description = "Whether to account reply payloads as received bytes")
    boolean measureRxBytes = false;

    /* Index */
    @CommandLine.Option(
            names = {"--index"},
            description = "Name of index")
    String index = "idx1";

    @CommandLine.Option(
            names = {"--index-schema"},
            description = "FT.CREATE arguments following the index name, e.g. 'ON HASH SCHEMA title TEXT'")
    String indexSchema = "";

    @CommandLine.Option(
            names = {"--do-create-db"},
            arity = "0..1",
            fallbackValue = "true",
            description = "Whether to create the index. Disable on all but one client if running on a multi client setup")
    boolean doCreateDb = true;

    @CommandLine.Option(
            names = {"--do-abort-on-exist"},
            arity = "0..1",
            fallbackValue = "true",
            description = "Whether to abort if an index with the given name already exists")
    boolean doAbortOnExist = false;

    /* Load */
    @CommandLine.Option(
            names = {"--file"},
            description = "File name to read the commands from, standard input if not set")
    String fileName = "";

    @CommandLine.Option(
            names = {"--workers"},
            description = "Number of parallel clients")
    int workers = 8;

    @CommandLine.Option(
            names = {"--work-queues"},
            description = "Number of work queues, 0 for one queue per worker")
    int workQueues = BenchmarkConfig.WORKER_PER_QUEUE;

    @CommandLine.Option(
            names = {"--batch-size"},
            description = "Number of commands to batch together")
    int batchSize = 1000;

    @CommandLine.Option(
            names = {"--limit"},
            description = "Number of commands to replay (0 = all of them)")
    long limit = 0;

    @CommandLine.Option(
            names = {"--do-benchmark"},
            arity = "0..1",
            fallbackValue = "true",
            description = "Whether to send the commands. Set to false to check input read speed")
    boolean doLoad = true;

    /* Output */
    @CommandLine.Option(
            names = {"--reporting-period"},
            converter = DurationConverter.class,
            description = "Period to report stats, 0 to disable")
    Duration reportingPeriod = Duration.ofSeconds(1);

    @CommandLine.Option(
            names = {"--json-out-file"},
            description = "Name of the json output file. If not set, results are only logged")
    String jsonOutFile = "";

    @CommandLine.Option(
            names = {"--metadata-string"},
            description = "Metadata string to add to the json output file")
    String metadata = "";

    BenchmarkConfig toConfig() {
        return BenchmarkConfig.builder()
                .dbName(index)
                .batchSize(batchSize)
                .workers(workers)
                .limit(limit)
                .doLoad(doLoad)
                .doCreateDb(doCreateDb)
                .doAbortOnExist(doAbortOnExist)
                .reportingPeriod(reportingPeriod)
                .fileName(fileName)
                .jsonOutFile(jsonOutFile)
                .metadata(metadata)
                .workQueues(workQueues)
                .host(host)
                .connections(connections)
                .pipeline(pipeline)
                .continueOnError(continueOnError)
                .clusterMode(clusterMode)
                .debug(debug)
                .measureRxBytes(measureRxBytes)
                .build();
    }

    @Override
    public Integer call() {
        final BenchmarkConfig config;
        try {
            config = toConfig();
        } catch (IllegalArgumentException ex) {
            log.error("Invalid configuration: {}", ex.getMessage());
            return 2;
        }
        try {
            new BenchmarkRunner(config).run(new RediSearchBenchmark(config, indexSchema));
            return 0;
        } catch (BenchmarkException ex) {
            log.error("Benchmark failed", ex);
            return 1;
        }
    }
}
