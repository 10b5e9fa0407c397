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

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;
import lombok.Builder;
import lombok.NonNull;

/**
 * Everything a benchmark run is configured with. Built once from the command line and passed
 * to the runner; nothing reads configuration from anywhere else.
 *
 * @param dbName name of the index the benchmark targets
 * @param batchSize number of records grouped into one batch
 * @param workers number of parallel workers
 * @param limit number of records to replay, 0 for all of them
 * @param doLoad false to only measure input read speed
 * @param doCreateDb whether to (re)create the index before the run
 * @param doAbortOnExist whether to abort if the index already exists
 * @param reportingPeriod period of the interval report, zero to disable it
 * @param fileName input file, empty to read standard input
 * @param jsonOutFile result document path, empty to skip writing it
 * @param metadata free form string copied to the result document
 * @param workQueues number of work queues, 0 for one queue per worker
 * @param host {@code host:port} of the target
 * @param connections pooled connections per worker
 * @param pipeline number of commands sent per pipelined round trip
 * @param continueOnError whether failed round trips are tolerated
 * @param clusterMode whether the target is a cluster
 * @param debug verbosity of error reporting, 0 for terse
 * @param measureRxBytes whether reply payloads are counted as received bytes
 */
@Builder
public record BenchmarkConfig(
        @NonNull String dbName,
        int batchSize,
        int workers,
        long limit,
        boolean doLoad,
        boolean doCreateDb,
        boolean doAbortOnExist,
        @NonNull Duration reportingPeriod,
        @NonNull String fileName,
        @NonNull String jsonOutFile,
        @NonNull String metadata,
        int workQueues,
        @NonNull String host,
        int connections,
        int pipeline,
        boolean continueOnError,
        boolean clusterMode,
        int debug,
        boolean measureRxBytes) {

    public static final int WORKER_PER_QUEUE = 0;

    public BenchmarkConfig {
        checkArgument(batchSize >= 1, "batch size can't be less than 1. got %s", batchSize);
        checkArgument(workers >= 1, "at least one worker is required, got %s", workers);
        checkArgument(limit >= 0, "limit must be non-negative, got %s", limit);
        checkArgument(
                workQueues >= 0 && workQueues <= workers,
                "cannot have more work queues (%s) than workers (%s)",
                workQueues,
                workers);
        checkArgument(connections >= 1, "at least one connection is required, got %s", connections);
        checkArgument(pipeline >= 1, "pipeline size can't be less than 1. got %s", pipeline);
        checkArgument(!reportingPeriod.isNegative(), "reporting period must not be negative");
    }

    /** Number of channels the scanner feeds. */
    public int channelCount() {
        return workQueues == WORKER_PER_QUEUE ? workers : workQueues;
    }

    /** Capacity of every channel: the number of workers it serves. */
    public int channelCapacity() {
        return (int) Math.ceil((double) workers / channelCount());
    }

    public static class BenchmarkConfigBuilder {
        private String dbName = "idx1";
        private int batchSize = 1000;
        private int workers = 8;
        private boolean doLoad = true;
        private boolean doCreateDb = true;
        private Duration reportingPeriod = Duration.ofSeconds(1);
        private String fileName = "";
        private String jsonOutFile = "";
        private String metadata = "";
        private String host = "localhost:6379";
        private int connections = 1;
        private int pipeline = 50;
    }
}
