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

import io.streamnative.searchbench.batch.PartitionIndexer;
import io.streamnative.searchbench.batch.RoundRobinIndexer;
import io.streamnative.searchbench.db.DbCreator;
import io.streamnative.searchbench.processor.Processor;
import io.streamnative.searchbench.record.RecordSource;
import java.io.BufferedReader;
import java.util.Map;

/** The target specific parts of a benchmark, plugged into the {@link BenchmarkRunner}. */
public interface Benchmark {

    RecordSource recordSource(BufferedReader reader);

    default PartitionIndexer indexer(int partitions) {
        return new RoundRobinIndexer(partitions);
    }

    /** Creates the processor of one worker. Called once per worker. */
    Processor newProcessor();

    DbCreator dbCreator();

    /** Target specific settings copied to the result document. */
    Map<String, Object> configurationParameters();
}
