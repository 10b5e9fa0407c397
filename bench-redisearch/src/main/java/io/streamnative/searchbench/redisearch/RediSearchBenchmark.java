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

import io.streamnative.searchbench.Benchmark;
import io.streamnative.searchbench.BenchmarkConfig;
import io.streamnative.searchbench.db.DbCreator;
import io.streamnative.searchbench.processor.PipelinedProcessor;
import io.streamnative.searchbench.processor.Processor;
import io.streamnative.searchbench.processor.TargetClientFactory;
import io.streamnative.searchbench.record.RecordSource;
import java.io.BufferedReader;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/** Replays RediSearch commands through pipelined Jedis connections. */
@RequiredArgsConstructor
public final class RediSearchBenchmark implements Benchmark {
    @NonNull private final BenchmarkConfig config;
    @NonNull private final String indexSchema;
    @NonNull private final TargetClientFactory clientFactory;

    public RediSearchBenchmark(@NonNull BenchmarkConfig config, @NonNull String indexSchema) {
        this(config, indexSchema, new JedisTargetClientFactory());
    }

    @Override
    public RecordSource recordSource(BufferedReader reader) {
        return new CsvCommandDecoder(reader);
    }

    @Override
    public Processor newProcessor() {
        return new PipelinedProcessor(config, clientFactory);
    }

    @Override
    public DbCreator dbCreator() {
        return new RediSearchDbCreator(config.host(), config.clusterMode(), indexSchema);
    }

    @Override
    public Map<String, Object> configurationParameters() {
        var parameters = new LinkedHashMap<String, Object>();
        parameters.put("host", config.host());
        parameters.put("pipeline", config.pipeline());
        parameters.put("connections", config.connections());
        parameters.put("cluster-mode", config.clusterMode());
        parameters.put("continue-on-error", config.continueOnError());
        return parameters;
    }
}
