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
package io.streamnative.searchbench.processor;

import static com.google.common.base.Preconditions.checkState;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

import com.google.common.base.Ticker;
import io.streamnative.searchbench.BenchmarkConfig;
import io.streamnative.searchbench.BenchmarkException;
import io.streamnative.searchbench.batch.Batch;
import io.streamnative.searchbench.record.CommandRecord;
import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Dispatches a batch as a sequence of pipelined round trips of {@code pipeline} commands each.
 *
 * <p>Every command records its own enqueue time, while all commands of a round trip share its
 * completion time. The reported latency of a command is therefore the time from its enqueue
 * to the end of the round trip that carried it, which includes the time spent waiting for the
 * window to fill up.
 */
@Slf4j
public class PipelinedProcessor implements Processor {
    private final BenchmarkConfig config;
    private final TargetClientFactory clientFactory;
    private final Ticker ticker;

    private final List<CommandRecord> window;
    private final long[] enqueuedAt;
    private TargetClient client;
    private int workerIndex;

    public PipelinedProcessor(@NonNull BenchmarkConfig config, @NonNull TargetClientFactory clientFactory) {
        this(config, clientFactory, Ticker.systemTicker());
    }

    public PipelinedProcessor(
            @NonNull BenchmarkConfig config,
            @NonNull TargetClientFactory clientFactory,
            @NonNull Ticker ticker) {
        this.config = config;
        this.clientFactory = clientFactory;
        this.ticker = ticker;
        this.window = new ArrayList<>(config.pipeline());
        this.enqueuedAt = new long[config.pipeline()];
    }

    @Override
    public void init(int workerIndex, int totalWorkers) {
        this.workerIndex = workerIndex;
        if (!config.doLoad()) {
            return;
        }
        try {
            client = clientFactory.create(config.host(), config.connections(), config.clusterMode());
        } catch (TargetException e) {
            throw new BenchmarkException(
                    String.format(
                            "Worker %d/%d failed to connect to %s", workerIndex, totalWorkers, config.host()),
                    e);
        }
        log.debug("Worker {}/{} connected to {}", workerIndex, totalWorkers, config.host());
    }

    @Override
    public Stat processBatch(@NonNull Batch batch, boolean doLoad) {
        final Stat stat = Stat.empty();
        if (!doLoad) {
            return stat;
        }
        checkState(client != null, "processor of worker %s is not initialized", workerIndex);
        for (CommandRecord record : batch.records()) {
            enqueuedAt[window.size()] = ticker.read();
            window.add(record);
            if (window.size() >= config.pipeline()) {
                flush(stat);
            }
        }
        if (!window.isEmpty()) {
            flush(stat);
        }
        return stat;
    }

    private void flush(Stat stat) {
        final List<Object> replies;
        try {
            replies = client.execute(window);
        } catch (TargetException e) {
            onFailure(stat, e);
            return;
        }
        final long completedAt = ticker.read();
        for (int i = 0; i < window.size(); i++) {
            final CommandRecord record = window.get(i);
            final long latencyMicros = NANOSECONDS.toMicros(completedAt - enqueuedAt[i]);
            final long rxBytes = config.measureRxBytes() && i < replies.size() ? Replies.sizeOf(replies.get(i)) : 0;
            stat.add(CmdStat.of(record.category(), record.id(), latencyMicros, record.txBytes(), rxBytes));
        }
        window.clear();
    }

    private void onFailure(Stat stat, TargetException e) {
        final int failed = window.size();
        if (!config.continueOnError()) {
            final String message = String.format("Pipeline of %d command(s) failed: %s", failed, e.getMessage());
            window.clear();
            throw new DispatchException(message, e);
        }
        if (config.debug() > 0) {
            log.warn("Received an error with the following command(s): {}", window, e);
        } else {
            log.warn("Pipeline of {} command(s) failed, continuing: {}", failed, e.getMessage());
        }
        stat.addFailures(failed);
        window.clear();
    }

    @Override
    public void close() {
        if (client != null) {
            client.close();
            client = null;
        }
    }
}
