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
package io.streamnative.searchbench.worker;

import io.streamnative.searchbench.batch.Batch;
import io.streamnative.searchbench.channel.DuplexChannel;
import io.streamnative.searchbench.processor.Processor;
import io.streamnative.searchbench.processor.Stat;
import io.streamnative.searchbench.stats.StatRecorder;
import java.util.Optional;
import java.util.function.Consumer;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Consumes batches from one channel until it is drained, feeding every batch to its own
 * processor and the resulting observations to the shared recorder.
 */
@Slf4j
@RequiredArgsConstructor
final class Worker implements Runnable {
    private final int index;
    private final int totalWorkers;
    @NonNull private final DuplexChannel channel;
    @NonNull private final Processor processor;
    @NonNull private final StatRecorder recorder;
    private final boolean doLoad;
    @NonNull private final Consumer<Throwable> onFatal;

    private long processedBatches;

    @Override
    public void run() {
        try (processor) {
            processor.init(index, totalWorkers);
            while (true) {
                Optional<Batch> next = channel.receive();
                if (next.isEmpty()) {
                    break;
                }
                try {
                    Stat stat = processor.processBatch(next.get(), doLoad);
                    recorder.record(stat);
                    processedBatches++;
                } finally {
                    channel.ack();
                }
            }
            log.debug("Worker {} is done after {} batches", index, processedBatches);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Worker {} interrupted", index);
            onFatal.accept(ex);
        } catch (Throwable ex) {
            log.error("Worker {} failed", index, ex);
            onFatal.accept(ex);
        }
    }
}
