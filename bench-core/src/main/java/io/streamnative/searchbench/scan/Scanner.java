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
package io.streamnative.searchbench.scan;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import io.streamnative.searchbench.BenchmarkException;
import io.streamnative.searchbench.batch.BatchAccumulator;
import io.streamnative.searchbench.batch.PartitionIndexer;
import io.streamnative.searchbench.channel.DuplexChannel;
import io.streamnative.searchbench.record.CommandRecord;
import io.streamnative.searchbench.record.RecordSource;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * The production loop: reads records, batches them per partition and hands full batches to the
 * partition's channel. Channel {@code i} serves partition {@code i}.
 */
@Slf4j
public final class Scanner {
    private final List<DuplexChannel> channels;
    private final PartitionIndexer indexer;

    public Scanner(@NonNull List<DuplexChannel> channels, @NonNull PartitionIndexer indexer) {
        checkArgument(!channels.isEmpty(), "at least one channel is required");
        this.channels = List.copyOf(channels);
        this.indexer = indexer;
    }

    /**
     * Scans the source until it is exhausted or {@code limit} records were emitted, then closes
     * every channel.
     *
     * @param limit maximum number of records to emit, 0 for no limit
     * @return number of records handed to the channels
     * @throws BenchmarkException if the source cannot be read
     */
    public long scan(@NonNull RecordSource source, int batchSize, long limit) {
        checkArgument(batchSize >= 1, "batch size can't be less than 1. got %s", batchSize);
        checkArgument(limit >= 0, "limit must be non-negative, got %s", limit);

        final int partitions = channels.size();
        final BatchAccumulator[] filling = new BatchAccumulator[partitions];
        for (int i = 0; i < partitions; i++) {
            filling[i] = new BatchAccumulator(i, batchSize);
        }

        long recordsRead = 0;
        try {
            while (limit == 0 || recordsRead < limit) {
                Optional<CommandRecord> next = source.next();
                if (next.isEmpty()) {
                    break;
                }
                int partition = checkElementIndex(indexer.indexOf(recordsRead, next.get()), partitions);
                recordsRead++;
                if (filling[partition].add(next.get())
                        && !channels.get(partition).send(filling[partition].seal())) {
                    log.warn("Channel {} was aborted, stopping the scan after {} records", partition, recordsRead);
                    return recordsRead;
                }
            }

            for (BatchAccumulator accumulator : filling) {
                if (!accumulator.isEmpty()
                        && !channels.get(accumulator.getPartition()).send(accumulator.seal())) {
                    log.warn("Channel {} was aborted while flushing partial batches", accumulator.getPartition());
                    return recordsRead;
                }
            }
        } catch (IOException e) {
            throw new BenchmarkException("Failed to read input after " + recordsRead + " records", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BenchmarkException("Interrupted while scanning input", e);
        } finally {
            channels.forEach(DuplexChannel::close);
        }
        log.debug("Scanned {} records, {} skipped", recordsRead, source.skipped());
        return recordsRead;
    }
}
