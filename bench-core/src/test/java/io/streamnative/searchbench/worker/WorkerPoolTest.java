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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.streamnative.searchbench.BenchmarkException;
import io.streamnative.searchbench.batch.Batch;
import io.streamnative.searchbench.channel.DuplexChannel;
import io.streamnative.searchbench.processor.CmdStat;
import io.streamnative.searchbench.processor.DispatchException;
import io.streamnative.searchbench.processor.Processor;
import io.streamnative.searchbench.processor.Stat;
import io.streamnative.searchbench.record.CommandRecord;
import io.streamnative.searchbench.record.Records;
import io.streamnative.searchbench.stats.StatRecorder;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WorkerPoolTest {

    /** Records what it was given, optionally failing on one batch. */
    class RecordingProcessor implements Processor {
        final AtomicInteger closed = new AtomicInteger();
        int workerIndex = -1;

        @Override
        public void init(int workerIndex, int totalWorkers) {
            this.workerIndex = workerIndex;
            initialized.add(workerIndex);
        }

        @Override
        public Stat processBatch(Batch batch, boolean doLoad) {
            if (failOn != null && batch.records().contains(failOn)) {
                throw new DispatchException("injected failure", new IllegalStateException());
            }
            var stat = Stat.empty();
            for (CommandRecord record : batch.records()) {
                processed.add(record);
                stat.add(CmdStat.of(record.category(), record.id(), 100, record.txBytes(), 0));
            }
            return stat;
        }

        @Override
        public void close() {
            closed.incrementAndGet();
        }
    }

    List<RecordingProcessor> processors;
    List<CommandRecord> processed;
    Set<Integer> initialized;
    StatRecorder recorder;
    volatile CommandRecord failOn;

    @BeforeEach
    void setup() {
        processors = new CopyOnWriteArrayList<>();
        processed = new CopyOnWriteArrayList<>();
        initialized = ConcurrentHashMap.newKeySet();
        recorder = new StatRecorder();
    }

    private WorkerPool pool(List<DuplexChannel> channels, int workers) {
        return new WorkerPool(
                channels,
                workers,
                () -> {
                    var processor = new RecordingProcessor();
                    processors.add(processor);
                    return processor;
                },
                recorder,
                true);
    }

    private static List<DuplexChannel> channels(int count, int capacity) {
        var channels = new ArrayList<DuplexChannel>();
        for (int i = 0; i < count; i++) {
            channels.add(new DuplexChannel(capacity));
        }
        return channels;
    }

    private static void feed(List<DuplexChannel> channels, List<CommandRecord> records, int batchSize)
            throws InterruptedException {
        int channel = 0;
        for (int from = 0; from < records.size(); from += batchSize) {
            var batch = new Batch(channel, records.subList(from, Math.min(records.size(), from + batchSize)));
            if (!channels.get(channel).send(batch)) {
                return;
            }
            channel = (channel + 1) % channels.size();
        }
    }

    @Test
    void everyBatchIsProcessedExactlyOnce() throws Exception {
        var channels = channels(4, 1);
        var pool = pool(channels, 4);
        var input = Records.writes(2_000);

        pool.start();
        feed(channels, input, 50);
        channels.forEach(DuplexChannel::close);
        pool.join();

        assertThat(processed).containsExactlyInAnyOrderElementsOf(input);
        assertThat(recorder.histograms(input.get(0).category()).totalCount()).isEqualTo(2_000);
    }

    @Test
    void workersShareChannelsAndCloseTheirProcessorOnce() throws Exception {
        var channels = channels(2, 3);
        var pool = pool(channels, 5);

        pool.start();
        feed(channels, Records.writes(300), 10);
        channels.forEach(DuplexChannel::close);
        pool.join();

        assertThat(processed).hasSize(300);
        assertThat(processors).hasSize(5);
        assertThat(processors).allSatisfy(p -> assertThat(p.closed).hasValue(1));
        assertThat(initialized).containsExactlyInAnyOrder(0, 1, 2, 3, 4);
    }

    @Test
    void processorFailureAbortsTheRun() throws Exception {
        var channels = channels(2, 2);
        var pool = pool(channels, 2);
        var input = Records.writes(1_000);
        failOn = input.get(100);

        pool.start();
        feed(channels, input, 10);
        channels.forEach(DuplexChannel::close);

        assertThatThrownBy(pool::join)
                .isInstanceOf(BenchmarkException.class)
                .hasCauseInstanceOf(DispatchException.class);
        assertThat(pool.isFailed()).isTrue();
        assertThat(channels).allSatisfy(c -> assertThat(c.isAborted()).isTrue());
        assertThat(processed).doesNotContain(failOn).hasSizeLessThan(input.size());
        assertThat(processors).allSatisfy(p -> assertThat(p.closed).hasValue(1));
    }

    @Test
    void moreQueuesThanWorkersIsRejected() {
        assertThatThrownBy(() -> pool(channels(3, 1), 2)).isInstanceOf(IllegalArgumentException.class);
    }
}
