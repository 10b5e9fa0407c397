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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import io.streamnative.searchbench.BenchmarkException;
import io.streamnative.searchbench.channel.DuplexChannel;
import io.streamnative.searchbench.processor.Processor;
import io.streamnative.searchbench.stats.StatRecorder;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * A fixed set of workers, worker {@code i} consuming from channel {@code i % channels}.
 *
 * <p>The first worker failure aborts every channel so the scanner and the remaining workers stop
 * early; {@link #join()} then rethrows it.
 */
@Slf4j
public final class WorkerPool {
    private final List<DuplexChannel> channels;
    private final int workers;
    private final Supplier<Processor> processorFactory;
    private final StatRecorder recorder;
    private final boolean doLoad;

    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final List<Future<?>> futures = new ArrayList<>();
    private ExecutorService executor;

    public WorkerPool(
            @NonNull List<DuplexChannel> channels,
            int workers,
            @NonNull Supplier<Processor> processorFactory,
            @NonNull StatRecorder recorder,
            boolean doLoad) {
        checkArgument(!channels.isEmpty(), "at least one channel is required");
        checkArgument(
                workers >= channels.size(),
                "cannot have more work queues (%s) than workers (%s)",
                channels.size(),
                workers);
        this.channels = List.copyOf(channels);
        this.workers = workers;
        this.processorFactory = processorFactory;
        this.recorder = recorder;
        this.doLoad = doLoad;
    }

    public void start() {
        checkState(executor == null, "worker pool already started");
        executor =
                Executors.newFixedThreadPool(
                        workers,
                        new ThreadFactoryBuilder().setNameFormat("search-bench-worker-%d").build());
        for (int i = 0; i < workers; i++) {
            var worker =
                    new Worker(
                            i,
                            workers,
                            channels.get(i % channels.size()),
                            processorFactory.get(),
                            recorder,
                            doLoad,
                            this::abort);
            futures.add(executor.submit(worker));
        }
        log.info("Started {} workers on {} work queues", workers, channels.size());
    }

    /**
     * Waits for every worker to drain its channel.
     *
     * @throws BenchmarkException if any worker failed
     */
    public void join() {
        checkState(executor != null, "worker pool not started");
        try {
            for (Future<?> future : futures) {
                try {
                    Uninterruptibles.getUninterruptibly(future);
                } catch (ExecutionException ex) {
                    abort(ex.getCause());
                }
            }
        } finally {
            executor.shutdown();
        }
        Throwable cause = failure.get();
        if (cause != null) {
            throw new BenchmarkException("benchmark aborted: " + cause.getMessage(), cause);
        }
    }

    public boolean isFailed() {
        return failure.get() != null;
    }

    /** Stops the run: queued batches are discarded and every worker exits after its batch. */
    public void abort(@NonNull Throwable cause) {
        if (failure.compareAndSet(null, cause)) {
            log.error("Aborting the benchmark: {}", cause.toString());
            channels.forEach(DuplexChannel::abort);
            if (executor != null) {
                executor.shutdown();
            }
        }
    }
}
