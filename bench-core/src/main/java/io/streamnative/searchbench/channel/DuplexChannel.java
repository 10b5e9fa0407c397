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
package io.streamnative.searchbench.channel;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import io.streamnative.searchbench.batch.Batch;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.NonNull;

/**
 * Pairs the queue of batches travelling from the scanner to the workers with the
 * acknowledgements travelling back.
 *
 * <p>The scanner may have at most {@link #getCapacity()} batches on a channel that no worker has
 * acknowledged yet; {@link #send(Batch)} blocks while that budget is exhausted. Several workers
 * may consume from the same channel.
 */
public final class DuplexChannel {

    /** End-of-stream marker. It stays in the queue so every worker sharing the channel sees it. */
    private static final Optional<Batch> END = Optional.empty();

    @Getter private final int capacity;
    private final Semaphore credits;
    private final BlockingQueue<Optional<Batch>> toWorker = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean aborted;

    public DuplexChannel(int capacity) {
        checkArgument(capacity >= 1, "channel capacity must be positive, got %s", capacity);
        this.capacity = capacity;
        this.credits = new Semaphore(capacity);
    }

    /**
     * Hands a batch to the workers, blocking while {@code capacity} batches are unacknowledged.
     *
     * @return false if the channel was aborted and the batch was not enqueued
     */
    public boolean send(@NonNull Batch batch) throws InterruptedException {
        if (aborted) {
            return false;
        }
        checkState(!closed.get(), "channel is closed");
        credits.acquire();
        if (aborted) {
            credits.release();
            return false;
        }
        toWorker.put(Optional.of(batch));
        return true;
    }

    /**
     * Takes the next batch, blocking while the channel is empty and still open.
     *
     * @return the next batch, or empty once the channel is closed and drained
     */
    public Optional<Batch> receive() throws InterruptedException {
        Optional<Batch> next = toWorker.take();
        if (next.isEmpty()) {
            toWorker.put(END);
        }
        return next;
    }

    /** Signals that a received batch was fully processed, freeing one slot of the budget. */
    public void ack() {
        credits.release();
    }

    /** Marks the end of input. Already queued batches are still delivered. Idempotent. */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            toWorker.add(END);
        }
    }

    /** Discards queued batches and wakes up blocked senders and receivers. */
    public void abort() {
        aborted = true;
        toWorker.clear();
        closed.set(true);
        toWorker.add(END);
        credits.release(capacity);
    }

    public boolean isAborted() {
        return aborted;
    }

    /** Number of batches sent and not yet acknowledged. */
    public int outstanding() {
        return Math.max(0, capacity - credits.availablePermits());
    }
}
