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

import io.streamnative.searchbench.batch.Batch;

/**
 * Turns batches into operations against the target system. Each worker owns one processor and
 * calls it from a single thread.
 */
public interface Processor extends AutoCloseable {

    /** Per-worker setup, invoked on the worker thread before the first batch. */
    void init(int workerIndex, int totalWorkers);

    /**
     * Processes one batch.
     *
     * @param doLoad false for a dry run: the batch is consumed but nothing is dispatched
     * @return the observations of the commands dispatched for this batch
     * @throws DispatchException if a round trip failed and errors are not tolerated
     */
    Stat processBatch(Batch batch, boolean doLoad);

    /** Invoked once after the worker's channel is drained. */
    @Override
    default void close() {}
}
