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
package io.streamnative.searchbench.batch;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import io.streamnative.searchbench.record.CommandRecord;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.NonNull;

/** The open batch of one partition. Owned by the scanner thread only. */
public final class BatchAccumulator {

    @Getter private final int partition;
    private final int batchSize;
    private List<CommandRecord> records;

    public BatchAccumulator(int partition, int batchSize) {
        checkArgument(batchSize >= 1, "batch size can't be less than 1. got %s", batchSize);
        this.partition = partition;
        this.batchSize = batchSize;
        this.records = new ArrayList<>(batchSize);
    }

    /**
     * Appends a record to the open batch.
     *
     * @return true when the batch reached its configured size and should be sealed
     */
    public boolean add(@NonNull CommandRecord record) {
        records.add(record);
        return records.size() >= batchSize;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /** Seals the current records into a batch and opens a fresh, empty one. */
    public Batch seal() {
        checkState(!records.isEmpty(), "cannot seal an empty batch");
        var sealed = new Batch(partition, records);
        records = new ArrayList<>(batchSize);
        return sealed;
    }
}
