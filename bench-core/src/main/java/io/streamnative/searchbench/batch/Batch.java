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

import io.streamnative.searchbench.record.CommandRecord;
import java.util.List;
import lombok.NonNull;

/**
 * A sealed group of records routed to one partition. Batches are never reused: the scanner
 * hands a batch to a channel and keeps no reference to it.
 */
public record Batch(int partition, @NonNull List<CommandRecord> records) {

    public Batch {
        checkArgument(partition >= 0, "partition must be non-negative: %s", partition);
        checkArgument(!records.isEmpty(), "a batch holds at least one record");
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
