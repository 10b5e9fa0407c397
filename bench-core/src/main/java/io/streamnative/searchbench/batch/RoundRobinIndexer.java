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

/** Spreads records over partitions by their position in the input. */
public final class RoundRobinIndexer implements PartitionIndexer {
    private final int partitions;

    public RoundRobinIndexer(int partitions) {
        checkArgument(partitions >= 1, "at least one partition is required, got %s", partitions);
        this.partitions = partitions;
    }

    @Override
    public int indexOf(long recordsRead, CommandRecord record) {
        return (int) (recordsRead % partitions);
    }
}
