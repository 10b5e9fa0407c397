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

import io.streamnative.searchbench.record.CommandRecord;

/**
 * Assigns records to partitions. Implementations must be pure functions of their arguments so
 * that replaying the same input with the same partition count yields the same assignment.
 */
@FunctionalInterface
public interface PartitionIndexer {

    /**
     * @param recordsRead number of records emitted before this one
     * @param record the record being assigned
     * @return a partition in {@code [0, partitions)}
     */
    int indexOf(long recordsRead, CommandRecord record);
}
