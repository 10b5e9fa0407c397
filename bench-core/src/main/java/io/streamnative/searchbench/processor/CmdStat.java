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

import io.streamnative.searchbench.record.CommandCategory;
import lombok.NonNull;

/** Observation of one dispatched command. */
public record CmdStat(
        @NonNull CommandCategory category,
        @NonNull String id,
        long latencyMicros,
        long txBytes,
        long rxBytes,
        boolean update,
        boolean delete) {

    public static CmdStat of(
            CommandCategory category, String id, long latencyMicros, long txBytes, long rxBytes) {
        return new CmdStat(
                category, id, latencyMicros, txBytes, rxBytes, category.isUpdate(), category.isDelete());
    }
}
