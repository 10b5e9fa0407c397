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
package io.streamnative.searchbench.stats;

import io.streamnative.searchbench.record.CommandCategory;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Predicate;
import lombok.NonNull;

/** Snapshot of the recorder counters, used to compute rates between two points in time. */
public record StatCounts(@NonNull Map<CommandCategory, Long> perCategory, long txBytes, long rxBytes) {

    public static final StatCounts ZERO = new StatCounts(new EnumMap<>(CommandCategory.class), 0, 0);

    public StatCounts {
        perCategory = Map.copyOf(perCategory);
    }

    public long count(CommandCategory category) {
        return perCategory.getOrDefault(category, 0L);
    }

    public long writes() {
        return sumOf(CommandCategory::isWrite);
    }

    public long reads() {
        return sumOf(CommandCategory::isRead);
    }

    private long sumOf(Predicate<CommandCategory> kind) {
        long sum = 0;
        for (Map.Entry<CommandCategory, Long> entry : perCategory.entrySet()) {
            if (kind.test(entry.getKey())) {
                sum += entry.getValue();
            }
        }
        return sum;
    }

    public long totalOps() {
        long total = 0;
        for (long count : perCategory.values()) {
            total += count;
        }
        return total;
    }
}
