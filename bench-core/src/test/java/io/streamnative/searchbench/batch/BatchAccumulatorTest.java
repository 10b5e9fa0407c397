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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.streamnative.searchbench.record.Records;
import java.util.List;
import org.junit.jupiter.api.Test;

class BatchAccumulatorTest {

    @Test
    void reportsFullAtBatchSize() {
        var accumulator = new BatchAccumulator(2, 3);
        assertThat(accumulator.add(Records.write(0))).isFalse();
        assertThat(accumulator.add(Records.write(1))).isFalse();
        assertThat(accumulator.add(Records.write(2))).isTrue();
        assertThat(accumulator.size()).isEqualTo(3);
    }

    @Test
    void sealOpensAFreshBatch() {
        var accumulator = new BatchAccumulator(1, 2);
        accumulator.add(Records.write(0));
        accumulator.add(Records.write(1));

        Batch batch = accumulator.seal();

        assertThat(batch.partition()).isEqualTo(1);
        assertThat(batch.records()).containsExactly(Records.write(0), Records.write(1));
        assertThat(accumulator.isEmpty()).isTrue();

        accumulator.add(Records.write(2));
        assertThat(batch.size()).isEqualTo(2);
    }

    @Test
    void emptyBatchCannotBeSealed() {
        var accumulator = new BatchAccumulator(0, 10);
        assertThatThrownBy(accumulator::seal).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void batchSizeMustBePositive() {
        assertThatThrownBy(() -> new BatchAccumulator(0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void batchRejectsEmptyRecordList() {
        assertThatThrownBy(() -> new Batch(0, List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
