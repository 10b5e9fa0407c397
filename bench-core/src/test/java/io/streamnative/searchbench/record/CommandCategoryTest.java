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
package io.streamnative.searchbench.record;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

class CommandCategoryTest {

    @ParameterizedTest
    @EnumSource(CommandCategory.class)
    void labelsResolveToTheirCategory(CommandCategory category) {
        assertThat(CommandCategory.fromLabel(category.getLabel())).contains(category);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "write", "SCAN", "READ "})
    void unknownLabelsAreRejected(String label) {
        assertThat(CommandCategory.fromLabel(label)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(CommandCategory.class)
    void everyCategoryHasExactlyOneKind(CommandCategory category) {
        int kinds = 0;
        kinds += category.isWrite() ? 1 : 0;
        kinds += category.isRead() ? 1 : 0;
        kinds += category.isUpdate() ? 1 : 0;
        kinds += category.isDelete() ? 1 : 0;
        assertThat(kinds).isEqualTo(1);
    }
}
