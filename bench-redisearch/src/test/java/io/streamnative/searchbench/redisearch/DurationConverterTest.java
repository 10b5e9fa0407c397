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
package io.streamnative.searchbench.redisearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import picocli.CommandLine;

class DurationConverterTest {
    private final DurationConverter converter = new DurationConverter();

    @ParameterizedTest
    @CsvSource({
        "0, 0",
        "1s, 1000",
        "500ms, 500",
        "1.5s, 1500",
        "1m30s, 90000",
        "2h, 7200000",
        "250000us, 250",
        "PT2S, 2000",
        "pt0.5s, 500",
    })
    void convertsDurations(String value, long expectedMillis) {
        assertThat(converter.convert(value)).isEqualTo(Duration.ofMillis(expectedMillis));
    }

    @Test
    void nanosecondPrecision() {
        assertThat(converter.convert("1500ns")).isEqualTo(Duration.ofNanos(1500));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "10", "abc", "1sx", "s1", "1 s", "PTX"})
    void rejectsInvalidDurations(String value) {
        assertThatThrownBy(() -> converter.convert(value))
                .isInstanceOf(CommandLine.TypeConversionException.class)
                .hasMessageContaining("invalid duration");
    }
}
