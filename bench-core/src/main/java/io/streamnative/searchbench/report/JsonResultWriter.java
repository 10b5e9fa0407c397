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
package io.streamnative.searchbench.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.streamnative.searchbench.BenchmarkException;
import java.io.IOException;
import java.nio.file.Path;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class JsonResultWriter {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectWriter writer = MAPPER.writerWithDefaultPrettyPrinter();

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public void write(@NonNull ResultDocument document, @NonNull Path path) {
        try {
            writer.writeValue(path.toFile(), document);
        } catch (IOException ex) {
            throw new BenchmarkException("cannot write the result document to " + path, ex);
        }
        log.info("Results written to {}", path);
    }

    public String writeValueAsString(@NonNull ResultDocument document) {
        try {
            return writer.writeValueAsString(document);
        } catch (IOException ex) {
            throw new BenchmarkException("cannot serialize the result document", ex);
        }
    }
}
