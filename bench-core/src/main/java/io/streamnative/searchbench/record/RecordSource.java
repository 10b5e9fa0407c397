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

import java.io.IOException;
import java.util.Optional;

/** Sequential source of decoded command records. */
public interface RecordSource {

    /**
     * Returns the next well-formed record. Malformed input is skipped by the source itself.
     *
     * @return the next record, or empty once the input is exhausted
     * @throws IOException if the underlying input can no longer be read
     */
    Optional<CommandRecord> next() throws IOException;

    /** Number of input entries skipped because they could not be decoded. */
    default long skipped() {
        return 0;
    }
}
