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

import java.util.List;
import lombok.NonNull;

/**
 * A single command read from the input stream.
 *
 * @param category the operation category the command is accounted under
 * @param id the query or document identifier carried by the input
 * @param command the command name, e.g. {@code FT.SEARCH}
 * @param args the command arguments, in order
 * @param txBytes the number of bytes the command is accounted for on the wire
 */
public record CommandRecord(
        @NonNull CommandCategory category,
        @NonNull String id,
        @NonNull String command,
        @NonNull List<String> args,
        long txBytes) {

    public CommandRecord {
        args = List.copyOf(args);
    }

    public String[] argsArray() {
        return args.toArray(String[]::new);
    }
}
