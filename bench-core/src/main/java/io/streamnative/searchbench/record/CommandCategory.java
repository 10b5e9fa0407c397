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

import java.util.Optional;
import lombok.Getter;

/**
 * The operation categories a command record can belong to. Every category owns one pair of
 * latency histograms in the stat recorder; the declaration order is the column order of the
 * periodic report.
 */
public enum CommandCategory {
    SETUP_WRITE("SETUP_WRITE", "setupWrite", "Setup Writes"),
    WRITE("WRITE", "write", "Writes"),
    UPDATE("UPDATE", "update", "Updates"),
    READ("READ", "read", "Reads"),
    CURSOR_READ("CURSOR_READ", "readCursor", "Cursor Reads"),
    DELETE("DELETE", "delete", "Deletes");

    /** Label used in the input stream. */
    @Getter private final String label;

    /** Prefix of the keys used in the result document. */
    @Getter private final String resultKey;

    @Getter private final String displayName;

    CommandCategory(String label, String resultKey, String displayName) {
        this.label = label;
        this.resultKey = resultKey;
        this.displayName = displayName;
    }

    public boolean isUpdate() {
        return this == UPDATE;
    }

    public boolean isDelete() {
        return this == DELETE;
    }

    public boolean isWrite() {
        return this == WRITE || this == SETUP_WRITE;
    }

    public boolean isRead() {
        return this == READ || this == CURSOR_READ;
    }

    public static Optional<CommandCategory> fromLabel(String label) {
        for (CommandCategory category : values()) {
            if (category.label.equals(label)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
