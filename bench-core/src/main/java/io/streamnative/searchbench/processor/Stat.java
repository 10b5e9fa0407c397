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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.NonNull;

/**
 * The outcome of processing one batch: the observations of every command that completed, and
 * the number of commands whose round trip failed. Confined to the worker that produced it.
 */
public final class Stat {
    private final List<CmdStat> cmdStats = new ArrayList<>();
    @Getter private long failedCommands;

    public static Stat empty() {
        return new Stat();
    }

    public Stat add(@NonNull CmdStat cmdStat) {
        cmdStats.add(cmdStat);
        return this;
    }

    public Stat addFailures(long commands) {
        failedCommands += commands;
        return this;
    }

    public List<CmdStat> cmdStats() {
        return Collections.unmodifiableList(cmdStats);
    }
}
