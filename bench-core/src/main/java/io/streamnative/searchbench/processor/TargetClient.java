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

import io.streamnative.searchbench.record.CommandRecord;
import java.util.List;

/** Connection to the system under test. */
public interface TargetClient extends AutoCloseable {

    /**
     * Sends all commands in a single pipelined round trip.
     *
     * @return one reply per command, in command order
     * @throws TargetException if the round trip or any of its commands failed
     */
    List<Object> execute(List<CommandRecord> commands) throws TargetException;

    @Override
    void close();
}
