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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Getter;
import lombok.NonNull;
import redis.clients.jedis.commands.ProtocolCommand;
import redis.clients.jedis.util.SafeEncoder;

/** A command sent by name, for the module commands Jedis has no constant for. */
final class RawCommand implements ProtocolCommand {
    private static final Map<String, RawCommand> CACHE = new ConcurrentHashMap<>();

    @Getter private final String name;
    private final byte[] raw;

    private RawCommand(String name) {
        this.name = name;
        this.raw = SafeEncoder.encode(name);
    }

    static RawCommand of(@NonNull String name) {
        return CACHE.computeIfAbsent(name, RawCommand::new);
    }

    @Override
    public byte[] getRaw() {
        return raw;
    }

    @Override
    public String toString() {
        return name;
    }
}
