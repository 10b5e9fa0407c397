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

import io.streamnative.searchbench.processor.TargetClient;
import io.streamnative.searchbench.processor.TargetException;
import io.streamnative.searchbench.record.CommandRecord;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import redis.clients.jedis.Connection;
import redis.clients.jedis.JedisCluster;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.util.JedisClusterCRC16;

/**
 * Pipelines commands against a cluster. Commands are routed by the hash slot of their first
 * argument, and one pipeline is sent per slot.
 */
@RequiredArgsConstructor
final class ClusterTargetClient implements TargetClient {
    @NonNull private final JedisCluster cluster;

    @Override
    public List<Object> execute(@NonNull List<CommandRecord> commands) throws TargetException {
        Map<Integer, List<Integer>> bySlot = new LinkedHashMap<>();
        for (int i = 0; i < commands.size(); i++) {
            bySlot.computeIfAbsent(slotOf(commands.get(i)), slot -> new ArrayList<>()).add(i);
        }

        Object[] replies = new Object[commands.size()];
        try {
            for (Map.Entry<Integer, List<Integer>> entry : bySlot.entrySet()) {
                List<Integer> positions = entry.getValue();
                try (Connection connection = cluster.getConnectionFromSlot(entry.getKey())) {
                    Pipeline pipeline = new Pipeline(connection);
                    for (int position : positions) {
                        CommandRecord command = commands.get(position);
                        pipeline.sendCommand(RawCommand.of(command.command()), command.argsArray());
                    }
                    List<Object> slotReplies = pipeline.syncAndReturnAll();
                    for (int i = 0; i < positions.size(); i++) {
                        replies[positions.get(i)] = slotReplies.get(i);
                    }
                }
            }
        } catch (JedisException e) {
            throw new TargetException(e.getMessage(), e);
        }
        return JedisTargetClientFactory.checkReplies(Arrays.asList(replies));
    }

    static int slotOf(CommandRecord command) {
        // commands without arguments carry no key
        String key = command.args().isEmpty() ? command.command() : command.args().get(0);
        return JedisClusterCRC16.getSlot(key);
    }

    @Override
    public void close() {
        cluster.close();
    }
}
