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
import java.util.List;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.exceptions.JedisException;

@RequiredArgsConstructor
final class StandaloneTargetClient implements TargetClient {
    @NonNull private final JedisPool pool;

    @Override
    public List<Object> execute(@NonNull List<CommandRecord> commands) throws TargetException {
        try (Jedis jedis = pool.getResource()) {
            Pipeline pipeline = jedis.pipelined();
            for (CommandRecord command : commands) {
                pipeline.sendCommand(RawCommand.of(command.command()), command.argsArray());
            }
            return JedisTargetClientFactory.checkReplies(pipeline.syncAndReturnAll());
        } catch (JedisException e) {
            throw new TargetException(e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}
