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
import io.streamnative.searchbench.processor.TargetClientFactory;
import io.streamnative.searchbench.processor.TargetException;
import java.util.List;
import lombok.NonNull;
import redis.clients.jedis.ConnectionPoolConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisCluster;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.exceptions.JedisException;

/** Creates Jedis backed clients, pooled against a single node or routed across a cluster. */
public final class JedisTargetClientFactory implements TargetClientFactory {
    static final int DEFAULT_PORT = 6379;

    @Override
    public TargetClient create(@NonNull String address, int poolSize, boolean clusterMode)
            throws TargetException {
        final HostAndPort node = parse(address);
        try {
            if (clusterMode) {
                var poolConfig = new ConnectionPoolConfig();
                poolConfig.setMaxTotal(poolSize);
                return new ClusterTargetClient(new JedisCluster(node, poolConfig));
            }
            var poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(poolSize);
            return new StandaloneTargetClient(new JedisPool(poolConfig, node.getHost(), node.getPort()));
        } catch (JedisException e) {
            throw new TargetException("cannot connect to " + address, e);
        }
    }

    static HostAndPort parse(String address) throws TargetException {
        try {
            var parsed = com.google.common.net.HostAndPort.fromString(address).withDefaultPort(DEFAULT_PORT);
            return new HostAndPort(parsed.getHost(), parsed.getPort());
        } catch (IllegalArgumentException e) {
            throw new TargetException("invalid address " + address + ", expected host:port", e);
        }
    }

    /** Fails the round trip if any of its replies is an error. */
    static List<Object> checkReplies(List<Object> replies) throws TargetException {
        for (Object reply : replies) {
            if (reply instanceof JedisDataException error) {
                throw new TargetException(error.getMessage(), error);
            }
        }
        return replies;
    }
}
