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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Splitter;
import io.streamnative.searchbench.db.DbCreator;
import io.streamnative.searchbench.processor.TargetException;
import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisCluster;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;

/**
 * Manages the lifecycle of the RediSearch index the benchmark runs against.
 *
 * <p>The index is created from a schema given as {@code FT.CREATE} arguments, for example
 * {@code ON HASH PREFIX 1 doc: SCHEMA title TEXT}. Without a schema nothing is created and the
 * input stream is expected to set up the index itself.
 */
@Slf4j
public final class RediSearchDbCreator implements DbCreator {
    private static final Splitter SCHEMA_SPLITTER = Splitter.on(' ').trimResults().omitEmptyStrings();

    /** Opens the session used to manage indexes. */
    @FunctionalInterface
    interface Connector {
        UnifiedJedis connect() throws TargetException;
    }

    private final Connector connector;
    private final List<String> schema;
    private UnifiedJedis jedis;

    public RediSearchDbCreator(@NonNull String address, boolean clusterMode, @NonNull String schema) {
        this(() -> connect(address, clusterMode), schema);
    }

    RediSearchDbCreator(@NonNull Connector connector, @NonNull String schema) {
        this.connector = connector;
        this.schema = SCHEMA_SPLITTER.splitToList(schema);
    }

    @Override
    public void init() throws TargetException {
        jedis = connector.connect();
    }

    @Override
    public boolean exists(String dbName) throws TargetException {
        try {
            return session().ftList().contains(dbName);
        } catch (JedisException e) {
            throw new TargetException("cannot list indexes", e);
        }
    }

    @Override
    public void removeOld(String dbName) throws TargetException {
        try {
            session().ftDropIndex(dbName);
        } catch (JedisException e) {
            throw new TargetException("cannot drop index " + dbName, e);
        }
    }

    @Override
    public void create(String dbName) throws TargetException {
        if (schema.isEmpty()) {
            log.info("No index schema given, not creating index {}", dbName);
            return;
        }
        List<String> args = new ArrayList<>(schema.size() + 1);
        args.add(dbName);
        args.addAll(schema);
        try {
            session().sendCommand(RawCommand.of("FT.CREATE"), args.toArray(String[]::new));
        } catch (JedisException e) {
            throw new TargetException("cannot create index " + dbName, e);
        }
    }

    @Override
    public void close() {
        if (jedis != null) {
            jedis.close();
            jedis = null;
        }
    }

    private UnifiedJedis session() {
        checkState(jedis != null, "index manager is not initialized");
        return jedis;
    }

    private static UnifiedJedis connect(String address, boolean clusterMode) throws TargetException {
        HostAndPort node = JedisTargetClientFactory.parse(address);
        try {
            return clusterMode ? new JedisCluster(node) : new JedisPooled(node);
        } catch (JedisException e) {
            throw new TargetException("cannot connect to " + address, e);
        }
    }
}
