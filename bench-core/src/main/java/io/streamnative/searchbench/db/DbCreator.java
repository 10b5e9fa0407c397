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
package io.streamnative.searchbench.db;

import io.streamnative.searchbench.processor.TargetException;

/**
 * Prepares the database or index a benchmark runs against. Only used when the benchmark
 * actually dispatches commands.
 */
public interface DbCreator extends AutoCloseable {

    /** Opens whatever session the other operations need. Invoked even if nothing is created. */
    void init() throws TargetException;

    boolean exists(String dbName) throws TargetException;

    void removeOld(String dbName) throws TargetException;

    void create(String dbName) throws TargetException;

    /** Invoked once the database is in place, whether or not it was just created. */
    default void postCreate(String dbName) throws TargetException {}

    @Override
    default void close() {}
}
