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

@FunctionalInterface
public interface TargetClientFactory {

    /**
     * @param address {@code host:port} of the target
     * @param poolSize number of pooled connections
     * @param clusterMode whether the address is a cluster seed node
     * @throws TargetException if the connection cannot be established
     */
    TargetClient create(String address, int poolSize, boolean clusterMode) throws TargetException;
}
