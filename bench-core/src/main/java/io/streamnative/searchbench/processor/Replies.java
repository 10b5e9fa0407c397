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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.Collection;
import lombok.experimental.UtilityClass;

@UtilityClass
public class Replies {

    /**
     * Payload size of a reply: the length of a string or bulk string, or the summed lengths of
     * the strings directly contained in a list reply. Other replies count as zero.
     */
    public static long sizeOf(Object reply) {
        if (reply instanceof Collection<?> items) {
            long size = 0;
            for (Object item : items) {
                size += scalarSize(item);
            }
            return size;
        }
        return scalarSize(reply);
    }

    private static long scalarSize(Object reply) {
        if (reply instanceof byte[] bytes) {
            return bytes.length;
        }
        if (reply instanceof String s) {
            return s.getBytes(UTF_8).length;
        }
        return 0;
    }
}
