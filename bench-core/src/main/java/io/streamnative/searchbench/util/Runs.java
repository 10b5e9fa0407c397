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
package io.streamnative.searchbench.util;

import java.util.Objects;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;

@UtilityClass
public final class Runs {

    /**
     * Runs a task that must not take down the thread it runs on, such as a periodic one whose
     * later executions would be suppressed by an exception.
     */
    public static void safeRun(Logger logger, String task, Runnable runnable) {
        Objects.requireNonNull(logger);
        Objects.requireNonNull(runnable);
        try {
            runnable.run();
        } catch (Throwable ex) {
            logger.warn("Exception when running {}", task, ex);
        }
    }
}
