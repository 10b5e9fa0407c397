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
package io.streamnative.searchbench.stats;

import lombok.experimental.UtilityClass;

@UtilityClass
public final class Rates {

    /** Reported in place of values that are not finite numbers. */
    public static final double UNDEFINED = -1.0;

    /** Events per second between two counter readings. Zero when no time elapsed. */
    public static double rate(long current, long previous, long elapsedNanos) {
        if (elapsedNanos <= 0) {
            return 0.0;
        }
        return orUndefined((current - previous) / (elapsedNanos / 1e9));
    }

    /** {@code part / total}, or {@link #UNDEFINED} when there is no total. */
    public static double ratio(long part, long total) {
        return orUndefined((double) part / total);
    }

    public static double orUndefined(double value) {
        return Double.isFinite(value) ? value : UNDEFINED;
    }

    /** Microseconds to milliseconds, the unit every quantile is reported in. */
    public static double toMillis(long micros) {
        return micros / 1000.0;
    }
}
