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
package io.streamnative.searchbench.report;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.experimental.UtilityClass;

/** Human readable byte sizes with binary multiples, such as {@code 1.5M} or {@code 512B}. */
@UtilityClass
public final class ByteSizes {
    private static final long KILOBYTE = 1024L;
    private static final String[] UNITS = {"B", "K", "M", "G", "T", "P", "E"};

    public static String format(long bytes) {
        if (bytes <= 0) {
            return "0B";
        }
        int unit = 0;
        double value = bytes;
        while (value >= KILOBYTE && unit < UNITS.length - 1) {
            value /= KILOBYTE;
            unit++;
        }
        String number =
                BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_EVEN).toPlainString();
        if (number.endsWith(".0")) {
            number = number.substring(0, number.length() - 2);
        }
        return number + UNITS[unit];
    }

    /** Formats a rate, truncated to whole bytes. */
    public static String format(double bytes) {
        if (!Double.isFinite(bytes)) {
            return "0B";
        }
        return format((long) bytes);
    }
}
