package io.tm1client.rest.version;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.Comparator;

/// Total order on dotted TM1 version strings such as `11.8.02500.3`.
///
/// Segments are compared as non-negative integers left to right. The shorter version is padded
/// with zeros, so `11.4` equals `11.4.0`. A segment that does not parse as a number counts as 0,
/// as do null and empty versions.
public final class Tm1Versions {

    public static final Comparator<String> ORDER = Tm1Versions::compare;

    private Tm1Versions() {
    }

    /// @return a negative number, zero, or a positive number as `v1` is below, equal to, or above `v2`
    public static int compare(String v1, String v2) {
        long[] a = segments(v1);
        long[] b = segments(v2);
        int length = Math.max(a.length, b.length);
        for (int i = 0; i < length; i++) {
            long left = i < a.length ? a[i] : 0L;
            long right = i < b.length ? b[i] : 0L;
            if (left != right) {
                return left < right ? -1 : 1;
            }
        }
        return 0;
    }

    /// The predicate every version gate is built on.
    public static boolean geq(String v1, String v2) {
        return compare(v1, v2) >= 0;
    }

    /// @return the leading numeric segment, 0 when absent
    public static long major(String version) {
        long[] parts = segments(version);
        return parts.length == 0 ? 0L : parts[0];
    }

    private static long[] segments(String version) {
        if (version == null || version.isBlank()) {
            return new long[0];
        }
        String[] parts = version.trim().split("\\.");
        long[] values = new long[parts.length];
        for (int i = 0; i < parts.length; i++) {
            values[i] = parseSegment(parts[i]);
        }
        return values;
    }

    private static long parseSegment(String segment) {
        try {
            long value = Long.parseLong(segment.trim());
            return value < 0 ? 0L : value;
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
