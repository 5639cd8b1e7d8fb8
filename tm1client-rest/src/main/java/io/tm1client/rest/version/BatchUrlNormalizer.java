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

/// Rewrites the `url` field of `$batch` sub-requests for the connected server.
///
/// Before v12 the batch processor resolves sub-request URLs against the server root, so they
/// need the `/api/v1` prefix. From v12 they resolve against the database root and only need a
/// single leading slash. Query strings are kept. The rewrite is idempotent.
public final class BatchUrlNormalizer {

    public static final String LEGACY_API_PREFIX = "/api/v1";
    private static final String V12 = "12.0.0";

    private BatchUrlNormalizer() {
    }

    public static String normalize(String url, String serverVersion) {
        String normalized = withSingleLeadingSlash(url == null ? "" : url.trim());
        if (Tm1Versions.geq(serverVersion, V12)) {
            return normalized;
        }
        if (hasLegacyPrefix(normalized)) {
            return normalized;
        }
        return LEGACY_API_PREFIX + normalized;
    }

    private static boolean hasLegacyPrefix(String url) {
        if (!url.startsWith(LEGACY_API_PREFIX)) {
            return false;
        }
        if (url.length() == LEGACY_API_PREFIX.length()) {
            return true;
        }
        char next = url.charAt(LEGACY_API_PREFIX.length());
        return next == '/' || next == '?';
    }

    private static String withSingleLeadingSlash(String url) {
        int start = 0;
        while (start < url.length() && url.charAt(start) == '/') {
            start++;
        }
        return "/" + url.substring(start);
    }
}
